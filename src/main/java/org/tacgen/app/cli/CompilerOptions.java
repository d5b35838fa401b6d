package org.tacgen.app.cli;

import org.tacgen.backend.tac.OutputFormat;
import org.tacgen.core.Configuration;

/**
 * Settings and flags used by the generator and the command line front end.
 * Filled by {@link ArgumentParser}; tests and embedders may set the fields directly.
 */
public class CompilerOptions implements Cloneable {
    public boolean debugEnabled = false;
    public boolean linesOnly = false; // --lines
    public boolean parseOnly = false; // --parse
    public boolean stepMode = false; // --step
    public boolean useExample = false; // --example
    public boolean helpRequested = false; // -h, --help
    public boolean versionRequested = false; // -v, --version
    public int stepDelayMillis = Configuration.DEFAULT_STEP_DELAY_MILLIS;
    public OutputFormat outputFormat = OutputFormat.TEXT;
    public String code = null;
    public String fileName = null;

    @Override
    public CompilerOptions clone() {
        try {
            return (CompilerOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "CompilerOptions{\n" +
                "    debugEnabled=" + debugEnabled + ",\n" +
                "    linesOnly=" + linesOnly + ",\n" +
                "    parseOnly=" + parseOnly + ",\n" +
                "    stepMode=" + stepMode + ",\n" +
                "    useExample=" + useExample + ",\n" +
                "    helpRequested=" + helpRequested + ",\n" +
                "    versionRequested=" + versionRequested + ",\n" +
                "    stepDelayMillis=" + stepDelayMillis + ",\n" +
                "    outputFormat=" + outputFormat + ",\n" +
                "    code='" + (code != null ? code : "null") + "',\n" +
                "    fileName='" + (fileName != null ? fileName : "null") + "'\n" +
                "}";
    }
}
