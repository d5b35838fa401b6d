package org.tacgen.backend.tac;

import java.util.Locale;

/**
 * Renderings of an instruction listing supported by {@link InstructionFormatter}.
 */
public enum OutputFormat {
    TEXT,
    JSON,
    YAML;

    /**
     * @throws IllegalArgumentException for an unknown format name
     */
    public static OutputFormat fromName(String name) {
        return OutputFormat.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
