package org.tacgen.core;

/**
 * Central configuration class for the three-address-code generator.
 * Contains constants that control the command line front end and the stepper.
 * <p>
 * Runtime switches (debug tracing, output format, stepping) are not kept here;
 * they live in {@link org.tacgen.app.cli.CompilerOptions}.
 */
public final class Configuration {

    public static final String tacgenVersion = "1.0.0";
    public static final String jarVersion = "1.0.0";

    // Stepper playback delay, in milliseconds
    public static final int DEFAULT_STEP_DELAY_MILLIS = 1000;
    public static final int MIN_STEP_DELAY_MILLIS = 200;
    public static final int MAX_STEP_DELAY_MILLIS = 2000;

    /**
     * The program loaded by {@code --example}.
     */
    public static final String SAMPLE_PROGRAM = String.join("\n",
            "if (a<5)",
            "{",
            "  c= b+d",
            "  d= i+j",
            "}",
            "else",
            "{",
            "  d= a+b",
            "  k= x+y",
            "}");

    // Prevent instantiation
    private Configuration() {
    }

    public static int clampStepDelay(int delayMillis) {
        return Math.max(MIN_STEP_DELAY_MILLIS, Math.min(delayMillis, MAX_STEP_DELAY_MILLIS));
    }
}
