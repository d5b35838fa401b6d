package org.tacgen.app.cli;

import org.tacgen.backend.tac.OutputFormat;
import org.tacgen.core.Configuration;
import org.tacgen.runtime.TacGenException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the CompilerOptions accordingly. It handles the switches that
 * select the program source, the output format, stepping and the debug modes.
 * <p>
 * Invalid arguments raise {@link TacGenException}; {@link Main} reports them and exits.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a CompilerOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CompilerOptions object with settings derived from the arguments.
     * @throws TacGenException for an unknown switch, a missing value or an unreadable file
     */
    public static CompilerOptions parseArguments(String[] args) {
        CompilerOptions parsedArgs = new CompilerOptions();
        parsedArgs.code = null; // Initialize code to null

        processArgs(args, parsedArgs);

        if (parsedArgs.useExample && parsedArgs.code == null) {
            parsedArgs.code = Configuration.SAMPLE_PROGRAM;
            parsedArgs.fileName = "<example>";
        }
        return parsedArgs;
    }

    /**
     * Processes the command-line arguments, distinguishing between switch and non-switch arguments.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CompilerOptions object to configure.
     */
    private static void processArgs(String[] args, CompilerOptions parsedArgs) {
        boolean readingFiles = false; // Once "--" is seen every argument is a file name

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingFiles || !arg.startsWith("-") || arg.equals("-")) {
                processNonSwitchArgument(args, parsedArgs, i);
            } else if (arg.equals("--")) {
                readingFiles = true;
            } else if (arg.startsWith("--")) {
                i = processLongSwitches(args, parsedArgs, arg, i);
            } else {
                i = processShortSwitches(args, parsedArgs, arg, i);
            }
        }
    }

    /**
     * Processes non-switch arguments: the program file. {@code -} stands for standard input.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CompilerOptions object to configure.
     * @param index      The current index in the arguments array.
     */
    private static void processNonSwitchArgument(String[] args, CompilerOptions parsedArgs, int index) {
        if (parsedArgs.code != null) {
            throw new TacGenException("Only one program may be given; unexpected argument " + args[index]);
        }
        if (args[index].equals("-")) {
            return;
        }
        parsedArgs.fileName = args[index];
        try {
            parsedArgs.code = new String(Files.readAllBytes(Paths.get(parsedArgs.fileName)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TacGenException("Unable to read file " + parsedArgs.fileName, parsedArgs.fileName, e);
        }
    }

    /**
     * Processes single-dash switches (e.g., -e, -h).
     *
     * @return The updated index after processing the switch.
     */
    private static int processShortSwitches(String[] args, CompilerOptions parsedArgs, String arg, int index) {
        switch (arg) {
            case "-e":
                // Program text from the command line
                if (parsedArgs.code != null) {
                    throw new TacGenException("Only one program may be given; -e conflicts with " + parsedArgs.fileName);
                }
                parsedArgs.code = requireValue(args, index, arg);
                parsedArgs.fileName = "-e";
                return index + 1;
            case "-h":
                parsedArgs.helpRequested = true;
                return index;
            case "-v":
                parsedArgs.versionRequested = true;
                return index;
            default:
                throw new TacGenException("Unrecognized switch: " + arg + "  (-h will show valid options)");
        }
    }

    /**
     * Processes long-form switches (e.g., --debug, --format json, --delay=500).
     *
     * @return The updated index after processing the switch.
     */
    private static int processLongSwitches(String[] args, CompilerOptions parsedArgs, String arg, int index) {
        String name = arg;
        String inlineValue = null;
        int equals = arg.indexOf('=');
        if (equals > 0) {
            name = arg.substring(0, equals);
            inlineValue = arg.substring(equals + 1);
        }

        switch (name) {
            case "--debug":
                parsedArgs.debugEnabled = true;
                break;
            case "--lines":
                validateExclusiveOptions(parsedArgs, "lines");
                parsedArgs.linesOnly = true;
                break;
            case "--parse":
                validateExclusiveOptions(parsedArgs, "parse");
                parsedArgs.parseOnly = true;
                break;
            case "--step":
                parsedArgs.stepMode = true;
                break;
            case "--example":
                parsedArgs.useExample = true;
                break;
            case "--format": {
                String value = inlineValue != null ? inlineValue : requireValue(args, index++, name);
                try {
                    parsedArgs.outputFormat = OutputFormat.fromName(value);
                } catch (IllegalArgumentException e) {
                    throw new TacGenException("Unknown output format '" + value + "' (expected text, json or yaml)");
                }
                break;
            }
            case "--delay": {
                String value = inlineValue != null ? inlineValue : requireValue(args, index++, name);
                try {
                    parsedArgs.stepDelayMillis = Configuration.clampStepDelay(Integer.parseInt(value.trim()));
                } catch (NumberFormatException e) {
                    throw new TacGenException("Invalid delay '" + value + "': expected milliseconds");
                }
                break;
            }
            case "--version":
                parsedArgs.versionRequested = true;
                break;
            case "--help":
                parsedArgs.helpRequested = true;
                break;
            default:
                throw new TacGenException("Unrecognized switch: " + arg + "  (-h will show valid options)");
        }
        return index;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index + 1 >= args.length) {
            throw new TacGenException("No value specified for " + option);
        }
        return args[index + 1];
    }

    /**
     * Validates that exclusive options are not combined.
     *
     * @param parsedArgs The CompilerOptions object to check.
     * @param option     The option being validated.
     */
    private static void validateExclusiveOptions(CompilerOptions parsedArgs, String option) {
        if (parsedArgs.linesOnly || parsedArgs.parseOnly) {
            throw new TacGenException("--" + option + " cannot be combined with other exclusive options");
        }
    }

    /**
     * Prints the help message detailing usage and options.
     */
    public static void printHelp() {
        System.out.println("Usage: java -jar target/tacgen-" + Configuration.jarVersion + ".jar [options] [file]");
        System.out.println();
        System.out.println("  -e program            program text (omit programfile)");
        System.out.println("  --example             translate the built-in sample program");
        System.out.println("  --format FORMAT       output format: text (default), json or yaml");
        System.out.println("  --step                play the listing back step by step");
        System.out.println("  --delay MS            delay between steps, " + Configuration.MIN_STEP_DELAY_MILLIS
                + ".." + Configuration.MAX_STEP_DELAY_MILLIS + " (default " + Configuration.DEFAULT_STEP_DELAY_MILLIS + ")");
        System.out.println("  --lines               print the preprocessed source lines");
        System.out.println("  --parse               print the recovered block structure");
        System.out.println("  --debug               enable debugging mode");
        System.out.println("  -v, --version         print the version");
        System.out.println("  -h, --help            displays this help message");
        System.out.println();
        System.out.println("Without a file, -e or --example the program is read from standard input.");
    }
}
