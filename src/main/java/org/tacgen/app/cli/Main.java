package org.tacgen.app.cli;

import org.tacgen.app.scriptengine.TacLanguageProvider;
import org.tacgen.app.stepper.ConsolePlayback;
import org.tacgen.backend.tac.Instruction;
import org.tacgen.backend.tac.InstructionFormatter;
import org.tacgen.core.Configuration;
import org.tacgen.runtime.TacGenException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Command line entry point.
 * <p>
 * Usage: {@code java -jar tacgen.jar [options] [file]}; see {@link ArgumentParser#printHelp()}.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(run(args, System.in));
    }

    /**
     * Runs the front end and returns the process exit status instead of exiting.
     *
     * @param args  the command-line arguments
     * @param stdin the stream read when no program is given on the command line
     * @return 0 on success, 1 on any error
     */
    public static int run(String[] args, InputStream stdin) {
        try {
            CompilerOptions options = ArgumentParser.parseArguments(args);
            if (options.helpRequested) {
                ArgumentParser.printHelp();
                return 0;
            }
            if (options.versionRequested) {
                System.out.println("tacgen " + Configuration.tacgenVersion);
                return 0;
            }
            if (options.code == null) {
                options.fileName = "<STDIN>";
                options.code = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (options.debugEnabled) {
                System.out.println(options);
            }

            String sourceText = options.code;
            List<Instruction> instructions = TacLanguageProvider.generateTac(options);
            if (instructions.isEmpty()) {
                // --lines or --parse already printed their output
                return 0;
            }

            System.out.println(InstructionFormatter.format(instructions, options.outputFormat));

            if (options.stepMode) {
                System.out.println();
                new ConsolePlayback(sourceText, System.out).play(instructions, options.stepDelayMillis);
            }
            return 0;
        } catch (TacGenException e) {
            System.err.println("Error: " + e.getDetailedMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Error: Unable to read standard input: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Error: playback interrupted");
            return 1;
        }
    }
}
