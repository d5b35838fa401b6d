package org.tacgen.backend.tac;

import org.tacgen.app.cli.CompilerOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * The EmitterContext class holds the state of one generation run: the next sequence
 * number, the next temporary index and the instructions emitted so far. It also routes
 * debug messages.
 * <p>
 * A context is created per call and never shared, which keeps the generator reentrant.
 */
public class EmitterContext {

    /**
     * CompilerOptions is a configuration class that holds various settings and flags
     * used by the generator.
     */
    public final CompilerOptions compilerOptions;

    /**
     * Sequence number the next emitted instruction receives.
     */
    private int lineNumber = 1;

    /**
     * Index of the next temporary, {@code T<tempCounter>}.
     */
    private int tempCounter = 1;

    private final List<Instruction> instructions = new ArrayList<>();

    public EmitterContext(CompilerOptions compilerOptions) {
        this.compilerOptions = compilerOptions;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public int tempCounter() {
        return tempCounter;
    }

    /**
     * Appends an instruction at the current sequence number and advances it.
     *
     * @return the sequence number the instruction received
     */
    public int emit(String text) {
        Instruction instruction = new Instruction(lineNumber++, text);
        logDebug("  emit " + instruction);
        instructions.add(instruction);
        return instruction.sequenceNumber();
    }

    /**
     * Hands out the current temporary index and advances the counter.
     */
    public int nextTemporary() {
        return tempCounter++;
    }

    public List<Instruction> instructions() {
        return List.copyOf(instructions);
    }

    /**
     * Prints a debug message if debugging is enabled.
     *
     * @param message the debug message to print
     */
    public void logDebug(String message) {
        if (this.compilerOptions.debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public String toString() {
        return "EmitterContext{\n" +
                "    lineNumber=" + lineNumber + ",\n" +
                "    tempCounter=" + tempCounter + ",\n" +
                "    instructions=" + instructions.size() + "\n" +
                "}";
    }
}
