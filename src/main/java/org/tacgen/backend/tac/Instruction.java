package org.tacgen.backend.tac;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One numbered three-address-code instruction.
 *
 * @param sequenceNumber 1-based position in the emitted program
 * @param text           the instruction, e.g. {@code T1=a+b}, {@code goto 5} or {@code END}
 */
public record Instruction(int sequenceNumber, String text) {

    private static final Pattern JUMP_TARGET = Pattern.compile("goto_*\\s*(\\d+)_?$");

    public InstructionKind kind() {
        return InstructionKind.of(text);
    }

    /**
     * Target of a {@code goto N}, {@code goto__N_} or {@code if (...) goto N} instruction.
     *
     * @return the target sequence number, or -1 when this instruction does not jump
     */
    public int jumpTarget() {
        InstructionKind kind = kind();
        if (kind != InstructionKind.JUMP && kind != InstructionKind.CONDITIONAL_JUMP) {
            return -1;
        }
        Matcher matcher = JUMP_TARGET.matcher(text);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : -1;
    }

    @Override
    public String toString() {
        return sequenceNumber + ") " + text;
    }
}
