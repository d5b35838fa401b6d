package org.tacgen.backend.tac;

/**
 * Classification of an instruction by the shape of its text.
 */
public enum InstructionKind {
    END,
    CONDITIONAL_JUMP,
    /**
     * {@code goto N} and the end-of-branch marker {@code goto__N_}.
     */
    JUMP,
    /**
     * {@code x=T1}: stores a temporary into a named variable.
     */
    VARIABLE_ASSIGNMENT,
    /**
     * {@code T1=a+b}: computes an expression into a temporary.
     */
    TEMPORARY_ASSIGNMENT,
    OTHER;

    public static InstructionKind of(String text) {
        if (text == null) {
            return OTHER;
        }
        if (text.equals("END")) {
            return END;
        }
        if (text.startsWith("if")) {
            return CONDITIONAL_JUMP;
        }
        if (text.startsWith("goto")) {
            return JUMP;
        }
        if (text.contains("=")) {
            return text.contains("T") && !text.startsWith("T") ? VARIABLE_ASSIGNMENT : TEMPORARY_ASSIGNMENT;
        }
        return OTHER;
    }
}
