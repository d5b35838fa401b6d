package org.tacgen.app.stepper;

import org.tacgen.backend.tac.Instruction;
import org.tacgen.frontend.lexer.LinePatterns;

/**
 * One-line narration of what an instruction does, shown next to each step.
 */
public class StepDescription {

    private StepDescription() {
    }

    public static String describe(Instruction instruction) {
        String text = instruction.text();
        switch (instruction.kind()) {
            case END:
                return "Execution Complete";
            case CONDITIONAL_JUMP:
                String condition = LinePatterns.matchCondition(text);
                return "Condition Check: " + (condition == null ? "" : condition);
            case JUMP:
                return "Jump Instruction: " + text;
            case VARIABLE_ASSIGNMENT:
                return "Variable Assignment: " + text + " (memory updated: " + text.split("=")[0] + ")";
            case TEMPORARY_ASSIGNMENT:
                return "Temporary Value Calculation: " + text;
            default:
                return text;
        }
    }
}
