package org.tacgen.app.stepper;

import org.tacgen.backend.tac.Instruction;
import org.tacgen.frontend.lexer.LinePatterns;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the current instruction back to the source lines it most likely came from.
 * <p>
 * This is a substring heuristic: instructions keep no source positions, so a line is
 * highlighted when it contains the condition, the expression or the assigned variable of
 * the instruction. Programs that repeat a variable or an expression get several lines
 * highlighted. Jumps and {@code END} highlight nothing.
 */
public class SourceHighlighter {

    private SourceHighlighter() {
    }

    public static boolean isCurrentExecutingLine(String line, Instruction instruction) {
        if (instruction == null) {
            return false;
        }
        String text = instruction.text();

        if (text.startsWith("if")) {
            String condition = LinePatterns.matchCondition(text);
            if (condition == null) {
                condition = "";
            }
            return line.contains("if (" + condition + ")") || line.contains("if(" + condition + ")");
        }

        if (text.contains("=")) {
            String[] parts = text.split("=", -1);
            if (text.startsWith("T")) {
                return line.contains(parts[1]);
            }
            String variable = parts[0].trim();
            return line.contains(variable + "=") || line.contains(variable + " =");
        }

        return false;
    }

    /**
     * @return 0-based indices of the source lines to highlight for the instruction
     */
    public static List<Integer> highlightedLines(String sourceText, Instruction instruction) {
        List<Integer> result = new ArrayList<>();
        String[] lines = sourceText.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (isCurrentExecutingLine(lines[i], instruction)) {
                result.add(i);
            }
        }
        return result;
    }
}
