package org.tacgen.frontend.lexer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The line shapes recognized by the analyzer and the code generator.
 * <p>
 * Both patterns are searched anywhere in a trimmed line, not anchored: the first
 * occurrence wins. The condition capture is lazy and stops at the first {@code )}.
 */
public final class LinePatterns {

    public static final Pattern CONDITIONAL_HEAD = Pattern.compile("if\\s*\\((.*?)\\)");
    public static final Pattern ASSIGNMENT = Pattern.compile("(\\w+)\\s*=\\s*(.*)");

    private LinePatterns() {
    }

    public static boolean isBlank(String line) {
        return line.trim().isEmpty();
    }

    /**
     * Lines that consist of a single brace and nothing else carry no statement.
     */
    public static boolean isBareBrace(String line) {
        String trimmed = line.trim();
        return trimmed.equals("{") || trimmed.equals("}");
    }

    public static boolean opensBrace(String line) {
        return line.contains("{");
    }

    public static boolean closesBrace(String line) {
        return line.contains("}");
    }

    public static boolean startsElse(String line) {
        return line.trim().startsWith("else");
    }

    /**
     * @return the trimmed condition, or null when the line is not a conditional head
     */
    public static String matchCondition(String line) {
        Matcher matcher = CONDITIONAL_HEAD.matcher(line.trim());
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    /**
     * @return {@code [target, expression]} trimmed, or null when the line is not an assignment
     */
    public static String[] matchAssignment(String line) {
        Matcher matcher = ASSIGNMENT.matcher(line.trim());
        if (!matcher.find()) {
            return null;
        }
        return new String[]{matcher.group(1).trim(), matcher.group(2).trim()};
    }
}
