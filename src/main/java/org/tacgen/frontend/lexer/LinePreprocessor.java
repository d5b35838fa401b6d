package org.tacgen.frontend.lexer;

import java.util.Arrays;
import java.util.List;

/**
 * Splits raw source text into the line sequence consumed by the structural analyzer.
 * <p>
 * The text is trimmed as a whole before splitting, so leading and trailing blank lines
 * disappear while blank lines in the middle are kept. Individual lines are returned
 * untrimmed; consumers trim them when they need to.
 */
public class LinePreprocessor {

    private LinePreprocessor() {
    }

    /**
     * @param sourceText the program text, may be null
     * @return the lines of the trimmed text; empty text gives one empty line
     */
    public static List<String> split(String sourceText) {
        String text = sourceText == null ? "" : sourceText.trim();
        return List.copyOf(Arrays.asList(text.split("\n", -1)));
    }
}
