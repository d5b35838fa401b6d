package org.tacgen.frontend.parser;

import org.tacgen.frontend.lexer.LinePatterns;

import java.util.List;

/**
 * Locates the brace-delimited region that follows a block head.
 * <p>
 * Matching is done per line, not per character: a line containing {@code {} adds one
 * to the depth and a line containing {@code }} removes one, so {@code "} else {"} leaves the
 * depth unchanged. Both scans stop at the end of input.
 */
public class BraceScanner {

    private BraceScanner() {
    }

    /**
     * Scans for the region opened at or after {@code headLine}.
     *
     * @param lines    the source lines
     * @param headLine index of the line holding the block keyword
     * @return the span; its indices may lie past the end of input when braces are missing
     */
    public static BraceSpan scan(List<String> lines, int headLine) {
        int open = headLine;
        while (open < lines.size() && !LinePatterns.opensBrace(lines.get(open).trim())) {
            open++;
        }

        int depth = 1;
        int next = open + 1;
        while (next < lines.size() && depth > 0) {
            String line = lines.get(next).trim();
            if (LinePatterns.opensBrace(line)) depth++;
            if (LinePatterns.closesBrace(line)) depth--;
            next++;
        }
        return new BraceSpan(open, next - 1);
    }

    /**
     * @param open  index of the line holding the opening brace
     * @param close index of the line where the depth returned to zero, or the last line
     *              scanned when input ran out first
     */
    public record BraceSpan(int open, int close) {

        public int firstBodyLine() {
            return open + 1;
        }

        /**
         * Exclusive upper bound of the body lines.
         */
        public int bodyEnd() {
            return close;
        }

        /**
         * The line following the closing brace.
         */
        public int next() {
            return close + 1;
        }
    }
}
