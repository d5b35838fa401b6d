package org.tacgen.frontend.parser;

import org.tacgen.app.cli.CompilerOptions;
import org.tacgen.backend.tac.EmitterContext;
import org.tacgen.frontend.astnode.Assignment;
import org.tacgen.frontend.astnode.Block;
import org.tacgen.frontend.astnode.Conditional;
import org.tacgen.frontend.lexer.LinePatterns;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers the top-level block structure of a program from its source lines.
 * <p>
 * The analyzer never fails. Lines that are neither a conditional head nor an assignment
 * are skipped, a missing or unbalanced brace shortens the block instead of raising, and
 * conditionals nested inside a branch are not recognized: their head line is dropped and
 * whatever assignments they hold are read as part of the enclosing branch.
 * <p>
 * Usage:
 * <pre>
 *   List&lt;Block&gt; blocks = new StructureAnalyzer(ctx, lines).analyze();
 * </pre>
 */
public class StructureAnalyzer {

    private final EmitterContext ctx;
    private final List<String> lines;
    // Index of the line being examined
    private int lineIndex;

    public StructureAnalyzer(EmitterContext ctx, List<String> lines) {
        this.ctx = ctx;
        this.lines = lines;
        this.lineIndex = 0;
    }

    /**
     * Analyzes the lines with debug tracing switched off.
     */
    public static List<Block> analyze(List<String> lines) {
        return new StructureAnalyzer(new EmitterContext(new CompilerOptions()), lines).analyze();
    }

    /**
     * Scans all lines from the top and returns the blocks in source order.
     */
    public List<Block> analyze() {
        List<Block> blocks = new ArrayList<>();
        lineIndex = 0;

        while (lineIndex < lines.size()) {
            String line = lines.get(lineIndex).trim();

            if (LinePatterns.isBlank(line)) {
                lineIndex++;
                continue;
            }

            String condition = LinePatterns.matchCondition(line);
            if (condition != null) {
                blocks.add(parseConditional(condition));
                continue;
            }

            Assignment assignment = parseAssignment(line, lineIndex);
            if (assignment != null) {
                ctx.logDebug("line " + (lineIndex + 1) + ": assignment " + assignment.target());
                blocks.add(assignment);
            } else {
                ctx.logDebug("line " + (lineIndex + 1) + ": skipped '" + line + "'");
            }
            lineIndex++;
        }
        return blocks;
    }

    /**
     * Parses the conditional whose head is at the current line and moves past it,
     * including the else branch when the line after the closing brace starts with {@code else}.
     */
    private Conditional parseConditional(String condition) {
        int headLine = lineIndex;
        BraceScanner.BraceSpan thenSpan = BraceScanner.scan(lines, headLine);
        List<Assignment> body = parseBranch(thenSpan);
        ctx.logDebug("line " + (headLine + 1) + ": if (" + condition + ") body lines "
                + (thenSpan.open() + 1) + ".." + (thenSpan.close() + 1) + ", " + body.size() + " assignment(s)");

        List<Assignment> elseBody = null;
        int afterThen = thenSpan.next();
        if (afterThen < lines.size() && LinePatterns.startsElse(lines.get(afterThen))) {
            BraceScanner.BraceSpan elseSpan = BraceScanner.scan(lines, afterThen);
            elseBody = parseBranch(elseSpan);
            ctx.logDebug("line " + (afterThen + 1) + ": else body lines "
                    + (elseSpan.open() + 1) + ".." + (elseSpan.close() + 1) + ", " + elseBody.size() + " assignment(s)");
            lineIndex = elseSpan.next();
        } else {
            lineIndex = afterThen;
        }
        return new Conditional(condition, body, elseBody, headLine);
    }

    /**
     * Collects the flat assignments strictly between the opening and closing brace lines.
     */
    private List<Assignment> parseBranch(BraceScanner.BraceSpan span) {
        List<Assignment> assignments = new ArrayList<>();
        for (int k = span.firstBodyLine(); k < span.bodyEnd() && k < lines.size(); k++) {
            String bodyLine = lines.get(k).trim();
            if (LinePatterns.isBlank(bodyLine) || LinePatterns.isBareBrace(bodyLine)) {
                continue;
            }
            if (LinePatterns.matchCondition(bodyLine) != null) {
                // nested conditionals are not structure
                ctx.logDebug("line " + (k + 1) + ": nested conditional ignored");
                continue;
            }
            Assignment assignment = parseAssignment(bodyLine, k);
            if (assignment != null) {
                assignments.add(assignment);
            }
        }
        return assignments;
    }

    private static Assignment parseAssignment(String line, int sourceLine) {
        String[] parts = LinePatterns.matchAssignment(line);
        if (parts == null) {
            return null;
        }
        return new Assignment(line, parts[0], parts[1], sourceLine);
    }
}
