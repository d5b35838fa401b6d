package org.tacgen.frontend.analysis;

import org.tacgen.frontend.astnode.Assignment;
import org.tacgen.frontend.astnode.Block;
import org.tacgen.frontend.astnode.Conditional;

import java.util.List;

/*
 * Renders the recovered block structure, one node per line, for --parse and --debug.
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   block.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements BlockVisitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    public static String print(List<Block> blocks) {
        PrintVisitor printVisitor = new PrintVisitor();
        for (Block block : blocks) {
            block.accept(printVisitor);
        }
        return printVisitor.getResult();
    }

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    @Override
    public void visit(Assignment node) {
        appendIndent();
        sb.append("Assignment: ").append(node.target())
                .append(" = ").append(node.expression())
                .append("  line:").append(node.sourceLine() + 1).append("\n");
    }

    @Override
    public void visit(Conditional node) {
        appendIndent();
        sb.append("Conditional: ").append(node.condition())
                .append("  line:").append(node.sourceLine() + 1).append("\n");
        indentLevel++;
        appendIndent();
        sb.append("Then:\n");
        visitBranch(node.body());
        if (node.hasElse()) {
            appendIndent();
            sb.append("Else:\n");
            visitBranch(node.elseBody());
        }
        indentLevel--;
    }

    private void visitBranch(List<Assignment> branch) {
        indentLevel++;
        if (branch.isEmpty()) {
            appendIndent();
            sb.append("(empty)\n");
        }
        for (Assignment assignment : branch) {
            assignment.accept(this);
        }
        indentLevel--;
    }
}
