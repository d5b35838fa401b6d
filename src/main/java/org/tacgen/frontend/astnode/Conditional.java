package org.tacgen.frontend.astnode;

import org.tacgen.frontend.analysis.BlockVisitor;

import java.util.List;

/**
 * An {@code if (<condition>) { ... }} block, possibly followed by {@code else { ... }}.
 * Both branches hold flat assignments only.
 *
 * @param condition  the text between the parentheses, trimmed
 * @param body       the assignments of the true branch
 * @param elseBody   the assignments of the else branch, or null when there is no else
 * @param sourceLine 0-based index of the {@code if} line
 */
public record Conditional(String condition, List<Assignment> body, List<Assignment> elseBody, int sourceLine)
        implements Block {

    public Conditional {
        body = List.copyOf(body);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public void accept(BlockVisitor visitor) {
        visitor.visit(this);
    }
}
