package org.tacgen.frontend.astnode;

import org.tacgen.frontend.analysis.BlockVisitor;

/**
 * A line of the form {@code <identifier> = <expression>}, at top level or inside a branch.
 *
 * @param text       the trimmed source line
 * @param target     the assigned identifier
 * @param expression everything after the {@code =}, trimmed
 * @param sourceLine 0-based index of the source line
 */
public record Assignment(String text, String target, String expression, int sourceLine) implements Block {

    @Override
    public void accept(BlockVisitor visitor) {
        visitor.visit(this);
    }
}
