package org.tacgen.frontend.astnode;

import org.tacgen.frontend.analysis.BlockVisitor;

/**
 * A top-level structural unit recovered from the source lines: either a single
 * {@link Assignment} or a {@link Conditional} with an optional else branch.
 * <p>
 * The hierarchy is sealed, and every consumer goes through {@link BlockVisitor},
 * so adding a block kind fails to compile until each visitor handles it.
 */
public sealed interface Block permits Assignment, Conditional {

    /**
     * Accepts a visitor that performs some operation on this block.
     *
     * @param visitor the visitor that will perform the operation on this block
     */
    void accept(BlockVisitor visitor);

    /**
     * @return the 0-based index of the source line that starts this block
     */
    int sourceLine();
}
