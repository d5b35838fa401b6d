package org.tacgen.frontend.analysis;

import org.tacgen.frontend.astnode.Assignment;
import org.tacgen.frontend.astnode.Conditional;

/**
 * Visitor over the two block kinds.
 */
public interface BlockVisitor {

    void visit(Assignment node);

    void visit(Conditional node);
}
