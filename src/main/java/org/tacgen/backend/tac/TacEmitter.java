package org.tacgen.backend.tac;

import org.tacgen.frontend.analysis.BlockVisitor;
import org.tacgen.frontend.astnode.Assignment;
import org.tacgen.frontend.astnode.Conditional;

import java.util.List;

/**
 * Emits the instructions of each block into an {@link EmitterContext}.
 * <p>
 * Every assignment takes two instructions, so the jump targets of a conditional follow from
 * the sizes of its branches. With {@code L} the number of the {@code if} instruction,
 * {@code n} body and {@code m} else assignments:
 * <pre>
 *   L            if (cond) goto L+2
 *   L+1          goto L+3+2n        (L+2+2n without else)
 *   L+2..L+1+2n  body
 *   L+2+2n       goto__L+3+2n+2m_   (else only)
 *   ...          else body
 * </pre>
 * The end-of-branch marker is written {@code goto__N_} on purpose: consumers key on the
 * {@code goto} prefix and the listing format depends on that spelling.
 */
public class TacEmitter implements BlockVisitor {

    private final EmitterContext ctx;

    public TacEmitter(EmitterContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void visit(Assignment node) {
        int temporary = ctx.nextTemporary();
        ctx.emit("T" + temporary + "=" + node.expression());
        ctx.emit(node.target() + "=T" + temporary);
    }

    @Override
    public void visit(Conditional node) {
        int ifLine = ctx.lineNumber();
        int bodySize = instructionCount(node.body());
        ctx.logDebug("conditional at " + ifLine + ": " + node.body().size() + " then, "
                + (node.hasElse() ? node.elseBody().size() : 0) + " else");

        // The true branch always starts right after the jump that skips it
        ctx.emit("if (" + node.condition() + ") goto " + (ifLine + 2));

        if (!node.hasElse()) {
            ctx.emit("goto " + (ifLine + 2 + bodySize));
            emitBranch(node.body());
            return;
        }

        // Skip the body and the end-of-branch jump
        ctx.emit("goto " + (ifLine + 2 + bodySize + 1));
        emitBranch(node.body());

        int elseStart = ctx.lineNumber() + 1;
        ctx.emit("goto__" + (elseStart + instructionCount(node.elseBody())) + "_");
        emitBranch(node.elseBody());
    }

    private void emitBranch(List<Assignment> branch) {
        for (Assignment assignment : branch) {
            assignment.accept(this);
        }
    }

    private static int instructionCount(List<Assignment> branch) {
        return branch.size() * 2;
    }
}
