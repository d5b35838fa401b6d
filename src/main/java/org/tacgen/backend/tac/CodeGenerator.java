package org.tacgen.backend.tac;

import org.tacgen.app.cli.CompilerOptions;
import org.tacgen.frontend.astnode.Block;

import java.util.List;

/**
 * Turns a block sequence into a numbered instruction listing terminated by {@code END}.
 */
public class CodeGenerator {

    private CodeGenerator() {
    }

    /**
     * Generates with debug tracing switched off.
     */
    public static List<Instruction> generate(List<Block> blocks) {
        return generate(blocks, new CompilerOptions());
    }

    public static List<Instruction> generate(List<Block> blocks, CompilerOptions compilerOptions) {
        EmitterContext ctx = new EmitterContext(compilerOptions);
        TacEmitter emitter = new TacEmitter(ctx);
        for (Block block : blocks) {
            block.accept(emitter);
        }
        ctx.emit("END");
        ctx.logDebug("generated " + ctx.instructions().size() + " instruction(s), "
                + (ctx.tempCounter() - 1) + " temporary(ies)");
        return ctx.instructions();
    }
}
