package org.tacgen.app.scriptengine;

import org.tacgen.backend.tac.CodeGenerator;
import org.tacgen.backend.tac.Instruction;
import org.tacgen.backend.tac.InstructionFormatter;
import org.tacgen.frontend.astnode.Block;

import javax.script.CompiledScript;
import javax.script.ScriptContext;
import javax.script.ScriptEngine;
import javax.script.ScriptException;
import java.util.List;

/**
 * TacCompiledScript holds the blocks of an analyzed program. Each evaluation runs the
 * code generator again with fresh counters, so repeated evaluations return equal listings.
 */
public class TacCompiledScript extends CompiledScript {

    private final TacScriptEngine engine;
    private final List<Block> blocks;

    public TacCompiledScript(TacScriptEngine engine, List<Block> blocks) {
        this.engine = engine;
        this.blocks = List.copyOf(blocks);
    }

    /**
     * @return the instruction listing as text
     */
    @Override
    public Object eval(ScriptContext context) throws ScriptException {
        return InstructionFormatter.toText(getInstructions());
    }

    public List<Instruction> getInstructions() {
        return CodeGenerator.generate(blocks);
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    @Override
    public ScriptEngine getEngine() {
        return engine;
    }
}
