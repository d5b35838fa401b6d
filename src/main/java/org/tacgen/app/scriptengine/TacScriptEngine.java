package org.tacgen.app.scriptengine;

import org.tacgen.app.cli.CompilerOptions;
import org.tacgen.backend.tac.InstructionFormatter;
import org.tacgen.frontend.astnode.Block;
import org.tacgen.frontend.lexer.LinePreprocessor;
import org.tacgen.frontend.parser.StructureAnalyzer;
import org.tacgen.runtime.TacGenException;

import javax.script.*;
import java.io.Reader;
import java.io.StringWriter;
import java.util.List;

/**
 * The TacScriptEngine class exposes the generator through the Java Scripting API (JSR 223).
 * <p>
 * Evaluating a program returns its instruction listing as text, one {@code N) instruction}
 * per line. Compiling a program keeps the recovered blocks, so the listing can be produced
 * again without re-reading the source.
 */
public class TacScriptEngine extends AbstractScriptEngine implements Compilable {

    private final ScriptEngineFactory factory;

    public TacScriptEngine(ScriptEngineFactory factory) {
        this.factory = factory;
    }

    @Override
    public Object eval(String script, ScriptContext context) throws ScriptException {
        try {
            CompilerOptions options = new CompilerOptions();
            options.fileName = "<STDIN>";
            options.code = script;
            return InstructionFormatter.toText(TacLanguageProvider.generateTac(options));
        } catch (Throwable t) {
            ScriptException scriptException = new ScriptException("Error generating three-address code: " + t.getMessage());
            scriptException.initCause(t);
            throw scriptException;
        }
    }

    @Override
    public Object eval(Reader reader, ScriptContext context) throws ScriptException {
        return eval(readAll(reader), context);
    }

    /**
     * Analyze a program once for repeated generation.
     *
     * @param script The program text
     * @return A CompiledScript that generates the listing on every eval
     * @throws ScriptException if the program is blank
     */
    @Override
    public CompiledScript compile(String script) throws ScriptException {
        try {
            if (script == null || script.trim().isEmpty()) {
                throw new TacGenException("Please enter some code", "<compiled>", null);
            }
            List<Block> blocks = StructureAnalyzer.analyze(LinePreprocessor.split(script));
            return new TacCompiledScript(this, blocks);
        } catch (Throwable t) {
            ScriptException scriptException = new ScriptException("Error compiling program: " + t.getMessage());
            scriptException.initCause(t);
            throw scriptException;
        }
    }

    @Override
    public CompiledScript compile(Reader reader) throws ScriptException {
        return compile(readAll(reader));
    }

    @Override
    public Bindings createBindings() {
        return new SimpleBindings();
    }

    @Override
    public ScriptEngineFactory getFactory() {
        return factory;
    }

    private static String readAll(Reader reader) throws ScriptException {
        StringWriter writer = new StringWriter();
        char[] buffer = new char[1024];
        int numRead;
        try {
            while ((numRead = reader.read(buffer)) != -1) {
                writer.write(buffer, 0, numRead);
            }
        } catch (Exception e) {
            ScriptException scriptException = new ScriptException("Error reading script");
            scriptException.initCause(e);
            throw scriptException;
        }
        return writer.toString();
    }
}
