package org.tacgen.app.scriptengine;

import org.tacgen.app.cli.CompilerOptions;
import org.tacgen.backend.tac.CodeGenerator;
import org.tacgen.backend.tac.EmitterContext;
import org.tacgen.backend.tac.Instruction;
import org.tacgen.frontend.analysis.PrintVisitor;
import org.tacgen.frontend.astnode.Block;
import org.tacgen.frontend.lexer.LinePreprocessor;
import org.tacgen.frontend.parser.StructureAnalyzer;
import org.tacgen.runtime.TacGenException;

import java.util.List;

/**
 * The TacLanguageProvider class runs the whole pipeline: line preprocessing, structural
 * analysis and code generation.
 * <p>
 * {@link #generate(String)} is the plain entry point used by embedders and tests.
 * {@link #generateTac(CompilerOptions)} is the front end entry point: it rejects blank
 * input and honours the debug and stop-after switches of {@link CompilerOptions}.
 */
public class TacLanguageProvider {

    private TacLanguageProvider() {
    }

    /**
     * Translates a program into its instruction listing. Never throws; input the analyzer
     * does not recognize yields a listing holding only {@code END}.
     *
     * @param sourceText the program text
     * @return the numbered instructions, ending with {@code END}
     */
    public static List<Instruction> generate(String sourceText) {
        List<String> lines = LinePreprocessor.split(sourceText);
        return CodeGenerator.generate(StructureAnalyzer.analyze(lines));
    }

    /**
     * Translates the program held by the options.
     *
     * @param compilerOptions Compiler flags, file name and source code
     * @return the instructions, or an empty list when {@code linesOnly} or {@code parseOnly}
     * stopped the pipeline after printing
     * @throws TacGenException if the source is blank
     */
    public static List<Instruction> generateTac(CompilerOptions compilerOptions) {
        if (compilerOptions.code == null || compilerOptions.code.trim().isEmpty()) {
            throw new TacGenException("Please enter some code", compilerOptions.fileName, null);
        }

        EmitterContext ctx = new EmitterContext(compilerOptions);
        ctx.logDebug("generate code: " + compilerOptions.code);

        List<String> lines = LinePreprocessor.split(compilerOptions.code);
        if (compilerOptions.linesOnly) {
            for (int i = 0; i < lines.size(); i++) {
                System.out.println(i + 1 + ": " + lines.get(i));
            }
            return List.of();
        }

        List<Block> blocks = new StructureAnalyzer(ctx, lines).analyze();
        if (compilerOptions.parseOnly) {
            System.out.print(PrintVisitor.print(blocks));
            return List.of();
        }
        ctx.logDebug("-- Blocks:\n" + PrintVisitor.print(blocks) + "--\n");

        return CodeGenerator.generate(blocks, compilerOptions);
    }
}
