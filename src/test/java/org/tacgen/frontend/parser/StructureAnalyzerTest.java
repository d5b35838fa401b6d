package org.tacgen.frontend.parser;

import org.junit.jupiter.api.Test;
import org.tacgen.core.Configuration;
import org.tacgen.frontend.astnode.Assignment;
import org.tacgen.frontend.astnode.Block;
import org.tacgen.frontend.astnode.Conditional;
import org.tacgen.frontend.lexer.LinePreprocessor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StructureAnalyzerTest {

    private static List<Block> analyze(String... lines) {
        return StructureAnalyzer.analyze(List.of(lines));
    }

    @Test
    public void testSampleProgramStructure() {
        List<Block> blocks = StructureAnalyzer.analyze(LinePreprocessor.split(Configuration.SAMPLE_PROGRAM));

        assertEquals(1, blocks.size());
        Conditional conditional = assertInstanceOf(Conditional.class, blocks.get(0));
        assertEquals("a<5", conditional.condition());
        assertEquals(0, conditional.sourceLine());
        assertEquals(List.of("c", "d"), conditional.body().stream().map(Assignment::target).toList());
        assertEquals(List.of("b+d", "i+j"), conditional.body().stream().map(Assignment::expression).toList());
        assertTrue(conditional.hasElse());
        assertEquals(List.of("d", "k"), conditional.elseBody().stream().map(Assignment::target).toList());
        assertEquals(7, conditional.elseBody().get(0).sourceLine());
    }

    @Test
    public void testTopLevelAssignmentsKeepSourceOrder() {
        List<Block> blocks = analyze("x = a+b", "", "  y=x * 2  ", "z= q");

        assertEquals(3, blocks.size());
        Assignment y = assertInstanceOf(Assignment.class, blocks.get(1));
        assertEquals("y", y.target());
        assertEquals("x * 2", y.expression());
        assertEquals("y=x * 2", y.text());
        assertEquals(2, y.sourceLine());
    }

    @Test
    public void testOpeningBraceOnTheIfLine() {
        List<Block> blocks = analyze("if (x > 1) {", "  y = 2", "}", "z = 3");

        assertEquals(2, blocks.size());
        Conditional conditional = assertInstanceOf(Conditional.class, blocks.get(0));
        assertEquals("x > 1", conditional.condition());
        assertEquals(1, conditional.body().size());
        assertFalse(conditional.hasElse());
        assertNull(conditional.elseBody());
        assertInstanceOf(Assignment.class, blocks.get(1));
    }

    @Test
    public void testElseMustDirectlyFollowTheClosingBrace() {
        List<Block> blocks = analyze("if (a)", "{", "b = 1", "}", "", "else", "{", "c = 2", "}");

        // the blank line separates the else from its if, so the else block is not attached
        Conditional conditional = assertInstanceOf(Conditional.class, blocks.get(0));
        assertFalse(conditional.hasElse());
        assertEquals(2, blocks.size());
        Assignment stray = assertInstanceOf(Assignment.class, blocks.get(1));
        assertEquals("c", stray.target());
    }

    @Test
    public void testEmptyElseBranchIsPresentButEmpty() {
        List<Block> blocks = analyze("if (a)", "{", "b = 1", "}", "else", "{", "}");

        Conditional conditional = assertInstanceOf(Conditional.class, blocks.get(0));
        assertTrue(conditional.hasElse());
        assertTrue(conditional.elseBody().isEmpty());
    }

    @Test
    public void testNestedConditionalIsFlattened() {
        List<Block> blocks = analyze(
                "if (a)", "{", "b = 1", "if (c == d)", "{", "e = 2", "}", "}", "f = 3");

        assertEquals(2, blocks.size());
        Conditional conditional = assertInstanceOf(Conditional.class, blocks.get(0));
        assertEquals(List.of("b", "e"), conditional.body().stream().map(Assignment::target).toList());
    }

    @Test
    public void testUnrecognizedLinesAreSkipped() {
        assertTrue(analyze("", "   ", "print x", "{", "}", "// nothing").isEmpty());
    }

    @Test
    public void testConditionalWithoutBraceConsumesTheRest() {
        List<Block> blocks = analyze("if (a)", "b = 1", "c = 2");

        assertEquals(1, blocks.size());
        Conditional conditional = assertInstanceOf(Conditional.class, blocks.get(0));
        assertTrue(conditional.body().isEmpty());
    }

    @Test
    public void testConditionTextStopsAtFirstClosingParenthesis() {
        List<Block> blocks = analyze("if ((a+b) < c) {", "d = 1", "}");

        Conditional conditional = assertInstanceOf(Conditional.class, blocks.get(0));
        assertEquals("(a+b", conditional.condition());
    }

    @Test
    public void testBraceScannerCountsLinesNotCharacters() {
        List<String> lines = List.of("if (a) {", "b = 1", "} else {", "c = 2", "}", "d = 3");

        BraceScanner.BraceSpan span = BraceScanner.scan(lines, 0);

        assertEquals(0, span.open());
        assertEquals(4, span.close());
        assertEquals(5, span.next());
    }

    @Test
    public void testBraceScannerWithoutOpeningBrace() {
        List<String> lines = List.of("if (a)", "b = 1");

        BraceScanner.BraceSpan span = BraceScanner.scan(lines, 0);

        assertEquals(2, span.open());
        assertTrue(span.next() > lines.size());
    }
}
