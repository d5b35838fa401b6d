package org.tacgen.app.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tacgen.backend.tac.OutputFormat;
import org.tacgen.core.Configuration;
import org.tacgen.runtime.TacGenException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentParserTest {

    @Test
    public void testDefaults() {
        CompilerOptions options = ArgumentParser.parseArguments(new String[0]);

        assertNull(options.code);
        assertEquals(OutputFormat.TEXT, options.outputFormat);
        assertEquals(Configuration.DEFAULT_STEP_DELAY_MILLIS, options.stepDelayMillis);
        assertFalse(options.debugEnabled || options.parseOnly || options.linesOnly || options.stepMode);
    }

    @Test
    public void testInlineProgramAndSwitches() {
        CompilerOptions options = ArgumentParser.parseArguments(
                new String[]{"--debug", "--format", "json", "--step", "--delay=300", "-e", "x = 1"});

        assertEquals("x = 1", options.code);
        assertEquals("-e", options.fileName);
        assertTrue(options.debugEnabled);
        assertTrue(options.stepMode);
        assertEquals(OutputFormat.JSON, options.outputFormat);
        assertEquals(300, options.stepDelayMillis);
    }

    @Test
    public void testDelayIsClamped() {
        assertEquals(Configuration.MIN_STEP_DELAY_MILLIS,
                ArgumentParser.parseArguments(new String[]{"--delay", "5"}).stepDelayMillis);
        assertEquals(Configuration.MAX_STEP_DELAY_MILLIS,
                ArgumentParser.parseArguments(new String[]{"--delay=99999"}).stepDelayMillis);
    }

    @Test
    public void testExample() {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{"--example", "--format=yaml"});

        assertEquals(Configuration.SAMPLE_PROGRAM, options.code);
        assertEquals(OutputFormat.YAML, options.outputFormat);
    }

    @Test
    public void testProgramFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("prog.tac");
        Files.writeString(file, "y = b*c\n", StandardCharsets.UTF_8);

        CompilerOptions options = ArgumentParser.parseArguments(new String[]{"--parse", file.toString()});

        assertEquals("y = b*c\n", options.code);
        assertEquals(file.toString(), options.fileName);
        assertTrue(options.parseOnly);
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.tac").toString();

        TacGenException e = assertThrows(TacGenException.class,
                () -> ArgumentParser.parseArguments(new String[]{missing}));
        assertEquals("Unable to read file " + missing, e.getMessage());
        assertNotNull(e.getCause());
    }

    @Test
    public void testErrors() {
        assertThrows(TacGenException.class, () -> ArgumentParser.parseArguments(new String[]{"--bogus"}));
        assertThrows(TacGenException.class, () -> ArgumentParser.parseArguments(new String[]{"-x"}));
        assertThrows(TacGenException.class, () -> ArgumentParser.parseArguments(new String[]{"-e"}));
        assertThrows(TacGenException.class, () -> ArgumentParser.parseArguments(new String[]{"--format", "xml"}));
        assertThrows(TacGenException.class, () -> ArgumentParser.parseArguments(new String[]{"--delay", "soon"}));
        assertThrows(TacGenException.class, () -> ArgumentParser.parseArguments(new String[]{"--lines", "--parse"}));
        assertThrows(TacGenException.class, () -> ArgumentParser.parseArguments(new String[]{"-e", "x = 1", "-e", "y = 2"}));
    }

    @Test
    public void testHelpAndVersion() {
        assertTrue(ArgumentParser.parseArguments(new String[]{"-h"}).helpRequested);
        assertTrue(ArgumentParser.parseArguments(new String[]{"--help"}).helpRequested);
        assertTrue(ArgumentParser.parseArguments(new String[]{"-v"}).versionRequested);
        assertTrue(ArgumentParser.parseArguments(new String[]{"--version"}).versionRequested);
    }

    @Test
    public void testCloneIsIndependent() {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{"-e", "x = 1"});
        CompilerOptions copy = options.clone();
        copy.code = "y = 2";

        assertEquals("x = 1", options.code);
        assertTrue(options.toString().contains("code='x = 1'"));
    }
}
