package org.tacgen;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.tacgen.app.scriptengine.TacLanguageProvider;
import org.tacgen.backend.tac.Instruction;
import org.tacgen.backend.tac.InstructionFormatter;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Translates every program under the {@code programs} resource directory and compares
 * the listing with the {@code .expected} file next to it.
 */
public class TacProgramExecutionTest {

    /**
     * Provides the names of the programs located in the resources directory.
     *
     * @return a Stream of resource names such as {@code programs/sample.tac}.
     * @throws IOException if an I/O error occurs while accessing the resources.
     */
    static Stream<String> providePrograms() throws IOException {
        URL resourceUrl = TacProgramExecutionTest.class.getClassLoader().getResource("programs/sample.tac");
        if (resourceUrl == null) {
            throw new IOException("Resource directory not found");
        }
        Path resourcePath;
        try {
            resourcePath = Paths.get(resourceUrl.toURI()).getParent();
        } catch (URISyntaxException e) {
            throw new RuntimeException(e);
        }

        try (Stream<Path> paths = Files.list(resourcePath)) {
            return paths
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(".tac"))
                    .sorted()
                    .map(name -> "programs/" + name)
                    .toList()
                    .stream();
        }
    }

    private String readResource(String name) throws IOException {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(name)) {
            assertNotNull(inputStream, "Resource file not found: " + name);
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @ParameterizedTest(name = "Test using resource file: {0}")
    @MethodSource("providePrograms")
    void testUsingResourceFile(String filename) throws IOException {
        String source = readResource(filename);
        String expected = readResource(filename.replace(".tac", ".expected")).trim();

        List<Instruction> instructions = TacLanguageProvider.generate(source);

        assertEquals(expected, InstructionFormatter.toText(instructions), "Listing differs for " + filename);
    }

    @ParameterizedTest(name = "Listing is well formed: {0}")
    @MethodSource("providePrograms")
    void testListingIsWellFormed(String filename) throws IOException {
        List<Instruction> instructions = TacLanguageProvider.generate(readResource(filename));

        for (int i = 0; i < instructions.size(); i++) {
            assertEquals(i + 1, instructions.get(i).sequenceNumber(), "sequence numbers are gap free");
        }
        assertEquals("END", instructions.get(instructions.size() - 1).text());
        assertEquals(1, instructions.stream().filter(instruction -> instruction.text().equals("END")).count());
        for (Instruction instruction : instructions) {
            int target = instruction.jumpTarget();
            if (target != -1) {
                assertTrue(target > instruction.sequenceNumber() && target <= instructions.size(),
                        "forward jump inside the listing: " + instruction);
            }
        }
    }
}
