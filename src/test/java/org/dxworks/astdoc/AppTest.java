package org.dxworks.astdoc;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.astdoc.analyzer.Diagnostics;
import org.dxworks.astdoc.model.DocumentReport;
import org.dxworks.astdoc.model.ImportInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return App.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void missingArgumentPrintsUsage() {
        assertEquals(App.EXIT_USAGE, run());
        assertTrue(stderr().startsWith("Usage:"));
        assertEquals("", stdout());
    }

    @Test
    void unreadableFileIsAnInputError(@TempDir Path dir) {
        Path missing = dir.resolve("missing.rs");

        assertEquals(App.EXIT_INPUT_ERROR, run(missing.toString()));
        assertTrue(stderr().contains("cannot read"));
        assertEquals("", stdout());
    }

    @Test
    void analyzesFileAndPrintsJson(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("lib.rs");
        Files.writeString(file, "use std::fmt;\n\npub fn greet(name: &str) -> String {\n    format!(\"hi {}\", name)\n}\n");

        assertEquals(App.EXIT_OK, run(file.toString()));

        JsonNode json = ReportWriter.MAPPER.readTree(stdout());
        assertEquals("use std::fmt;", json.get("imports").get(0).get("name").asText());
        JsonNode greet = json.get("functions").get(0);
        assertEquals("greet", greet.get("name").asText());
        assertEquals("String", greet.get("return_type").asText());
        assertEquals("format!", greet.get("called_methods").get(0).get("name").asText());
        assertEquals("Root", json.get("nested_items").get("kind").asText());
    }

    @Test
    void serializationFailureIsNotReportedAsAnInputError() {
        DocumentReport report = new DocumentReport();
        report.imports.add(new UnwritableImport());

        int exitCode = App.write(report, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(App.EXIT_OUTPUT_ERROR, exitCode);
        assertTrue(stderr().startsWith("Error: cannot write the JSON document"));
        assertFalse(stderr().contains("cannot read"));
        assertEquals("", stdout());
    }

    @Test
    void byteOrderMarkIsIgnored() {
        DocumentReport report = App.analyzeSource("\uFEFFfn main() {}\n", AstDocConfig.defaults(), new Diagnostics());

        assertEquals(1, report.functions.size());
        assertEquals("fn main() {}", report.functions.get(0).body);
    }

    @Test
    void fileOverTheLineLimitIsRejected(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("long.rs");
        Files.writeString(file, "fn a() {}\nfn b() {}\nfn c() {}\n");
        AstDocConfig config = AstDocConfig.with(2, 0, false);

        assertThrows(IllegalArgumentException.class, () -> App.analyzeFile(file, config, new Diagnostics()));
    }

    @Test
    void sampleFileDiagnosticsAreCollected() throws IOException {
        Diagnostics diagnostics = new Diagnostics();

        DocumentReport report = App.analyzeFile(Paths.get(TestUtils.SAMPLES + "Inventory.rs"),
                AstDocConfig.defaults(), diagnostics);

        assertEquals(3, report.functions.size());
        assertEquals(2, report.structs.size());
        assertEquals(3, report.metadata.size());
        assertEquals(2, report.schemas.size());
        assertEquals(2, diagnostics.getMessages().size());
    }

    public static class UnwritableImport extends ImportInfo {
        public UnwritableImport() {
            super("use broken;");
        }

        public String getBroken() {
            throw new IllegalStateException("not serializable");
        }
    }
}
