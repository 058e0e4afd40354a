package org.dxworks.astdoc;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.dxworks.astdoc.analyzer.Diagnostics;
import org.dxworks.astdoc.analyzer.LanguageAnalyzer;
import org.dxworks.astdoc.analyzer.RustDocumentAssembler;
import org.dxworks.astdoc.model.DocumentReport;
import org.dxworks.astdoc.syntax.RustSourceParser;
import org.dxworks.astdoc.syntax.SourceParseException;
import org.dxworks.astdoc.syntax.SourceText;
import org.dxworks.astdoc.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_OUTPUT_ERROR = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println("Usage: java -jar astdoc.jar <rust-source-file>");
            err.println("  <rust-source-file>: Path to the Rust file to analyze");
            err.println("The JSON document is written to standard output.");
            return EXIT_USAGE;
        }

        Path input = Paths.get(args[0]);
        AstDocConfig config = AstDocConfig.load();
        DocumentReport report;
        try {
            report = analyzeFile(input, config, new Diagnostics());
        } catch (IOException e) {
            err.println("Error: cannot read " + input + ": " + e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (SourceParseException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
        return write(report, out, err);
    }

    static int write(DocumentReport report, PrintStream out, PrintStream err) {
        try {
            out.println(ReportWriter.toJson(report));
            return EXIT_OK;
        } catch (JsonProcessingException e) {
            log.debug("Serialization failed", e);
            err.println("Error: cannot write the JSON document: " + e.getOriginalMessage());
            return EXIT_OUTPUT_ERROR;
        }
    }

    public static DocumentReport analyzeFile(Path filePath, AstDocConfig config, Diagnostics diagnostics)
            throws IOException {
        log.info("Analyzing {}", filePath.toAbsolutePath());
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        long lines = sourceCode.lines().count();
        if (lines > config.getMaxFileLines()) {
            throw new IllegalArgumentException(filePath + " has " + lines + " lines, more than the configured maximum of "
                    + config.getMaxFileLines());
        }
        DocumentReport report = analyzeSource(sourceCode, config, diagnostics);
        if (!diagnostics.isEmpty()) {
            log.info("{}: {} construct(s) skipped", filePath.getFileName(), diagnostics.getMessages().size());
        }
        return report;
    }

    public static DocumentReport analyzeSource(String sourceCode, AstDocConfig config, Diagnostics diagnostics) {
        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        SyntaxNode rootNode = new RustSourceParser().parse(sourceCode);
        SourceText source = new SourceText(sourceCode, config.getPreviewLength());
        LanguageAnalyzer analyzer = new RustDocumentAssembler(config.isSortChildren());
        return analyzer.analyze(source, rootNode, diagnostics);
    }
}
