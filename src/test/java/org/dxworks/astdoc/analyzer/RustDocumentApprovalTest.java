package org.dxworks.astdoc.analyzer;

import org.approvaltests.Approvals;
import org.dxworks.astdoc.App;
import org.dxworks.astdoc.AstDocConfig;
import org.dxworks.astdoc.ReportWriter;
import org.dxworks.astdoc.TestUtils;
import org.dxworks.astdoc.model.DocumentReport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class RustDocumentApprovalTest {

    // short previews keep the approved tree readable
    private static final AstDocConfig CONFIG = AstDocConfig.with(20000, 24, false);

    @Test
    void analyzeInventory() throws IOException {
        verify(Paths.get(TestUtils.SAMPLES + "Inventory.rs"));
    }

    private static void verify(Path file) throws IOException {
        DocumentReport report = App.analyzeFile(file, CONFIG, new Diagnostics());
        Approvals.verify(ReportWriter.toJson(report) + "\n");
    }
}
