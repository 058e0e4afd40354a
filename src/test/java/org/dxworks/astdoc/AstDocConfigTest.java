package org.dxworks.astdoc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AstDocConfigTest {

    @Test
    void missingFileGivesDefaults(@TempDir Path dir) {
        AstDocConfig config = AstDocConfig.load(dir.resolve("astdoc-config.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(0, config.getPreviewLength());
        assertFalse(config.isSortChildren());
    }

    @Test
    void readsAllSettings(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("astdoc-config.yml");
        Files.writeString(file, "maxFileLines: 500\npreviewLength: 40\nsortChildren: true\n");

        AstDocConfig config = AstDocConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertEquals(40, config.getPreviewLength());
        assertTrue(config.isSortChildren());
    }

    @Test
    void outOfRangeValuesFallBackToDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("astdoc-config.yml");
        Files.writeString(file, "maxFileLines: 0\npreviewLength: -3\n");

        AstDocConfig config = AstDocConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(0, config.getPreviewLength());
        assertFalse(config.isSortChildren());
    }

    @Test
    void unparseableFileGivesDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("astdoc-config.yml");
        Files.writeString(file, "maxFileLines: [not, a, number]\n");

        AstDocConfig config = AstDocConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
    }
}
