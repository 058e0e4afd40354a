package org.dxworks.astdoc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class AstDocConfig {

    private static final Logger log = LoggerFactory.getLogger(AstDocConfig.class);

    private static final String CONFIG_FILE_NAME = "astdoc-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_PREVIEW_LENGTH = 0;
    private static final boolean DEFAULT_SORT_CHILDREN = false;

    private final int maxFileLines;
    private final int previewLength;
    private final boolean sortChildren;

    private AstDocConfig(int maxFileLines, int previewLength, boolean sortChildren) {
        this.maxFileLines = maxFileLines;
        this.previewLength = previewLength;
        this.sortChildren = sortChildren;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /**
     * Maximum length of element text in {@code nested_items}, {@code 0} keeps the full text.
     */
    public int getPreviewLength() {
        return previewLength;
    }

    /**
     * Whether {@code nested_items} children are ordered by (kind, name) instead of document order.
     */
    public boolean isSortChildren() {
        return sortChildren;
    }

    public static AstDocConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static AstDocConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                int effectivePreviewLength = (yamlConfig.previewLength != null && yamlConfig.previewLength >= 0)
                        ? yamlConfig.previewLength
                        : DEFAULT_PREVIEW_LENGTH;
                boolean effectiveSortChildren = (yamlConfig.sortChildren != null)
                        ? yamlConfig.sortChildren
                        : DEFAULT_SORT_CHILDREN;

                return new AstDocConfig(effectiveMaxFileLines, effectivePreviewLength, effectiveSortChildren);
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static AstDocConfig defaults() {
        return new AstDocConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_PREVIEW_LENGTH, DEFAULT_SORT_CHILDREN);
    }

    public static AstDocConfig with(int maxFileLines, int previewLength, boolean sortChildren) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new AstDocConfig(effectiveMaxFileLines, Math.max(0, previewLength), sortChildren);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer previewLength;
        public Boolean sortChildren;
    }
}
