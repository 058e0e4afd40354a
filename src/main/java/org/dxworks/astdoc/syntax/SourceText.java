package org.dxworks.astdoc.syntax;

import java.nio.charset.StandardCharsets;

/**
 * Resolves node text from the source buffer.
 * Tree-sitter spans are UTF-8 byte offsets, so the buffer is kept as bytes and decoded per slice.
 */
public final class SourceText {

    private final String source;
    private final byte[] bytes;
    private final int previewLength;

    public SourceText(String source) {
        this(source, 0);
    }

    /**
     * @param previewLength maximum length of {@link #preview(SyntaxNode)} results, {@code 0} for no limit
     */
    public SourceText(String source, int previewLength) {
        this.source = source;
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
        this.previewLength = Math.max(0, previewLength);
    }

    public String source() {
        return source;
    }

    public String text(SyntaxNode node) {
        if (node == null) return null;
        return slice(node.startByte(), node.endByte());
    }

    /**
     * Display text for the shaped tree. Never use it for names or attribute matching.
     */
    public String preview(SyntaxNode node) {
        String text = text(node);
        if (text == null || previewLength == 0 || text.length() <= previewLength) return text;
        return text.substring(0, previewLength) + "...";
    }

    String slice(int startByte, int endByte) {
        if (startByte < 0) startByte = 0;
        if (endByte > bytes.length) endByte = bytes.length;
        if (startByte >= endByte) return "";

        String text = new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        // Normalize line endings to LF for cross-platform consistency
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
