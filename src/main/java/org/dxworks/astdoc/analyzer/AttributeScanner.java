package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.model.AttributeInfo;
import org.dxworks.astdoc.syntax.SourceText;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code #[...]} and {@code #![...]} attribute items.
 */
public class AttributeScanner {

    static final String DERIVE_MARKER = "derive";

    private static final Pattern DERIVE_LIST = Pattern.compile("derive\\s*\\(([^)]*)\\)");

    private final SourceText source;
    private final Diagnostics diagnostics;
    private final Map<String, Optional<AttributeInfo>> readItems = new HashMap<>();

    public AttributeScanner(SourceText source, Diagnostics diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    public static boolean isAttributeItem(SyntaxNode node) {
        return node.isKind("attribute_item", "inner_attribute_item");
    }

    /**
     * Attribute items among the direct children of {@code node}.
     */
    public List<AttributeInfo> attributes(SyntaxNode node) {
        List<AttributeInfo> result = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (isAttributeItem(child)) {
                readItem(child).ifPresent(result::add);
            }
        }
        return result;
    }

    /**
     * Attribute items placed immediately before the child at {@code index} of {@code container}.
     * The grammar keeps outer attributes as preceding siblings, not as children of the item they annotate.
     */
    public List<AttributeInfo> leadingAttributes(SyntaxNode container, int index) {
        List<SyntaxNode> siblings = container.namedChildren();
        List<AttributeInfo> result = new ArrayList<>();
        for (int i = index - 1; i >= 0; i--) {
            SyntaxNode sibling = siblings.get(i);
            if (sibling.isKind("attribute_item")) {
                readItem(sibling).ifPresent(result::add);
            } else if (!sibling.isKind("line_comment", "block_comment")) {
                break;
            }
        }
        Collections.reverse(result);
        return result;
    }

    /**
     * Same as {@link #leadingAttributes(SyntaxNode, int)} for a node located by identity inside its container.
     */
    public List<AttributeInfo> leadingAttributes(SyntaxNode container, SyntaxNode item) {
        List<SyntaxNode> siblings = container.namedChildren();
        for (int i = 0; i < siblings.size(); i++) {
            SyntaxNode sibling = siblings.get(i);
            if (sibling.startByte() == item.startByte() && sibling.endByte() == item.endByte()
                    && sibling.kind().equals(item.kind())) {
                return leadingAttributes(container, i);
            }
        }
        return new ArrayList<>();
    }

    /**
     * Source text of one attribute item, or empty (with a diagnostic) when the brackets hold no attribute.
     * Each item is read once per file, so scanning it again from another extractor reports nothing new.
     */
    public Optional<AttributeInfo> readItem(SyntaxNode attributeItem) {
        String key = attributeItem.kind() + "@" + attributeItem.startByte() + ".." + attributeItem.endByte();
        return readItems.computeIfAbsent(key, k -> read(attributeItem));
    }

    private Optional<AttributeInfo> read(SyntaxNode attributeItem) {
        boolean hasContent = attributeItem.namedChildren().stream().anyMatch(c -> c.isKind("attribute"));
        if (!hasContent) {
            diagnostics.skipped("attribute", attributeItem, "no attribute content inside the brackets");
            return Optional.empty();
        }
        return Optional.of(new AttributeInfo(source.text(attributeItem)));
    }

    public static boolean isDerive(AttributeInfo attribute) {
        return attribute.attribute != null && attribute.attribute.contains(DERIVE_MARKER);
    }

    /**
     * Trait names listed in a {@code derive(...)} attribute, in source order.
     */
    public static List<String> derivedTraits(AttributeInfo attribute) {
        List<String> traits = new ArrayList<>();
        if (attribute.attribute == null) return traits;
        Matcher matcher = DERIVE_LIST.matcher(attribute.attribute);
        while (matcher.find()) {
            for (String part : matcher.group(1).split(",")) {
                String trait = part.trim();
                if (!trait.isEmpty()) traits.add(trait);
            }
        }
        return traits;
    }
}
