package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects structural gaps found while extracting one file.
 * Every gap is also logged at WARN, extraction always continues past it.
 */
public class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final List<String> messages = new ArrayList<>();

    public void skipped(String what, SyntaxNode node, String reason) {
        String message = "Skipped " + what + " at bytes " + node.startByte() + ".." + node.endByte() + ": " + reason;
        messages.add(message);
        log.warn(message);
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
