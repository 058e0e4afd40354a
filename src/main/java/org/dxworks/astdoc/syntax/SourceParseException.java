package org.dxworks.astdoc.syntax;

/**
 * Thrown when the parser cannot produce a syntax tree for the input at all.
 */
public class SourceParseException extends RuntimeException {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
