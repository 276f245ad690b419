package org.masmtext;

/**
 * Raised when an operand cannot be rendered faithfully: an expression kind, integer width,
 * register or size type this package does not handle. Rendering of the operand stops; no
 * partial text is returned.
 */
public class UnparseException extends RuntimeException {
    public UnparseException(String message) {
        super(message);
    }
}
