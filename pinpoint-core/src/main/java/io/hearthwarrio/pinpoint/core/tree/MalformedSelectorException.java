package io.hearthwarrio.pinpoint.core.tree;

/**
 * Thrown by a {@link DocumentTree} when a selector string is not valid syntax for the host.
 */
public class MalformedSelectorException extends RuntimeException {

    public MalformedSelectorException(String message) {
        super(message);
    }

    public MalformedSelectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
