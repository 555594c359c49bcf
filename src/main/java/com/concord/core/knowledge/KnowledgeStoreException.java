package com.concord.core.knowledge;

/**
 * Raised when the knowledge store cannot read or write.
 */
public class KnowledgeStoreException extends RuntimeException {

    public KnowledgeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
