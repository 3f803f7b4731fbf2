package io.mailq.infrastructure.codec;

/**
 * Extractor JSON could not be turned into entities (or entities into JSON).
 */
public class EntityCodecException extends RuntimeException {
    public EntityCodecException(String message) {
        super(message);
    }

    public EntityCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
