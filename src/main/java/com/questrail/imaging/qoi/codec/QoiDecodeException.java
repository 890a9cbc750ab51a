package com.questrail.imaging.qoi.codec;

import java.util.Objects;

/**
 * Indicates that a byte sequence could not be decoded into a QOI image.
 *
 * <p>Every decode failure is terminal for the call that raised it: no partial
 * image is ever returned. The {@link Kind} tells the caller why.</p>
 */
public final class QoiDecodeException extends RuntimeException
{
    /**
     * Failure classification.
     */
    public enum Kind
    {
        /** The leading four bytes are not the {@code qoif} signature. */
        INVALID_MAGIC,

        /** The header channel or colorspace byte is not a recognized value. */
        INVALID_TAG,

        /**
         * The stream is structurally inconsistent: too short for its declared
         * dimensions, a run overruns the pixel count, or a malformed end marker.
         */
        INVALID_DATA,

        /** The source ended before an opcode or the header was complete. */
        END_OF_STREAM,

        /** The declared dimensions exceed the configured or allocatable pixel limit. */
        OUT_OF_MEMORY
    }

    private final Kind kind;

    public QoiDecodeException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public QoiDecodeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
