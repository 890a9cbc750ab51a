package com.questrail.imaging.qoi.config;

import com.questrail.imaging.qoi.observability.NullObservabilitySink;
import com.questrail.imaging.qoi.observability.QoiObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for the QOI encoder and decoder.
 *
 * @param maxPixels largest {@code width * height} the decoder will allocate for
 * @param requireEndMarker whether decode must find the 8-byte end marker after the last opcode
 * @param observabilitySink receiver of encode/decode/error events
 */
public record QoiCodecConfig(
    long maxPixels,
    boolean requireEndMarker,
    QoiObservabilitySink observabilitySink
) {
    /** Largest pixel array the JVM can reliably allocate. */
    public static final long MAX_ARRAY_PIXELS = Integer.MAX_VALUE - 8;

    public QoiCodecConfig {
        if (maxPixels <= 0 || maxPixels > MAX_ARRAY_PIXELS) {
            throw new IllegalArgumentException(
                "maxPixels must be in range 1–" + MAX_ARRAY_PIXELS + " (was " + maxPixels + ")");
        }
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static QoiCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long maxPixels = MAX_ARRAY_PIXELS;
        private boolean requireEndMarker = false;
        private QoiObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withMaxPixels(long maxPixels) {
            this.maxPixels = maxPixels;
            return this;
        }

        public Builder withRequireEndMarker(boolean requireEndMarker) {
            this.requireEndMarker = requireEndMarker;
            return this;
        }

        public Builder withObservabilitySink(QoiObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public QoiCodecConfig build() {
            return new QoiCodecConfig(maxPixels, requireEndMarker, observabilitySink);
        }
    }
}
