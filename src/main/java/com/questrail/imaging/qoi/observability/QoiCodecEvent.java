package com.questrail.imaging.qoi.observability;

import com.questrail.imaging.qoi.model.QoiHeader;

import java.time.Instant;

/**
 * Record describing one completed encode or decode.
 *
 * @param encodedBytes size of the QOI stream written or consumed, header included
 */
public record QoiCodecEvent(
    Instant timestamp,
    Direction direction,
    QoiHeader header,
    long encodedBytes
) {
    public enum Direction {
        ENCODE,
        DECODE
    }

    /**
     * Raw RGBA size divided by encoded size.
     */
    public double compressionRatio() {
        if (encodedBytes == 0) {
            return 0.0;
        }
        return (header.pixelCount() * 4.0) / encodedBytes;
    }
}
