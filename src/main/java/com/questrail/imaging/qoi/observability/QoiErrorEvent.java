package com.questrail.imaging.qoi.observability;

import com.questrail.imaging.qoi.codec.QoiDecodeException;

import java.time.Instant;

/**
 * Record representing a failed decode.
 */
public record QoiErrorEvent(
    Instant timestamp,
    String message,
    QoiDecodeException cause
) {
    public QoiDecodeException.Kind kind() {
        return cause.kind();
    }
}
