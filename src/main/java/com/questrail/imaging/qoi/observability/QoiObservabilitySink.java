package com.questrail.imaging.qoi.observability;

/**
 * Main interface for receiving QOI codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface QoiObservabilitySink {
    /**
     * Called after an image was completely encoded.
     * @param event the encode details
     */
    void onImageEncoded(QoiCodecEvent event);

    /**
     * Called after an image was completely decoded.
     * @param event the decode details
     */
    void onImageDecoded(QoiCodecEvent event);

    /**
     * Called when a decode fails.
     * @param event the error event
     */
    void onError(QoiErrorEvent event);
}
