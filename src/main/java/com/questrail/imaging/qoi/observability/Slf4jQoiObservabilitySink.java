package com.questrail.imaging.qoi.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of QoiObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jQoiObservabilitySink implements QoiObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jQoiObservabilitySink.class);

    @Override
    public void onImageEncoded(QoiCodecEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("QOI encoded {}x{} {} {} into {} bytes (ratio {})",
                event.header().width(),
                event.header().height(),
                event.header().channels(),
                event.header().colorspace(),
                event.encodedBytes(),
                String.format("%.2f", event.compressionRatio()));
        }
    }

    @Override
    public void onImageDecoded(QoiCodecEvent event) {
        log.debug("QOI decoded {}x{} {} {} from {} bytes",
            event.header().width(),
            event.header().height(),
            event.header().channels(),
            event.header().colorspace(),
            event.encodedBytes());
    }

    @Override
    public void onError(QoiErrorEvent event) {
        log.warn("QOI decode failed [{}]: {}", event.kind(), event.message());
    }
}
