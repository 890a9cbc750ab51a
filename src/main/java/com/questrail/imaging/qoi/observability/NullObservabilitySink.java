package com.questrail.imaging.qoi.observability;

/**
 * No-op implementation of QoiObservabilitySink.
 */
public final class NullObservabilitySink implements QoiObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onImageEncoded(QoiCodecEvent event) {}

    @Override
    public void onImageDecoded(QoiCodecEvent event) {}

    @Override
    public void onError(QoiErrorEvent event) {}
}
