package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.codec.QoiImageEncoder;
import com.questrail.imaging.qoi.config.QoiCodecConfig;
import com.questrail.imaging.qoi.model.ImageView;
import com.questrail.imaging.qoi.model.QoiHeader;
import com.questrail.imaging.qoi.observability.QoiCodecEvent;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Objects;

/**
 * DefaultQoiImageEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link QoiImageEncoder}.
 *
 * <p>Walks the image once in row-major order, feeding every pixel to a fresh
 * {@link QoiPixelEncoder}. The buffer and stream variants share that path and
 * therefore produce identical bytes.</p>
 *
 * <p>The header's channel format is {@code RGB} when every pixel is opaque and
 * {@code RGBA} otherwise; the colorspace is taken from the image.</p>
 */
public final class DefaultQoiImageEncoder implements QoiImageEncoder
{
    /** Initial buffer guess: half the raw RGBA size, capped. */
    private static final int MAX_INITIAL_CAPACITY = 1 << 20;

    private final QoiCodecConfig config;

    public DefaultQoiImageEncoder()
    {
        this(QoiCodecConfig.defaults());
    }

    public DefaultQoiImageEncoder(QoiCodecConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public byte[] encode(ImageView image)
    {
        Objects.requireNonNull(image, "image");

        final long estimate = QoiFraming.HEADER_SIZE + image.pixelCount() * 2L + QoiFraming.END_MARKER_SIZE;
        final ByteArrayOutputStream out =
                new ByteArrayOutputStream((int) Math.min(estimate, MAX_INITIAL_CAPACITY));
        try {
            encode(image, out);
        }
        catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    @Override
    public void encode(ImageView image, OutputStream sink) throws IOException
    {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(sink, "sink");

        final QoiHeader header = QoiHeader.forImage(image);
        final QoiPixelEncoder encoder = QoiPixelEncoder.open(sink, header);

        final int count = image.pixelCount();
        for (int i = 0; i < count; i++) {
            encoder.push(image.pixelAt(i));
        }
        encoder.finish();

        config.observabilitySink().onImageEncoded(new QoiCodecEvent(
                Instant.now(),
                QoiCodecEvent.Direction.ENCODE,
                header,
                encoder.bytesWritten()));
    }
}
