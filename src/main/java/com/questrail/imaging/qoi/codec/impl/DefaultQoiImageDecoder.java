package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.codec.QoiByteSource;
import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiDecodeException.Kind;
import com.questrail.imaging.qoi.codec.QoiImageDecoder;
import com.questrail.imaging.qoi.config.QoiCodecConfig;
import com.questrail.imaging.qoi.model.PixelRun;
import com.questrail.imaging.qoi.model.QoiHeader;
import com.questrail.imaging.qoi.model.QoiImage;
import com.questrail.imaging.qoi.observability.QoiCodecEvent;
import com.questrail.imaging.qoi.observability.QoiErrorEvent;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultQoiImageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link QoiImageDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Header decode (magic, channels and colorspace tags)</li>
 *   <li>Pixel limit check against {@link QoiCodecConfig#maxPixels()}, before
 *       any pixel memory is allocated</li>
 *   <li>For buffers: length check against
 *       {@link QoiFraming#minimumEncodedLength(QoiHeader)}</li>
 *   <li>Opcode interpretation via {@link QoiPixelDecoder}</li>
 *   <li>Optional end marker check ({@link QoiCodecConfig#requireEndMarker()})</li>
 * </ol>
 *
 * <p>Pixels are collected in a {@link QoiPixelBuffer}, which grows
 * geometrically towards the declared pixel count and hands its array to the
 * image without a final copy.</p>
 */
public final class DefaultQoiImageDecoder implements QoiImageDecoder
{
    private final QoiCodecConfig config;

    public DefaultQoiImageDecoder()
    {
        this(QoiCodecConfig.defaults());
    }

    public DefaultQoiImageDecoder(QoiCodecConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public boolean isValidContainer(byte[] data)
    {
        if (data == null || data.length < QoiFraming.HEADER_SIZE) {
            return false;
        }
        try {
            final QoiHeader header = QoiHeaderCodec.decode(data);
            return header.pixelCount() <= config.maxPixels()
                    && data.length >= QoiFraming.minimumEncodedLength(header);
        }
        catch (QoiDecodeException e) {
            return false;
        }
    }

    @Override
    public QoiImage decode(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        try {
            if (data.length < QoiFraming.HEADER_SIZE) {
                throw new QoiDecodeException(Kind.INVALID_DATA,
                        "Buffer of " + data.length + " bytes is shorter than the QOI header");
            }

            final QoiPixelDecoder decoder = QoiPixelDecoder.open(new ArrayByteSource(data));
            final QoiHeader header = decoder.header();
            checkPixelLimit(header);

            final long minimum = QoiFraming.minimumEncodedLength(header);
            if (data.length < minimum) {
                throw new QoiDecodeException(Kind.INVALID_DATA,
                        "Buffer of " + data.length + " bytes cannot hold a "
                                + header.width() + "x" + header.height()
                                + " image (at least " + minimum + " bytes required)");
            }

            return decodeBody(decoder);
        }
        catch (QoiDecodeException e) {
            reportError(e);
            throw e;
        }
        catch (IOException e) {
            // ArrayByteSource does not throw
            throw new IllegalStateException(e);
        }
    }

    @Override
    public QoiImage decode(InputStream source) throws IOException
    {
        Objects.requireNonNull(source, "source");
        return decode(new StreamByteSource(source));
    }

    /**
     * Decode one image from an arbitrary byte source.
     *
     * @throws QoiDecodeException if the stream is not a valid QOI stream
     * @throws IOException if {@code source} fails
     */
    public QoiImage decode(QoiByteSource source) throws IOException
    {
        Objects.requireNonNull(source, "source");
        try {
            final QoiPixelDecoder decoder = QoiPixelDecoder.open(source);
            checkPixelLimit(decoder.header());
            return decodeBody(decoder);
        }
        catch (QoiDecodeException e) {
            reportError(e);
            throw e;
        }
    }

    private QoiImage decodeBody(QoiPixelDecoder decoder) throws IOException
    {
        final QoiHeader header = decoder.header();
        final QoiPixelBuffer buffer = new QoiPixelBuffer(header);

        Optional<PixelRun> next;
        while ((next = decoder.fetch()).isPresent()) {
            buffer.append(next.get());
        }

        if (config.requireEndMarker()) {
            decoder.readEndMarker();
        }

        final QoiImage image = buffer.toImage();

        config.observabilitySink().onImageDecoded(new QoiCodecEvent(
                Instant.now(),
                QoiCodecEvent.Direction.DECODE,
                header,
                decoder.bytesRead()));

        return image;
    }

    private void checkPixelLimit(QoiHeader header)
    {
        if (header.pixelCount() > config.maxPixels()) {
            throw new QoiDecodeException(Kind.OUT_OF_MEMORY,
                    "Image " + header.width() + "x" + header.height() + " exceeds the limit of "
                            + config.maxPixels() + " pixels");
        }
    }

    private void reportError(QoiDecodeException e)
    {
        config.observabilitySink().onError(new QoiErrorEvent(Instant.now(), e.getMessage(), e));
    }
}
