package com.questrail.imaging.qoi;

import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiImageDecoder;
import com.questrail.imaging.qoi.codec.QoiImageEncoder;
import com.questrail.imaging.qoi.codec.impl.DefaultQoiImageDecoder;
import com.questrail.imaging.qoi.codec.impl.DefaultQoiImageEncoder;
import com.questrail.imaging.qoi.model.ImageView;
import com.questrail.imaging.qoi.model.QoiImage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Qoi
 * =============================================================================
 * Entry point for callers that only need "encode a pixel buffer to bytes" and
 * "decode bytes to a pixel buffer".
 *
 * <p>Every method uses the default configuration. Callers that need a pixel
 * limit, strict end marker checking or observability should construct
 * {@link DefaultQoiImageEncoder} / {@link DefaultQoiImageDecoder} with a
 * {@link com.questrail.imaging.qoi.config.QoiCodecConfig}. For incremental
 * use see {@link com.questrail.imaging.qoi.codec.impl.QoiPixelEncoder} and
 * {@link com.questrail.imaging.qoi.codec.impl.QoiPixelDecoder}.</p>
 *
 * <p>The default encoder and decoder hold no mutable state, so the shared
 * instances below are safe to use from any thread.</p>
 */
public final class Qoi
{
    private static final QoiImageEncoder ENCODER = new DefaultQoiImageEncoder();

    private static final QoiImageDecoder DECODER = new DefaultQoiImageDecoder();

    private Qoi() {}

    /**
     * Header sanity and length check only; no opcodes are decoded.
     */
    public static boolean isValidContainer(byte[] data)
    {
        return DECODER.isValidContainer(data);
    }

    /**
     * @throws QoiDecodeException if {@code data} is not a valid QOI stream
     */
    public static QoiImage decode(byte[] data)
    {
        return DECODER.decode(data);
    }

    /**
     * @throws QoiDecodeException if the stream is not a valid QOI stream
     * @throws IOException if {@code source} fails
     */
    public static QoiImage decode(InputStream source) throws IOException
    {
        return DECODER.decode(source);
    }

    public static byte[] encode(ImageView image)
    {
        return ENCODER.encode(image);
    }

    /**
     * @throws IOException if {@code sink} fails
     */
    public static void encode(ImageView image, OutputStream sink) throws IOException
    {
        ENCODER.encode(image, sink);
    }
}
