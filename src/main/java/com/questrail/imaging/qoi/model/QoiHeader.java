package com.questrail.imaging.qoi.model;

import java.util.Objects;

/**
 * QoiHeader
 * -----------------------------------------------------------------------------
 * Container metadata carried in the fixed 14-byte block at the start of every
 * QOI stream.
 *
 * <p>Width and height are unsigned 32-bit values on the wire and are therefore
 * held as {@code long}. Their product can exceed {@link Long#MAX_VALUE}, so
 * {@link #pixelCount()} saturates instead of wrapping.</p>
 *
 * <p>A header is built fresh for every encode from the image being encoded
 * ({@link #forImage(ImageView)}) and parsed once per decode.</p>
 */
public record QoiHeader(long width, long height, ChannelFormat channels, Colorspace colorspace)
{
    /** Largest value representable in the u32 width/height fields. */
    public static final long MAX_DIMENSION = 0xFFFF_FFFFL;

    public QoiHeader
    {
        requireDimension(width, "width");
        requireDimension(height, "height");
        Objects.requireNonNull(channels, "channels");
        Objects.requireNonNull(colorspace, "colorspace");
    }

    /**
     * Number of pixels declared by this header, saturated at
     * {@link Long#MAX_VALUE}.
     */
    public long pixelCount()
    {
        if (height != 0 && width > Long.MAX_VALUE / height) {
            return Long.MAX_VALUE;
        }
        return width * height;
    }

    /**
     * Builds the header used to encode {@code image}.
     *
     * <p>The channel format is {@link ChannelFormat#RGB} when every pixel is
     * fully opaque and {@link ChannelFormat#RGBA} otherwise.</p>
     */
    public static QoiHeader forImage(ImageView image)
    {
        Objects.requireNonNull(image, "image");

        ChannelFormat channels = ChannelFormat.RGB;
        final int count = image.pixelCount();
        for (int i = 0; i < count; i++) {
            if ((image.pixelAt(i) & 0xFF) != 0xFF) {
                channels = ChannelFormat.RGBA;
                break;
            }
        }
        return new QoiHeader(image.width(), image.height(), channels, image.colorspace());
    }

    private static void requireDimension(long value, String name)
    {
        if (value < 0 || value > MAX_DIMENSION) {
            throw new IllegalArgumentException(
                    "QOI " + name + " must be in range 0–" + MAX_DIMENSION + " (was " + value + ")");
        }
    }
}
