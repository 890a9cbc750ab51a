package com.questrail.imaging.qoi.model;

import java.util.Objects;

/**
 * ImageView
 * -----------------------------------------------------------------------------
 * Read-only view of an RGBA image: dimensions, colorspace and pixels in
 * row-major order (left-to-right, top-to-bottom).
 *
 * <p>Pixels are exposed in packed {@code 0xRRGGBBAA} form so that large
 * images can be borrowed by the encoder without copying or boxing. The
 * encoder only ever reads through this interface.</p>
 */
public interface ImageView
{
    long width();

    long height();

    Colorspace colorspace();

    /**
     * Number of pixels, {@code width * height}.
     */
    int pixelCount();

    /**
     * Returns pixel {@code index} packed as {@code 0xRRGGBBAA}.
     */
    int pixelAt(int index);

    /**
     * Returns pixel {@code index} as a {@link Color}.
     */
    default Color pixel(int index)
    {
        return Color.fromPacked(pixelAt(index));
    }

    /**
     * Wraps a caller-owned packed pixel array without copying it.
     *
     * <p>The caller must not mutate {@code pixels} while the view is in use.</p>
     *
     * @throws IllegalArgumentException if {@code pixels.length != width * height}
     */
    static ImageView wrap(long width, long height, Colorspace colorspace, int[] pixels)
    {
        Objects.requireNonNull(colorspace, "colorspace");
        Objects.requireNonNull(pixels, "pixels");
        final int count = checkedPixelCount(width, height);
        if (pixels.length != count) {
            throw new IllegalArgumentException(
                    "Pixel array length " + pixels.length + " does not match "
                            + width + "x" + height);
        }

        return new ImageView()
        {
            @Override
            public long width()
            {
                return width;
            }

            @Override
            public long height()
            {
                return height;
            }

            @Override
            public Colorspace colorspace()
            {
                return colorspace;
            }

            @Override
            public int pixelCount()
            {
                return count;
            }

            @Override
            public int pixelAt(int index)
            {
                return pixels[index];
            }
        };
    }

    /**
     * Validates dimensions and returns {@code width * height} as an {@code int}.
     *
     * @throws IllegalArgumentException if a dimension is outside the u32 range
     *         or the product does not fit a Java array
     */
    static int checkedPixelCount(long width, long height)
    {
        if (width < 0 || width > QoiHeader.MAX_DIMENSION || height < 0 || height > QoiHeader.MAX_DIMENSION) {
            throw new IllegalArgumentException("Invalid dimensions " + width + "x" + height);
        }
        if (height != 0 && width > Integer.MAX_VALUE / height) {
            throw new IllegalArgumentException(
                    "Image " + width + "x" + height + " has more than " + Integer.MAX_VALUE + " pixels");
        }
        return (int) (width * height);
    }
}
