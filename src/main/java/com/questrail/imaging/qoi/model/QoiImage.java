package com.questrail.imaging.qoi.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * QoiImage
 * -----------------------------------------------------------------------------
 * Immutable RGBA image: dimensions, colorspace and exactly
 * {@code width * height} pixels.
 *
 * <h2>Ownership</h2>
 * The pixel array is exclusively owned by this instance. Immutability is
 * enforced via defensive copying on the way in ({@link #QoiImage}) and on the
 * way out ({@link #pixels()}). {@link #adopt} skips the inbound copy for
 * buffers nobody else references. Use {@link #pixelAt(int)} or pass the image as
 * an {@link ImageView} to read without copying.
 *
 * <h2>Equality</h2>
 * Two images are equal when their dimensions, colorspace and every pixel
 * match. The header channel format is not part of the image.
 */
public final class QoiImage implements ImageView
{
    private final long width;

    private final long height;

    private final Colorspace colorspace;

    /**
     * Pixels in row-major order, packed {@code 0xRRGGBBAA}.
     */
    private final int[] pixels;

    /**
     * @param pixels packed {@code 0xRRGGBBAA} pixels, copied
     * @throws IllegalArgumentException if {@code pixels.length != width * height}
     */
    public QoiImage(long width, long height, Colorspace colorspace, int[] pixels)
    {
        this(width, height, colorspace, pixels, true);
    }

    private QoiImage(long width, long height, Colorspace colorspace, int[] pixels, boolean copy)
    {
        Objects.requireNonNull(colorspace, "colorspace");
        Objects.requireNonNull(pixels, "pixels");

        final int count = ImageView.checkedPixelCount(width, height);
        if (pixels.length != count) {
            throw new IllegalArgumentException(
                    "Pixel array length " + pixels.length + " does not match "
                            + width + "x" + height);
        }

        this.width = width;
        this.height = height;
        this.colorspace = colorspace;
        this.pixels = copy ? pixels.clone() : pixels;
    }

    /**
     * Builds an image that takes ownership of {@code pixels} without copying.
     *
     * <p>Used by decoders to hand over a freshly filled buffer. The caller
     * must not keep or modify {@code pixels} afterwards.</p>
     *
     * @throws IllegalArgumentException if {@code pixels.length != width * height}
     */
    public static QoiImage adopt(long width, long height, Colorspace colorspace, int[] pixels)
    {
        return new QoiImage(width, height, colorspace, pixels, false);
    }

    /**
     * Builds an image from {@link Color} values.
     */
    public static QoiImage of(long width, long height, Colorspace colorspace, Color... colors)
    {
        Objects.requireNonNull(colors, "colors");
        final int[] packed = new int[colors.length];
        for (int i = 0; i < colors.length; i++) {
            packed[i] = colors[i].packed();
        }
        return new QoiImage(width, height, colorspace, packed);
    }

    /**
     * Copies any view into an owning image.
     */
    public static QoiImage copyOf(ImageView view)
    {
        Objects.requireNonNull(view, "view");
        if (view instanceof QoiImage image) {
            return image;
        }
        final int[] packed = new int[view.pixelCount()];
        for (int i = 0; i < packed.length; i++) {
            packed[i] = view.pixelAt(i);
        }
        return new QoiImage(view.width(), view.height(), view.colorspace(), packed);
    }

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
        return pixels.length;
    }

    @Override
    public int pixelAt(int index)
    {
        return pixels[index];
    }

    /**
     * Returns a copy of the packed pixels.
     */
    public int[] pixels()
    {
        return pixels.clone();
    }

    /**
     * Returns the pixel at column {@code x}, row {@code y}.
     */
    public Color pixel(long x, long y)
    {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return Color.fromPacked(pixels[(int) (y * width + x)]);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof QoiImage that)) return false;
        return width == that.width
                && height == that.height
                && colorspace == that.colorspace
                && Arrays.equals(pixels, that.pixels);
    }

    @Override
    public int hashCode()
    {
        int result = Objects.hash(width, height, colorspace);
        result = 31 * result + Arrays.hashCode(pixels);
        return result;
    }

    @Override
    public String toString()
    {
        return "QoiImage[" +
                width + "x" + height +
                ", colorspace=" + colorspace +
                ']';
    }
}
