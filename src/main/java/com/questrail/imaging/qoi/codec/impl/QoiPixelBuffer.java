package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiDecodeException.Kind;
import com.questrail.imaging.qoi.model.PixelRun;
import com.questrail.imaging.qoi.model.QoiHeader;
import com.questrail.imaging.qoi.model.QoiImage;

import java.util.Arrays;
import java.util.Objects;

/**
 * QoiPixelBuffer
 * -----------------------------------------------------------------------------
 * Collects decoded {@link PixelRun}s into the pixel array of one image.
 *
 * <p>The array starts small and doubles towards the declared pixel count, so a
 * header that claims a large image on a short stream cannot reserve memory the
 * stream never fills. Every allocation, including the final hand-over, maps a
 * JVM {@link OutOfMemoryError} to {@code OUT_OF_MEMORY}. The finished array is
 * adopted by the {@link QoiImage}, never copied.</p>
 *
 * <p>Callers check the pixel limit before constructing a buffer.</p>
 */
public final class QoiPixelBuffer
{
    private static final int INITIAL_CAPACITY = 1 << 16;

    private final QoiHeader header;

    private final int total;

    private int[] pixels;

    private int size;

    /**
     * @throws IllegalArgumentException if the header declares more pixels than
     *         a Java array can hold
     * @throws QoiDecodeException {@code OUT_OF_MEMORY} if the initial array cannot be allocated
     */
    public QoiPixelBuffer(QoiHeader header)
    {
        this.header = Objects.requireNonNull(header, "header");
        if (header.pixelCount() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(header.pixelCount() + " pixels do not fit an array");
        }
        this.total = (int) header.pixelCount();
        this.pixels = allocate(Math.min(total, INITIAL_CAPACITY));
    }

    /**
     * Appends {@code run.count()} copies of {@code run.color()}.
     *
     * @throws IllegalStateException if the run exceeds the declared pixel count
     */
    public void append(PixelRun run)
    {
        final int end = size + run.count();
        if (end > total || end < 0) {
            throw new IllegalStateException("Run of " + run.count() + " exceeds " + total + " pixels");
        }
        if (end > pixels.length) {
            pixels = grow(end);
        }
        Arrays.fill(pixels, size, end, run.color().packed());
        size = end;
    }

    /**
     * Number of pixels appended so far.
     */
    public int size()
    {
        return size;
    }

    /**
     * Hands the filled array over to a new image. The buffer must not be used
     * afterwards.
     *
     * @throws IllegalStateException if fewer pixels than declared were appended
     */
    public QoiImage toImage()
    {
        if (size != total) {
            throw new IllegalStateException(size + " of " + total + " pixels decoded");
        }
        final int[] filled = pixels;
        pixels = null;
        return QoiImage.adopt(header.width(), header.height(), header.colorspace(), filled);
    }

    private int[] grow(int required)
    {
        long capacity = Math.max((long) pixels.length * 2, required);
        capacity = Math.min(capacity, total);
        try {
            return Arrays.copyOf(pixels, (int) capacity);
        }
        catch (OutOfMemoryError e) {
            throw new QoiDecodeException(Kind.OUT_OF_MEMORY,
                    "Cannot allocate " + capacity + " pixels", e);
        }
    }

    private static int[] allocate(int capacity)
    {
        try {
            return new int[capacity];
        }
        catch (OutOfMemoryError e) {
            throw new QoiDecodeException(Kind.OUT_OF_MEMORY,
                    "Cannot allocate " + capacity + " pixels", e);
        }
    }
}
