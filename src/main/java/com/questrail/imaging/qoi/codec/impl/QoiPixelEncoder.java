package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.model.Color;
import com.questrail.imaging.qoi.model.QoiHeader;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * QoiPixelEncoder
 * -----------------------------------------------------------------------------
 * Incremental (push-style) QOI encoder.
 *
 * <p>{@link #open} writes the header; each {@link #push} consumes one pixel in
 * row-major order; {@link #finish} writes the end marker. The bytes produced
 * are identical to those of {@link DefaultQoiImageEncoder}, which is built on
 * this class.</p>
 *
 * <h2>Opcode priority</h2>
 * For each pixel the first applicable opcode wins:
 * <ol>
 *   <li>RUN: pixel equals the previous pixel (run extended, flushed later)</li>
 *   <li>INDEX: the cache slot for the pixel already holds it</li>
 *   <li>DIFF: alpha unchanged, each of dr, dg, db in [-2, 1]</li>
 *   <li>LUMA: alpha unchanged, dg in [-32, 31], dr-dg and db-dg in [-8, 7]</li>
 *   <li>RGB: alpha unchanged</li>
 *   <li>RGBA: otherwise</li>
 * </ol>
 *
 * <p>A pending run is flushed when the next pixel differs, when it reaches
 * {@value QoiFraming#MAX_RUN_LENGTH}, or at the last pixel. Only non-run
 * opcodes update the color cache.</p>
 *
 * <p>Not thread-safe. One instance encodes exactly one image.</p>
 */
public final class QoiPixelEncoder
{
    private final OutputStream sink;

    private final QoiHeader header;

    private final long pixelCount;

    private final QoiColorCache cache = new QoiColorCache();

    /** Scratch space for the longest opcode (RGBA, 5 bytes). */
    private final byte[] scratch = new byte[5];

    private Color previous = Color.OPAQUE_BLACK;

    private int runLength;

    private long pushed;

    private long bytesWritten;

    private boolean finished;

    private QoiPixelEncoder(OutputStream sink, QoiHeader header)
    {
        this.sink = sink;
        this.header = header;
        this.pixelCount = header.pixelCount();
    }

    /**
     * Writes the header for {@code header} to {@code sink} and returns an
     * encoder ready to accept {@code header.pixelCount()} pixels.
     *
     * @throws IOException if the sink fails
     */
    public static QoiPixelEncoder open(OutputStream sink, QoiHeader header) throws IOException
    {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(header, "header");

        final QoiPixelEncoder encoder = new QoiPixelEncoder(sink, header);
        encoder.write(QoiHeaderCodec.encode(header), QoiFraming.HEADER_SIZE);
        return encoder;
    }

    public QoiHeader header()
    {
        return header;
    }

    /**
     * Number of pixels still expected before {@link #finish()}.
     */
    public long remaining()
    {
        return pixelCount - pushed;
    }

    /**
     * Total bytes written to the sink so far, header included.
     */
    public long bytesWritten()
    {
        return bytesWritten;
    }

    /**
     * Pushes one pixel packed as {@code 0xRRGGBBAA}.
     */
    public void push(int rgba) throws IOException
    {
        push(Color.fromPacked(rgba));
    }

    /**
     * Pushes the next pixel.
     *
     * @throws IllegalStateException if all declared pixels were already pushed
     * @throws IOException if the sink fails
     */
    public void push(Color pixel) throws IOException
    {
        Objects.requireNonNull(pixel, "pixel");
        if (finished || pushed >= pixelCount) {
            throw new IllegalStateException("All " + pixelCount + " pixels have already been pushed");
        }

        pushed++;
        final boolean samePixel = pixel.equals(previous);
        final boolean lastPixel = pushed == pixelCount;

        if (samePixel) {
            runLength++;
        }

        if (runLength > 0 && (runLength == QoiFraming.MAX_RUN_LENGTH || !samePixel || lastPixel)) {
            writeRun();
        }

        if (!samePixel) {
            writePixel(pixel);
        }

        previous = pixel;
    }

    /**
     * Flushes the bytes emitted so far to the sink.
     *
     * <p>This does not close a pending run: the opcode stream is the same
     * whether or not flush is called.</p>
     */
    public void flush() throws IOException
    {
        sink.flush();
    }

    /**
     * Writes the end marker and flushes the sink. The sink is not closed.
     *
     * @throws IllegalStateException if fewer pixels than declared were pushed
     */
    public void finish() throws IOException
    {
        if (finished) {
            return;
        }
        if (pushed != pixelCount) {
            throw new IllegalStateException(
                    "Expected " + pixelCount + " pixels but only " + pushed + " were pushed");
        }

        // Runs are flushed at the last pixel; nothing may be pending here.
        assert runLength == 0;

        write(QoiFraming.END_MARKER, QoiFraming.END_MARKER_SIZE);
        sink.flush();
        finished = true;
    }

    /**
     * Test hook: the current color cache contents.
     */
    Color[] cacheSnapshot()
    {
        return cache.snapshot();
    }

    private void writeRun() throws IOException
    {
        scratch[0] = (byte) (QoiOpcode.RUN.tag() | (runLength - 1));
        write(scratch, 1);
        runLength = 0;
    }

    private void writePixel(Color pixel) throws IOException
    {
        if (cache.contains(pixel)) {
            scratch[0] = (byte) (QoiOpcode.INDEX.tag() | pixel.hash());
            write(scratch, 1);
            return;
        }
        cache.store(pixel);

        if (pixel.a() != previous.a()) {
            scratch[0] = (byte) QoiOpcode.RGBA.tag();
            scratch[1] = (byte) pixel.r();
            scratch[2] = (byte) pixel.g();
            scratch[3] = (byte) pixel.b();
            scratch[4] = (byte) pixel.a();
            write(scratch, 5);
            return;
        }

        // Deltas wrap modulo 256: 255 -> 0 is +1, 0 -> 255 is -1.
        final int dr = (byte) (pixel.r() - previous.r());
        final int dg = (byte) (pixel.g() - previous.g());
        final int db = (byte) (pixel.b() - previous.b());

        if (QoiOpcode.fits(dr, QoiOpcode.DIFF_BIAS, 2)
                && QoiOpcode.fits(dg, QoiOpcode.DIFF_BIAS, 2)
                && QoiOpcode.fits(db, QoiOpcode.DIFF_BIAS, 2)) {
            scratch[0] = (byte) (QoiOpcode.DIFF.tag()
                    | QoiOpcode.bias(dr, QoiOpcode.DIFF_BIAS, 2) << 4
                    | QoiOpcode.bias(dg, QoiOpcode.DIFF_BIAS, 2) << 2
                    | QoiOpcode.bias(db, QoiOpcode.DIFF_BIAS, 2));
            write(scratch, 1);
            return;
        }

        final int drg = dr - dg;
        final int dbg = db - dg;

        if (QoiOpcode.fits(dg, QoiOpcode.LUMA_GREEN_BIAS, 6)
                && QoiOpcode.fits(drg, QoiOpcode.LUMA_RB_BIAS, 4)
                && QoiOpcode.fits(dbg, QoiOpcode.LUMA_RB_BIAS, 4)) {
            scratch[0] = (byte) (QoiOpcode.LUMA.tag() | QoiOpcode.bias(dg, QoiOpcode.LUMA_GREEN_BIAS, 6));
            scratch[1] = (byte) (QoiOpcode.bias(drg, QoiOpcode.LUMA_RB_BIAS, 4) << 4
                    | QoiOpcode.bias(dbg, QoiOpcode.LUMA_RB_BIAS, 4));
            write(scratch, 2);
            return;
        }

        scratch[0] = (byte) QoiOpcode.RGB.tag();
        scratch[1] = (byte) pixel.r();
        scratch[2] = (byte) pixel.g();
        scratch[3] = (byte) pixel.b();
        write(scratch, 4);
    }

    private void write(byte[] bytes, int length) throws IOException
    {
        sink.write(bytes, 0, length);
        bytesWritten += length;
    }
}
