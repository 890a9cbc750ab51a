package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.codec.QoiByteSource;
import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiDecodeException.Kind;
import com.questrail.imaging.qoi.model.Color;
import com.questrail.imaging.qoi.model.PixelRun;
import com.questrail.imaging.qoi.model.QoiHeader;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * QoiPixelDecoder
 * -----------------------------------------------------------------------------
 * Incremental (pull-style) QOI decoder.
 *
 * <p>{@link #open} reads and validates the header; each {@link #fetch()}
 * interprets exactly one opcode and returns the color it produced together
 * with its repeat count. Decoding stops once the declared pixel count has been
 * produced: bytes after the last opcode are never interpreted as pixels.</p>
 *
 * <h2>State</h2>
 * <ul>
 *   <li>current color, seeded to opaque black</li>
 *   <li>a private {@link QoiColorCache}, updated with the color of every
 *       opcode, runs included</li>
 *   <li>the number of pixels still to be produced</li>
 * </ul>
 *
 * <h2>Failure</h2>
 * <ul>
 *   <li>A run longer than the remaining pixel count is {@code INVALID_DATA}</li>
 *   <li>A source that ends inside an opcode is {@code END_OF_STREAM}</li>
 * </ul>
 *
 * <p>Not thread-safe. One instance decodes exactly one image.</p>
 */
public final class QoiPixelDecoder
{
    private final QoiByteSource source;

    private final QoiHeader header;

    private final QoiColorCache cache = new QoiColorCache();

    private Color current = Color.OPAQUE_BLACK;

    /** Operand bytes of the current opcode; RGBA has the most (4). */
    private final int[] operands = new int[4];

    private long remaining;

    private long bytesRead = QoiFraming.HEADER_SIZE;

    private QoiPixelDecoder(QoiByteSource source, QoiHeader header)
    {
        this.source = source;
        this.header = header;
        this.remaining = header.pixelCount();
    }

    /**
     * Reads the header from {@code source} and returns a decoder positioned at
     * the first opcode.
     *
     * @throws QoiDecodeException if the header is truncated or invalid
     * @throws IOException if the source fails
     */
    public static QoiPixelDecoder open(QoiByteSource source) throws IOException
    {
        Objects.requireNonNull(source, "source");
        return new QoiPixelDecoder(source, QoiHeaderCodec.read(source));
    }

    public QoiHeader header()
    {
        return header;
    }

    /**
     * Number of pixels not yet produced.
     */
    public long remaining()
    {
        return remaining;
    }

    /**
     * Bytes consumed from the source so far, header included.
     */
    public long bytesRead()
    {
        return bytesRead;
    }

    /**
     * Decodes the next opcode.
     *
     * @return the produced run, or empty once every declared pixel was produced
     * @throws QoiDecodeException on truncated or inconsistent input
     * @throws IOException if the source fails
     */
    public Optional<PixelRun> fetch() throws IOException
    {
        if (remaining == 0) {
            return Optional.empty();
        }

        final int first = next();
        final QoiOpcode opcode = QoiOpcode.classify(first);
        for (int i = 0; i < opcode.extraBytes(); i++) {
            operands[i] = next();
        }

        Color color = current;
        int count = 1;

        switch (opcode) {
            case RGB -> color = new Color(operands[0], operands[1], operands[2], current.a());
            case RGBA -> color = new Color(operands[0], operands[1], operands[2], operands[3]);
            case INDEX -> color = cache.lookup(first & QoiOpcode.PAYLOAD_MASK);
            case DIFF -> color = new Color(
                    wrap(current.r() + QoiOpcode.unbias(first >>> 4, QoiOpcode.DIFF_BIAS, 2)),
                    wrap(current.g() + QoiOpcode.unbias(first >>> 2, QoiOpcode.DIFF_BIAS, 2)),
                    wrap(current.b() + QoiOpcode.unbias(first, QoiOpcode.DIFF_BIAS, 2)),
                    current.a());
            case LUMA -> {
                final int dg = QoiOpcode.unbias(first, QoiOpcode.LUMA_GREEN_BIAS, 6);
                final int dr = dg + QoiOpcode.unbias(operands[0] >>> 4, QoiOpcode.LUMA_RB_BIAS, 4);
                final int db = dg + QoiOpcode.unbias(operands[0], QoiOpcode.LUMA_RB_BIAS, 4);
                color = new Color(
                        wrap(current.r() + dr),
                        wrap(current.g() + dg),
                        wrap(current.b() + db),
                        current.a());
            }
            case RUN -> count = (first & QoiOpcode.PAYLOAD_MASK) + 1;
        }

        if (count > remaining) {
            throw new QoiDecodeException(Kind.INVALID_DATA,
                    "Run of " + count + " overruns the " + remaining + " remaining pixels");
        }

        // Runs store too: a leading run of the seed pixel puts opaque black in slot 53.
        cache.store(color);
        current = color;

        remaining -= count;
        return Optional.of(new PixelRun(color, count));
    }

    /**
     * Consumes the 8-byte end marker that follows the last opcode.
     *
     * @throws IllegalStateException if pixels remain to be decoded
     * @throws QoiDecodeException {@code INVALID_DATA} if the bytes are not the end marker,
     *         {@code END_OF_STREAM} if the source ends first
     */
    public void readEndMarker() throws IOException
    {
        if (remaining != 0) {
            throw new IllegalStateException(remaining + " pixels remain before the end marker");
        }
        for (int i = 0; i < QoiFraming.END_MARKER_SIZE; i++) {
            if (next() != QoiFraming.END_MARKER[i]) {
                throw new QoiDecodeException(Kind.INVALID_DATA, "Malformed end marker");
            }
        }
    }

    /**
     * Test hook: the current color cache contents.
     */
    Color[] cacheSnapshot()
    {
        return cache.snapshot();
    }

    private int next() throws IOException
    {
        final int b = source.readUnsignedByte();
        bytesRead++;
        return b;
    }

    /** Channel addition is modulo 256. */
    private static int wrap(int channel)
    {
        return channel & 0xFF;
    }
}
