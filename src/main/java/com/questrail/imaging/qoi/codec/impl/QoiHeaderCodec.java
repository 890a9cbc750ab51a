package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.codec.QoiByteSource;
import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiDecodeException.Kind;
import com.questrail.imaging.qoi.model.ChannelFormat;
import com.questrail.imaging.qoi.model.Colorspace;
import com.questrail.imaging.qoi.model.QoiHeader;

import java.io.IOException;
import java.util.Objects;

/**
 * QoiHeaderCodec
 * -----------------------------------------------------------------------------
 * Encodes and decodes the fixed 14-byte QOI header.
 *
 * <pre>
 *   offset  size  field
 *   0       4     magic "qoif"
 *   4       4     width   (u32, big-endian)
 *   8       4     height  (u32, big-endian)
 *   12      1     channels (3 = RGB, 4 = RGBA)
 *   13      1     colorspace (0 = sRGB + linear alpha, 1 = all linear)
 * </pre>
 *
 * <p>Stateless; shared by the buffer and stream entry points.</p>
 */
public final class QoiHeaderCodec
{
    private QoiHeaderCodec() {}

    /**
     * Encodes {@code header} into a new 14-byte block.
     */
    public static byte[] encode(QoiHeader header)
    {
        Objects.requireNonNull(header, "header");

        final byte[] out = new byte[QoiFraming.HEADER_SIZE];
        System.arraycopy(QoiFraming.MAGIC, 0, out, 0, QoiFraming.MAGIC.length);
        writeU32(out, 4, header.width());
        writeU32(out, 8, header.height());
        out[12] = (byte) header.channels().tag();
        out[13] = (byte) header.colorspace().tag();
        return out;
    }

    /**
     * Decodes the header at the start of {@code block}.
     *
     * @throws QoiDecodeException {@code END_OF_STREAM} if fewer than 14 bytes are given,
     *         {@code INVALID_MAGIC} on a signature mismatch,
     *         {@code INVALID_TAG} on an unknown channels or colorspace byte
     */
    public static QoiHeader decode(byte[] block)
    {
        Objects.requireNonNull(block, "block");
        if (block.length < QoiFraming.HEADER_SIZE) {
            throw new QoiDecodeException(Kind.END_OF_STREAM,
                    "Header requires " + QoiFraming.HEADER_SIZE + " bytes (got " + block.length + ")");
        }

        for (int i = 0; i < QoiFraming.MAGIC.length; i++) {
            if (block[i] != QoiFraming.MAGIC[i]) {
                throw new QoiDecodeException(Kind.INVALID_MAGIC, "Missing 'qoif' signature");
            }
        }

        final long width = readU32(block, 4);
        final long height = readU32(block, 8);

        final int channelsTag = block[12] & 0xFF;
        final ChannelFormat channels = ChannelFormat.fromTag(channelsTag)
                .orElseThrow(() -> new QoiDecodeException(Kind.INVALID_TAG,
                        String.format("Unknown channels byte 0x%02X", channelsTag)));

        final int colorspaceTag = block[13] & 0xFF;
        final Colorspace colorspace = Colorspace.fromTag(colorspaceTag)
                .orElseThrow(() -> new QoiDecodeException(Kind.INVALID_TAG,
                        String.format("Unknown colorspace byte 0x%02X", colorspaceTag)));

        return new QoiHeader(width, height, channels, colorspace);
    }

    /**
     * Reads exactly 14 bytes from {@code source} and decodes them.
     *
     * @throws IOException if the source fails
     */
    public static QoiHeader read(QoiByteSource source) throws IOException
    {
        final byte[] block = new byte[QoiFraming.HEADER_SIZE];
        source.readFully(block);
        return decode(block);
    }

    private static long readU32(byte[] b, int off)
    {
        return ((long) (b[off] & 0xFF) << 24)
                | ((b[off + 1] & 0xFF) << 16)
                | ((b[off + 2] & 0xFF) << 8)
                | (b[off + 3] & 0xFF);
    }

    private static void writeU32(byte[] b, int off, long value)
    {
        b[off] = (byte) ((value >>> 24) & 0xFF);
        b[off + 1] = (byte) ((value >>> 16) & 0xFF);
        b[off + 2] = (byte) ((value >>> 8) & 0xFF);
        b[off + 3] = (byte) (value & 0xFF);
    }
}
