package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.model.QoiHeader;

/**
 * QoiFraming
 * -----------------------------------------------------------------------------
 * Stream-level framing constants of the QOI container.
 *
 * <p>A QOI stream is framed by:</p>
 * <ul>
 *   <li>a fixed 14-byte header starting with the ASCII signature {@code qoif}</li>
 *   <li>the opcode stream, whose length is implied only by the pixel count</li>
 *   <li>a fixed 8-byte end marker {@code 00 00 00 00 00 00 00 01}</li>
 * </ul>
 *
 * <p>Zero bytes are valid INDEX opcodes, so the marker is only meaningful
 * after the last pixel. The decoder stops at the pixel count and never
 * interprets the marker as pixels.</p>
 */
public final class QoiFraming
{
    /** Size of the fixed header block in bytes. */
    public static final int HEADER_SIZE = 14;

    /** Size of the end marker in bytes. */
    public static final int END_MARKER_SIZE = 8;

    /** Longest run a single RUN opcode can express. */
    public static final int MAX_RUN_LENGTH = 62;

    static final byte[] MAGIC = { 'q', 'o', 'i', 'f' };

    static final byte[] END_MARKER = { 0, 0, 0, 0, 0, 0, 0, 1 };

    private QoiFraming() {}

    /**
     * Returns a copy of the end marker bytes.
     */
    public static byte[] endMarker()
    {
        return END_MARKER.clone();
    }

    /**
     * Length in bytes of the opcode that starts with {@code firstByte},
     * operands included.
     */
    public static int opcodeLength(int firstByte)
    {
        return 1 + QoiOpcode.classify(firstByte).extraBytes();
    }

    /**
     * Returns the shortest possible encoded size of an image with this header.
     *
     * <p>Every opcode is at least one byte and covers at most
     * {@link #MAX_RUN_LENGTH} pixels, so no valid stream can be shorter than
     * {@code 14 + ceil(pixels / 62) + 8}. Buffers shorter than this are
     * rejected before any pixel memory is allocated.</p>
     */
    public static long minimumEncodedLength(QoiHeader header)
    {
        final long pixels = header.pixelCount();
        final long opcodes = pixels / MAX_RUN_LENGTH + (pixels % MAX_RUN_LENGTH == 0 ? 0 : 1);
        return HEADER_SIZE + opcodes + END_MARKER_SIZE;
    }
}
