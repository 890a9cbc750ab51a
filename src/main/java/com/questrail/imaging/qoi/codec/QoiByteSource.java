package com.questrail.imaging.qoi.codec;

import java.io.IOException;

/**
 * QoiByteSource
 * -----------------------------------------------------------------------------
 * Pull-style byte source consumed by the QOI decoder one byte at a time.
 *
 * <p>The decoder never asks for a byte it does not need, so a source is left
 * positioned exactly after the last byte of the last completed opcode (or the
 * end marker, when that is read).</p>
 *
 * <p>Implementations must report exhaustion by throwing
 * {@link QoiDecodeException} with {@link QoiDecodeException.Kind#END_OF_STREAM};
 * genuine I/O failures propagate as {@link IOException}.</p>
 */
public interface QoiByteSource
{
    /**
     * Returns the next byte as an unsigned value in {@code 0..255}.
     *
     * @throws QoiDecodeException with kind {@code END_OF_STREAM} if no byte is available
     * @throws IOException if the underlying source fails
     */
    int readUnsignedByte() throws IOException;

    /**
     * Fills {@code dst} completely.
     *
     * @throws QoiDecodeException with kind {@code END_OF_STREAM} if fewer bytes are available
     */
    default void readFully(byte[] dst) throws IOException
    {
        for (int i = 0; i < dst.length; i++) {
            dst[i] = (byte) readUnsignedByte();
        }
    }
}
