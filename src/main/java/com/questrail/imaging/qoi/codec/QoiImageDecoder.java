package com.questrail.imaging.qoi.codec;

import com.questrail.imaging.qoi.model.QoiImage;

import java.io.IOException;
import java.io.InputStream;

/**
 * QoiImageDecoder
 * -----------------------------------------------------------------------------
 * Converts a QOI stream back into an RGBA image.
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Validating the header and the declared dimensions</li>
 *   <li>Interpreting the opcode stream until exactly {@code width * height}
 *       pixels have been produced</li>
 *   <li>Rejecting truncated, overrunning or otherwise malformed input</li>
 * </ul>
 *
 * <p>All failures are reported as {@link QoiDecodeException}; a caller
 * receives either a complete image or an exception, never a partially filled
 * buffer.</p>
 */
public interface QoiImageDecoder
{
    /**
     * Returns true if {@code data} starts with a valid header whose dimensions
     * are acceptable and is long enough to hold the declared image.
     *
     * <p>No opcodes are decoded.</p>
     */
    boolean isValidContainer(byte[] data);

    /**
     * Decode a complete in-memory QOI stream.
     *
     * @throws QoiDecodeException if the data is not a valid QOI stream
     */
    QoiImage decode(byte[] data);

    /**
     * Decode one QOI image from {@code source}.
     *
     * <p>Bytes are consumed one at a time; nothing after the last opcode
     * (or the end marker, when it is required) is read.</p>
     *
     * @throws QoiDecodeException if the stream is not a valid QOI stream
     * @throws IOException if {@code source} fails
     */
    QoiImage decode(InputStream source) throws IOException;
}
