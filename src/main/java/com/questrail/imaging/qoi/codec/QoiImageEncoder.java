package com.questrail.imaging.qoi.codec;

import com.questrail.imaging.qoi.model.ImageView;

import java.io.IOException;
import java.io.OutputStream;

/**
 * QoiImageEncoder
 * -----------------------------------------------------------------------------
 * Converts an RGBA image into a complete QOI stream: header, opcodes and end
 * marker.
 *
 * <p>Encoding has no data-dependent failure modes. Both methods produce the
 * same bytes for the same image.</p>
 */
public interface QoiImageEncoder
{
    /**
     * Encode {@code image} into a new byte array.
     */
    byte[] encode(ImageView image);

    /**
     * Encode {@code image} into {@code sink}.
     *
     * <p>The sink is flushed but not closed.</p>
     *
     * @throws IOException if the sink fails
     */
    void encode(ImageView image, OutputStream sink) throws IOException;
}
