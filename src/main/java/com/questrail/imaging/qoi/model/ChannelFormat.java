package com.questrail.imaging.qoi.model;

import java.util.Optional;

/**
 * Channel layout of the source image, as recorded in the QOI header (byte 12).
 *
 * <p>Informational only. A decoded image always has four channels; an
 * {@link #RGB} header merely states that every pixel was fully opaque when
 * the stream was written.</p>
 */
public enum ChannelFormat
{
    RGB(3),
    RGBA(4);

    private final int tag;

    ChannelFormat(int tag)
    {
        this.tag = tag;
    }

    public int tag()
    {
        return tag;
    }

    public static Optional<ChannelFormat> fromTag(int tag)
    {
        for (ChannelFormat f : values()) {
            if (f.tag == tag) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
