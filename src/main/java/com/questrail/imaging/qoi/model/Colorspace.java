package com.questrail.imaging.qoi.model;

import java.util.Optional;

/**
 * Colorspace tag carried in the QOI header (byte 13).
 *
 * <p>The tag is informational: it never changes decode arithmetic, only how
 * a consumer should interpret the channel values.</p>
 */
public enum Colorspace
{
    /** sRGB color channels with linear alpha. */
    SRGB(0),

    /** All four channels linear. */
    LINEAR(1);

    private final int tag;

    Colorspace(int tag)
    {
        this.tag = tag;
    }

    /**
     * Returns the header byte value for this colorspace.
     */
    public int tag()
    {
        return tag;
    }

    /**
     * Looks up the colorspace for a header byte.
     *
     * @return the matching colorspace, or empty if the byte is not a recognized tag
     */
    public static Optional<Colorspace> fromTag(int tag)
    {
        for (Colorspace c : values()) {
            if (c.tag == tag) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
