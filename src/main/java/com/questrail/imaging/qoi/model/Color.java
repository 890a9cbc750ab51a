package com.questrail.imaging.qoi.model;

/**
 * Color
 * -----------------------------------------------------------------------------
 * Immutable RGBA color with four independent 8-bit channels.
 *
 * <p>Channels are held as {@code int} values in {@code 0..255}. Two colors are
 * equal iff all four channels match. The packed form used by {@link QoiImage}
 * and {@link ImageView} is {@code 0xRRGGBBAA}.</p>
 *
 * <h2>Wire-relevant values</h2>
 * <ul>
 *   <li>{@link #TRANSPARENT_BLACK} seeds every color cache slot</li>
 *   <li>{@link #OPAQUE_BLACK} seeds the "previous pixel" of every encode/decode</li>
 *   <li>{@link #hash()} selects the cache slot and is fixed by the format</li>
 * </ul>
 */
public record Color(int r, int g, int b, int a)
{
    public static final Color TRANSPARENT_BLACK = new Color(0, 0, 0, 0);

    public static final Color OPAQUE_BLACK = new Color(0, 0, 0, 255);

    public Color
    {
        requireChannel(r, "r");
        requireChannel(g, "g");
        requireChannel(b, "b");
        requireChannel(a, "a");
    }

    /**
     * Creates a fully opaque color.
     */
    public static Color rgb(int r, int g, int b)
    {
        return new Color(r, g, b, 255);
    }

    public static Color rgba(int r, int g, int b, int a)
    {
        return new Color(r, g, b, a);
    }

    /**
     * Unpacks a {@code 0xRRGGBBAA} value.
     */
    public static Color fromPacked(int rgba)
    {
        return new Color(
                (rgba >>> 24) & 0xFF,
                (rgba >>> 16) & 0xFF,
                (rgba >>> 8) & 0xFF,
                rgba & 0xFF);
    }

    /**
     * Returns this color packed as {@code 0xRRGGBBAA}.
     */
    public int packed()
    {
        return (r << 24) | (g << 16) | (b << 8) | a;
    }

    /**
     * Returns the color cache slot of this color: {@code (r*3 + g*5 + b*7 + a*11) % 64}.
     *
     * <p>This function is part of the wire contract. Encoder and decoder must
     * agree on it or INDEX opcodes resolve to different colors.</p>
     */
    public int hash()
    {
        return (r * 3 + g * 5 + b * 7 + a * 11) & 63;
    }

    /**
     * Returns a copy of this color with a different alpha channel.
     */
    public Color withAlpha(int alpha)
    {
        return new Color(r, g, b, alpha);
    }

    @Override
    public String toString()
    {
        return String.format("Color[#%08X]", packed());
    }

    private static void requireChannel(int value, String name)
    {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(
                    "Channel " + name + " must be in range 0–255 (was " + value + ")");
        }
    }
}
