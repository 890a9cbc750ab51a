package com.questrail.imaging.qoi.codec.impl;

/**
 * QoiOpcode
 * -----------------------------------------------------------------------------
 * The six QOI opcodes and the classification of a first opcode byte.
 *
 * <pre>
 *   first byte   opcode  extra bytes
 *   11111110     RGB     3  (r, g, b)
 *   11111111     RGBA    4  (r, g, b, a)
 *   00xxxxxx     INDEX   0  (cache slot x)
 *   01rrggbb     DIFF    0  (each delta biased by 2)
 *   10gggggg     LUMA    1  (green delta biased by 32; next byte dr-dg, db-dg biased by 8)
 *   11xxxxxx     RUN     0  (length x + 1, 1..62)
 * </pre>
 *
 * <p>The two full-byte sentinels are matched before the two-bit prefixes,
 * which is why a RUN byte can never carry {@code x = 62} or {@code x = 63}.</p>
 */
enum QoiOpcode
{
    INDEX(0x00, 0),
    DIFF(0x40, 0),
    LUMA(0x80, 1),
    RUN(0xC0, 0),
    RGB(0xFE, 3),
    RGBA(0xFF, 4);

    static final int PREFIX_MASK = 0xC0;

    static final int PAYLOAD_MASK = 0x3F;

    static final int DIFF_BIAS = 2;

    static final int LUMA_GREEN_BIAS = 32;

    static final int LUMA_RB_BIAS = 8;

    private final int tag;

    private final int extraBytes;

    QoiOpcode(int tag, int extraBytes)
    {
        this.tag = tag;
        this.extraBytes = extraBytes;
    }

    /**
     * The fixed tag bits of this opcode's first byte.
     */
    int tag()
    {
        return tag;
    }

    /**
     * Number of bytes following the first byte.
     */
    int extraBytes()
    {
        return extraBytes;
    }

    /**
     * Classifies the first byte of an opcode.
     */
    static QoiOpcode classify(int firstByte)
    {
        final int b = firstByte & 0xFF;
        if (b == RGB.tag) {
            return RGB;
        }
        if (b == RGBA.tag) {
            return RGBA;
        }
        return switch (b >>> 6) {
            case 0 -> INDEX;
            case 1 -> DIFF;
            case 2 -> LUMA;
            default -> RUN;
        };
    }

    /**
     * Adds {@code bias} to a signed value and checks it fits in {@code bits} bits.
     *
     * @throws IllegalArgumentException if the biased value is out of range
     */
    static int bias(int value, int bias, int bits)
    {
        final int biased = value + bias;
        if (biased < 0 || biased >= (1 << bits)) {
            throw new IllegalArgumentException(
                    "Delta " + value + " does not fit " + bits + " bits with bias " + bias);
        }
        return biased;
    }

    /**
     * Extracts a {@code bits}-wide field and removes {@code bias}.
     */
    static int unbias(int field, int bias, int bits)
    {
        return (field & ((1 << bits) - 1)) - bias;
    }

    /**
     * True if {@code value} lies in the signed range a biased field of
     * {@code bits} bits can hold: {@code [-bias, (1 << bits) - 1 - bias]}.
     */
    static boolean fits(int value, int bias, int bits)
    {
        return value >= -bias && value < (1 << bits) - bias;
    }
}
