package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.model.Color;

import java.util.Arrays;

/**
 * QoiColorCache
 * -----------------------------------------------------------------------------
 * The 64-slot direct-mapped table of recently seen colors.
 *
 * <p>Every slot starts as {@link Color#TRANSPARENT_BLACK}. A color is always
 * stored at its own {@link Color#hash()} slot; a collision silently replaces
 * the previous occupant.</p>
 *
 * <p>Each encode or decode invocation owns exactly one cache. Encoder and
 * decoder apply identical updates, so their tables agree after every pixel.</p>
 */
final class QoiColorCache
{
    static final int SIZE = 64;

    private final Color[] slots = new Color[SIZE];

    QoiColorCache()
    {
        Arrays.fill(slots, Color.TRANSPARENT_BLACK);
    }

    Color lookup(int index)
    {
        return slots[index];
    }

    /**
     * Stores {@code color} at its hash slot and returns that slot.
     */
    int store(Color color)
    {
        final int index = color.hash();
        slots[index] = color;
        return index;
    }

    /**
     * Returns true if the slot for {@code color} already holds it.
     */
    boolean contains(Color color)
    {
        return slots[color.hash()].equals(color);
    }

    /**
     * Test hook: a copy of all 64 slots.
     */
    Color[] snapshot()
    {
        return slots.clone();
    }
}
