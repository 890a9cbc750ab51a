package com.questrail.imaging.qoi.model;

import java.util.Objects;

/**
 * A color repeated {@code count} times in row-major order.
 *
 * <p>One {@code PixelRun} is produced per decoded opcode: a count of 1 for
 * every pixel opcode, 1..62 for a run opcode.</p>
 */
public record PixelRun(Color color, int count)
{
    public PixelRun
    {
        Objects.requireNonNull(color, "color");
        if (count < 1) {
            throw new IllegalArgumentException("Run count must be positive (was " + count + ")");
        }
    }
}
