package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.codec.QoiByteSource;
import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiDecodeException.Kind;

import java.util.Objects;

/**
 * {@link QoiByteSource} over a region of a byte array. The array is borrowed,
 * not copied.
 */
public final class ArrayByteSource implements QoiByteSource
{
    private final byte[] data;

    private final int end;

    private int position;

    public ArrayByteSource(byte[] data)
    {
        this(data, 0, Objects.requireNonNull(data, "data").length);
    }

    public ArrayByteSource(byte[] data, int offset, int length)
    {
        Objects.requireNonNull(data, "data");
        Objects.checkFromIndexSize(offset, length, data.length);
        this.data = data;
        this.position = offset;
        this.end = offset + length;
    }

    @Override
    public int readUnsignedByte()
    {
        if (position >= end) {
            throw new QoiDecodeException(Kind.END_OF_STREAM, "Unexpected end of buffer at offset " + position);
        }
        return data[position++] & 0xFF;
    }

    /**
     * Index of the next byte to be read.
     */
    public int position()
    {
        return position;
    }
}
