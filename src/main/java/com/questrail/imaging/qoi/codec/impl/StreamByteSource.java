package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.codec.QoiByteSource;
import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiDecodeException.Kind;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * {@link QoiByteSource} over an {@link InputStream}.
 *
 * <p>Reads one byte per call and performs no buffering of its own, so the
 * stream is never advanced past the bytes the decoder asked for. Wrap slow
 * sources in a {@link java.io.BufferedInputStream} when over-reading is
 * acceptable.</p>
 */
public final class StreamByteSource implements QoiByteSource
{
    private final InputStream in;

    private long offset;

    public StreamByteSource(InputStream in)
    {
        this.in = Objects.requireNonNull(in, "in");
    }

    @Override
    public int readUnsignedByte() throws IOException
    {
        final int b = in.read();
        if (b < 0) {
            throw new QoiDecodeException(Kind.END_OF_STREAM, "Unexpected end of stream at offset " + offset);
        }
        offset++;
        return b;
    }
}
