package com.questrail.imaging.qoi.transport.netty;

import com.questrail.imaging.qoi.codec.QoiByteSource;
import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiDecodeException.Kind;

import io.netty.buffer.ByteBuf;

/**
 * {@link QoiByteSource} reading from the readable bytes of a {@link ByteBuf}.
 *
 * <p>Advances the buffer's reader index. The buffer is swapped with
 * {@link #reset(ByteBuf)} on every read, since the cumulation handed to a
 * decoder is not always the same instance.</p>
 */
final class ByteBufByteSource implements QoiByteSource
{
    private ByteBuf buf;

    ByteBufByteSource reset(ByteBuf buf)
    {
        this.buf = buf;
        return this;
    }

    @Override
    public int readUnsignedByte()
    {
        if (buf == null || !buf.isReadable()) {
            throw new QoiDecodeException(Kind.END_OF_STREAM, "No more readable bytes");
        }
        return buf.readUnsignedByte();
    }
}
