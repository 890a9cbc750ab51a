package com.questrail.imaging.qoi.transport.netty;

import com.questrail.imaging.qoi.codec.QoiImageEncoder;
import com.questrail.imaging.qoi.codec.impl.DefaultQoiImageEncoder;
import com.questrail.imaging.qoi.config.QoiCodecConfig;
import com.questrail.imaging.qoi.model.ImageView;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.util.Objects;

/**
 * QoiNettyImageEncoder
 * =============================================================================
 * Outbound Netty handler writing one complete QOI stream (header, opcodes,
 * end marker) per {@link ImageView} message.
 *
 * <p>This class is a <strong>pure stream adapter</strong>: all wire rules live
 * in the codec layer; this handler only routes bytes into the outbound
 * {@link ByteBuf}.</p>
 */
public final class QoiNettyImageEncoder extends MessageToByteEncoder<ImageView>
{
    private final QoiImageEncoder encoder;

    public QoiNettyImageEncoder()
    {
        this(QoiCodecConfig.defaults());
    }

    public QoiNettyImageEncoder(QoiCodecConfig config)
    {
        super(ImageView.class);
        this.encoder = new DefaultQoiImageEncoder(Objects.requireNonNull(config, "config"));
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, ImageView image, ByteBuf out) throws Exception
    {
        try (ByteBufOutputStream stream = new ByteBufOutputStream(out)) {
            encoder.encode(image, stream);
        }
    }
}
