package com.questrail.imaging.qoi.transport.netty;

import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.codec.QoiDecodeException.Kind;
import com.questrail.imaging.qoi.codec.impl.QoiFraming;
import com.questrail.imaging.qoi.codec.impl.QoiPixelBuffer;
import com.questrail.imaging.qoi.codec.impl.QoiPixelDecoder;
import com.questrail.imaging.qoi.config.QoiCodecConfig;
import com.questrail.imaging.qoi.model.QoiHeader;
import com.questrail.imaging.qoi.model.QoiImage;
import com.questrail.imaging.qoi.observability.QoiCodecEvent;
import com.questrail.imaging.qoi.observability.QoiErrorEvent;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * QoiNettyImageDecoder
 * =============================================================================
 * Inbound Netty handler turning a byte stream of back-to-back QOI streams into
 * {@link QoiImage} messages.
 *
 * <h2>Framing</h2>
 * Each image must be followed by the 8-byte end marker; the marker is what
 * separates one image from the next on the channel.
 *
 * <h2>Partial input</h2>
 * The handler keeps one {@link QoiPixelDecoder} and its
 * {@link QoiPixelBuffer} across reads. An opcode is only fetched once all of
 * its bytes are readable ({@link QoiFraming#opcodeLength(int)}), so every
 * byte is interpreted exactly once however the transport fragments the
 * stream.
 *
 * <h2>Failure</h2>
 * A decode error discards the cumulated bytes and the image in progress,
 * reports to the configured sink and propagates; Netty delivers it to
 * {@code exceptionCaught} wrapped in a
 * {@link io.netty.handler.codec.DecoderException}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g. {@code ByteBuf}) MUST NOT escape this package.
 */
public final class QoiNettyImageDecoder extends ByteToMessageDecoder
{
    private static final Logger log = LoggerFactory.getLogger(QoiNettyImageDecoder.class);

    private final QoiCodecConfig config;

    private final ByteBufByteSource source = new ByteBufByteSource();

    /** Image in progress; both null between images. */
    private QoiPixelDecoder pixelDecoder;

    private QoiPixelBuffer pixels;

    public QoiNettyImageDecoder()
    {
        this(QoiCodecConfig.defaults());
    }

    public QoiNettyImageDecoder(QoiCodecConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        source.reset(in);
        try {
            if (pixelDecoder == null) {
                if (in.readableBytes() < QoiFraming.HEADER_SIZE) {
                    return;
                }
                begin();
            }

            while (pixelDecoder.remaining() > 0) {
                if (!in.isReadable()
                        || in.readableBytes() < QoiFraming.opcodeLength(in.getUnsignedByte(in.readerIndex()))) {
                    log.trace("Waiting for more bytes ({} pixels outstanding)", pixelDecoder.remaining());
                    return;
                }
                pixels.append(pixelDecoder.fetch().orElseThrow());
            }

            if (in.readableBytes() < QoiFraming.END_MARKER_SIZE) {
                return;
            }
            pixelDecoder.readEndMarker();
            out.add(complete());
        }
        catch (QoiDecodeException e) {
            log.debug("Discarding {} bytes after QOI decode failure", in.readableBytes());
            in.skipBytes(in.readableBytes());
            clear();
            config.observabilitySink().onError(new QoiErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
        catch (IOException e) {
            // ByteBufByteSource does not throw
            throw new IllegalStateException(e);
        }
    }

    @Override
    protected void handlerRemoved0(ChannelHandlerContext ctx)
    {
        clear();
    }

    private void begin() throws IOException
    {
        final QoiPixelDecoder decoder = QoiPixelDecoder.open(source);
        final QoiHeader header = decoder.header();
        if (header.pixelCount() > config.maxPixels()) {
            throw new QoiDecodeException(Kind.OUT_OF_MEMORY,
                    "Image " + header.width() + "x" + header.height() + " exceeds the limit of "
                            + config.maxPixels() + " pixels");
        }
        pixels = new QoiPixelBuffer(header);
        pixelDecoder = decoder;
    }

    private QoiImage complete()
    {
        final QoiImage image = pixels.toImage();
        config.observabilitySink().onImageDecoded(new QoiCodecEvent(
                Instant.now(),
                QoiCodecEvent.Direction.DECODE,
                pixelDecoder.header(),
                pixelDecoder.bytesRead()));
        clear();
        return image;
    }

    private void clear()
    {
        pixelDecoder = null;
        pixels = null;
    }
}
