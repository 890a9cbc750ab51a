package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.model.ChannelFormat;
import com.questrail.imaging.qoi.model.Color;
import com.questrail.imaging.qoi.model.Colorspace;
import com.questrail.imaging.qoi.model.ImageView;
import com.questrail.imaging.qoi.model.QoiHeader;
import com.questrail.imaging.qoi.model.QoiImage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QoiRoundTripTest
 * -----------------------------------------------------------------------------
 * Encode then decode must reproduce the image exactly, through every entry
 * point.
 */
final class QoiRoundTripTest
{
    private final DefaultQoiImageEncoder encoder = new DefaultQoiImageEncoder();
    private final DefaultQoiImageDecoder decoder = new DefaultQoiImageDecoder();

    @Test
    void randomImageSurvives()
    {
        QoiImage image = QoiTestImages.random(new Random(1), 251, 49, Colorspace.SRGB);
        assertEquals(image, decoder.decode(encoder.encode(image)));
    }

    @Test
    void texturedImagesOfVariousShapesSurvive()
    {
        Random rng = new Random(7);
        int[][] shapes = { { 1, 1 }, { 1, 300 }, { 300, 1 }, { 17, 13 }, { 64, 64 }, { 333, 77 } };
        for (int[] shape : shapes) {
            QoiImage image = QoiTestImages.textured(rng, shape[0], shape[1], Colorspace.LINEAR);
            assertEquals(image, decoder.decode(encoder.encode(image)), shape[0] + "x" + shape[1]);
        }
    }

    @Test
    void longRunsSurvive()
    {
        QoiImage image = QoiTestImages.solid(1000, 3, Color.rgba(12, 34, 56, 78));
        byte[] encoded = encoder.encode(image);

        assertEquals(image, decoder.decode(encoded));
        // first pixel, then ceil(2999 / 62) runs
        assertEquals(QoiFraming.HEADER_SIZE + 5 + 49 + QoiFraming.END_MARKER_SIZE, encoded.length);
    }

    @Test
    void zeroSizedImagesSurvive()
    {
        for (QoiImage image : new QoiImage[] {
                QoiImage.of(0, 0, Colorspace.SRGB),
                QoiImage.of(0, 12, Colorspace.LINEAR),
                QoiImage.of(12, 0, Colorspace.SRGB) }) {
            byte[] encoded = encoder.encode(image);
            assertEquals(QoiFraming.HEADER_SIZE + QoiFraming.END_MARKER_SIZE, encoded.length);
            assertEquals(image, decoder.decode(encoded));
        }
    }

    @Test
    void headerReflectsAlphaAndColorspace()
    {
        QoiImage opaque = QoiImage.of(2, 1, Colorspace.LINEAR, Color.rgb(1, 2, 3), Color.rgb(4, 5, 6));
        QoiImage translucent = QoiImage.of(1, 1, Colorspace.SRGB, Color.rgba(1, 2, 3, 4));

        QoiHeader a = QoiHeaderCodec.decode(encoder.encode(opaque));
        QoiHeader b = QoiHeaderCodec.decode(encoder.encode(translucent));

        assertEquals(new QoiHeader(2, 1, ChannelFormat.RGB, Colorspace.LINEAR), a);
        assertEquals(new QoiHeader(1, 1, ChannelFormat.RGBA, Colorspace.SRGB), b);
        assertEquals(Colorspace.LINEAR, decoder.decode(encoder.encode(opaque)).colorspace());
    }

    @Test
    void allEncodePathsProduceIdenticalBytes() throws IOException
    {
        QoiImage image = QoiTestImages.textured(new Random(3), 97, 31, Colorspace.SRGB);
        byte[] buffered = encoder.encode(image);

        ByteArrayOutputStream streamed = new ByteArrayOutputStream();
        encoder.encode(image, streamed);

        ByteArrayOutputStream pushed = new ByteArrayOutputStream();
        QoiPixelEncoder incremental = QoiPixelEncoder.open(pushed, QoiHeader.forImage(image));
        for (int i = 0; i < image.pixelCount(); i++) {
            incremental.push(image.pixel(i));
        }
        incremental.finish();

        assertArrayEquals(buffered, streamed.toByteArray());
        assertArrayEquals(buffered, pushed.toByteArray());
    }

    @Test
    void bufferAndStreamDecodeAgree() throws IOException
    {
        QoiImage image = QoiTestImages.textured(new Random(11), 40, 40, Colorspace.SRGB);
        byte[] encoded = encoder.encode(image);

        assertEquals(decoder.decode(encoded), decoder.decode(new ByteArrayInputStream(encoded)));
    }

    @Test
    void wrappedViewEncodesLikeImage()
    {
        QoiImage image = QoiTestImages.random(new Random(5), 8, 8, Colorspace.SRGB);
        ImageView view = ImageView.wrap(8, 8, Colorspace.SRGB, image.pixels());

        assertArrayEquals(encoder.encode(image), encoder.encode(view));
    }
}
