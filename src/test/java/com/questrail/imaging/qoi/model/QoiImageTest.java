package com.questrail.imaging.qoi.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QoiImageTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link QoiImage}, {@link ImageView} and {@link QoiHeader}.
 */
final class QoiImageTest
{
    @Test
    void rejectsPixelCountMismatch()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new QoiImage(2, 2, Colorspace.SRGB, new int[3]));
    }

    @Test
    void rejectsDimensionsBeyondArrayRange()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new QoiImage(0xFFFF_FFFFL, 2, Colorspace.SRGB, new int[0]));
        assertThrows(IllegalArgumentException.class,
                () -> ImageView.checkedPixelCount(65536, 65536));
    }

    @Test
    void zeroSizedImageIsAllowed()
    {
        QoiImage image = new QoiImage(0xFFFF_FFFFL, 0, Colorspace.LINEAR, new int[0]);
        assertEquals(0, image.pixelCount());
    }

    @Test
    void pixelsAreDefensivelyCopied()
    {
        int[] pixels = { 0x11223344, 0x55667788 };
        QoiImage image = new QoiImage(2, 1, Colorspace.SRGB, pixels);

        pixels[0] = 0;
        assertEquals(0x11223344, image.pixelAt(0));

        int[] out = image.pixels();
        out[1] = 0;
        assertEquals(0x55667788, image.pixelAt(1));
    }

    @Test
    void pixelByCoordinate()
    {
        QoiImage image = QoiImage.of(2, 2, Colorspace.SRGB,
                Color.rgb(1, 0, 0), Color.rgb(2, 0, 0),
                Color.rgb(3, 0, 0), Color.rgb(4, 0, 0));

        assertEquals(Color.rgb(3, 0, 0), image.pixel(0L, 1L));
        assertEquals(Color.rgb(2, 0, 0), image.pixel(1L, 0L));
        assertThrows(IndexOutOfBoundsException.class, () -> image.pixel(2L, 0L));
    }

    @Test
    void equalityCoversDimensionsColorspaceAndPixels()
    {
        QoiImage a = new QoiImage(2, 1, Colorspace.SRGB, new int[] { 1, 2 });

        assertEquals(a, new QoiImage(2, 1, Colorspace.SRGB, new int[] { 1, 2 }));
        assertEquals(a.hashCode(), new QoiImage(2, 1, Colorspace.SRGB, new int[] { 1, 2 }).hashCode());
        assertNotEquals(a, new QoiImage(1, 2, Colorspace.SRGB, new int[] { 1, 2 }));
        assertNotEquals(a, new QoiImage(2, 1, Colorspace.LINEAR, new int[] { 1, 2 }));
        assertNotEquals(a, new QoiImage(2, 1, Colorspace.SRGB, new int[] { 1, 3 }));
    }

    @Test
    void wrapBorrowsWithoutCopying()
    {
        int[] pixels = { 1, 2, 3 };
        ImageView view = ImageView.wrap(3, 1, Colorspace.SRGB, pixels);

        pixels[2] = 7;
        assertEquals(7, view.pixelAt(2));
        assertEquals(3, view.pixelCount());
        assertEquals(new QoiImage(3, 1, Colorspace.SRGB, new int[] { 1, 2, 7 }), QoiImage.copyOf(view));
    }

    @Test
    void adoptTakesOwnershipWithoutCopying()
    {
        int[] pixels = { 1, 2, 3, 4 };
        QoiImage image = QoiImage.adopt(2, 2, Colorspace.LINEAR, pixels);

        pixels[0] = 9;
        assertEquals(9, image.pixelAt(0));
        assertEquals(new QoiImage(2, 2, Colorspace.LINEAR, new int[] { 9, 2, 3, 4 }), image);
        assertThrows(IllegalArgumentException.class, () -> QoiImage.adopt(3, 2, Colorspace.SRGB, pixels));
    }

    @Test
    void headerChannelsReflectAlpha()
    {
        ImageView opaque = ImageView.wrap(2, 1, Colorspace.SRGB,
                new int[] { Color.rgb(1, 2, 3).packed(), Color.rgb(4, 5, 6).packed() });
        ImageView translucent = ImageView.wrap(2, 1, Colorspace.LINEAR,
                new int[] { Color.rgb(1, 2, 3).packed(), Color.rgba(4, 5, 6, 7).packed() });

        assertEquals(ChannelFormat.RGB, QoiHeader.forImage(opaque).channels());
        assertEquals(ChannelFormat.RGBA, QoiHeader.forImage(translucent).channels());
        assertEquals(Colorspace.LINEAR, QoiHeader.forImage(translucent).colorspace());
    }

    @Test
    void headerPixelCountSaturatesInsteadOfWrapping()
    {
        QoiHeader max = new QoiHeader(0xFFFF_FFFFL, 0xFFFF_FFFFL, ChannelFormat.RGBA, Colorspace.SRGB);
        assertEquals(Long.MAX_VALUE, max.pixelCount());

        QoiHeader wide = new QoiHeader(0xFFFF_FFFFL, 2, ChannelFormat.RGBA, Colorspace.SRGB);
        assertEquals(0x1_FFFF_FFFEL, wide.pixelCount());

        QoiHeader empty = new QoiHeader(0xFFFF_FFFFL, 0, ChannelFormat.RGB, Colorspace.SRGB);
        assertEquals(0, empty.pixelCount());
    }

    @Test
    void headerRejectsDimensionsOutsideU32()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new QoiHeader(0x1_0000_0000L, 1, ChannelFormat.RGB, Colorspace.SRGB));
        assertThrows(IllegalArgumentException.class,
                () -> new QoiHeader(1, -1, ChannelFormat.RGB, Colorspace.SRGB));
    }
}
