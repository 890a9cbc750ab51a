package com.questrail.imaging.qoi;

import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.model.Color;
import com.questrail.imaging.qoi.model.Colorspace;
import com.questrail.imaging.qoi.model.QoiImage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QoiTest
 * -----------------------------------------------------------------------------
 * Smoke tests for the static entry point.
 */
final class QoiTest
{
    private static final QoiImage IMAGE = QoiImage.of(2, 2, Colorspace.SRGB,
            Color.rgb(10, 20, 30), Color.rgb(11, 21, 31),
            Color.rgba(10, 20, 30, 0), Color.rgb(10, 20, 30));

    @Test
    void bufferRoundTrip()
    {
        byte[] encoded = Qoi.encode(IMAGE);

        assertTrue(Qoi.isValidContainer(encoded));
        assertEquals(IMAGE, Qoi.decode(encoded));
    }

    @Test
    void streamRoundTrip() throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Qoi.encode(IMAGE, out);

        assertArrayEquals(Qoi.encode(IMAGE), out.toByteArray());
        assertEquals(IMAGE, Qoi.decode(new ByteArrayInputStream(out.toByteArray())));
    }

    @Test
    void garbageIsRejected()
    {
        byte[] garbage = "definitely not an image".getBytes();

        assertFalse(Qoi.isValidContainer(garbage));
        assertThrows(QoiDecodeException.class, () -> Qoi.decode(garbage));
    }
}
