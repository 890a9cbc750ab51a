package com.questrail.imaging.qoi.codec.impl;

import com.questrail.imaging.qoi.codec.QoiDecodeException;
import com.questrail.imaging.qoi.config.QoiCodecConfig;
import com.questrail.imaging.qoi.model.Colorspace;
import com.questrail.imaging.qoi.model.QoiImage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QoiFuzzTest
 * -----------------------------------------------------------------------------
 * Arbitrary input must either decode or fail with {@link QoiDecodeException};
 * no other exception may escape.
 */
final class QoiFuzzTest
{
    private static final int ROUNDS = 32;

    private static final int BUFFER_SIZE = 1 << 20;

    private final DefaultQoiImageDecoder decoder = new DefaultQoiImageDecoder(
            QoiCodecConfig.builder().withMaxPixels(1 << 22).build());

    @Test
    void randomBuffersNeverEscapeAsOtherExceptions() throws IOException
    {
        Random rng = new Random(0x51F15EEDL);
        for (int round = 0; round < ROUNDS; round++) {
            byte[] data = new byte[BUFFER_SIZE];
            rng.nextBytes(data);
            if (rng.nextInt(4) != 0) {
                plantHeader(data, rng);
            }

            decoder.isValidContainer(data);
            checkOutcome(() -> decoder.decode(data), round);
            checkOutcome(() -> decoder.decode(new ByteArrayInputStream(data)), round);
        }
    }

    @Test
    void truncatedValidStreamsFailCleanly()
    {
        byte[] encoded = new DefaultQoiImageEncoder().encode(
                QoiTestImages.textured(new Random(17), 30, 30, Colorspace.SRGB));
        for (int length = 0; length < encoded.length; length += 7) {
            byte[] prefix = Arrays.copyOf(encoded, length);
            checkOutcome(() -> decoder.decode(prefix), length);
        }
    }

    /** Writes a header with small dimensions so that the body gets decoded. */
    private static void plantHeader(byte[] data, Random rng)
    {
        byte[] header = QoiTestImages.stream(rng.nextInt(2048), rng.nextInt(2048), 3 + rng.nextInt(2), rng.nextInt(2));
        System.arraycopy(header, 0, data, 0, header.length);
    }

    private static void checkOutcome(Attempt attempt, int round)
    {
        try {
            QoiImage image = attempt.run();
            assertNotNull(image);
        }
        catch (QoiDecodeException e) {
            assertNotNull(e.kind());
        }
        catch (Exception e) {
            fail("round " + round + " escaped with " + e, e);
        }
    }

    @FunctionalInterface
    private interface Attempt
    {
        QoiImage run() throws IOException;
    }
}
