package com.questrail.imaging.qoi.config;

import com.questrail.imaging.qoi.observability.NullObservabilitySink;
import com.questrail.imaging.qoi.observability.Slf4jQoiObservabilitySink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QoiCodecConfigTest {

    @Test
    void defaultsAreLenientAndSilent() {
        QoiCodecConfig config = QoiCodecConfig.defaults();

        assertEquals(QoiCodecConfig.MAX_ARRAY_PIXELS, config.maxPixels());
        assertFalse(config.requireEndMarker());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void builderOverridesEachField() {
        Slf4jQoiObservabilitySink sink = new Slf4jQoiObservabilitySink();
        QoiCodecConfig config = QoiCodecConfig.builder()
            .withMaxPixels(1024)
            .withRequireEndMarker(true)
            .withObservabilitySink(sink)
            .build();

        assertEquals(1024, config.maxPixels());
        assertTrue(config.requireEndMarker());
        assertSame(sink, config.observabilitySink());
    }

    @Test
    void maxPixelsMustBePositiveAndAllocatable() {
        assertThrows(IllegalArgumentException.class,
            () -> QoiCodecConfig.builder().withMaxPixels(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> QoiCodecConfig.builder().withMaxPixels(QoiCodecConfig.MAX_ARRAY_PIXELS + 1).build());
    }

    @Test
    void sinkIsRequired() {
        assertThrows(NullPointerException.class,
            () -> QoiCodecConfig.builder().withObservabilitySink(null).build());
    }
}
