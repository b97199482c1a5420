package com.flowmable.epaper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DisplayEncoderTest {

    private final DisplayEncoder encoder = new DisplayEncoder();
    private final FloydSteinbergDitherer ditherer = new FloydSteinbergDitherer();

    @Test
    void encode_lengthIsWidthTimesHeight() {
        Raster dithered = ditherer.dither(SyntheticPhotos.noise(31, 17, 11L));
        assertEquals(31 * 17, encoder.encode(dithered).length);
    }

    @Test
    void encode_rowMajorOrder() {
        Raster raster = Raster.of(3, 2, new int[]{
                0xFFFFFF, 0xFFFF00, 0xFFA500,
                0xFF0000, 0x008000, 0x0000FF
        });
        byte[] codes = encoder.encode(raster);
        assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xFC, (byte) 0xEC, (byte) 0xE0, 0x35, 0x2B}, codes);
    }

    @Test
    void encode_doesNotHitFallbackForDitheredRaster() {
        long before = DisplayPalette.fallbackCount();
        encoder.encode(ditherer.dither(SyntheticPhotos.noise(50, 50, 5L)));
        assertEquals(before, DisplayPalette.fallbackCount());
    }

    @Test
    void toText_uppercaseZeroPaddedCommaSpace() {
        assertEquals("0x00, 0xFF, 0x2B, 0x35",
                encoder.toText(new byte[]{0x00, (byte) 0xFF, 0x2B, 0x35}));
    }

    @Test
    void toText_singleCode_noSeparator() {
        assertEquals("0xEC", encoder.toText(new byte[]{(byte) 0xEC}));
    }

    @Test
    void toText_empty() {
        assertEquals("", encoder.toText(new byte[0]));
    }

    @Test
    void toText_tokenCountMatchesCodes() {
        byte[] codes = encoder.encode(ditherer.dither(SyntheticPhotos.noise(20, 10, 9L)));
        String text = encoder.toText(codes);
        assertEquals(200, text.split(", ").length);
        assertTrue(text.matches("0x[0-9A-F]{2}(, 0x[0-9A-F]{2})*"));
    }

    @Test
    void decode_readsWireText() {
        assertArrayEquals(new byte[]{(byte) 0xFC, 0x00, (byte) 0xE0}, encoder.decode("0xFC, 0x00, 0xE0"));
        assertEquals(0, encoder.decode("").length);
    }

    @Test
    void decode_rejectsMalformedTokens() {
        assertThrows(IllegalArgumentException.class, () -> encoder.decode("0xfc, 0x00"));
        assertThrows(IllegalArgumentException.class, () -> encoder.decode("0xFC,0x00"));
        assertThrows(IllegalArgumentException.class, () -> encoder.decode("FC"));
    }
}
