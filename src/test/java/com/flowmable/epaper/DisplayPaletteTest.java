package com.flowmable.epaper;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DisplayPaletteTest {

    @Test
    void palette_hasSevenEntriesInCanonicalOrder() {
        List<String> names = DisplayPalette.entries().stream().map(PaletteEntry::name).toList();
        assertEquals(List.of("White", "Yellow", "Orange", "Red", "Green", "Blue", "Black"), names);
    }

    @Test
    void palette_codesMatchPanelFirmware() {
        assertEquals(0xFF, DisplayPalette.WHITE.code());
        assertEquals(0xFC, DisplayPalette.YELLOW.code());
        assertEquals(0xEC, DisplayPalette.ORANGE.code());
        assertEquals(0xE0, DisplayPalette.RED.code());
        assertEquals(0x35, DisplayPalette.GREEN.code());
        assertEquals(0x2B, DisplayPalette.BLUE.code());
        assertEquals(0x00, DisplayPalette.BLACK.code());

        Set<Integer> codes = new HashSet<>();
        DisplayPalette.entries().forEach(e -> codes.add(e.code()));
        assertEquals(7, codes.size(), "Codes must be distinct");
    }

    @Test
    void nearestColor_exactPaletteColorMapsToItself() {
        for (PaletteEntry entry : DisplayPalette.entries()) {
            assertSame(entry, DisplayPalette.nearestColor(entry.color()), entry.name());
        }
    }

    @Test
    void nearestColor_nearBlackIsBlack() {
        assertSame(DisplayPalette.BLACK, DisplayPalette.nearestColor(new RgbColor(10, 10, 10)));
    }

    @Test
    void nearestColor_lightGrayIsWhite() {
        assertSame(DisplayPalette.WHITE, DisplayPalette.nearestColor(new RgbColor(200, 200, 200)));
    }

    @Test
    void nearestColor_tieGoesToEarlierEntry_greenBeforeBlack() {
        // (0,64,0) is 64² from both Green (0,128,0) and Black
        assertSame(DisplayPalette.GREEN, DisplayPalette.nearestColor(new RgbColor(0, 64, 0)));
    }

    @Test
    void nearestColor_tieGoesToEarlierEntry_yellowBeforeOrange() {
        // (255,210,0) is 45² from both Yellow (255,255,0) and Orange (255,165,0)
        assertSame(DisplayPalette.YELLOW, DisplayPalette.nearestColor(new RgbColor(255, 210, 0)));
    }

    @Test
    void nearestColor_acceptsOutOfRangeChannels() {
        assertSame(DisplayPalette.WHITE, DisplayPalette.nearestColor(400, 390, 410));
        assertSame(DisplayPalette.BLACK, DisplayPalette.nearestColor(-120, -80, -200));
    }

    @Test
    void codeFor_paletteColors() {
        assertEquals(0xE0, DisplayPalette.codeFor(new RgbColor(255, 0, 0)));
        assertEquals(0x2B, DisplayPalette.codeFor(new RgbColor(0, 0, 255)));
        assertTrue(DisplayPalette.contains(new RgbColor(255, 165, 0)));
    }

    @Test
    void codeFor_nonPaletteColorFallsBackToWhiteAndIsCounted() {
        long before = DisplayPalette.fallbackCount();
        RgbColor offPalette = new RgbColor(12, 34, 56);

        assertFalse(DisplayPalette.contains(offPalette));
        assertEquals(0xFF, DisplayPalette.codeFor(offPalette));
        assertEquals(before + 1, DisplayPalette.fallbackCount());
    }

    @Test
    void rgbColor_rejectsOutOfRangeChannels() {
        assertThrows(IllegalArgumentException.class, () -> new RgbColor(256, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new RgbColor(0, -1, 0));
    }

    @Test
    void rgbColor_packedRoundTrip() {
        RgbColor c = new RgbColor(0x12, 0xAB, 0xEF);
        assertEquals(0x12ABEF, c.packed());
        assertEquals(c, RgbColor.fromPacked(0xFF12ABEF));
        assertEquals("#12ABEF", c.toString());
    }
}
