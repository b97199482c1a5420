package com.flowmable.epaper;

/**
 * One renderable display color and the byte the panel expects for it.
 *
 * @param name  Human readable name, used in reports
 * @param color The exact RGB value
 * @param code  Device byte code (0–255)
 */
public record PaletteEntry(String name, RgbColor color, int code) {

    public PaletteEntry {
        if (code < 0 || code > 0xFF) {
            throw new IllegalArgumentException("Code out of byte range: " + code);
        }
    }

    public String hexCode() {
        return String.format("0x%02X", code);
    }
}
