package com.flowmable.epaper;

import java.util.Objects;

/**
 * Turns a dithered raster into the byte stream the panel firmware reads.
 * <p>
 * Wire form: every code as {@code 0xHH} with uppercase hex digits, joined by
 * {@code ", "}, in row-major pixel order.
 */
public class DisplayEncoder {

    private static final String SEPARATOR = ", ";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    public byte[] encode(Raster raster) {
        Objects.requireNonNull(raster, "raster");
        byte[] codes = new byte[raster.pixelCount()];
        for (int i = 0; i < codes.length; i++) {
            codes[i] = (byte) DisplayPalette.codeFor(raster.packedAtIndex(i));
        }
        return codes;
    }

    public String toText(byte[] codes) {
        if (codes.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder(codes.length * 6);
        for (int i = 0; i < codes.length; i++) {
            if (i > 0) {
                sb.append(SEPARATOR);
            }
            int v = codes[i] & 0xFF;
            sb.append('0').append('x').append(HEX[v >> 4]).append(HEX[v & 0x0F]);
        }
        return sb.toString();
    }

    /**
     * Parse wire text back into codes.
     *
     * @throws IllegalArgumentException if a token is not of the form {@code 0xHH}
     */
    public byte[] decode(String text) {
        if (text.isEmpty()) {
            return new byte[0];
        }
        String[] tokens = text.split(SEPARATOR, -1);
        byte[] codes = new byte[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.length() != 4 || token.charAt(0) != '0' || token.charAt(1) != 'x') {
                throw new IllegalArgumentException("Malformed token at " + i + ": '" + token + "'");
            }
            int hi = hexValue(token.charAt(2));
            int lo = hexValue(token.charAt(3));
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Malformed token at " + i + ": '" + token + "'");
            }
            codes[i] = (byte) ((hi << 4) | lo);
        }
        return codes;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        return -1;
    }
}
