package com.dbmodel.converter.model;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import lombok.EqualsAndHashCode;

/**
 * RGB color in {@code #rrggbb} notation.
 */
@EqualsAndHashCode
public final class Color {

    private final int red;
    private final int green;
    private final int blue;

    private Color(int red, int green, int blue) {
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    public static Color parse(String hex) {
        if (hex == null || hex.length() != 7 || hex.charAt(0) != '#') {
            throw new ConversionException(ConversionError.MALFORMED_ATTRIBUTE, "Not a #rrggbb color: " + hex);
        }
        try {
            return new Color(
                    Integer.parseInt(hex.substring(1, 3), 16),
                    Integer.parseInt(hex.substring(3, 5), 16),
                    Integer.parseInt(hex.substring(5, 7), 16));
        } catch (NumberFormatException e) {
            throw new ConversionException(ConversionError.MALFORMED_ATTRIBUTE, "Not a #rrggbb color: " + hex, e);
        }
    }

    /**
     * Adds {@code delta} to every channel, clamped to 0..255.
     */
    public Color shift(int delta) {
        return new Color(clamp(red + delta), clamp(green + delta), clamp(blue + delta));
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }

    @Override
    public String toString() {
        return String.format("#%02X%02X%02X", red, green, blue);
    }
}
