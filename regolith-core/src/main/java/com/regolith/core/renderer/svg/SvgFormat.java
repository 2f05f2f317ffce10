package com.regolith.core.renderer.svg;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number and text formatting shared by all SVG elements.
 */
public final class SvgFormat {

    private static final int PRECISION = 10;

    private SvgFormat() {
    }

    /**
     * Formats a coordinate or length with at most ten decimals.
     *
     * <p>Trailing zeros and a trailing decimal point are removed, so {@code 12.0} becomes
     * {@code "12"} and {@code 1.25} stays {@code "1.25"}. Negative zero prints as
     * {@code "0"}. Output never uses exponent notation.
     *
     * @param value number to format
     * @return formatted number
     */
    public static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value)
            .setScale(PRECISION, RoundingMode.HALF_EVEN)
            .stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }

    /**
     * Escapes text for use in XML character data and attribute values.
     *
     * @param text raw text
     * @return escaped text
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length() + 16);
        escape(text, sb);
        return sb.toString();
    }

    static void escape(String text, StringBuilder out) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&#34;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
    }

    /**
     * Appends {@code name="value"} with a leading space, escaping the value.
     */
    static void attribute(StringBuilder out, String name, String value) {
        out.append(' ').append(name).append("=\"");
        escape(value, out);
        out.append('"');
    }

    static void attribute(StringBuilder out, String name, double value) {
        out.append(' ').append(name).append("=\"").append(number(value)).append('"');
    }

    static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
