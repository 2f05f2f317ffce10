package com.regolith.core.renderer.layout;

import com.regolith.core.renderer.svg.SvgFormat;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent builder for SVG path data, absolute commands only.
 *
 * <pre>{@code
 * String d = new PathBuilder()
 *     .moveTo(0, 20)
 *     .quadraticTo(0, 10, 10, 10)
 *     .horizontalTo(40)
 *     .build();   // "M 0 20 Q 0 10 10 10 H 40"
 * }</pre>
 */
public final class PathBuilder {

    private final List<String> commands = new ArrayList<>();

    public PathBuilder moveTo(double x, double y) {
        return command("M", x, y);
    }

    public PathBuilder lineTo(double x, double y) {
        return command("L", x, y);
    }

    public PathBuilder horizontalTo(double x) {
        return command("H", x);
    }

    public PathBuilder verticalTo(double y) {
        return command("V", y);
    }

    public PathBuilder quadraticTo(double cx, double cy, double x, double y) {
        return command("Q", cx, cy, x, y);
    }

    public PathBuilder cubicTo(double c1x, double c1y, double c2x, double c2y, double x, double y) {
        return command("C", c1x, c1y, c2x, c2y, x, y);
    }

    public PathBuilder arcTo(double rx, double ry, double rotation, boolean largeArc, boolean sweep,
                             double x, double y) {
        commands.add("A " + SvgFormat.number(rx) + " " + SvgFormat.number(ry) + " "
            + SvgFormat.number(rotation) + " " + (largeArc ? 1 : 0) + " " + (sweep ? 1 : 0) + " "
            + SvgFormat.number(x) + " " + SvgFormat.number(y));
        return this;
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    /**
     * Joins the commands with single spaces.
     *
     * @return path data
     */
    public String build() {
        return String.join(" ", commands);
    }

    @Override
    public String toString() {
        return build();
    }

    private PathBuilder command(String name, double... args) {
        StringBuilder sb = new StringBuilder(name);
        for (double arg : args) {
            sb.append(' ').append(SvgFormat.number(arg));
        }
        commands.add(sb.toString());
        return this;
    }
}
