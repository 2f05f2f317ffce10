package com.regolith.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.List;

/**
 * Styling and dimension settings for rendering railroad diagrams.
 *
 * <p>A flat, read-only value object. One instance may be shared by any number of
 * concurrent renders. Values are not validated; callers supply sane numbers.
 *
 * <p>Loaded from YAML by {@link RenderConfigLoader}. Every key is optional and absent
 * keys keep the value from {@link #defaults()}:
 * <pre>{@code
 * padding: 12
 * fontSize: 16
 * charWidth: 9.6
 * literalFill: "#ff0000"
 * subexpColors:
 *   - "#cce5ff"
 *   - "#d4edda"
 * }</pre>
 *
 * @param padding padding around the diagram and inside titled boxes
 * @param horizontalGap gap between concatenated fragments
 * @param verticalGap gap between stacked rows (doubled between alternation branches)
 * @param cornerRadius corner radius of every box
 * @param fontFamily font family for all text
 * @param fontSize base font size in pixels
 * @param charWidth approximate width of one character, used to size boxes around text
 * @param backgroundColor background color of the whole drawing
 * @param textColor default text color
 * @param lineColor color of connector lines and paths
 * @param lineWidth stroke width of connector lines and paths
 * @param literalFill fill of literal boxes
 * @param charsetFill fill of character class boxes
 * @param escapeFill fill of escape, back-reference and Unicode property boxes
 * @param anchorFill fill of anchor boxes
 * @param subexpFill fill of outermost group boxes (depth 0)
 * @param subexpStroke stroke of group boxes
 * @param subexpColors palette cycled through by nested group boxes (depth 1 and deeper)
 * @param anyCharFill fill of any-character boxes
 * @param flagsFill fill of flag and inline modifier boxes
 * @param repeatLabelColor color of quantifier labels
 * @param recursiveRefFill fill of recursion boxes
 * @param calloutFill fill of callout boxes
 * @param backtrackControlFill fill of backtracking control verb boxes
 * @param conditionalFill fill of conditional boxes
 */
@JsonDeserialize(builder = RenderConfig.Builder.class)
public record RenderConfig(
    double padding,
    double horizontalGap,
    double verticalGap,
    double cornerRadius,
    String fontFamily,
    double fontSize,
    double charWidth,
    String backgroundColor,
    String textColor,
    String lineColor,
    double lineWidth,
    String literalFill,
    String charsetFill,
    String escapeFill,
    String anchorFill,
    String subexpFill,
    String subexpStroke,
    List<String> subexpColors,
    String anyCharFill,
    String flagsFill,
    String repeatLabelColor,
    String recursiveRefFill,
    String calloutFill,
    String backtrackControlFill,
    String conditionalFill
) {
    /**
     * Compact constructor; copies the palette.
     */
    public RenderConfig {
        subexpColors = subexpColors == null ? List.of() : List.copyOf(subexpColors);
    }

    /**
     * Creates the default configuration.
     *
     * @return default render config
     */
    public static RenderConfig defaults() {
        return new Builder().build();
    }

    /**
     * Creates a builder pre-populated with the default values.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with this configuration's values.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builder for {@link RenderConfig}, also used by Jackson when reading YAML.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {

        private double padding = 10;
        private double horizontalGap = 10;
        private double verticalGap = 5;
        private double cornerRadius = 3;
        private String fontFamily = "monospace";
        private double fontSize = 14;
        private double charWidth = 8.4;
        private String backgroundColor = "transparent";
        private String textColor = "#000";
        private String lineColor = "#000";
        private double lineWidth = 2;
        private String literalFill = "#ff6b6b";
        private String charsetFill = "#cbcbba";
        private String escapeFill = "#bada55";
        private String anchorFill = "#6b6659";
        private String subexpFill = "none";
        private String subexpStroke = "#908c83";
        // Light blue, green, yellow, pink, lavender: readable with black text
        private List<String> subexpColors = List.of("#cce5ff", "#d4edda", "#fff3cd", "#f8d7da", "#e2d5f0");
        private String anyCharFill = "#dae9e5";
        private String flagsFill = "#c8e0f9";
        private String repeatLabelColor = "#666";
        private String recursiveRefFill = "#c9b3ff";
        private String calloutFill = "#ffd699";
        private String backtrackControlFill = "#ffb3a7";
        private String conditionalFill = "#b3e5fc";

        public Builder() {
        }

        private Builder(RenderConfig config) {
            this.padding = config.padding;
            this.horizontalGap = config.horizontalGap;
            this.verticalGap = config.verticalGap;
            this.cornerRadius = config.cornerRadius;
            this.fontFamily = config.fontFamily;
            this.fontSize = config.fontSize;
            this.charWidth = config.charWidth;
            this.backgroundColor = config.backgroundColor;
            this.textColor = config.textColor;
            this.lineColor = config.lineColor;
            this.lineWidth = config.lineWidth;
            this.literalFill = config.literalFill;
            this.charsetFill = config.charsetFill;
            this.escapeFill = config.escapeFill;
            this.anchorFill = config.anchorFill;
            this.subexpFill = config.subexpFill;
            this.subexpStroke = config.subexpStroke;
            this.subexpColors = config.subexpColors;
            this.anyCharFill = config.anyCharFill;
            this.flagsFill = config.flagsFill;
            this.repeatLabelColor = config.repeatLabelColor;
            this.recursiveRefFill = config.recursiveRefFill;
            this.calloutFill = config.calloutFill;
            this.backtrackControlFill = config.backtrackControlFill;
            this.conditionalFill = config.conditionalFill;
        }

        public Builder padding(double padding) {
            this.padding = padding;
            return this;
        }

        public Builder horizontalGap(double horizontalGap) {
            this.horizontalGap = horizontalGap;
            return this;
        }

        public Builder verticalGap(double verticalGap) {
            this.verticalGap = verticalGap;
            return this;
        }

        public Builder cornerRadius(double cornerRadius) {
            this.cornerRadius = cornerRadius;
            return this;
        }

        public Builder fontFamily(String fontFamily) {
            this.fontFamily = fontFamily;
            return this;
        }

        public Builder fontSize(double fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder charWidth(double charWidth) {
            this.charWidth = charWidth;
            return this;
        }

        public Builder backgroundColor(String backgroundColor) {
            this.backgroundColor = backgroundColor;
            return this;
        }

        public Builder textColor(String textColor) {
            this.textColor = textColor;
            return this;
        }

        public Builder lineColor(String lineColor) {
            this.lineColor = lineColor;
            return this;
        }

        public Builder lineWidth(double lineWidth) {
            this.lineWidth = lineWidth;
            return this;
        }

        public Builder literalFill(String literalFill) {
            this.literalFill = literalFill;
            return this;
        }

        public Builder charsetFill(String charsetFill) {
            this.charsetFill = charsetFill;
            return this;
        }

        public Builder escapeFill(String escapeFill) {
            this.escapeFill = escapeFill;
            return this;
        }

        public Builder anchorFill(String anchorFill) {
            this.anchorFill = anchorFill;
            return this;
        }

        public Builder subexpFill(String subexpFill) {
            this.subexpFill = subexpFill;
            return this;
        }

        public Builder subexpStroke(String subexpStroke) {
            this.subexpStroke = subexpStroke;
            return this;
        }

        public Builder subexpColors(List<String> subexpColors) {
            this.subexpColors = subexpColors;
            return this;
        }

        public Builder anyCharFill(String anyCharFill) {
            this.anyCharFill = anyCharFill;
            return this;
        }

        public Builder flagsFill(String flagsFill) {
            this.flagsFill = flagsFill;
            return this;
        }

        public Builder repeatLabelColor(String repeatLabelColor) {
            this.repeatLabelColor = repeatLabelColor;
            return this;
        }

        public Builder recursiveRefFill(String recursiveRefFill) {
            this.recursiveRefFill = recursiveRefFill;
            return this;
        }

        public Builder calloutFill(String calloutFill) {
            this.calloutFill = calloutFill;
            return this;
        }

        public Builder backtrackControlFill(String backtrackControlFill) {
            this.backtrackControlFill = backtrackControlFill;
            return this;
        }

        public Builder conditionalFill(String conditionalFill) {
            this.conditionalFill = conditionalFill;
            return this;
        }

        public RenderConfig build() {
            return new RenderConfig(
                padding, horizontalGap, verticalGap, cornerRadius,
                fontFamily, fontSize, charWidth,
                backgroundColor, textColor, lineColor, lineWidth,
                literalFill, charsetFill, escapeFill, anchorFill,
                subexpFill, subexpStroke, subexpColors,
                anyCharFill, flagsFill, repeatLabelColor,
                recursiveRefFill, calloutFill, backtrackControlFill, conditionalFill
            );
        }
    }
}
