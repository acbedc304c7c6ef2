package com.wildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Axis-aligned rectangle in image coordinates.
 *
 * <p>
 * When {@code frameWidth}/{@code frameHeight} are positive the box is
 * measured in pixels of that frame; otherwise width and height are taken to
 * be fractions of the frame already.
 * </p>
 *
 * @since 1.0.0
 */
public final class BoundingBox implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final double frameWidth;
    private final double frameHeight;

    @JsonCreator
    public BoundingBox(@JsonProperty("x") double x,
            @JsonProperty("y") double y,
            @JsonProperty("width") double width,
            @JsonProperty("height") double height,
            @JsonProperty("frameWidth") double frameWidth,
            @JsonProperty("frameHeight") double frameHeight) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
    }

    /**
     * Box already expressed as fractions of the frame.
     */
    public static BoundingBox normalized(double x, double y, double width, double height) {
        return new BoundingBox(x, y, width, height, 0, 0);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getFrameWidth() {
        return frameWidth;
    }

    public double getFrameHeight() {
        return frameHeight;
    }

    /**
     * Area of the box as a fraction of the frame area.
     *
     * @param fallbackFrameWidth  frame width to use when the box does not carry
     *                            its own (e.g. from camera metadata); ignored if
     *                            not positive
     * @param fallbackFrameHeight frame height, same rules
     * @return normalized area, never negative
     */
    public double normalizedArea(double fallbackFrameWidth, double fallbackFrameHeight) {
        double fw = frameWidth > 0 ? frameWidth : fallbackFrameWidth;
        double fh = frameHeight > 0 ? frameHeight : fallbackFrameHeight;
        double area = Math.max(0, width) * Math.max(0, height);
        if (fw > 0 && fh > 0) {
            return area / (fw * fh);
        }
        return area;
    }

    @JsonIgnore
    public double normalizedArea() {
        return normalizedArea(0, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BoundingBox that))
            return false;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(width, that.width) == 0
                && Double.compare(height, that.height) == 0
                && Double.compare(frameWidth, that.frameWidth) == 0
                && Double.compare(frameHeight, that.frameHeight) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height, frameWidth, frameHeight);
    }

    @Override
    public String toString() {
        return "BoundingBox{" + x + "," + y + " " + width + "x" + height
                + (frameWidth > 0 ? " in " + frameWidth + "x" + frameHeight : "") + '}';
    }
}
