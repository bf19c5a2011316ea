package org.janelia.registration.grid;

import com.google.common.base.Objects;

/**
 * Pixel dimensions and channel count of a multi-channel image.
 *
 * @author Eric Trautman
 */
public class ImageShape {

    private final int height;
    private final int width;
    private final int channels;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ImageShape() {
        this(1, 1, 1);
    }

    public ImageShape(final int height,
                      final int width,
                      final int channels) {
        if ((height <= 0) || (width <= 0) || (channels <= 0)) {
            throw new InvalidConfigurationException(
                    "image shape must be positive but was height " + height + ", width " + width +
                    ", channels " + channels);
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getChannels() {
        return channels;
    }

    /**
     * @return number of pixels in one channel (may exceed the int range for stitched images).
     */
    public long getPixelCount() {
        return (long) height * width;
    }

    /**
     * @return element-wise maximum of this shape and the other shape.
     */
    public ImageShape padTo(final ImageShape other) {
        return new ImageShape(Math.max(height, other.height),
                              Math.max(width, other.width),
                              Math.max(channels, other.channels));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ImageShape that = (ImageShape) o;
        return (height == that.height) && (width == that.width) && (channels == that.channels);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(height, width, channels);
    }

    @Override
    public String toString() {
        return "{height: " + height + ", width: " + width + ", channels: " + channels + "}";
    }
}
