package org.janelia.registration.image;

import ij.process.ShortProcessor;

/**
 * Pixel level helpers for 16-bit tiles.
 *
 * @author Eric Trautman
 */
public class TileImages {

    // absorbs rounding noise from inverted transforms
    private static final double EDGE_TOLERANCE = 0.000001;

    private TileImages() {
    }

    /**
     * @return true if every pixel of the tile has the same value.
     */
    public static boolean isUniform(final ShortProcessor tile) {
        final short[] pixels = (short[]) tile.getPixels();
        final short first = pixels[0];
        for (int i = 1; i < pixels.length; i++) {
            if (pixels[i] != first) {
                return false;
            }
        }
        return true;
    }

    public static boolean hasSameShape(final ShortProcessor a,
                                       final ShortProcessor b) {
        return (a.getWidth() == b.getWidth()) && (a.getHeight() == b.getHeight());
    }

    public static String shapeString(final ShortProcessor tile) {
        return tile.getHeight() + "x" + tile.getWidth();
    }

    /**
     * @return copy of the specified rectangle (which must lie inside the tile).
     */
    public static ShortProcessor crop(final ShortProcessor tile,
                                      final int x,
                                      final int y,
                                      final int width,
                                      final int height) {
        if ((width < 1) || (height < 1) ||
            (x < 0) || (y < 0) || (x + width > tile.getWidth()) || (y + height > tile.getHeight())) {
            throw new IllegalArgumentException(
                    "crop [" + x + ", " + y + ", " + width + ", " + height + "] exceeds " + shapeString(tile) +
                    " tile bounds");
        }
        tile.setRoi(x, y, width, height);
        final ShortProcessor cropped = (ShortProcessor) tile.crop();
        tile.resetRoi();
        return cropped;
    }

    /**
     * @return the tile itself if it already has the specified size,
     *         otherwise a copy that is cropped or zero filled at its right and bottom edges.
     */
    public static ShortProcessor conformTo(final ShortProcessor tile,
                                           final int width,
                                           final int height) {
        if ((tile.getWidth() == width) && (tile.getHeight() == height)) {
            return tile;
        }
        final ShortProcessor conformed = new ShortProcessor(width, height);
        conformed.insert(tile, 0, 0);
        return conformed;
    }

    /**
     * Samples the tile at a sub-pixel location with ImageJ's bilinear interpolation.
     *
     * @return the interpolated value or zero if the location lies outside the tile's pixel centers.
     */
    public static double interpolatedValue(final ShortProcessor tile,
                                           final double x,
                                           final double y) {
        if ((x < -EDGE_TOLERANCE) || (y < -EDGE_TOLERANCE) ||
            (x > tile.getWidth() - 1 + EDGE_TOLERANCE) || (y > tile.getHeight() - 1 + EDGE_TOLERANCE)) {
            return 0.0;
        }
        return tile.getInterpolatedValue(x, y);
    }
}
