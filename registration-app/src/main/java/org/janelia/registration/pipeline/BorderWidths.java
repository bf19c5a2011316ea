package org.janelia.registration.pipeline;

import ij.process.ShortProcessor;

/**
 * Widths of the all-zero rows and columns along each edge of a tile.
 *
 * @author Eric Trautman
 */
public class BorderWidths {

    private final int top;
    private final int bottom;
    private final int left;
    private final int right;

    public BorderWidths(final int top,
                        final int bottom,
                        final int left,
                        final int right) {
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
    }

    public static BorderWidths measure(final ShortProcessor tile) {

        final int width = tile.getWidth();
        final int height = tile.getHeight();

        int top = 0;
        while ((top < height) && isZeroRow(tile, top)) {
            top++;
        }
        int bottom = 0;
        while ((bottom < height) && isZeroRow(tile, height - 1 - bottom)) {
            bottom++;
        }
        int left = 0;
        while ((left < width) && isZeroColumn(tile, left)) {
            left++;
        }
        int right = 0;
        while ((right < width) && isZeroColumn(tile, width - 1 - right)) {
            right++;
        }

        return new BorderWidths(top, bottom, left, right);
    }

    public int getTop() {
        return top;
    }

    public int getBottom() {
        return bottom;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "{top: " + top + ", bottom: " + bottom + ", left: " + left + ", right: " + right + "}";
    }

    private static boolean isZeroRow(final ShortProcessor tile,
                                     final int y) {
        for (int x = 0; x < tile.getWidth(); x++) {
            if (tile.get(x, y) != 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isZeroColumn(final ShortProcessor tile,
                                        final int x) {
        for (int y = 0; y < tile.getHeight(); y++) {
            if (tile.get(x, y) != 0) {
                return false;
            }
        }
        return true;
    }
}
