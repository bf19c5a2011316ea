package org.janelia.registration.stitch;

/**
 * Number of pixels removed from each side of a tile.
 *
 * @author Eric Trautman
 */
public class TrimMargins {

    private final int top;
    private final int bottom;
    private final int left;
    private final int right;

    public TrimMargins(final int top,
                       final int bottom,
                       final int left,
                       final int right) {
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
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
}
