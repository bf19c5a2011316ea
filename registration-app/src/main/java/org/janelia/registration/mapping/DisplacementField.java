package org.janelia.registration.mapping;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Per-tile displacement vectors sampled on a regular control grid.
 * Control point (i, j) sits at pixel (i * spacing, j * spacing) and holds the offset
 * to add to a target pixel location to find its source location.
 * Displacements between control points are bilinearly interpolated.
 *
 * @author Eric Trautman
 */
public class DisplacementField {

    private final int width;
    private final int height;
    private final int spacing;
    private final int gridWidth;
    private final int gridHeight;
    private final float[] dx;
    private final float[] dy;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DisplacementField() {
        this.width = 0;
        this.height = 0;
        this.spacing = 1;
        this.gridWidth = 0;
        this.gridHeight = 0;
        this.dx = null;
        this.dy = null;
    }

    public DisplacementField(final int width,
                             final int height,
                             final int spacing,
                             final float[] dx,
                             final float[] dy) {
        if ((width < 1) || (height < 1) || (spacing < 1)) {
            throw new IllegalArgumentException("width " + width + ", height " + height + ", and spacing " +
                                               spacing + " must all be positive");
        }
        this.width = width;
        this.height = height;
        this.spacing = spacing;
        this.gridWidth = gridSize(width, spacing);
        this.gridHeight = gridSize(height, spacing);
        final int controlPointCount = gridWidth * gridHeight;
        if ((dx.length != controlPointCount) || (dy.length != controlPointCount)) {
            throw new IllegalArgumentException("expected " + controlPointCount + " control point values but found " +
                                               dx.length + " x and " + dy.length + " y values");
        }
        this.dx = dx;
        this.dy = dy;
    }

    public static DisplacementField zero(final int width,
                                         final int height,
                                         final int spacing) {
        final int count = gridSize(width, spacing) * gridSize(height, spacing);
        return new DisplacementField(width, height, spacing, new float[count], new float[count]);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getSpacing() {
        return spacing;
    }

    public int getGridWidth() {
        return gridWidth;
    }

    public int getGridHeight() {
        return gridHeight;
    }

    /**
     * @return interpolated displacement {dx, dy} at the specified pixel.
     */
    public double[] displacementAt(final double x,
                                   final double y) {
        return displacementAt(createGrid(dx), createGrid(dy), x, y);
    }

    FloatProcessor createDxGrid() {
        return createGrid(dx);
    }

    FloatProcessor createDyGrid() {
        return createGrid(dy);
    }

    /**
     * Locations beyond the outermost control points use the edge displacements.
     */
    double[] displacementAt(final FloatProcessor dxGrid,
                            final FloatProcessor dyGrid,
                            final double x,
                            final double y) {
        final double gx = x / spacing;
        final double gy = y / spacing;
        return new double[] { dxGrid.getInterpolatedPixel(gx, gy), dyGrid.getInterpolatedPixel(gx, gy) };
    }

    private FloatProcessor createGrid(final float[] values) {
        final FloatProcessor grid = new FloatProcessor(gridWidth, gridHeight, values);
        grid.setInterpolationMethod(ImageProcessor.BILINEAR);
        return grid;
    }

    static int gridSize(final int pixelCount,
                        final int spacing) {
        return ((pixelCount - 1) / spacing) + 2;
    }
}
