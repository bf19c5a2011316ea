package org.janelia.registration.grid;

import com.google.common.base.Objects;

/**
 * Half-open pixel rectangle [rowStart, rowEnd) x [colStart, colEnd) within a padded image.
 *
 * @author Eric Trautman
 */
public class TileArea {

    private final int rowStart;
    private final int rowEnd;
    private final int colStart;
    private final int colEnd;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TileArea() {
        this(0, 1, 0, 1);
    }

    public TileArea(final int rowStart,
                    final int rowEnd,
                    final int colStart,
                    final int colEnd) {
        if ((rowEnd <= rowStart) || (colEnd <= colStart)) {
            throw new IllegalArgumentException(
                    "invalid area rows [" + rowStart + ", " + rowEnd + "), columns [" + colStart + ", " + colEnd + ")");
        }
        this.rowStart = rowStart;
        this.rowEnd = rowEnd;
        this.colStart = colStart;
        this.colEnd = colEnd;
    }

    public TileArea(final AxisInterval rows,
                    final AxisInterval columns) {
        this(rows.getStart(), rows.getEnd(), columns.getStart(), columns.getEnd());
    }

    public int getRowStart() {
        return rowStart;
    }

    public int getRowEnd() {
        return rowEnd;
    }

    public int getColStart() {
        return colStart;
    }

    public int getColEnd() {
        return colEnd;
    }

    public int getWidth() {
        return colEnd - colStart;
    }

    public int getHeight() {
        return rowEnd - rowStart;
    }

    /**
     * @return a copy of this area extended by the specified number of pixels on every side.
     *         The result may extend beyond the image (including negative starts).
     */
    public TileArea grow(final int margin) {
        return new TileArea(rowStart - margin, rowEnd + margin, colStart - margin, colEnd + margin);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TileArea that = (TileArea) o;
        return (rowStart == that.rowStart) && (rowEnd == that.rowEnd) &&
               (colStart == that.colStart) && (colEnd == that.colEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(rowStart, rowEnd, colStart, colEnd);
    }

    @Override
    public String toString() {
        return "{rows: [" + rowStart + ", " + rowEnd + "), columns: [" + colStart + ", " + colEnd + ")}";
    }
}
