package org.janelia.registration.grid;

import com.google.common.base.Objects;

import javax.annotation.Nonnull;

/**
 * Zero-based (row, column) position of a tile within a {@link TileGrid}.
 * Coordinates sort in row-major order.
 *
 * @author Eric Trautman
 */
public class TileCoordinate
        implements Comparable<TileCoordinate> {

    private final int row;
    private final int column;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TileCoordinate() {
        this(0, 0);
    }

    public TileCoordinate(final int row,
                          final int column) {
        if ((row < 0) || (column < 0)) {
            throw new IllegalArgumentException("row " + row + " and column " + column + " must be non-negative");
        }
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TileCoordinate that = (TileCoordinate) o;
        return (row == that.row) && (column == that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(row, column);
    }

    @Override
    public int compareTo(@Nonnull final TileCoordinate that) {
        int result = Integer.compare(this.row, that.row);
        if (result == 0) {
            result = Integer.compare(this.column, that.column);
        }
        return result;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
