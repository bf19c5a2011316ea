package org.janelia.registration.stitch;

import ij.process.ShortProcessor;

import org.janelia.registration.grid.TileArea;
import org.janelia.registration.grid.TileCoordinate;
import org.janelia.registration.grid.TileGrid;
import org.janelia.registration.image.TileImages;

/**
 * Trims the borders that a tile shares with its neighbors so that trimmed tiles abut exactly.
 *
 * Each shared border of width overlap is split at overlap / 2 (rounded down):
 * the tile before the border keeps the first part and the tile after it keeps the rest.
 * Borders on the outside of the grid are never trimmed.
 *
 * @author Eric Trautman
 */
public class OverlapRemover {

    private final TileGrid grid;
    private final int overlapX;
    private final int overlapY;

    public OverlapRemover(final TileGrid grid) {
        this.grid = grid;
        this.overlapX = grid.getTilingParameters().getOverlapX();
        this.overlapY = grid.getTilingParameters().getOverlapY();
    }

    public TrimMargins getMargins(final TileCoordinate coordinate) {
        final int leftSplit = overlapX / 2;
        final int topSplit = overlapY / 2;
        final int left = coordinate.getColumn() == 0 ? 0 : leftSplit;
        final int right = coordinate.getColumn() == grid.getMaxColumn() ? 0 : overlapX - leftSplit;
        final int top = coordinate.getRow() == 0 ? 0 : topSplit;
        final int bottom = coordinate.getRow() == grid.getMaxRow() ? 0 : overlapY - topSplit;
        return new TrimMargins(top, bottom, left, right);
    }

    public int getTrimmedWidth(final TileCoordinate coordinate) {
        final TrimMargins margins = getMargins(coordinate);
        return grid.getArea(coordinate).getWidth() - margins.getLeft() - margins.getRight();
    }

    public int getTrimmedHeight(final TileCoordinate coordinate) {
        final TrimMargins margins = getMargins(coordinate);
        return grid.getArea(coordinate).getHeight() - margins.getTop() - margins.getBottom();
    }

    /**
     * @return copy of the tile without its shared borders.
     *
     * @throws IllegalArgumentException
     *   if the tile's shape differs from the shape of its grid area.
     */
    public ShortProcessor trim(final TileCoordinate coordinate,
                               final ShortProcessor tile)
            throws IllegalArgumentException {

        final TileArea area = grid.getArea(coordinate);
        if ((tile.getWidth() != area.getWidth()) || (tile.getHeight() != area.getHeight())) {
            throw new IllegalArgumentException(
                    "tile " + coordinate + " is " + TileImages.shapeString(tile) + " but its area " + area + " is " +
                    area.getHeight() + "x" + area.getWidth());
        }

        final TrimMargins margins = getMargins(coordinate);
        return TileImages.crop(tile,
                               margins.getLeft(),
                               margins.getTop(),
                               getTrimmedWidth(coordinate),
                               getTrimmedHeight(coordinate));
    }

}
