package org.janelia.registration.stitch;

import ij.process.ShortProcessor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.janelia.registration.checkpoint.CheckpointCodec;
import org.janelia.registration.checkpoint.CheckpointKey;
import org.janelia.registration.checkpoint.CheckpointStore;
import org.janelia.registration.checkpoint.Stage;
import org.janelia.registration.grid.ImageShape;
import org.janelia.registration.grid.TileCoordinate;
import org.janelia.registration.grid.TileGrid;
import org.janelia.registration.image.ImageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles trimmed tiles into one multi-channel image.
 *
 * Placement offsets are the cumulative trimmed heights of the rows above a tile and
 * the cumulative trimmed widths of the columns to its left.
 * Tiles are loaded and written one at a time, the stitched image is never held in memory.
 *
 * @author Eric Trautman
 */
public class Stitcher {

    private final TileGrid grid;
    private final OverlapRemover overlapRemover;
    private final int[] rowOffsets;
    private final int[] columnOffsets;

    public Stitcher(final TileGrid grid) {
        this.grid = grid;
        this.overlapRemover = new OverlapRemover(grid);

        this.rowOffsets = new int[grid.getRowCount() + 1];
        for (int row = 0; row < grid.getRowCount(); row++) {
            rowOffsets[row + 1] = rowOffsets[row] + overlapRemover.getTrimmedHeight(new TileCoordinate(row, 0));
        }

        this.columnOffsets = new int[grid.getColumnCount() + 1];
        for (int column = 0; column < grid.getColumnCount(); column++) {
            columnOffsets[column + 1] =
                    columnOffsets[column] + overlapRemover.getTrimmedWidth(new TileCoordinate(0, column));
        }
    }

    public int getStitchedWidth() {
        return columnOffsets[columnOffsets.length - 1];
    }

    public int getStitchedHeight() {
        return rowOffsets[rowOffsets.length - 1];
    }

    public int getRowOffset(final int row) {
        return rowOffsets[row];
    }

    public int getColumnOffset(final int column) {
        return columnOffsets[column];
    }

    /**
     * @return keys for every trimmed tile of the stage that does not have a checkpoint.
     */
    public List<CheckpointKey> findMissingKeys(final CheckpointStore checkpointStore,
                                               final Stage trimmedStage,
                                               final int channelCount) {
        final List<CheckpointKey> missingKeys = new ArrayList<>();
        for (final TileCoordinate coordinate : grid.getCoordinates()) {
            for (int channel = 0; channel < channelCount; channel++) {
                final CheckpointKey key = CheckpointKey.forTileChannel(trimmedStage, coordinate, channel);
                if (! checkpointStore.exists(key)) {
                    missingKeys.add(key);
                }
            }
        }
        return missingKeys;
    }

    /**
     * Streams the trimmed tiles of a stage into an image sink, one tile and channel at a time,
     * so that only a single tile is ever held in memory.
     *
     * @return shape of the stitched image.
     *
     * @throws StitchIncompleteException
     *   if any trimmed tile is missing (nothing is written in this case).
     *
     * @throws IllegalStateException
     *   if a loaded tile does not have its expected trimmed size.
     */
    public ImageShape stitch(final CheckpointStore checkpointStore,
                             final Stage trimmedStage,
                             final int channelCount,
                             final CheckpointCodec<ShortProcessor> tileCodec,
                             final ImageSink imageSink,
                             final String outputPath)
            throws StitchIncompleteException, IllegalStateException, IOException {

        LOG.info("stitch: entry, assembling {} tiles with {} channels from {} into {}",
                 grid.size(), channelCount, trimmedStage, outputPath);

        final List<CheckpointKey> missingKeys = findMissingKeys(checkpointStore, trimmedStage, channelCount);
        if (missingKeys.size() > 0) {
            throw new StitchIncompleteException(missingKeys);
        }

        final ImageShape stitchedShape = new ImageShape(getStitchedHeight(), getStitchedWidth(), channelCount);
        imageSink.create(outputPath, stitchedShape);

        for (final TileCoordinate coordinate : grid.getCoordinates()) {
            for (int channel = 0; channel < channelCount; channel++) {
                final CheckpointKey key = CheckpointKey.forTileChannel(trimmedStage, coordinate, channel);
                final ShortProcessor tile = checkpointStore.get(key, tileCodec);
                verifyTrimmedSize(coordinate, tile);
                imageSink.writeRegion(outputPath,
                                      columnOffsets[coordinate.getColumn()],
                                      rowOffsets[coordinate.getRow()],
                                      channel,
                                      tile);
            }
        }

        LOG.info("stitch: exit, assembled {} image with {} pixels per channel",
                 stitchedShape, stitchedShape.getPixelCount());

        return stitchedShape;
    }

    void verifyTrimmedSize(final TileCoordinate coordinate,
                           final ShortProcessor tile)
            throws IllegalStateException {

        final int expectedWidth = overlapRemover.getTrimmedWidth(coordinate);
        final int expectedHeight = overlapRemover.getTrimmedHeight(coordinate);
        if ((tile.getWidth() != expectedWidth) || (tile.getHeight() != expectedHeight)) {
            throw new IllegalStateException(
                    "trimmed tile " + coordinate + " is " + tile.getHeight() + "x" + tile.getWidth() +
                    " but should be " + expectedHeight + "x" + expectedWidth);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(Stitcher.class);
}
