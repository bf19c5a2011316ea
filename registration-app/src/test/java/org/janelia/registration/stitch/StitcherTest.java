package org.janelia.registration.stitch;

import ij.process.ShortProcessor;

import java.io.File;
import java.util.List;

import org.janelia.registration.checkpoint.CheckpointCodec;
import org.janelia.registration.checkpoint.CheckpointKey;
import org.janelia.registration.checkpoint.CheckpointLayout;
import org.janelia.registration.checkpoint.CheckpointStore;
import org.janelia.registration.checkpoint.FileCheckpointStore;
import org.janelia.registration.checkpoint.Stage;
import org.janelia.registration.checkpoint.TiffTileCodec;
import org.janelia.registration.grid.GridPlanner;
import org.janelia.registration.grid.ImageShape;
import org.janelia.registration.grid.TileArea;
import org.janelia.registration.grid.TileCoordinate;
import org.janelia.registration.grid.TileGrid;
import org.janelia.registration.grid.TilingParameters;
import org.janelia.registration.image.ImageSink;
import org.janelia.registration.image.N5ImageStore;
import org.janelia.registration.image.TileImages;
import org.janelia.registration.util.FileUtil;
import org.janelia.registration.util.TestDirectories;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link Stitcher} class.
 *
 * @author Eric Trautman
 */
public class StitcherTest {

    private static final TiffTileCodec TILE_CODEC = new TiffTileCodec();

    private File checkpointDirectory;
    private FileCheckpointStore store;

    @Before
    public void setup() throws Exception {
        checkpointDirectory = TestDirectories.createTestDirectory("test_stitcher");
        store = new FileCheckpointStore(CheckpointLayout.inDirectory(checkpointDirectory.getAbsolutePath()));
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(checkpointDirectory);
    }

    @Test
    public void testStitchReproducesImage() throws Exception {

        final int channelCount = 2;
        final ShortProcessor[] channels = new ShortProcessor[channelCount];
        for (int channel = 0; channel < channelCount; channel++) {
            channels[channel] = buildImage(103, 77, channel);
        }

        final TileGrid grid = GridPlanner.plan(new ImageShape(77, 103, channelCount),
                                               new TilingParameters(40, 30, 11, 7));
        storeTrimmedTiles(grid, channels);

        final Stitcher stitcher = new Stitcher(grid);
        Assert.assertEquals("invalid stitched width", 103, stitcher.getStitchedWidth());
        Assert.assertEquals("invalid stitched height", 77, stitcher.getStitchedHeight());

        final String outputPath = new File(checkpointDirectory, "stitched.n5").getAbsolutePath();
        final N5ImageStore imageStore = new N5ImageStore(16);
        final ImageShape stitchedShape = stitcher.stitch(store, Stage.TRIMMED_AFFINE_TILE, channelCount, TILE_CODEC,
                                                         imageStore, outputPath);
        Assert.assertEquals("invalid stitched shape", new ImageShape(77, 103, channelCount), stitchedShape);
        Assert.assertEquals("invalid stored shape", stitchedShape, imageStore.getShape(outputPath));

        for (int channel = 0; channel < channelCount; channel++) {
            final ShortProcessor stitched = imageStore.readRegion(outputPath, new TileArea(0, 77, 0, 103), channel);
            for (int y = 0; y < 77; y++) {
                for (int x = 0; x < 103; x++) {
                    Assert.assertEquals("invalid channel " + channel + " pixel (" + x + ", " + y + ")",
                                        channels[channel].get(x, y), stitched.get(x, y));
                }
            }
        }
    }

    @Test
    public void testStitchLargerThanIntPixelCount() throws Exception {

        final ImageShape imageShape = new ImageShape(50000, 50000, 1);
        final TileGrid grid = GridPlanner.plan(imageShape, new TilingParameters(5000, 5000, 100, 100));
        final Stitcher stitcher = new Stitcher(grid);
        final RegionRecordingSink sink = new RegionRecordingSink();

        final ImageShape stitchedShape = stitcher.stitch(new BlankTileStore(grid), Stage.TRIMMED_AFFINE_TILE, 1,
                                                         TILE_CODEC, sink, "large");

        Assert.assertEquals("invalid stitched shape", imageShape, stitchedShape);
        Assert.assertEquals("invalid pixel count", 2500000000L, stitchedShape.getPixelCount());
        Assert.assertEquals("invalid created shape", imageShape, sink.createdShape);
        Assert.assertEquals("every tile should be written once", grid.size(), sink.regionCount);
        Assert.assertEquals("written regions should cover the image exactly once",
                            stitchedShape.getPixelCount(), sink.writtenPixelCount);
    }

    @Test
    public void testStitchIncomplete() throws Exception {

        final ShortProcessor image = buildImage(60, 60, 0);
        final TileGrid grid = GridPlanner.plan(new ImageShape(60, 60, 1), new TilingParameters(25, 25, 5, 5));
        storeTrimmedTiles(grid, new ShortProcessor[] { image });

        final CheckpointKey missingKey = CheckpointKey.forTileChannel(Stage.TRIMMED_AFFINE_TILE,
                                                                      new TileCoordinate(1, 2),
                                                                      0);
        FileUtil.deleteRecursive(store.getPath(missingKey).toFile());

        final Stitcher stitcher = new Stitcher(grid);
        final RegionRecordingSink sink = new RegionRecordingSink();
        final List<CheckpointKey> missingKeys = stitcher.findMissingKeys(store, Stage.TRIMMED_AFFINE_TILE, 1);
        Assert.assertEquals("invalid missing keys", 1, missingKeys.size());

        try {
            stitcher.stitch(store, Stage.TRIMMED_AFFINE_TILE, 1, TILE_CODEC, sink, "incomplete");
            Assert.fail("stitch should fail when a tile is missing");
        } catch (final StitchIncompleteException e) {
            Assert.assertEquals("exception should list missing key",
                                missingKey, e.getMissingKeys().get(0));
        }

        try {
            stitcher.stitch(store, Stage.TRIMMED_AFFINE_TILE, 2, TILE_CODEC, sink, "incomplete");
            Assert.fail("stitch should fail when a channel is missing");
        } catch (final StitchIncompleteException e) {
            Assert.assertEquals("every tile of the second channel should be missing",
                                grid.size() + 1, e.getMissingKeys().size());
        }

        Assert.assertNull("nothing should be written for an incomplete stage", sink.createdShape);
    }

    @Test(expected = IllegalStateException.class)
    public void testWrongTrimmedSizeIsRejected() {
        final TileGrid grid = GridPlanner.plan(new ImageShape(60, 60, 1), new TilingParameters(25, 25, 5, 5));
        final Stitcher stitcher = new Stitcher(grid);
        stitcher.verifyTrimmedSize(new TileCoordinate(0, 0), new ShortProcessor(3, 3));
    }

    private void storeTrimmedTiles(final TileGrid grid,
                                   final ShortProcessor[] channels)
            throws Exception {
        final OverlapRemover remover = new OverlapRemover(grid);
        for (final TileGrid.Entry entry : grid.getEntries()) {
            final TileArea area = entry.getArea();
            for (int channel = 0; channel < channels.length; channel++) {
                final ShortProcessor tile = TileImages.crop(channels[channel],
                                                            area.getColStart(),
                                                            area.getRowStart(),
                                                            area.getWidth(),
                                                            area.getHeight());
                store.put(CheckpointKey.forTileChannel(Stage.TRIMMED_AFFINE_TILE, entry.getCoordinate(), channel),
                          remover.trim(entry.getCoordinate(), tile),
                          TILE_CODEC);
            }
        }
    }

    /**
     * Serves blank trimmed tiles of the expected size without storing anything.
     */
    private static class BlankTileStore
            implements CheckpointStore {

        private final OverlapRemover overlapRemover;

        BlankTileStore(final TileGrid grid) {
            this.overlapRemover = new OverlapRemover(grid);
        }

        @Override
        public boolean exists(final CheckpointKey key) {
            return true;
        }

        @Override
        public <T> void put(final CheckpointKey key,
                            final T payload,
                            final CheckpointCodec<T> codec) {
            throw new UnsupportedOperationException("read only store");
        }

        @Override
        public <T> T get(final CheckpointKey key,
                         final CheckpointCodec<T> codec) {
            final TileCoordinate coordinate = key.getCoordinate();
            @SuppressWarnings("unchecked")
            final T tile = (T) new ShortProcessor(overlapRemover.getTrimmedWidth(coordinate),
                                                  overlapRemover.getTrimmedHeight(coordinate));
            return tile;
        }
    }

    /**
     * Checks region bounds and counts written pixels without keeping any of them.
     */
    private static class RegionRecordingSink
            implements ImageSink {

        private ImageShape createdShape;
        private int regionCount;
        private long writtenPixelCount;

        @Override
        public void create(final String path,
                           final ImageShape shape) {
            createdShape = shape;
        }

        @Override
        public void writeRegion(final String path,
                                final int x,
                                final int y,
                                final int channel,
                                final ShortProcessor region) {
            Assert.assertNotNull("region written before create", createdShape);
            Assert.assertTrue("region [" + x + ", " + y + "] outside stitched image",
                              (x >= 0) && (y >= 0) &&
                              (x + region.getWidth() <= createdShape.getWidth()) &&
                              (y + region.getHeight() <= createdShape.getHeight()));
            regionCount++;
            writtenPixelCount += (long) region.getWidth() * region.getHeight();
        }
    }

    static ShortProcessor buildImage(final int width,
                                     final int height,
                                     final int channel) {
        final ShortProcessor image = new ShortProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.set(x, y, (channel * 30000) + (y * width) + x);
            }
        }
        return image;
    }
}
