package org.janelia.registration.image;

import ij.process.ShortProcessor;

import java.io.IOException;
import java.util.Arrays;

import org.janelia.registration.grid.ImageShape;
import org.janelia.registration.grid.TileArea;
import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.ShortArrayDataBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores multi-channel 16-bit images in N5 containers.
 *
 * Each container holds a single {@value #DATASET_NAME} dataset with dimensions [width, height, channels]
 * and blocks of [blockSize, blockSize, 1], so that region reads only load the blocks they intersect.
 *
 * @author Eric Trautman
 */
public class N5ImageStore
        implements ImageSource, ImageSink {

    public static final String DATASET_NAME = "dataset";
    public static final int DEFAULT_BLOCK_SIZE = 512;

    private final int blockSize;

    public N5ImageStore() {
        this(DEFAULT_BLOCK_SIZE);
    }

    public N5ImageStore(final int blockSize) {
        if (blockSize < 1) {
            throw new IllegalArgumentException("block size " + blockSize + " must be positive");
        }
        this.blockSize = blockSize;
    }

    @Override
    public ImageShape getShape(final String path)
            throws IOException {
        final long[] dimensions = getDatasetAttributes(new N5FSReader(path), path).getDimensions();
        final int channels = dimensions.length > 2 ? (int) dimensions[2] : 1;
        return new ImageShape((int) dimensions[1], (int) dimensions[0], channels);
    }

    @Override
    public ShortProcessor readRegion(final String path,
                                     final TileArea area,
                                     final int channel)
            throws IOException {

        final N5Reader reader = new N5FSReader(path);
        final DatasetAttributes attributes = getDatasetAttributes(reader, path);
        final long[] dimensions = attributes.getDimensions();
        final int[] datasetBlockSize = attributes.getBlockSize();
        final int imageWidth = (int) dimensions[0];
        final int imageHeight = (int) dimensions[1];
        final int channels = dimensions.length > 2 ? (int) dimensions[2] : 1;

        if ((channel < 0) || (channel >= channels)) {
            throw new IllegalArgumentException("channel " + channel + " does not exist in " + path +
                                               " which has " + channels + " channels");
        }

        final ShortProcessor region = new ShortProcessor(area.getWidth(), area.getHeight());
        final short[] regionPixels = (short[]) region.getPixels();

        final int minX = Math.max(area.getColStart(), 0);
        final int maxX = Math.min(area.getColEnd(), imageWidth);
        final int minY = Math.max(area.getRowStart(), 0);
        final int maxY = Math.min(area.getRowEnd(), imageHeight);

        if ((minX >= maxX) || (minY >= maxY)) {
            return region;
        }

        final int blockWidth = datasetBlockSize[0];
        final int blockHeight = datasetBlockSize[1];

        for (int gridY = minY / blockHeight; gridY <= (maxY - 1) / blockHeight; gridY++) {
            for (int gridX = minX / blockWidth; gridX <= (maxX - 1) / blockWidth; gridX++) {

                final long[] gridPosition = dimensions.length > 2 ?
                                            new long[] { gridX, gridY, channel } :
                                            new long[] { gridX, gridY };
                final DataBlock<?> block = reader.readBlock(DATASET_NAME, attributes, gridPosition);
                if (block == null) {
                    continue; // never written, all zeros
                }

                final short[] blockPixels = (short[]) block.getData();
                final int blockDataWidth = block.getSize()[0];
                final int blockX = gridX * blockWidth;
                final int blockY = gridY * blockHeight;

                final int fromX = Math.max(minX, blockX);
                final int toX = Math.min(maxX, blockX + blockDataWidth);
                final int fromY = Math.max(minY, blockY);
                final int toY = Math.min(maxY, blockY + block.getSize()[1]);

                for (int y = fromY; y < toY; y++) {
                    System.arraycopy(blockPixels,
                                     (y - blockY) * blockDataWidth + (fromX - blockX),
                                     regionPixels,
                                     (y - area.getRowStart()) * area.getWidth() + (fromX - area.getColStart()),
                                     toX - fromX);
                }
            }
        }

        return region;
    }

    @Override
    public void create(final String path,
                       final ImageShape shape)
            throws IOException {

        LOG.info("create: entry, creating {} image with {} pixels per channel in {}",
                 shape, shape.getPixelCount(), path);

        final N5Writer writer = new N5FSWriter(path);
        if (writer.datasetExists(DATASET_NAME)) {
            writer.remove(DATASET_NAME);
        }
        writer.createDataset(DATASET_NAME,
                             new long[] { shape.getWidth(), shape.getHeight(), shape.getChannels() },
                             new int[] { blockSize, blockSize, 1 },
                             DataType.UINT16,
                             new GzipCompression());
    }

    /**
     * Writes every block the region intersects.
     * Blocks that are only partially covered are merged with their current content.
     */
    @Override
    public void writeRegion(final String path,
                            final int x,
                            final int y,
                            final int channel,
                            final ShortProcessor region)
            throws IOException {

        final N5Writer writer = new N5FSWriter(path);
        final DatasetAttributes attributes = getDatasetAttributes(writer, path);
        final long[] dimensions = attributes.getDimensions();
        final int[] datasetBlockSize = attributes.getBlockSize();
        final int imageWidth = (int) dimensions[0];
        final int imageHeight = (int) dimensions[1];
        final int channels = dimensions.length > 2 ? (int) dimensions[2] : 1;

        final int regionWidth = region.getWidth();
        final int maxX = x + regionWidth;
        final int maxY = y + region.getHeight();

        if ((channel < 0) || (channel >= channels)) {
            throw new IllegalArgumentException("channel " + channel + " does not exist in " + path +
                                               " which has " + channels + " channels");
        }
        if ((x < 0) || (y < 0) || (maxX > imageWidth) || (maxY > imageHeight)) {
            throw new IllegalArgumentException(
                    "region [" + x + ", " + y + ", " + regionWidth + ", " + region.getHeight() +
                    "] exceeds " + imageHeight + "x" + imageWidth + " image " + path);
        }

        final short[] regionPixels = (short[]) region.getPixels();
        final int blockWidth = datasetBlockSize[0];
        final int blockHeight = datasetBlockSize[1];

        for (int gridY = y / blockHeight; gridY <= (maxY - 1) / blockHeight; gridY++) {
            for (int gridX = x / blockWidth; gridX <= (maxX - 1) / blockWidth; gridX++) {

                final long[] gridPosition = dimensions.length > 2 ?
                                            new long[] { gridX, gridY, channel } :
                                            new long[] { gridX, gridY };
                final int blockX = gridX * blockWidth;
                final int blockY = gridY * blockHeight;
                final int blockDataWidth = Math.min(blockWidth, imageWidth - blockX);
                final int blockDataHeight = Math.min(blockHeight, imageHeight - blockY);

                final int fromX = Math.max(x, blockX);
                final int toX = Math.min(maxX, blockX + blockDataWidth);
                final int fromY = Math.max(y, blockY);
                final int toY = Math.min(maxY, blockY + blockDataHeight);

                final boolean coversBlock = (fromX == blockX) && (toX == blockX + blockDataWidth) &&
                                            (fromY == blockY) && (toY == blockY + blockDataHeight);
                final short[] blockPixels = coversBlock ?
                                            new short[blockDataWidth * blockDataHeight] :
                                            readBlockPixels(writer, attributes, gridPosition,
                                                            blockDataWidth, blockDataHeight);

                for (int row = fromY; row < toY; row++) {
                    System.arraycopy(regionPixels,
                                     (row - y) * regionWidth + (fromX - x),
                                     blockPixels,
                                     (row - blockY) * blockDataWidth + (fromX - blockX),
                                     toX - fromX);
                }

                final int[] blockDataSize = dimensions.length > 2 ?
                                            new int[] { blockDataWidth, blockDataHeight, 1 } :
                                            new int[] { blockDataWidth, blockDataHeight };
                writer.writeBlock(DATASET_NAME,
                                  attributes,
                                  new ShortArrayDataBlock(blockDataSize, gridPosition, blockPixels));
            }
        }
    }

    private static short[] readBlockPixels(final N5Writer writer,
                                           final DatasetAttributes attributes,
                                           final long[] gridPosition,
                                           final int blockDataWidth,
                                           final int blockDataHeight)
            throws IOException {

        final DataBlock<?> block = writer.readBlock(DATASET_NAME, attributes, gridPosition);
        final short[] blockPixels;
        if (block == null) {
            blockPixels = new short[blockDataWidth * blockDataHeight];
        } else if (block.getNumElements() == blockDataWidth * blockDataHeight) {
            blockPixels = (short[]) block.getData();
        } else {
            throw new IOException("block " + Arrays.toString(gridPosition) + " has " + block.getNumElements() +
                                  " elements but should have " + (blockDataWidth * blockDataHeight));
        }
        return blockPixels;
    }

    private static DatasetAttributes getDatasetAttributes(final N5Reader reader,
                                                          final String path)
            throws IOException {
        final DatasetAttributes attributes = reader.getDatasetAttributes(DATASET_NAME);
        if (attributes == null) {
            throw new IOException("dataset '" + DATASET_NAME + "' not found in " + path);
        }
        return attributes;
    }

    private static final Logger LOG = LoggerFactory.getLogger(N5ImageStore.class);
}
