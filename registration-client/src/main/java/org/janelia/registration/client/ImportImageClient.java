package org.janelia.registration.client;

import com.beust.jcommander.Parameter;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.Opener;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import java.io.File;
import java.io.IOException;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.janelia.registration.grid.ImageShape;
import org.janelia.registration.image.N5ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for converting a TIFF image into the N5 container read by the registration stages.
 * Each TIFF slice becomes one channel.  Slices that are not 16-bit are converted without scaling.
 *
 * @author Eric Trautman
 */
public class ImportImageClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--tiffPath",
                description = "Path of the TIFF image to import",
                required = true)
        public String tiffPath;

        @Parameter(
                names = "--n5Path",
                description = "Path of the N5 container to create",
                required = true)
        public String n5Path;

        @Parameter(
                names = "--blockSize",
                description = "Width and height of N5 blocks")
        public int blockSize = N5ImageStore.DEFAULT_BLOCK_SIZE;
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final ImportImageClient client = new ImportImageClient(parameters);
                client.importImage();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public ImportImageClient(final Parameters parameters)
            throws IllegalArgumentException {
        if (parameters.blockSize < 1) {
            throw new IllegalArgumentException("blockSize " + parameters.blockSize + " must be positive");
        }
        this.parameters = parameters;
    }

    /**
     * @return shape of the imported image.
     *
     * @throws IOException
     *   if the TIFF cannot be read or the container cannot be written.
     */
    public ImageShape importImage()
            throws IOException {

        final File tiffFile = new File(parameters.tiffPath).getAbsoluteFile();
        if (! tiffFile.canRead()) {
            throw new IOException("cannot read " + tiffFile);
        }

        final ImagePlus imagePlus = new Opener().openImage(tiffFile.getAbsolutePath());
        if (imagePlus == null) {
            throw new IOException("failed to open " + tiffFile + " as an image");
        }

        final ImageStack slices = imagePlus.getStack();
        final ImageStack channels = new ImageStack(slices.getWidth(), slices.getHeight());
        for (int slice = 1; slice <= slices.getSize(); slice++) {
            final ImageProcessor processor = slices.getProcessor(slice);
            final ShortProcessor channel;
            if (processor instanceof ShortProcessor) {
                channel = (ShortProcessor) processor;
            } else {
                channel = processor.convertToShortProcessor(false);
            }
            channels.addSlice("channel-" + (slice - 1), channel);
        }

        final ImageShape shape = new ImageShape(channels.getHeight(), channels.getWidth(), channels.getSize());

        LOG.info("importImage: read {} from {}", shape, tiffFile);

        new N5ImageStore(parameters.blockSize).write(parameters.n5Path, channels);

        return shape;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImportImageClient.class);
}
