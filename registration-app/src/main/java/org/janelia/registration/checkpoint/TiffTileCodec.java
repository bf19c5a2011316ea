package org.janelia.registration.checkpoint;

import ij.ImagePlus;
import ij.io.Opener;
import ij.io.TiffEncoder;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stores 16-bit tiles as uncompressed TIFF using ImageJ's {@link TiffEncoder}.
 *
 * @author Eric Trautman
 */
public class TiffTileCodec
        implements CheckpointCodec<ShortProcessor> {

    @Override
    public void encode(final ShortProcessor payload,
                       final OutputStream outputStream)
            throws IOException {
        final ImagePlus imagePlus = new ImagePlus("tile", payload);
        final TiffEncoder tiffEncoder = new TiffEncoder(imagePlus.getFileInfo());
        tiffEncoder.write(outputStream);
        outputStream.flush();
    }

    @Override
    public ShortProcessor decode(final InputStream inputStream)
            throws IOException {

        final ImagePlus imagePlus = new Opener().openTiff(inputStream, "tile");
        if (imagePlus == null) {
            throw new IOException("failed to decode TIFF tile");
        }

        final ImageProcessor processor = imagePlus.getProcessor();
        final ShortProcessor shortProcessor;
        if (processor instanceof ShortProcessor) {
            shortProcessor = (ShortProcessor) processor;
        } else {
            throw new IOException("expected 16-bit tile but found " + processor.getClass().getSimpleName());
        }

        return shortProcessor;
    }

}
