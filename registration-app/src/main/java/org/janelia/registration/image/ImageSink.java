package org.janelia.registration.image;

import ij.ImageStack;
import ij.process.ShortProcessor;

import java.io.IOException;

import org.janelia.registration.grid.ImageShape;

/**
 * Persists multi-channel 16-bit images.
 *
 * Large images are written region by region after {@link #create} so that
 * the complete image never needs to be held in memory.
 *
 * @author Eric Trautman
 */
public interface ImageSink {

    /**
     * Creates (or replaces) an all-zero image with the specified shape.
     */
    void create(final String path,
                final ImageShape shape)
            throws IOException;

    /**
     * Copies a region into one channel of a previously created image.
     *
     * @param  path      location of the image.
     * @param  x         column of the region's top-left pixel.
     * @param  y         row of the region's top-left pixel.
     * @param  channel   channel to write.
     * @param  region    pixels to write (must lie inside the image).
     */
    void writeRegion(final String path,
                     final int x,
                     final int y,
                     final int channel,
                     final ShortProcessor region)
            throws IOException;

    /**
     * @param  path      location of the image.
     * @param  channels  one 16-bit slice per channel.
     */
    default void write(final String path,
                       final ImageStack channels)
            throws IOException {
        create(path, new ImageShape(channels.getHeight(), channels.getWidth(), channels.getSize()));
        for (int channel = 0; channel < channels.getSize(); channel++) {
            // ImageStack slices are 1-based
            final ShortProcessor slice = channels.getProcessor(channel + 1).convertToShortProcessor(false);
            writeRegion(path, 0, 0, channel, slice);
        }
    }

}
