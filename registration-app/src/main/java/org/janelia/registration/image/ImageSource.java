package org.janelia.registration.image;

import ij.process.ShortProcessor;

import java.io.IOException;

import org.janelia.registration.grid.ImageShape;
import org.janelia.registration.grid.TileArea;

/**
 * Region-readable multi-channel image container.
 *
 * @author Eric Trautman
 */
public interface ImageSource {

    /**
     * @return shape of the image, read from metadata only.
     */
    ImageShape getShape(final String path)
            throws IOException;

    /**
     * @return exactly the requested rectangle of one channel.
     *         Pixels outside the image (including negative positions) are zero.
     */
    ShortProcessor readRegion(final String path,
                              final TileArea area,
                              final int channel)
            throws IOException;

}
