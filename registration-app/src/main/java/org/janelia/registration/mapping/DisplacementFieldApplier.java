package org.janelia.registration.mapping;

import ij.process.FloatProcessor;
import ij.process.ShortProcessor;

import org.janelia.registration.image.TileImages;

/**
 * Samples each target pixel at its displaced source location with bilinear interpolation.
 *
 * @author Eric Trautman
 */
public class DisplacementFieldApplier
        implements DeformableApplier {

    @Override
    public ShortProcessor apply(final DisplacementField field,
                                final ShortProcessor image)
            throws IllegalArgumentException {

        final int width = image.getWidth();
        final int height = image.getHeight();

        if ((field.getWidth() != width) || (field.getHeight() != height)) {
            throw new IllegalArgumentException(
                    "field size " + field.getWidth() + "x" + field.getHeight() +
                    " differs from image size " + width + "x" + height);
        }

        final FloatProcessor dxGrid = field.createDxGrid();
        final FloatProcessor dyGrid = field.createDyGrid();

        final ShortProcessor result = new ShortProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final double[] d = field.displacementAt(dxGrid, dyGrid, x, y);
                result.putPixelValue(x, y, TileImages.interpolatedValue(image, x + d[0], y + d[1]));
            }
        }

        return result;
    }

}
