package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;

import org.janelia.registration.image.TileImages;

/**
 * Inverse maps every target pixel into the source image and samples it with bilinear interpolation.
 * Target pixels whose source location lies outside the image are zero.
 * Values are rounded and clamped to the 16-bit range by {@link ShortProcessor#putPixelValue}.
 *
 * @author Eric Trautman
 */
public class BilinearAffineApplier
        implements TransformApplier {

    @Override
    public ShortProcessor apply(final AffineMapping mapping,
                                final ShortProcessor image)
            throws IllegalArgumentException {

        final AffineTransform inverse;
        try {
            inverse = mapping.createTransform().createInverse();
        } catch (final NoninvertibleTransformException e) {
            throw new IllegalArgumentException("mapping " + mapping + " cannot be inverted", e);
        }

        final int width = image.getWidth();
        final int height = image.getHeight();
        final ShortProcessor result = new ShortProcessor(width, height);

        final Point2D.Double target = new Point2D.Double();
        final Point2D.Double source = new Point2D.Double();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                target.setLocation(x, y);
                inverse.transform(target, source);
                result.putPixelValue(x, y, TileImages.interpolatedValue(image, source.x, source.y));
            }
        }

        return result;
    }

}
