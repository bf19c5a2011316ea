package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

import org.janelia.registration.image.TileImages;

/**
 * Default estimator that treats affine registration as final by returning a zero displacement field.
 *
 * @author Eric Trautman
 */
public class ZeroDisplacementEstimator
        implements DeformableEstimator {

    public static final int DEFAULT_SPACING = 64;

    @Override
    public DeformableMapping compute(final ShortProcessor reference,
                                     final ShortProcessor moving)
            throws IllegalArgumentException {
        if (! TileImages.hasSameShape(reference, moving)) {
            throw new IllegalArgumentException("reference " + TileImages.shapeString(reference) +
                                               " and moving " + TileImages.shapeString(moving) +
                                               " tiles must have the same shape");
        }
        return DeformableMapping.computed(
                DisplacementField.zero(reference.getWidth(), reference.getHeight(), DEFAULT_SPACING));
    }

}
