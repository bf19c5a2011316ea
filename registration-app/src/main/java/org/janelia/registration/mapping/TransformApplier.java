package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

/**
 * Resamples an image with an affine mapping.
 *
 * @author Eric Trautman
 */
public interface TransformApplier {

    /**
     * @return transformed copy of the image with the same shape as the input.
     */
    ShortProcessor apply(final AffineMapping mapping,
                         final ShortProcessor image);

}
