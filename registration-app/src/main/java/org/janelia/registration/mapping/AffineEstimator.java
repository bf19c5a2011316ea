package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

/**
 * Derives the global affine mapping between a reference and a moving image.
 *
 * Implementations are created by class name and therefore need a public no-arg constructor.
 *
 * @author Eric Trautman
 */
public interface AffineEstimator {

    /**
     * @return mapping from moving image coordinates to reference image coordinates.
     *
     * @throws InsufficientFeaturesException
     *   if the images do not contain enough matching features.
     */
    AffineMapping compute(final ShortProcessor reference,
                          final ShortProcessor moving)
            throws InsufficientFeaturesException;

}
