package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

/**
 * Resamples a tile with a displacement field.
 *
 * @author Eric Trautman
 */
public interface DeformableApplier {

    /**
     * @return warped copy of the image with the same shape as the input.
     */
    ShortProcessor apply(final DisplacementField field,
                         final ShortProcessor image);

}
