package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

/**
 * Derives a per-tile displacement field that refines an affine registered tile against its reference tile.
 *
 * Implementations are created by class name and therefore need a public no-arg constructor.
 *
 * @author Eric Trautman
 */
public interface DeformableEstimator {

    /**
     * @param  reference  reference tile.
     * @param  moving     affine registered moving tile with the same shape as the reference tile.
     *
     * @return computed or degenerate mapping.
     *
     * @throws IllegalArgumentException
     *   if the tiles have different shapes.
     */
    DeformableMapping compute(final ShortProcessor reference,
                              final ShortProcessor moving)
            throws IllegalArgumentException;

}
