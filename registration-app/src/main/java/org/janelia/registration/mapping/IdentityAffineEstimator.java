package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default estimator for image pairs that are already aligned.
 *
 * @author Eric Trautman
 */
public class IdentityAffineEstimator
        implements AffineEstimator {

    @Override
    public AffineMapping compute(final ShortProcessor reference,
                                 final ShortProcessor moving) {
        LOG.info("compute: returning identity mapping for {}x{} reference and {}x{} moving images",
                 reference.getWidth(), reference.getHeight(), moving.getWidth(), moving.getHeight());
        return AffineMapping.IDENTITY;
    }

    private static final Logger LOG = LoggerFactory.getLogger(IdentityAffineEstimator.class);
}
