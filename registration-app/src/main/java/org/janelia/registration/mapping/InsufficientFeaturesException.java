package org.janelia.registration.mapping;

/**
 * Thrown by an {@link AffineEstimator} when the images do not share enough features to derive a mapping.
 *
 * @author Eric Trautman
 */
public class InsufficientFeaturesException
        extends Exception {

    public InsufficientFeaturesException(final String message) {
        super(message);
    }

}
