package org.janelia.registration.grid;

/**
 * Thrown when tiling or pipeline configuration values cannot produce a valid grid.
 * Always detected before any work is dispatched.
 *
 * @author Eric Trautman
 */
public class InvalidConfigurationException
        extends IllegalArgumentException {

    public InvalidConfigurationException(final String message) {
        super(message);
    }

}
