package org.janelia.registration.checkpoint;

import java.io.IOException;

/**
 * Thrown when a required checkpoint record does not exist.
 *
 * @author Eric Trautman
 */
public class CheckpointNotFoundException
        extends IOException {

    private final CheckpointKey key;

    public CheckpointNotFoundException(final CheckpointKey key) {
        super("missing checkpoint for " + key);
        this.key = key;
    }

    public CheckpointKey getKey() {
        return key;
    }
}
