package org.janelia.registration.checkpoint;

import java.io.IOException;

/**
 * Thrown when a checkpoint record cannot be stored.
 *
 * @author Eric Trautman
 */
public class CheckpointWriteException
        extends IOException {

    public CheckpointWriteException(final CheckpointKey key,
                                    final Throwable cause) {
        super("failed to write checkpoint for " + key, cause);
    }

}
