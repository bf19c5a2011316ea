package org.janelia.registration.executor;

import org.janelia.registration.checkpoint.CheckpointKey;

/**
 * Computes and stores the checkpoint for one key of a stage.
 *
 * @author Eric Trautman
 */
@FunctionalInterface
public interface UnitOfWork {

    /**
     * Reads the unit's inputs, computes its result, and writes the checkpoint for the key.
     *
     * @throws Exception
     *   if the unit fails for any reason.  The failure only affects this key.
     */
    void process(final CheckpointKey key)
            throws Exception;

}
