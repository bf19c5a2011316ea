package org.janelia.registration.checkpoint;

import java.io.IOException;

/**
 * Durable, write-once map from {@link CheckpointKey} to payload.
 * The presence of a record marks the unit that produced it as complete.
 *
 * @author Eric Trautman
 */
public interface CheckpointStore {

    /**
     * @return true if a complete record exists for the key.
     */
    boolean exists(final CheckpointKey key);

    /**
     * Persists the payload for a key that does not yet have a record.
     * Once this method returns, {@link #get} for the key is stable.
     * A record that already exists is never replaced.
     *
     * @throws CheckpointWriteException
     *   if the payload cannot be stored.
     */
    <T> void put(final CheckpointKey key,
                 final T payload,
                 final CheckpointCodec<T> codec)
            throws CheckpointWriteException;

    /**
     * @throws CheckpointNotFoundException
     *   if no record exists for the key.
     *
     * @throws IOException
     *   if the record cannot be read.
     */
    <T> T get(final CheckpointKey key,
              final CheckpointCodec<T> codec)
            throws CheckpointNotFoundException, IOException;

}
