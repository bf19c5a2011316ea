package org.janelia.registration.checkpoint;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Serializes checkpoint payloads of one type.
 *
 * @param <T> payload type.
 *
 * @author Eric Trautman
 */
public interface CheckpointCodec<T> {

    void encode(final T payload,
                final OutputStream outputStream)
            throws IOException;

    T decode(final InputStream inputStream)
            throws IOException;

}
