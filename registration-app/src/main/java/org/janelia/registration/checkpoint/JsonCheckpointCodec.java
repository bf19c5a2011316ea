package org.janelia.registration.checkpoint;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.janelia.registration.json.JsonUtils;

/**
 * Stores payloads as pretty-printed JSON.
 *
 * @author Eric Trautman
 */
public class JsonCheckpointCodec<T>
        implements CheckpointCodec<T> {

    private final JsonUtils.Helper<T> jsonHelper;

    public JsonCheckpointCodec(final Class<T> payloadClass) {
        this.jsonHelper = new JsonUtils.Helper<>(payloadClass);
    }

    @Override
    public void encode(final T payload,
                       final OutputStream outputStream)
            throws IOException {
        jsonHelper.write(payload, outputStream);
    }

    @Override
    public T decode(final InputStream inputStream)
            throws IOException {
        return jsonHelper.read(inputStream);
    }

}
