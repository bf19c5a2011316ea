package org.janelia.registration.stitch;

import java.util.ArrayList;
import java.util.List;

import org.janelia.registration.checkpoint.CheckpointKey;

/**
 * Thrown when trimmed tiles are missing for some grid coordinates or channels.
 *
 * @author Eric Trautman
 */
public class StitchIncompleteException
        extends Exception {

    private final List<CheckpointKey> missingKeys;

    public StitchIncompleteException(final List<CheckpointKey> missingKeys) {
        super(buildMessage(missingKeys));
        this.missingKeys = new ArrayList<>(missingKeys);
    }

    public List<CheckpointKey> getMissingKeys() {
        return missingKeys;
    }

    private static String buildMessage(final List<CheckpointKey> missingKeys) {
        final int maxListed = 20;
        final StringBuilder sb = new StringBuilder();
        sb.append(missingKeys.size()).append(" trimmed tiles are missing: ");
        for (int i = 0; i < missingKeys.size() && i < maxListed; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(missingKeys.get(i));
        }
        if (missingKeys.size() > maxListed) {
            sb.append(", ...");
        }
        return sb.toString();
    }
}
