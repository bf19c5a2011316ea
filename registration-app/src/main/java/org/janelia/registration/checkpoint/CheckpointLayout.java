package org.janelia.registration.checkpoint;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Names the directory used for each checkpoint role.
 * Every stage writes to its own sub-directory below its role's directory.
 *
 * @author Eric Trautman
 */
public class CheckpointLayout {

    public enum Role {
        CROPS, MAPPINGS, REGISTERED_TILES, TRIMMED_TILES
    }

    private final String cropsDirectory;
    private final String mappingsDirectory;
    private final String registeredTilesDirectory;
    private final String trimmedTilesDirectory;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private CheckpointLayout() {
        this(null, null, null, null);
    }

    public CheckpointLayout(final String cropsDirectory,
                            final String mappingsDirectory,
                            final String registeredTilesDirectory,
                            final String trimmedTilesDirectory) {
        this.cropsDirectory = cropsDirectory;
        this.mappingsDirectory = mappingsDirectory;
        this.registeredTilesDirectory = registeredTilesDirectory;
        this.trimmedTilesDirectory = trimmedTilesDirectory;
    }

    /**
     * @return layout with all role directories placed below the specified checkpoint directory.
     */
    public static CheckpointLayout inDirectory(final String checkpointDirectory) {
        return new CheckpointLayout(new File(checkpointDirectory, "crops").getAbsolutePath(),
                                    new File(checkpointDirectory, "mappings").getAbsolutePath(),
                                    new File(checkpointDirectory, "registered_tiles").getAbsolutePath(),
                                    new File(checkpointDirectory, "trimmed_tiles").getAbsolutePath());
    }

    public String getCropsDirectory() {
        return cropsDirectory;
    }

    public String getMappingsDirectory() {
        return mappingsDirectory;
    }

    public String getRegisteredTilesDirectory() {
        return registeredTilesDirectory;
    }

    public String getTrimmedTilesDirectory() {
        return trimmedTilesDirectory;
    }

    public Path getRoleDirectory(final Role role) {
        final String directory;
        switch (role) {
            case CROPS:
                directory = cropsDirectory;
                break;
            case MAPPINGS:
                directory = mappingsDirectory;
                break;
            case REGISTERED_TILES:
                directory = registeredTilesDirectory;
                break;
            default:
                directory = trimmedTilesDirectory;
                break;
        }
        if (directory == null) {
            throw new IllegalStateException(role + " directory is not defined");
        }
        return Paths.get(directory).toAbsolutePath();
    }

    public Path getStageDirectory(final Stage stage) {
        return getRoleDirectory(stage.getRole()).resolve(stage.getDirectoryName());
    }

    @Override
    public String toString() {
        return "{cropsDirectory: '" + cropsDirectory +
               "', mappingsDirectory: '" + mappingsDirectory +
               "', registeredTilesDirectory: '" + registeredTilesDirectory +
               "', trimmedTilesDirectory: '" + trimmedTilesDirectory + "'}";
    }
}
