package org.janelia.registration.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.File;

import org.janelia.registration.checkpoint.CheckpointLayout;

/**
 * Parameters for locating checkpoint directories.
 *
 * @author Eric Trautman
 */
public class CheckpointParameters {

    @Parameter(
            names = "--checkpointDirectory",
            description = "Base directory for all checkpoints",
            required = true)
    public String checkpointDirectory;

    @Parameter(
            names = "--cropsDirectory",
            description = "Directory for reference and moving crops (default is crops below checkpointDirectory)")
    public String cropsDirectory;

    @Parameter(
            names = "--mappingsDirectory",
            description = "Directory for mappings and the grid record (default is mappings below checkpointDirectory)")
    public String mappingsDirectory;

    @Parameter(
            names = "--registeredTilesDirectory",
            description = "Directory for registered tiles (default is registered_tiles below checkpointDirectory)")
    public String registeredTilesDirectory;

    @Parameter(
            names = "--trimmedTilesDirectory",
            description = "Directory for trimmed tiles (default is trimmed_tiles below checkpointDirectory)")
    public String trimmedTilesDirectory;

    public CheckpointLayout buildLayout() {
        final CheckpointLayout defaultLayout = CheckpointLayout.inDirectory(checkpointDirectory);
        return new CheckpointLayout(override(cropsDirectory, defaultLayout.getCropsDirectory()),
                                    override(mappingsDirectory, defaultLayout.getMappingsDirectory()),
                                    override(registeredTilesDirectory, defaultLayout.getRegisteredTilesDirectory()),
                                    override(trimmedTilesDirectory, defaultLayout.getTrimmedTilesDirectory()));
    }

    private static String override(final String directory,
                                   final String defaultDirectory) {
        return directory == null ? defaultDirectory : new File(directory).getAbsolutePath();
    }

}
