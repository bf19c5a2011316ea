package org.janelia.registration.checkpoint;

/**
 * Pipeline stages that persist checkpoints, with the key granularity and payload format of each.
 *
 * @author Eric Trautman
 */
public enum Stage {

    AFFINE_MAPPING(CheckpointLayout.Role.MAPPINGS, false, false, "json"),
    REFERENCE_CROP(CheckpointLayout.Role.CROPS, true, true, "tif"),
    MOVING_CROP(CheckpointLayout.Role.CROPS, true, true, "tif"),
    AFFINE_TILE(CheckpointLayout.Role.REGISTERED_TILES, true, true, "tif"),
    DEFORMABLE_MAPPING(CheckpointLayout.Role.MAPPINGS, true, false, "json"),
    DEFORMABLE_TILE(CheckpointLayout.Role.REGISTERED_TILES, true, true, "tif"),
    TRIMMED_AFFINE_TILE(CheckpointLayout.Role.TRIMMED_TILES, true, true, "tif"),
    TRIMMED_DEFORMABLE_TILE(CheckpointLayout.Role.TRIMMED_TILES, true, true, "tif");

    private final CheckpointLayout.Role role;
    private final boolean perTile;
    private final boolean perChannel;
    private final String fileExtension;

    Stage(final CheckpointLayout.Role role,
          final boolean perTile,
          final boolean perChannel,
          final String fileExtension) {
        this.role = role;
        this.perTile = perTile;
        this.perChannel = perChannel;
        this.fileExtension = fileExtension;
    }

    public CheckpointLayout.Role getRole() {
        return role;
    }

    /**
     * @return true if keys for this stage identify a tile coordinate.
     */
    public boolean isPerTile() {
        return perTile;
    }

    /**
     * @return true if keys for this stage identify a channel.
     */
    public boolean isPerChannel() {
        return perChannel;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public String getDirectoryName() {
        return name().toLowerCase().replace('_', '-');
    }
}
