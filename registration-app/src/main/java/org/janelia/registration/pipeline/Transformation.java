package org.janelia.registration.pipeline;

import org.janelia.registration.checkpoint.Stage;

/**
 * Registration result that can be trimmed and stitched into an output image.
 *
 * @author Eric Trautman
 */
public enum Transformation {

    AFFINE(Stage.AFFINE_TILE, Stage.TRIMMED_AFFINE_TILE),
    DEFORMABLE(Stage.DEFORMABLE_TILE, Stage.TRIMMED_DEFORMABLE_TILE);

    private final Stage registeredStage;
    private final Stage trimmedStage;

    Transformation(final Stage registeredStage,
                   final Stage trimmedStage) {
        this.registeredStage = registeredStage;
        this.trimmedStage = trimmedStage;
    }

    public Stage getRegisteredStage() {
        return registeredStage;
    }

    public Stage getTrimmedStage() {
        return trimmedStage;
    }
}
