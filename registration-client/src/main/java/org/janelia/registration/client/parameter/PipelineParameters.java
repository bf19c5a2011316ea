package org.janelia.registration.client.parameter;

import com.beust.jcommander.ParametersDelegate;

import org.janelia.registration.pipeline.PipelineConfiguration;
import org.janelia.registration.pipeline.PipelineController;

/**
 * Parameters shared by every registration stage client.
 *
 * @author Eric Trautman
 */
public class PipelineParameters {

    @ParametersDelegate
    public ImagePairParameters images = new ImagePairParameters();

    @ParametersDelegate
    public CheckpointParameters checkpoint = new CheckpointParameters();

    @ParametersDelegate
    public TileGridParameters tileGrid = new TileGridParameters();

    @ParametersDelegate
    public ExecutionParameters execution = new ExecutionParameters();

    public PipelineConfiguration buildConfiguration() {
        final PipelineConfiguration configuration =
                new PipelineConfiguration(images.referenceImage, images.movingImage, checkpoint.buildLayout())
                        .withRegistrationChannel(images.registrationChannel)
                        .withTileSize(tileGrid.tileWidth, tileGrid.tileHeight)
                        .withOverlaps(tileGrid.overlapX, tileGrid.overlapY)
                        .withCropMargin(tileGrid.cropMargin)
                        .withAffineEstimationRegionSize(tileGrid.affineEstimationRegionSize)
                        .withOverlapEstimation(tileGrid.overlapEstimationSize, tileGrid.overlapFactor)
                        .withMaxConcurrency(execution.maxWorkers);
        if (execution.affineEstimatorClass != null) {
            configuration.withAffineEstimatorClass(execution.affineEstimatorClass);
        }
        if (execution.deformableEstimatorClass != null) {
            configuration.withDeformableEstimatorClass(execution.deformableEstimatorClass);
        }
        return configuration;
    }

    public PipelineController buildController() {
        return PipelineController.build(buildConfiguration());
    }

}
