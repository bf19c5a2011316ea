package org.janelia.registration.client;

import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.util.Collections;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.janelia.registration.client.parameter.PipelineParameters;
import org.janelia.registration.grid.TileGrid;
import org.janelia.registration.mapping.InsufficientFeaturesException;
import org.janelia.registration.pipeline.PipelineController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for planning the tile grid and estimating the global affine mapping.
 * This is the first stage of a registration and records the grid that later stages verify.
 *
 * @author Eric Trautman
 */
public class AffineEstimationClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public PipelineParameters pipeline = new PipelineParameters();
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);
                parameters.pipeline.execution.setupLogFile("affine_estimation");

                LOG.info("runClient: entry, parameters={}", parameters);

                final AffineEstimationClient client = new AffineEstimationClient(parameters);
                client.estimateAffine();
            }
        };
        clientRunner.run();
    }

    private final PipelineController controller;

    public AffineEstimationClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.controller = parameters.pipeline.buildController();
    }

    /**
     * @return the planned grid.
     *
     * @throws InsufficientFeaturesException
     *   if the images do not share enough features for an affine estimate.
     */
    public TileGrid estimateAffine()
            throws InsufficientFeaturesException, IOException, InterruptedException, IllegalStateException {

        final TileGrid grid = controller.planGrid();

        LOG.info("estimateAffine: planned {} with tiling {}", grid, grid.getTilingParameters());

        StageResults.verify(Collections.singletonList(controller.estimateAffine()));

        return grid;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AffineEstimationClient.class);
}
