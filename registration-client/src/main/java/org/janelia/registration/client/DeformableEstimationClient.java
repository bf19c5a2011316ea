package org.janelia.registration.client;

import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.util.Collections;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.janelia.registration.client.parameter.PipelineParameters;
import org.janelia.registration.mapping.InsufficientFeaturesException;
import org.janelia.registration.pipeline.PipelineController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for estimating a deformable mapping for every tile.
 *
 * @author Eric Trautman
 */
public class DeformableEstimationClient {

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
                parameters.pipeline.execution.setupLogFile("deformable_estimation");

                LOG.info("runClient: entry, parameters={}", parameters);

                final DeformableEstimationClient client = new DeformableEstimationClient(parameters);
                client.estimateDeformable();
            }
        };
        clientRunner.run();
    }

    private final PipelineController controller;

    public DeformableEstimationClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.controller = parameters.pipeline.buildController();
    }

    public void estimateDeformable()
            throws InsufficientFeaturesException, IOException, InterruptedException, IllegalStateException {
        StageResults.verify(Collections.singletonList(controller.estimateDeformable()));
    }

    private static final Logger LOG = LoggerFactory.getLogger(DeformableEstimationClient.class);
}
