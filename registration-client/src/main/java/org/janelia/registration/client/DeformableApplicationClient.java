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
 * Java client for applying each tile's deformable mapping to its affine registered tile.
 *
 * @author Eric Trautman
 */
public class DeformableApplicationClient {

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
                parameters.pipeline.execution.setupLogFile("deformable_application");

                LOG.info("runClient: entry, parameters={}", parameters);

                final DeformableApplicationClient client = new DeformableApplicationClient(parameters);
                client.applyDeformable();
            }
        };
        clientRunner.run();
    }

    private final PipelineController controller;

    public DeformableApplicationClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.controller = parameters.pipeline.buildController();
    }

    public void applyDeformable()
            throws InsufficientFeaturesException, IOException, InterruptedException, IllegalStateException {
        StageResults.verify(Collections.singletonList(controller.applyDeformable()));
    }

    private static final Logger LOG = LoggerFactory.getLogger(DeformableApplicationClient.class);
}
