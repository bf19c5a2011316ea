package org.janelia.registration.client;

import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.janelia.registration.client.parameter.PipelineParameters;
import org.janelia.registration.mapping.InsufficientFeaturesException;
import org.janelia.registration.pipeline.PipelineController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for extracting reference and moving crops for every tile of the grid.
 *
 * @author Eric Trautman
 */
public class CropExtractionClient {

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
                parameters.pipeline.execution.setupLogFile("crop_extraction");

                LOG.info("runClient: entry, parameters={}", parameters);

                final CropExtractionClient client = new CropExtractionClient(parameters);
                client.extractCrops();
            }
        };
        clientRunner.run();
    }

    private final PipelineController controller;

    public CropExtractionClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.controller = parameters.pipeline.buildController();
    }

    public void extractCrops()
            throws InsufficientFeaturesException, IOException, InterruptedException, IllegalStateException {
        StageResults.verify(controller.extractCrops());
    }

    private static final Logger LOG = LoggerFactory.getLogger(CropExtractionClient.class);
}
