package org.janelia.registration.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.util.List;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.janelia.registration.client.parameter.PipelineParameters;
import org.janelia.registration.executor.StageReport;
import org.janelia.registration.mapping.InsufficientFeaturesException;
import org.janelia.registration.pipeline.PipelineConfiguration;
import org.janelia.registration.pipeline.PipelineController;
import org.janelia.registration.pipeline.Transformation;
import org.janelia.registration.stitch.StitchIncompleteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for running every registration stage in one process.
 * Stages whose checkpoints already exist are skipped, so an interrupted run can simply be restarted.
 *
 * @author Eric Trautman
 */
public class RegistrationPipelineClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public PipelineParameters pipeline = new PipelineParameters();

        @Parameter(
                names = "--outputImage",
                description = "N5 container path for the stitched image",
                required = true)
        public String outputImage;

        @Parameter(
                names = "--transformation",
                description = "Registered tiles to stitch")
        public Transformation transformation = Transformation.DEFORMABLE;

        public PipelineConfiguration buildConfiguration() {
            return pipeline.buildConfiguration()
                    .withOutputImage(outputImage)
                    .withTransformation(transformation);
        }
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
                parameters.pipeline.execution.setupLogFile("registration");

                LOG.info("runClient: entry, parameters={}", parameters);

                final RegistrationPipelineClient client = new RegistrationPipelineClient(parameters);
                client.run();
            }
        };
        clientRunner.run();
    }

    private final PipelineController controller;

    public RegistrationPipelineClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.controller = PipelineController.build(parameters.buildConfiguration());
        Runtime.getRuntime().addShutdownHook(new Thread(controller::cancel));
    }

    public List<StageReport> run()
            throws StitchIncompleteException, InsufficientFeaturesException, IOException, InterruptedException {
        final List<StageReport> reports = controller.run();
        StageResults.verify(reports);
        return reports;
    }

    private static final Logger LOG = LoggerFactory.getLogger(RegistrationPipelineClient.class);
}
