package org.janelia.registration.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.janelia.registration.client.parameter.PipelineParameters;
import org.janelia.registration.mapping.InsufficientFeaturesException;
import org.janelia.registration.pipeline.PipelineConfiguration;
import org.janelia.registration.pipeline.PipelineController;
import org.janelia.registration.pipeline.Transformation;
import org.janelia.registration.stitch.StitchIncompleteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for trimming the registered tiles of one transformation and
 * stitching them into an output image.
 *
 * @author Eric Trautman
 */
public class ExportImageClient {

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
                description = "Registered tiles to export")
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
                parameters.pipeline.execution.setupLogFile("export_image");

                LOG.info("runClient: entry, parameters={}", parameters);

                final ExportImageClient client = new ExportImageClient(parameters);
                client.exportImage();
            }
        };
        clientRunner.run();
    }

    private final PipelineController controller;

    public ExportImageClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.controller = PipelineController.build(parameters.buildConfiguration());
    }

    /**
     * @throws StitchIncompleteException
     *   if any registered tile could not be trimmed.
     */
    public void exportImage()
            throws StitchIncompleteException, InsufficientFeaturesException, IOException, InterruptedException {

        final PipelineConfiguration configuration = controller.getConfiguration();
        final Transformation transformation = configuration.getTransformation();

        // missing trimmed tiles are reported by the stitcher
        StageResults.logFailures(controller.trimOverlaps(transformation));

        controller.stitch(transformation);

        LOG.info("exportImage: wrote {} tiles to {}", transformation, configuration.getOutputImage());
    }

    private static final Logger LOG = LoggerFactory.getLogger(ExportImageClient.class);
}
