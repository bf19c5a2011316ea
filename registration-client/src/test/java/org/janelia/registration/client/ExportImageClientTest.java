package org.janelia.registration.client;

import ij.ImageStack;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.janelia.registration.image.N5ImageStore;
import org.janelia.registration.stitch.StitchIncompleteException;
import org.janelia.registration.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link ExportImageClient} class along with the stage clients that produce its inputs.
 *
 * @author Eric Trautman
 */
public class ExportImageClientTest {

    private File testDirectory;
    private List<String> pipelineArgs;
    private ImageStack moving;

    @Before
    public void setup() throws Exception {

        testDirectory = RegistrationPipelineClientTest.createTestDirectory("test_export_image");

        final N5ImageStore imageStore = new N5ImageStore(16);
        final String referencePath = new File(testDirectory, "reference.n5").getAbsolutePath();
        final String movingPath = new File(testDirectory, "moving.n5").getAbsolutePath();
        imageStore.write(referencePath, RegistrationPipelineClientTest.buildStack(64, 48, 1));
        moving = RegistrationPipelineClientTest.buildStack(64, 44, 1);
        imageStore.write(movingPath, moving);

        pipelineArgs = Arrays.asList(
                "--referenceImage", referencePath,
                "--movingImage", movingPath,
                "--checkpointDirectory", new File(testDirectory, "checkpoints").getAbsolutePath(),
                "--trimmedTilesDirectory", new File(testDirectory, "trimmed").getAbsolutePath(),
                "--tileWidth", "24",
                "--tileHeight", "20",
                "--overlapX", "4",
                "--overlapY", "4",
                "--maxWorkers", "2");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new ExportImageClient.Parameters());
    }

    @Test
    public void testStageByStageExport() throws Exception {

        final AffineEstimationClient.Parameters affineEstimationParameters = new AffineEstimationClient.Parameters();
        affineEstimationParameters.parse(buildArgs(), AffineEstimationClient.class, false);
        new AffineEstimationClient(affineEstimationParameters).estimateAffine();

        final CropExtractionClient.Parameters cropParameters = new CropExtractionClient.Parameters();
        cropParameters.parse(buildArgs(), CropExtractionClient.class, false);
        new CropExtractionClient(cropParameters).extractCrops();

        final AffineApplicationClient.Parameters affineApplicationParameters = new AffineApplicationClient.Parameters();
        affineApplicationParameters.parse(buildArgs(), AffineApplicationClient.class, false);
        new AffineApplicationClient(affineApplicationParameters).applyAffine();

        final String deformableOutputPath = new File(testDirectory, "deformable.n5").getAbsolutePath();
        try {
            exportImage(deformableOutputPath, "DEFORMABLE");
            Assert.fail("deformable export should fail before deformable tiles exist");
        } catch (final StitchIncompleteException e) {
            Assert.assertFalse("missing keys should be listed", e.getMissingKeys().isEmpty());
        }

        final String affineOutputPath = new File(testDirectory, "affine.n5").getAbsolutePath();
        exportImage(affineOutputPath, "AFFINE");
        RegistrationPipelineClientTest.assertMatchesPaddedImage(affineOutputPath, moving, 64, 48);

        final DeformableEstimationClient.Parameters deformableEstimationParameters =
                new DeformableEstimationClient.Parameters();
        deformableEstimationParameters.parse(buildArgs(), DeformableEstimationClient.class, false);
        new DeformableEstimationClient(deformableEstimationParameters).estimateDeformable();

        final DeformableApplicationClient.Parameters deformableApplicationParameters =
                new DeformableApplicationClient.Parameters();
        deformableApplicationParameters.parse(buildArgs(), DeformableApplicationClient.class, false);
        new DeformableApplicationClient(deformableApplicationParameters).applyDeformable();

        exportImage(deformableOutputPath, "DEFORMABLE");
        RegistrationPipelineClientTest.assertMatchesPaddedImage(deformableOutputPath, moving, 64, 48);

        Assert.assertTrue("trimmed tiles should be written to overridden directory",
                          new File(testDirectory, "trimmed").isDirectory());
    }

    private String[] buildArgs(final String... additionalArgs) {
        final List<String> args = new ArrayList<>(pipelineArgs);
        args.addAll(Arrays.asList(additionalArgs));
        return args.toArray(new String[0]);
    }

    private void exportImage(final String outputPath,
                             final String transformation)
            throws Exception {
        final ExportImageClient.Parameters parameters = new ExportImageClient.Parameters();
        parameters.parse(buildArgs("--outputImage", outputPath, "--transformation", transformation),
                         ExportImageClient.class,
                         false);
        new ExportImageClient(parameters).exportImage();
    }
}
