package org.janelia.registration.client.parameter;

import java.io.File;

import org.janelia.registration.checkpoint.CheckpointLayout;
import org.janelia.registration.client.AffineEstimationClient;
import org.janelia.registration.grid.TilingParameters;
import org.janelia.registration.pipeline.PipelineConfiguration;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link PipelineParameters} class.
 *
 * @author Eric Trautman
 */
public class PipelineParametersTest {

    @Test
    public void testBuildConfiguration() {

        final AffineEstimationClient.Parameters parameters = new AffineEstimationClient.Parameters();
        parameters.parse(new String[] {
                "--referenceImage", "/data/reference.n5",
                "--movingImage", "/data/moving.n5",
                "--registrationChannel", "1",
                "--checkpointDirectory", "/scratch/run",
                "--mappingsDirectory", "/nrs/mappings",
                "--tileWidth", "512",
                "--tileHeight", "256",
                "--overlapX", "32",
                "--overlapY", "16",
                "--cropMargin", "8",
                "--maxWorkers", "6"
        }, AffineEstimationClient.class, false);

        final PipelineConfiguration configuration = parameters.pipeline.buildConfiguration();
        configuration.validate();

        Assert.assertEquals("invalid registration channel", 1, configuration.getRegistrationChannel());
        Assert.assertEquals("invalid tiling",
                            new TilingParameters(512, 256, 32, 16).toString(),
                            configuration.getTilingParameters().toString());
        Assert.assertEquals("invalid crop margin", 8, configuration.getCropMargin());
        Assert.assertEquals("invalid max concurrency", 6, configuration.getMaxConcurrency());

        final CheckpointLayout layout = configuration.getCheckpointLayout();
        Assert.assertEquals("invalid crops directory",
                            new File("/scratch/run/crops").getAbsolutePath(), layout.getCropsDirectory());
        Assert.assertEquals("mappings directory should be overridden",
                            new File("/nrs/mappings").getAbsolutePath(), layout.getMappingsDirectory());
        Assert.assertEquals("invalid trimmed tiles directory",
                            new File("/scratch/run/trimmed_tiles").getAbsolutePath(),
                            layout.getTrimmedTilesDirectory());
    }

    @Test
    public void testOmittedOverlapsAreEstimated() {

        final AffineEstimationClient.Parameters parameters = new AffineEstimationClient.Parameters();
        parameters.parse(new String[] {
                "--referenceImage", "/data/reference.n5",
                "--movingImage", "/data/moving.n5",
                "--checkpointDirectory", "/scratch/run",
                "--affineEstimatorClass", "org.janelia.registration.mapping.IdentityAffineEstimator"
        }, AffineEstimationClient.class, false);

        final PipelineConfiguration configuration = parameters.pipeline.buildConfiguration();

        Assert.assertFalse("overlaps should be estimated", configuration.hasOverlaps());
        Assert.assertEquals("invalid default tile width", 2000, configuration.getTileWidth());
        Assert.assertEquals("invalid affine estimator class",
                            "org.janelia.registration.mapping.IdentityAffineEstimator",
                            configuration.getAffineEstimatorClass());
    }

}
