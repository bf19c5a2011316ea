package org.janelia.registration.pipeline;

import ij.process.ShortProcessor;

import org.janelia.registration.grid.TilingParameters;
import org.janelia.registration.mapping.AffineMapping;
import org.janelia.registration.mapping.BilinearAffineApplier;
import org.janelia.registration.mapping.IdentityAffineEstimator;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link OverlapEstimator} and {@link BorderWidths} classes.
 *
 * @author Eric Trautman
 */
public class OverlapEstimatorTest {

    @Test
    public void testBorderWidths() {
        final ShortProcessor tile = new ShortProcessor(10, 8);
        tile.set(2, 1, 5);
        tile.set(6, 4, 5);
        Assert.assertEquals("invalid border widths",
                            "{top: 1, bottom: 3, left: 2, right: 3}",
                            BorderWidths.measure(tile).toString());
    }

    @Test
    public void testEqualBordersUseDefaultOverlap() throws Exception {

        final OverlapEstimator estimator =
                new OverlapEstimator(new IdentityAffineEstimator(), new BilinearAffineApplier(), 0.2);

        final ShortProcessor sample = buildNonZeroSample(60, 60);
        final TilingParameters tiling = estimator.estimate(sample, sample, new TilingParameters(500, 300, 0, 0));

        Assert.assertEquals("invalid overlapX", 50, tiling.getOverlapX());
        Assert.assertEquals("invalid overlapY", 30, tiling.getOverlapY());
        Assert.assertEquals("tile width should be unchanged", 500, tiling.getTileWidth());
    }

    @Test
    public void testShiftedSampleWidensOverlap() throws Exception {

        final OverlapEstimator estimator =
                new OverlapEstimator((reference, moving) -> AffineMapping.translation(3, 0),
                                     new BilinearAffineApplier(),
                                     0.2);

        final ShortProcessor sample = buildNonZeroSample(60, 60);
        final TilingParameters tiling = estimator.estimate(sample, sample, new TilingParameters(500, 300, 0, 0));

        // left border of 3 pixels: 2 * ceil(3 * 1.2)
        Assert.assertEquals("invalid overlapX", 8, tiling.getOverlapX());
        Assert.assertEquals("invalid overlapY", 30, tiling.getOverlapY());
    }

    @Test
    public void testOverlapDependsOnTileSizeNotSampleSize() throws Exception {

        final OverlapEstimator estimator =
                new OverlapEstimator(new IdentityAffineEstimator(), new BilinearAffineApplier(), 0.2);
        final TilingParameters requested = new TilingParameters(512, 512, 0, 0);

        final ShortProcessor smallSample = buildNonZeroSample(40, 40);
        final ShortProcessor largeSample = buildNonZeroSample(400, 300);

        Assert.assertEquals("small sample should use 10% of the tile size",
                            51, estimator.estimate(smallSample, smallSample, requested).getOverlapX());
        Assert.assertEquals("large sample should use 10% of the tile size",
                            51, estimator.estimate(largeSample, largeSample, requested).getOverlapX());
    }

    @Test
    public void testOverlapIsClampedBelowTileSize() {
        final OverlapEstimator estimator =
                new OverlapEstimator(new IdentityAffineEstimator(), new BilinearAffineApplier(), 0.2);
        Assert.assertEquals("overlap should be clamped", 19, estimator.deriveOverlap(0, 40, 20));
    }

    private static ShortProcessor buildNonZeroSample(final int width,
                                                     final int height) {
        final ShortProcessor sample = new ShortProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                sample.set(x, y, 1 + x + y);
            }
        }
        return sample;
    }
}
