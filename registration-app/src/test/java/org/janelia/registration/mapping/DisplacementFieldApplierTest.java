package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DisplacementFieldApplier} and {@link ZeroDisplacementEstimator} classes.
 *
 * @author Eric Trautman
 */
public class DisplacementFieldApplierTest {

    @Test
    public void testZeroFieldIsIdentity() {

        final ShortProcessor image = BilinearAffineApplierTest.buildGradient(70, 40);
        final DeformableMapping mapping = new ZeroDisplacementEstimator().compute(image, image);

        Assert.assertTrue("mapping should be computed", mapping.isComputed());

        final ShortProcessor result = new DisplacementFieldApplier().apply(mapping.getField(), image);
        BilinearAffineApplierTest.assertSamePixels(image, result);
    }

    @Test
    public void testConstantDisplacement() {

        final int width = 12;
        final int height = 9;
        final int spacing = 4;
        final DisplacementField zero = DisplacementField.zero(width, height, spacing);
        final int count = zero.getGridWidth() * zero.getGridHeight();
        final float[] dx = new float[count];
        final float[] dy = new float[count];
        Arrays.fill(dx, 1.0f);
        final DisplacementField field = new DisplacementField(width, height, spacing, dx, dy);

        final double[] displacement = field.displacementAt(5.5, 3.25);
        Assert.assertEquals("invalid dx", 1.0, displacement[0], 0.000001);
        Assert.assertEquals("invalid dy", 0.0, displacement[1], 0.000001);

        final ShortProcessor image = BilinearAffineApplierTest.buildGradient(width, height);
        final ShortProcessor result = new DisplacementFieldApplier().apply(field, image);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final int expected = x + 1 < width ? image.get(x + 1, y) : 0;
                Assert.assertEquals("invalid pixel (" + x + ", " + y + ")", expected, result.get(x, y));
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFieldSizeMismatch() {
        new DisplacementFieldApplier().apply(DisplacementField.zero(10, 10, 4),
                                             BilinearAffineApplierTest.buildGradient(11, 10));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEstimatorRejectsShapeMismatch() {
        new ZeroDisplacementEstimator().compute(BilinearAffineApplierTest.buildGradient(10, 10),
                                                BilinearAffineApplierTest.buildGradient(10, 9));
    }

    @Test
    public void testEstimatorsByClassName() {
        Assert.assertTrue("invalid affine estimator",
                          Estimators.newAffineEstimator(IdentityAffineEstimator.class.getName())
                                  instanceof IdentityAffineEstimator);
        Assert.assertTrue("invalid deformable estimator",
                          Estimators.newDeformableEstimator(ZeroDisplacementEstimator.class.getName())
                                  instanceof ZeroDisplacementEstimator);
        try {
            Estimators.newAffineEstimator(ZeroDisplacementEstimator.class.getName());
            Assert.fail("class with wrong interface should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name interface", e.getMessage().contains("AffineEstimator"));
        }
        try {
            Estimators.newAffineEstimator("org.example.MissingEstimator");
            Assert.fail("missing class should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name class", e.getMessage().contains("MissingEstimator"));
        }
    }
}
