package org.janelia.registration.mapping;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Estimators} class.
 *
 * @author Eric Trautman
 */
public class EstimatorsTest {

    @Test
    public void testNewEstimators() {
        Assert.assertTrue("invalid affine estimator type",
                          Estimators.newAffineEstimator(IdentityAffineEstimator.class.getName())
                                  instanceof IdentityAffineEstimator);
        Assert.assertTrue("invalid deformable estimator type",
                          Estimators.newDeformableEstimator(ZeroDisplacementEstimator.class.getName())
                                  instanceof ZeroDisplacementEstimator);
    }

    @Test
    public void testInvalidClassNames() {
        validateFailure("org.janelia.registration.mapping.MissingEstimator", "cannot be found");
        validateFailure(ZeroDisplacementEstimator.class.getName(), "does not implement");
        validateFailure(null, "no AffineEstimator class name defined");
    }

    private void validateFailure(final String className,
                                 final String expectedMessageFragment) {
        try {
            Estimators.newAffineEstimator(className);
            Assert.fail("creation of '" + className + "' should have failed");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message '" + e.getMessage() + "' should contain '" + expectedMessageFragment + "'",
                              e.getMessage().contains(expectedMessageFragment));
        }
    }

}
