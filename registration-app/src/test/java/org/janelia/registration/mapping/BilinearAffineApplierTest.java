package org.janelia.registration.mapping;

import ij.process.ShortProcessor;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link BilinearAffineApplier} class.
 *
 * @author Eric Trautman
 */
public class BilinearAffineApplierTest {

    @Test
    public void testIdentity() {
        final ShortProcessor image = buildGradient(9, 6);
        final ShortProcessor result = new BilinearAffineApplier().apply(AffineMapping.IDENTITY, image);
        assertSamePixels(image, result);
    }

    @Test
    public void testIntegerTranslation() {

        final ShortProcessor image = buildGradient(10, 8);
        // moving content shifts 2 pixels right and 1 pixel down in the reference frame
        final ShortProcessor result = new BilinearAffineApplier().apply(AffineMapping.translation(2, 1), image);

        Assert.assertEquals("invalid width", image.getWidth(), result.getWidth());
        Assert.assertEquals("invalid height", image.getHeight(), result.getHeight());

        for (int y = 0; y < result.getHeight(); y++) {
            for (int x = 0; x < result.getWidth(); x++) {
                final int expected = ((x < 2) || (y < 1)) ? 0 : image.get(x - 2, y - 1);
                Assert.assertEquals("invalid pixel (" + x + ", " + y + ")", expected, result.get(x, y));
            }
        }
    }

    @Test
    public void testHalfPixelTranslationInterpolates() {

        final ShortProcessor image = new ShortProcessor(3, 1);
        image.set(0, 0, 100);
        image.set(1, 0, 200);
        image.set(2, 0, 300);

        final ShortProcessor result = new BilinearAffineApplier().apply(AffineMapping.translation(-0.5, 0), image);
        Assert.assertEquals("invalid interpolated value", 150, result.get(0, 0));
        Assert.assertEquals("invalid interpolated value", 250, result.get(1, 0));
    }

    @Test
    public void testScaledValuesAreClamped() {

        final ShortProcessor image = new ShortProcessor(4, 4);
        image.setValue(65535);
        image.fill();
        image.set(1, 1, 0);

        // two times magnification about the origin
        final ShortProcessor result =
                new BilinearAffineApplier().apply(new AffineMapping(2, 0, 0, 0, 2, 0), image);

        Assert.assertEquals("saturated pixel should stay saturated", 65535, result.get(0, 0));
        Assert.assertEquals("dark pixel should move to scaled location", 0, result.get(2, 2));
        Assert.assertEquals("interpolated pixel should be rounded", 32768, result.get(1, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonInvertibleMapping() {
        new BilinearAffineApplier().apply(new AffineMapping(0, 0, 0, 0, 0, 0), buildGradient(3, 3));
    }

    static ShortProcessor buildGradient(final int width,
                                        final int height) {
        final ShortProcessor image = new ShortProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.set(x, y, 1000 + (y * 100) + x);
            }
        }
        return image;
    }

    static void assertSamePixels(final ShortProcessor expected,
                                 final ShortProcessor actual) {
        Assert.assertEquals("invalid width", expected.getWidth(), actual.getWidth());
        Assert.assertEquals("invalid height", expected.getHeight(), actual.getHeight());
        for (int y = 0; y < expected.getHeight(); y++) {
            for (int x = 0; x < expected.getWidth(); x++) {
                Assert.assertEquals("invalid pixel (" + x + ", " + y + ")", expected.get(x, y), actual.get(x, y));
            }
        }
    }
}
