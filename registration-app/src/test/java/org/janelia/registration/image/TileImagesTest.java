package org.janelia.registration.image;

import ij.process.ShortProcessor;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TileImages} class.
 *
 * @author Eric Trautman
 */
public class TileImagesTest {

    @Test
    public void testIsUniform() {
        final ShortProcessor tile = new ShortProcessor(5, 4);
        tile.setValue(42);
        tile.fill();
        Assert.assertTrue("filled tile should be uniform", TileImages.isUniform(tile));

        tile.set(4, 3, 43);
        Assert.assertFalse("tile with one different pixel should not be uniform", TileImages.isUniform(tile));
    }

    @Test
    public void testCrop() {
        final ShortProcessor tile = new ShortProcessor(6, 5);
        for (int y = 0; y < 5; y++) {
            for (int x = 0; x < 6; x++) {
                tile.set(x, y, (y * 10) + x);
            }
        }

        final ShortProcessor cropped = TileImages.crop(tile, 2, 1, 3, 2);
        Assert.assertEquals("invalid shape", "2x3", TileImages.shapeString(cropped));
        Assert.assertEquals("invalid first pixel", 12, cropped.get(0, 0));
        Assert.assertEquals("invalid last pixel", 24, cropped.get(2, 1));
    }

    @Test
    public void testCropKeepsSourceTileIntact() {
        final ShortProcessor tile = new ShortProcessor(6, 5);
        tile.set(0, 0, 7);

        final ShortProcessor cropped = TileImages.crop(tile, 1, 1, 2, 2);
        cropped.set(0, 0, 99);

        Assert.assertEquals("source pixel changed by crop", 0, tile.get(1, 1));
        Assert.assertEquals("source roi should be reset", 6, tile.getRoi().width);

        try {
            TileImages.crop(tile, 5, 0, 2, 2);
            Assert.fail("crop past tile edge should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name tile shape", e.getMessage().contains("5x6"));
        }
    }

    @Test
    public void testInterpolatedValue() {
        final ShortProcessor tile = new ShortProcessor(2, 2);
        tile.set(0, 0, 100);
        tile.set(1, 0, 200);
        tile.set(0, 1, 300);
        tile.set(1, 1, 400);

        Assert.assertEquals("invalid exact sample", 400.0, TileImages.interpolatedValue(tile, 1, 1), 0.0001);
        Assert.assertEquals("invalid center sample", 250.0, TileImages.interpolatedValue(tile, 0.5, 0.5), 0.0001);
        Assert.assertEquals("invalid edge sample", 150.0, TileImages.interpolatedValue(tile, 0.5, 0), 0.0001);
        Assert.assertEquals("pixels outside tile should be zero",
                            0.0, TileImages.interpolatedValue(tile, 2, 0), 0.0001);
        Assert.assertEquals("locations before the first pixel should be zero",
                            0.0, TileImages.interpolatedValue(tile, -0.5, 0), 0.0001);
    }
}
