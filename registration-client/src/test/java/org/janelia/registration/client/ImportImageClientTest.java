package org.janelia.registration.client;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ShortProcessor;

import java.io.File;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.janelia.registration.grid.ImageShape;
import org.janelia.registration.grid.TileArea;
import org.janelia.registration.image.N5ImageStore;
import org.janelia.registration.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link ImportImageClient} class.
 *
 * @author Eric Trautman
 */
public class ImportImageClientTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = RegistrationPipelineClientTest.createTestDirectory("test_import_image");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new ImportImageClient.Parameters());
    }

    @Test
    public void testImportImage() throws Exception {

        final File tiffFile = new File(testDirectory, "channels.tif");
        final ImagePlus imagePlus = new ImagePlus("channels", RegistrationPipelineClientTest.buildStack(40, 30, 2));
        Assert.assertTrue("failed to save " + tiffFile,
                          new FileSaver(imagePlus).saveAsTiffStack(tiffFile.getAbsolutePath()));

        final String n5Path = new File(testDirectory, "channels.n5").getAbsolutePath();
        final ImportImageClient.Parameters parameters = new ImportImageClient.Parameters();
        parameters.parse(new String[] {
                "--tiffPath", tiffFile.getAbsolutePath(),
                "--n5Path", n5Path,
                "--blockSize", "16"
        }, ImportImageClient.class, false);

        final ImageShape shape = new ImportImageClient(parameters).importImage();

        final ImageShape expectedShape = new ImageShape(30, 40, 2);
        Assert.assertEquals("invalid imported shape", expectedShape, shape);

        final N5ImageStore imageStore = new N5ImageStore();
        Assert.assertEquals("invalid stored shape", expectedShape, imageStore.getShape(n5Path));

        final ShortProcessor secondChannel = imageStore.readRegion(n5Path, new TileArea(10, 12, 20, 22), 1);
        Assert.assertEquals("invalid pixel value", 10000 + (11 * 40) + 21 + 1, secondChannel.get(1, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBlockSize() {
        final ImportImageClient.Parameters parameters = new ImportImageClient.Parameters();
        parameters.blockSize = 0;
        new ImportImageClient(parameters);
    }
}
