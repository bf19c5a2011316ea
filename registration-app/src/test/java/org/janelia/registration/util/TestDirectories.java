package org.janelia.registration.util;

import java.io.File;
import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.Date;

/**
 * Creates uniquely named scratch directories for tests.
 *
 * @author Eric Trautman
 */
public class TestDirectories {

    public static File createTestDirectory(final String baseName)
            throws IOException {
        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMddHHmmssSSS");
        final String timestamp = sdf.format(new Date());
        final File testDirectory = new File("target", baseName + "_" + timestamp).getCanonicalFile();
        if (! testDirectory.mkdirs()) {
            throw new IOException("failed to create " + testDirectory.getAbsolutePath());
        }
        return testDirectory;
    }

}
