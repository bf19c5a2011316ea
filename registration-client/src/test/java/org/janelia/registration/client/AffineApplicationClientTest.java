package org.janelia.registration.client;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.junit.Test;

/**
 * Tests the {@link AffineApplicationClient} class.
 *
 * @author Eric Trautman
 */
public class AffineApplicationClientTest {

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new AffineApplicationClient.Parameters());
    }

}
