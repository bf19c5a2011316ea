package org.janelia.registration.client;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.junit.Test;

/**
 * Tests the {@link AffineEstimationClient} class.
 *
 * @author Eric Trautman
 */
public class AffineEstimationClientTest {

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new AffineEstimationClient.Parameters());
    }

}
