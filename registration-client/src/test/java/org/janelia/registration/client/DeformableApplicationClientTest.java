package org.janelia.registration.client;

import org.janelia.registration.client.parameter.CommandLineParameters;
import org.junit.Test;

/**
 * Tests the {@link DeformableApplicationClient} class.
 *
 * @author Eric Trautman
 */
public class DeformableApplicationClientTest {

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new DeformableApplicationClient.Parameters());
    }

}
