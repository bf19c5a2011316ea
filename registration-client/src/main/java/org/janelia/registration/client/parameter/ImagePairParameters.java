package org.janelia.registration.client.parameter;

import com.beust.jcommander.Parameter;

/**
 * Parameters for identifying the images to register.
 *
 * @author Eric Trautman
 */
public class ImagePairParameters {

    @Parameter(
            names = "--referenceImage",
            description = "N5 container path for the fixed reference image",
            required = true)
    public String referenceImage;

    @Parameter(
            names = "--movingImage",
            description = "N5 container path for the image to be registered onto the reference",
            required = true)
    public String movingImage;

    @Parameter(
            names = "--registrationChannel",
            description = "Channel used for all estimations")
    public int registrationChannel = 0;

}
