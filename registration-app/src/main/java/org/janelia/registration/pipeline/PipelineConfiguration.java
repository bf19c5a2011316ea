package org.janelia.registration.pipeline;

import org.janelia.registration.checkpoint.CheckpointLayout;
import org.janelia.registration.grid.InvalidConfigurationException;
import org.janelia.registration.grid.TilingParameters;
import org.janelia.registration.json.JsonUtils;
import org.janelia.registration.mapping.IdentityAffineEstimator;
import org.janelia.registration.mapping.ZeroDisplacementEstimator;

/**
 * Everything a {@link PipelineController} needs to know about one registration run.
 *
 * Overlaps may be left undefined, in which case they are estimated from the
 * top-left corner of the image pair before the grid is planned.
 *
 * @author Eric Trautman
 */
public class PipelineConfiguration {

    public static final int DEFAULT_OVERLAP_ESTIMATION_SIZE = 500;
    public static final double DEFAULT_OVERLAP_FACTOR = 0.2;

    private final String referenceImage;
    private final String movingImage;
    private final CheckpointLayout checkpointLayout;

    private String outputImage;
    private int tileWidth;
    private int tileHeight;
    private Integer overlapX;
    private Integer overlapY;
    private int registrationChannel;
    private int cropMargin;
    private Integer affineEstimationRegionSize;
    private int overlapEstimationSize;
    private double overlapFactor;
    private int maxConcurrency;
    private Transformation transformation;
    private String affineEstimatorClass;
    private String deformableEstimatorClass;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private PipelineConfiguration() {
        this(null, null, null);
    }

    public PipelineConfiguration(final String referenceImage,
                                 final String movingImage,
                                 final CheckpointLayout checkpointLayout) {
        this.referenceImage = referenceImage;
        this.movingImage = movingImage;
        this.checkpointLayout = checkpointLayout;
        this.outputImage = null;
        this.tileWidth = 2000;
        this.tileHeight = 2000;
        this.overlapX = null;
        this.overlapY = null;
        this.registrationChannel = 0;
        this.cropMargin = 0;
        this.affineEstimationRegionSize = null;
        this.overlapEstimationSize = DEFAULT_OVERLAP_ESTIMATION_SIZE;
        this.overlapFactor = DEFAULT_OVERLAP_FACTOR;
        this.maxConcurrency = 1;
        this.transformation = Transformation.DEFORMABLE;
        this.affineEstimatorClass = IdentityAffineEstimator.class.getName();
        this.deformableEstimatorClass = ZeroDisplacementEstimator.class.getName();
    }

    public String getReferenceImage() {
        return referenceImage;
    }

    public String getMovingImage() {
        return movingImage;
    }

    public CheckpointLayout getCheckpointLayout() {
        return checkpointLayout;
    }

    public String getOutputImage() {
        return outputImage;
    }

    public int getTileWidth() {
        return tileWidth;
    }

    public int getTileHeight() {
        return tileHeight;
    }

    public Integer getOverlapX() {
        return overlapX;
    }

    public Integer getOverlapY() {
        return overlapY;
    }

    public boolean hasOverlaps() {
        return (overlapX != null) && (overlapY != null);
    }

    /**
     * @return tiling parameters with the configured overlaps (or zero overlaps if they are undefined).
     */
    public TilingParameters getTilingParameters() {
        return new TilingParameters(tileWidth,
                                    tileHeight,
                                    overlapX == null ? 0 : overlapX,
                                    overlapY == null ? 0 : overlapY);
    }

    public int getRegistrationChannel() {
        return registrationChannel;
    }

    public int getCropMargin() {
        return cropMargin;
    }

    public Integer getAffineEstimationRegionSize() {
        return affineEstimationRegionSize;
    }

    public int getOverlapEstimationSize() {
        return overlapEstimationSize;
    }

    public double getOverlapFactor() {
        return overlapFactor;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Transformation getTransformation() {
        return transformation;
    }

    public String getAffineEstimatorClass() {
        return affineEstimatorClass;
    }

    public String getDeformableEstimatorClass() {
        return deformableEstimatorClass;
    }

    public PipelineConfiguration withOutputImage(final String outputImage) {
        this.outputImage = outputImage;
        return this;
    }

    public PipelineConfiguration withTileSize(final int tileWidth,
                                              final int tileHeight) {
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        return this;
    }

    public PipelineConfiguration withOverlaps(final Integer overlapX,
                                              final Integer overlapY) {
        this.overlapX = overlapX;
        this.overlapY = overlapY;
        return this;
    }

    public PipelineConfiguration withRegistrationChannel(final int registrationChannel) {
        this.registrationChannel = registrationChannel;
        return this;
    }

    public PipelineConfiguration withCropMargin(final int cropMargin) {
        this.cropMargin = cropMargin;
        return this;
    }

    public PipelineConfiguration withAffineEstimationRegionSize(final Integer affineEstimationRegionSize) {
        this.affineEstimationRegionSize = affineEstimationRegionSize;
        return this;
    }

    public PipelineConfiguration withOverlapEstimation(final int overlapEstimationSize,
                                                       final double overlapFactor) {
        this.overlapEstimationSize = overlapEstimationSize;
        this.overlapFactor = overlapFactor;
        return this;
    }

    public PipelineConfiguration withMaxConcurrency(final int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
        return this;
    }

    public PipelineConfiguration withTransformation(final Transformation transformation) {
        this.transformation = transformation;
        return this;
    }

    public PipelineConfiguration withAffineEstimatorClass(final String affineEstimatorClass) {
        this.affineEstimatorClass = affineEstimatorClass;
        return this;
    }

    public PipelineConfiguration withDeformableEstimatorClass(final String deformableEstimatorClass) {
        this.deformableEstimatorClass = deformableEstimatorClass;
        return this;
    }

    /**
     * @throws InvalidConfigurationException
     *   if any value is out of range.
     */
    public void validate()
            throws InvalidConfigurationException {

        if (referenceImage == null) {
            throw new InvalidConfigurationException("reference image must be defined");
        }
        if (movingImage == null) {
            throw new InvalidConfigurationException("moving image must be defined");
        }
        if (checkpointLayout == null) {
            throw new InvalidConfigurationException("checkpoint layout must be defined");
        }
        if ((overlapX == null) != (overlapY == null)) {
            throw new InvalidConfigurationException("overlapX and overlapY must either both be defined or both be omitted");
        }
        if (hasOverlaps()) {
            getTilingParameters().validate();
        } else if ((tileWidth < 2) || (tileHeight < 2)) {
            throw new InvalidConfigurationException("tile width " + tileWidth + " and height " + tileHeight +
                                                    " must be at least 2 when overlaps are estimated");
        }
        if (registrationChannel < 0) {
            throw new InvalidConfigurationException("registration channel " + registrationChannel +
                                                    " must not be negative");
        }
        if (cropMargin < 0) {
            throw new InvalidConfigurationException("crop margin " + cropMargin + " must not be negative");
        }
        if ((affineEstimationRegionSize != null) && (affineEstimationRegionSize < 1)) {
            throw new InvalidConfigurationException("affine estimation region size " + affineEstimationRegionSize +
                                                    " must be positive");
        }
        if (overlapEstimationSize < 1) {
            throw new InvalidConfigurationException("overlap estimation size " + overlapEstimationSize +
                                                    " must be positive");
        }
        if (overlapFactor < 0) {
            throw new InvalidConfigurationException("overlap factor " + overlapFactor + " must not be negative");
        }
        if (maxConcurrency < 1) {
            throw new InvalidConfigurationException("max concurrency " + maxConcurrency + " must be at least 1");
        }
    }

    @Override
    public String toString() {
        return toJson();
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    private static final JsonUtils.Helper<PipelineConfiguration> JSON_HELPER =
            new JsonUtils.Helper<>(PipelineConfiguration.class);
}
