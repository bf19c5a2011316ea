package org.janelia.registration.pipeline;

import ij.process.ShortProcessor;

import org.janelia.registration.grid.TilingParameters;
import org.janelia.registration.mapping.AffineEstimator;
import org.janelia.registration.mapping.AffineMapping;
import org.janelia.registration.mapping.InsufficientFeaturesException;
import org.janelia.registration.mapping.TransformApplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives tile overlaps from the empty borders that affine registration leaves in a corner sample of the image pair.
 *
 * The registered sample is scanned for all-zero rows and columns along each edge.
 * When the borders on opposite sides differ, tiles along that axis must overlap by
 * twice the wider border (scaled up by the overlap factor) so that each tile can be
 * registered with enough shared content.  When the borders are equal the overlap
 * defaults to a tenth of the tile size.
 *
 * @author Eric Trautman
 */
public class OverlapEstimator {

    private final AffineEstimator affineEstimator;
    private final TransformApplier transformApplier;
    private final double overlapFactor;

    public OverlapEstimator(final AffineEstimator affineEstimator,
                            final TransformApplier transformApplier,
                            final double overlapFactor) {
        this.affineEstimator = affineEstimator;
        this.transformApplier = transformApplier;
        this.overlapFactor = overlapFactor;
    }

    /**
     * @param  referenceSample  top-left corner of the reference registration channel.
     * @param  movingSample     top-left corner of the moving registration channel.
     * @param  tiling           tile sizes to use (overlaps are ignored).
     *
     * @return the tile sizes with estimated overlaps.
     */
    public TilingParameters estimate(final ShortProcessor referenceSample,
                                     final ShortProcessor movingSample,
                                     final TilingParameters tiling)
            throws InsufficientFeaturesException {

        final AffineMapping mapping = affineEstimator.compute(referenceSample, movingSample);
        final ShortProcessor registeredSample = transformApplier.apply(mapping, movingSample);
        final BorderWidths borders = BorderWidths.measure(registeredSample);

        final int overlapX = deriveOverlap(borders.getLeft(), borders.getRight(), tiling.getTileWidth());
        final int overlapY = deriveOverlap(borders.getTop(), borders.getBottom(), tiling.getTileHeight());

        LOG.info("estimate: borders {} after applying {}, derived overlapX {} and overlapY {}",
                 borders, mapping, overlapX, overlapY);

        return tiling.withOverlap(overlapX, overlapY);
    }

    int deriveOverlap(final int border1,
                      final int border2,
                      final int tileSize) {
        final int overlap;
        if (border1 != border2) {
            overlap = 2 * (int) Math.ceil(Math.max(border1, border2) * (1.0 + overlapFactor));
        } else {
            overlap = tileSize / 10;
        }
        return Math.min(overlap, tileSize - 1);
    }

    private static final Logger LOG = LoggerFactory.getLogger(OverlapEstimator.class);
}
