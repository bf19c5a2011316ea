package org.janelia.registration.client.parameter;

import com.beust.jcommander.Parameter;

import org.janelia.registration.pipeline.PipelineConfiguration;

/**
 * Parameters for planning the tile grid.
 *
 * @author Eric Trautman
 */
public class TileGridParameters {

    @Parameter(
            names = "--tileWidth",
            description = "Tile width in pixels")
    public int tileWidth = 2000;

    @Parameter(
            names = "--tileHeight",
            description = "Tile height in pixels")
    public int tileHeight = 2000;

    @Parameter(
            names = "--overlapX",
            description = "Horizontal overlap between adjacent tiles (omit with overlapY to estimate overlaps)")
    public Integer overlapX;

    @Parameter(
            names = "--overlapY",
            description = "Vertical overlap between adjacent tiles (omit with overlapX to estimate overlaps)")
    public Integer overlapY;

    @Parameter(
            names = "--cropMargin",
            description = "Extra pixels read around each moving crop")
    public int cropMargin = 0;

    @Parameter(
            names = "--affineEstimationRegionSize",
            description = "Estimate the affine mapping from this top-left square only (default is the whole image)")
    public Integer affineEstimationRegionSize;

    @Parameter(
            names = "--overlapEstimationSize",
            description = "Size of the top-left square used to estimate overlaps")
    public int overlapEstimationSize = PipelineConfiguration.DEFAULT_OVERLAP_ESTIMATION_SIZE;

    @Parameter(
            names = "--overlapFactor",
            description = "Fraction added to the largest measured border when estimating overlaps")
    public double overlapFactor = PipelineConfiguration.DEFAULT_OVERLAP_FACTOR;

}
