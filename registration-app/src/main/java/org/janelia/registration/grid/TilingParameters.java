package org.janelia.registration.grid;

/**
 * Tile size and overlap for both image axes.
 *
 * @author Eric Trautman
 */
public class TilingParameters {

    private final int tileWidth;
    private final int tileHeight;
    private final int overlapX;
    private final int overlapY;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TilingParameters() {
        this(1, 1, 0, 0);
    }

    public TilingParameters(final int tileWidth,
                            final int tileHeight,
                            final int overlapX,
                            final int overlapY) {
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.overlapX = overlapX;
        this.overlapY = overlapY;
    }

    public int getTileWidth() {
        return tileWidth;
    }

    public int getTileHeight() {
        return tileHeight;
    }

    public int getOverlapX() {
        return overlapX;
    }

    public int getOverlapY() {
        return overlapY;
    }

    public TilingParameters withOverlap(final int overlapX,
                                        final int overlapY) {
        return new TilingParameters(tileWidth, tileHeight, overlapX, overlapY);
    }

    /**
     * @throws InvalidConfigurationException
     *   if a tile size is not larger than its overlap or an overlap is negative.
     */
    public void validate()
            throws InvalidConfigurationException {
        validateAxis("x", tileWidth, overlapX);
        validateAxis("y", tileHeight, overlapY);
    }

    @Override
    public String toString() {
        return "{tileWidth: " + tileWidth + ", tileHeight: " + tileHeight +
               ", overlapX: " + overlapX + ", overlapY: " + overlapY + "}";
    }

    static void validateAxis(final String axisName,
                             final int tileSize,
                             final int overlap)
            throws InvalidConfigurationException {
        if (overlap < 0) {
            throw new InvalidConfigurationException(
                    axisName + " overlap " + overlap + " must not be negative");
        }
        if (tileSize <= overlap) {
            throw new InvalidConfigurationException(
                    axisName + " tile size " + tileSize + " must be greater than overlap " + overlap);
        }
    }
}
