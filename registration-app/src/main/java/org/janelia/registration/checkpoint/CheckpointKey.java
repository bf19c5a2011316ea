package org.janelia.registration.checkpoint;

import com.google.common.base.Objects;

import javax.annotation.Nonnull;

import org.janelia.registration.grid.TileCoordinate;

/**
 * Identifies one checkpoint: a stage plus (where the stage requires them) a tile coordinate and channel.
 *
 * @author Eric Trautman
 */
public class CheckpointKey
        implements Comparable<CheckpointKey> {

    private final Stage stage;
    private final TileCoordinate coordinate;
    private final Integer channel;

    private CheckpointKey(final Stage stage,
                          final TileCoordinate coordinate,
                          final Integer channel) {
        this.stage = stage;
        this.coordinate = coordinate;
        this.channel = channel;
    }

    public static CheckpointKey forStage(final Stage stage) {
        if (stage.isPerTile()) {
            throw new IllegalArgumentException(stage + " keys require a tile coordinate");
        }
        return new CheckpointKey(stage, null, null);
    }

    public static CheckpointKey forTile(final Stage stage,
                                        final TileCoordinate coordinate) {
        if ((! stage.isPerTile()) || stage.isPerChannel()) {
            throw new IllegalArgumentException(stage + " keys are not identified by tile coordinate alone");
        }
        return new CheckpointKey(stage, coordinate, null);
    }

    public static CheckpointKey forTileChannel(final Stage stage,
                                               final TileCoordinate coordinate,
                                               final int channel) {
        if (! stage.isPerChannel()) {
            throw new IllegalArgumentException(stage + " keys do not have a channel");
        }
        if (channel < 0) {
            throw new IllegalArgumentException("channel " + channel + " must not be negative");
        }
        return new CheckpointKey(stage, coordinate, channel);
    }

    public Stage getStage() {
        return stage;
    }

    public TileCoordinate getCoordinate() {
        return coordinate;
    }

    public Integer getChannel() {
        return channel;
    }

    /**
     * @return key for the same coordinate and channel in a different stage.
     *         The channel is dropped or the specified default channel is added
     *         as the other stage requires.
     */
    public CheckpointKey withStage(final Stage otherStage,
                                   final int defaultChannel) {
        final CheckpointKey key;
        if (! otherStage.isPerTile()) {
            key = forStage(otherStage);
        } else if (otherStage.isPerChannel()) {
            key = forTileChannel(otherStage, coordinate, channel == null ? defaultChannel : channel);
        } else {
            key = forTile(otherStage, coordinate);
        }
        return key;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final CheckpointKey that = (CheckpointKey) o;
        return (stage == that.stage) &&
               Objects.equal(coordinate, that.coordinate) &&
               Objects.equal(channel, that.channel);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(stage, coordinate, channel);
    }

    @Override
    public int compareTo(@Nonnull final CheckpointKey that) {
        int result = this.stage.compareTo(that.stage);
        if ((result == 0) && (this.coordinate != null)) {
            result = this.coordinate.compareTo(that.coordinate);
        }
        if ((result == 0) && (this.channel != null)) {
            result = this.channel.compareTo(that.channel);
        }
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(stage.toString());
        if (coordinate != null) {
            sb.append(" ").append(coordinate);
        }
        if (channel != null) {
            sb.append(" channel ").append(channel);
        }
        return sb.toString();
    }
}
