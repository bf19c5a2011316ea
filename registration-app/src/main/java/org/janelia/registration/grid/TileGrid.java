package org.janelia.registration.grid;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;

import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.registration.json.JsonUtils;

/**
 * Immutable, row-major ordered set of tiles covering one (padded) image shape.
 *
 * @author Eric Trautman
 */
public class TileGrid {

    private final ImageShape imageShape;
    private final TilingParameters tilingParameters;
    private final List<Entry> entries;

    private final transient Map<TileCoordinate, TileArea> coordinateToArea;
    private final transient int maxRow;
    private final transient int maxColumn;

    @JsonCreator
    public TileGrid(@JsonProperty("imageShape") final ImageShape imageShape,
                    @JsonProperty("tilingParameters") final TilingParameters tilingParameters,
                    @JsonProperty("entries") final List<Entry> entries) {

        this.imageShape = imageShape;
        this.tilingParameters = tilingParameters;

        final List<Entry> sortedEntries = new ArrayList<>(entries);
        Collections.sort(sortedEntries);
        this.entries = Collections.unmodifiableList(sortedEntries);

        this.coordinateToArea = new LinkedHashMap<>();
        int lastRow = -1;
        int lastColumn = -1;
        for (final Entry entry : this.entries) {
            if (coordinateToArea.put(entry.coordinate, entry.area) != null) {
                throw new IllegalArgumentException("duplicate tile coordinate " + entry.coordinate);
            }
            lastRow = Math.max(lastRow, entry.coordinate.getRow());
            lastColumn = Math.max(lastColumn, entry.coordinate.getColumn());
        }
        this.maxRow = lastRow;
        this.maxColumn = lastColumn;
    }

    public ImageShape getImageShape() {
        return imageShape;
    }

    public TilingParameters getTilingParameters() {
        return tilingParameters;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public List<TileCoordinate> getCoordinates() {
        return new ArrayList<>(coordinateToArea.keySet());
    }

    public int size() {
        return entries.size();
    }

    public int getMaxRow() {
        return maxRow;
    }

    public int getMaxColumn() {
        return maxColumn;
    }

    public int getRowCount() {
        return maxRow + 1;
    }

    public int getColumnCount() {
        return maxColumn + 1;
    }

    public boolean contains(final TileCoordinate coordinate) {
        return coordinateToArea.containsKey(coordinate);
    }

    /**
     * @throws IllegalArgumentException
     *   if the coordinate is not part of this grid.
     */
    public TileArea getArea(final TileCoordinate coordinate)
            throws IllegalArgumentException {
        final TileArea area = coordinateToArea.get(coordinate);
        if (area == null) {
            throw new IllegalArgumentException("coordinate " + coordinate + " is not part of this grid");
        }
        return area;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TileGrid that = (TileGrid) o;
        return Objects.equal(imageShape, that.imageShape) &&
               Objects.equal(entries, that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(imageShape, entries);
    }

    @Override
    public String toString() {
        return "{imageShape: " + imageShape + ", rows: " + getRowCount() + ", columns: " + getColumnCount() + "}";
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static TileGrid fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * A tile coordinate and the pixel area it covers.
     */
    public static class Entry
            implements Comparable<Entry> {

        private final TileCoordinate coordinate;
        private final TileArea area;

        @JsonCreator
        public Entry(@JsonProperty("coordinate") final TileCoordinate coordinate,
                     @JsonProperty("area") final TileArea area) {
            this.coordinate = coordinate;
            this.area = area;
        }

        public TileCoordinate getCoordinate() {
            return coordinate;
        }

        public TileArea getArea() {
            return area;
        }

        @Override
        public int compareTo(final Entry that) {
            return this.coordinate.compareTo(that.coordinate);
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            final Entry that = (Entry) o;
            return Objects.equal(coordinate, that.coordinate) &&
                   Objects.equal(area, that.area);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(coordinate, area);
        }

        @Override
        public String toString() {
            return coordinate + " " + area;
        }
    }

    private static final JsonUtils.Helper<TileGrid> JSON_HELPER =
            new JsonUtils.Helper<>(TileGrid.class);
}
