/*
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.registration.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Divides an image into overlapping tiles that cover it without gaps.
 *
 * @author Stephan Saalfeld &lt;saalfelds@janelia.hhmi.org&gt;
 */
public class GridPlanner {

	private GridPlanner() {}

	/**
	 * Plans the intervals for one axis.
	 *
	 * Tiles start at multiples of (width - overlap).  A tile that would end
	 * beyond the axis ends the sequence and the axis is closed with a tile
	 * starting overlap pixels before the previous tile's end.  When the first
	 * tile already reaches past the axis end, the whole axis is a single tile.
	 *
	 * @param  dim      axis length.
	 * @param  width    tile length along the axis.
	 * @param  overlap  number of pixels shared by adjacent tiles.
	 *
	 * @return ordered intervals covering [0, dim).
	 *
	 * @throws InvalidConfigurationException
	 *   if dim is not positive, overlap is negative, or width does not exceed overlap.
	 */
	public static List<AxisInterval> planAxis(
			final int dim,
			final int width,
			final int overlap) throws InvalidConfigurationException {

		if (dim <= 0) {
			throw new InvalidConfigurationException("axis length " + dim + " must be positive");
		}
		TilingParameters.validateAxis("axis", width, overlap);

		final int stride = width - overlap;
		final List<AxisInterval> intervals = new ArrayList<>();

		for (long start = 0; start < dim - stride; start += stride) {
			final long end = start + width;
			if (end > dim) {
				break;
			}
			intervals.add(new AxisInterval((int) start, (int) end));
		}

		if (intervals.isEmpty()) {
			intervals.add(new AxisInterval(0, dim));
		} else {
			final int lastEnd = intervals.get(intervals.size() - 1).getEnd();
			if (lastEnd < dim) {
				intervals.add(new AxisInterval(lastEnd - overlap, dim));
			}
		}

		return intervals;
	}

	/**
	 * Plans a row-major grid of tiles for the specified shape.
	 * Rows use the tile height and y overlap, columns use the tile width and x overlap.
	 */
	public static TileGrid plan(
			final ImageShape shape,
			final TilingParameters tilingParameters) throws InvalidConfigurationException {

		tilingParameters.validate();

		final List<AxisInterval> rows =
				planAxis(shape.getHeight(), tilingParameters.getTileHeight(), tilingParameters.getOverlapY());
		final List<AxisInterval> columns =
				planAxis(shape.getWidth(), tilingParameters.getTileWidth(), tilingParameters.getOverlapX());

		final List<TileGrid.Entry> entries = new ArrayList<>(rows.size() * columns.size());
		for (int row = 0; row < rows.size(); row++) {
			for (int column = 0; column < columns.size(); column++) {
				entries.add(new TileGrid.Entry(new TileCoordinate(row, column),
											   new TileArea(rows.get(row), columns.get(column))));
			}
		}

		return new TileGrid(shape, tilingParameters, entries);
	}

	/**
	 * Plans one grid for a reference and moving image pair by
	 * logically zero-extending both to their element-wise maximum shape.
	 */
	public static TileGrid planPair(
			final ImageShape referenceShape,
			final ImageShape movingShape,
			final TilingParameters tilingParameters) throws InvalidConfigurationException {
		return plan(referenceShape.padTo(movingShape), tilingParameters);
	}
}
