package org.janelia.registration.grid;

import com.google.common.base.Objects;

/**
 * Half-open pixel interval [start, end) along one image axis.
 *
 * @author Eric Trautman
 */
public class AxisInterval {

    private final int start;
    private final int end;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private AxisInterval() {
        this(0, 1);
    }

    public AxisInterval(final int start,
                        final int end) {
        if (end <= start) {
            throw new IllegalArgumentException("end " + end + " must be greater than start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLength() {
        return end - start;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final AxisInterval that = (AxisInterval) o;
        return (start == that.start) && (end == that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
