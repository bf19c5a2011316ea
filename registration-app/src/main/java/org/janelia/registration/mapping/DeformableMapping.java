package org.janelia.registration.mapping;

/**
 * Result of deformable estimation for one tile.
 * Only {@link Status#COMPUTED} mappings carry a displacement field.
 *
 * @author Eric Trautman
 */
public class DeformableMapping {

    public enum Status {
        /** a displacement field was estimated */
        COMPUTED,

        /** tile has no usable content (e.g. uniform background), nothing to refine */
        DEGENERATE,

        /** reference and affine registered tiles have different shapes */
        SHAPE_MISMATCH
    }

    private final Status status;
    private final DisplacementField field;
    private final String reason;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DeformableMapping() {
        this(Status.DEGENERATE, null, null);
    }

    private DeformableMapping(final Status status,
                              final DisplacementField field,
                              final String reason) {
        this.status = status;
        this.field = field;
        this.reason = reason;
    }

    public static DeformableMapping computed(final DisplacementField field) {
        if (field == null) {
            throw new IllegalArgumentException("computed mapping requires a displacement field");
        }
        return new DeformableMapping(Status.COMPUTED, field, null);
    }

    public static DeformableMapping degenerate(final String reason) {
        return new DeformableMapping(Status.DEGENERATE, null, reason);
    }

    public static DeformableMapping shapeMismatch(final String reason) {
        return new DeformableMapping(Status.SHAPE_MISMATCH, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isComputed() {
        return status == Status.COMPUTED;
    }

    public DisplacementField getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return reason == null ? status.toString() : status + " (" + reason + ")";
    }
}
