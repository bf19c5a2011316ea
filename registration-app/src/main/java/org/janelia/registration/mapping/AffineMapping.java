package org.janelia.registration.mapping;

import java.awt.geom.AffineTransform;
import java.util.Arrays;

/**
 * Global 2x3 affine matrix that maps moving image pixel coordinates (x = column, y = row)
 * into the reference image frame.
 *
 * <pre>
 *   x' = m00 * x + m01 * y + m02
 *   y' = m10 * x + m11 * y + m12
 * </pre>
 *
 * @author Eric Trautman
 */
public class AffineMapping {

    public static final AffineMapping IDENTITY = new AffineMapping(1, 0, 0, 0, 1, 0);

    private final double m00;
    private final double m01;
    private final double m02;
    private final double m10;
    private final double m11;
    private final double m12;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private AffineMapping() {
        this(1, 0, 0, 0, 1, 0);
    }

    public AffineMapping(final double m00,
                         final double m01,
                         final double m02,
                         final double m10,
                         final double m11,
                         final double m12) {
        this.m00 = m00;
        this.m01 = m01;
        this.m02 = m02;
        this.m10 = m10;
        this.m11 = m11;
        this.m12 = m12;
    }

    public static AffineMapping translation(final double dx,
                                            final double dy) {
        return new AffineMapping(1, 0, dx, 0, 1, dy);
    }

    public static AffineMapping fromTransform(final AffineTransform transform) {
        return new AffineMapping(transform.getScaleX(), transform.getShearX(), transform.getTranslateX(),
                                 transform.getShearY(), transform.getScaleY(), transform.getTranslateY());
    }

    /**
     * @return row-major matrix values [m00, m01, m02, m10, m11, m12].
     */
    public double[] getMatrix() {
        return new double[] { m00, m01, m02, m10, m11, m12 };
    }

    public AffineTransform createTransform() {
        return new AffineTransform(m00, m10, m01, m11, m02, m12);
    }

    /**
     * Re-expresses this mapping for a sub-image whose top-left pixel sits at (originX, originY)
     * in both the moving and reference frames.
     */
    public AffineMapping inLocalFrame(final double originX,
                                      final double originY) {
        final AffineTransform local = AffineTransform.getTranslateInstance(-originX, -originY);
        local.concatenate(createTransform());
        local.concatenate(AffineTransform.getTranslateInstance(originX, originY));
        return fromTransform(local);
    }

    public boolean isIdentity() {
        return createTransform().isIdentity();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(getMatrix(), ((AffineMapping) o).getMatrix());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(getMatrix());
    }

    @Override
    public String toString() {
        return Arrays.toString(getMatrix());
    }
}
