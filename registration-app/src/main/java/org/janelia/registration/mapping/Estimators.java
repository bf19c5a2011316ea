package org.janelia.registration.mapping;

/**
 * Creates estimator instances from class names so that registration implementations can be plugged in.
 *
 * @author Eric Trautman
 */
public class Estimators {

    private Estimators() {
    }

    public static AffineEstimator newAffineEstimator(final String className)
            throws IllegalArgumentException {
        return newInstance(className, AffineEstimator.class);
    }

    public static DeformableEstimator newDeformableEstimator(final String className)
            throws IllegalArgumentException {
        return newInstance(className, DeformableEstimator.class);
    }

    static <T> T newInstance(final String className,
                             final Class<T> interfaceClass)
            throws IllegalArgumentException {

        if (className == null) {
            throw new IllegalArgumentException("no " + interfaceClass.getSimpleName() + " class name defined");
        }

        final Class<?> clazz;
        try {
            clazz = Class.forName(className);
        } catch (final ClassNotFoundException e) {
            throw new IllegalArgumentException("estimator class '" + className + "' cannot be found", e);
        }

        if (! interfaceClass.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException("estimator class '" + className + "' does not implement the '" +
                                               interfaceClass.getName() + "' interface");
        }

        final Object instance;
        try {
            instance = clazz.getDeclaredConstructor().newInstance();
        } catch (final Exception e) {
            throw new IllegalArgumentException("failed to create instance of estimator class '" + className + "'", e);
        }

        return interfaceClass.cast(instance);
    }
}
