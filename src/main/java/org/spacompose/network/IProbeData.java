package org.spacompose.network;

/**
 * Recorded probe data, one row per time step.
 */
public interface IProbeData {

    /**
     * @param probe The probe key.
     * @return The recorded rows; every row has the probed object's width.
     */
    double[][] get(Object probe);

    /**
     * @param probe The probe key.
     * @return The width of the probed object, also when nothing has been recorded yet.
     */
    int dimensions(Object probe);
}
