package org.janelia.speckle.image.algorithms;

public class PixelIntensityAlgorithms {

    /**
     * @return a copy of the values where every value above or equal to the threshold is set to the threshold.
     */
    public static double[] clampIntensity(double[] values, double threshold) {
        double[] clamped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            clamped[i] = value >= threshold ? threshold : value;
        }
        return clamped;
    }

    /**
     * @return 1 for every value above or equal to the threshold and 0 otherwise.
     */
    public static double[] thresholdIndicator(double[] values, double threshold) {
        double[] indicator = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (values[i] >= threshold) {
                indicator[i] = 1;
            }
        }
        return indicator;
    }
}
