package org.janelia.speckle.dataio;

/**
 * Range and mean of the finite values of a map.
 */
public class MapStatistics {

    public static MapStatistics of(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        long n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                min = Math.min(min, v);
                max = Math.max(max, v);
                sum += v;
                n++;
            }
        }
        return n > 0
                ? new MapStatistics(min, max, sum / n, n, values.length - n)
                : new MapStatistics(Double.NaN, Double.NaN, Double.NaN, 0, values.length);
    }

    private final double min;
    private final double max;
    private final double mean;
    private final long finitePixels;
    private final long undefinedPixels;

    private MapStatistics(double min, double max, double mean, long finitePixels, long undefinedPixels) {
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.finitePixels = finitePixels;
        this.undefinedPixels = undefinedPixels;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public long getFinitePixels() {
        return finitePixels;
    }

    public long getUndefinedPixels() {
        return undefinedPixels;
    }
}
