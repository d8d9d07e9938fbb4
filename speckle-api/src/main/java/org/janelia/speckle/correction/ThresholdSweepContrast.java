package org.janelia.speckle.correction;

import com.google.common.base.Preconditions;

import org.janelia.speckle.image.algorithms.PixelIntensityAlgorithms;
import org.janelia.speckle.image.algorithms.WindowStatistics;

/**
 * Accumulates, over a sequence of frames, the local speckle contrast of the frames artificially
 * saturated at a threshold, i.e. with every value at or above the threshold replaced by the threshold.
 */
public class ThresholdSweepContrast {

    private final int width;
    private final int height;
    private final int windowSize;
    private final double threshold;
    private final double[] sums;
    private int nFrames;

    public ThresholdSweepContrast(int width, int height, int windowSize, double threshold) {
        this.width = width;
        this.height = height;
        this.windowSize = windowSize;
        this.threshold = threshold;
        this.sums = new double[width * height];
        this.nFrames = 0;
    }

    /**
     * Local contrast std/mean of a single frame clamped at the threshold.
     * A zero local mean produces NaN or infinity.
     */
    public static double[] clampedContrast(double[] frame, int width, int height, int windowSize, double threshold) {
        return WindowStatistics.compute(
                PixelIntensityAlgorithms.clampIntensity(frame, threshold),
                width, height, windowSize)
                .getContrast();
    }

    public void add(double[] frame) {
        double[] contrast = clampedContrast(frame, width, height, windowSize, threshold);
        for (int i = 0; i < sums.length; i++) {
            sums[i] += contrast[i];
        }
        nFrames++;
    }

    public void merge(ThresholdSweepContrast other) {
        Preconditions.checkArgument(other.sums.length == sums.length && other.threshold == threshold,
                "Cannot merge contrast accumulators for different images or thresholds");
        for (int i = 0; i < sums.length; i++) {
            sums[i] += other.sums[i];
        }
        nFrames += other.nFrames;
    }

    public int getFrameCount() {
        return nFrames;
    }

    /**
     * @return the sequence averaged contrast
     */
    public double[] average() {
        Preconditions.checkState(nFrames > 0, "No frame has been accumulated");
        double[] avg = new double[sums.length];
        for (int i = 0; i < sums.length; i++) {
            avg[i] = sums[i] / nFrames;
        }
        return avg;
    }
}
