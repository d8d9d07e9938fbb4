package org.janelia.speckle.correction;

import com.google.common.base.Preconditions;

import org.janelia.speckle.image.algorithms.PixelIntensityAlgorithms;
import org.janelia.speckle.image.algorithms.WindowStatistics;

/**
 * Accumulates, over a sequence of frames, the fraction of pixels in the NxN window
 * that are at or above a saturation threshold.
 */
public class SaturationAccumulator {

    private final int width;
    private final int height;
    private final int windowSize;
    private final double threshold;
    private final double[] sums;
    private int nFrames;

    public SaturationAccumulator(int width, int height, int windowSize, double threshold) {
        this.width = width;
        this.height = height;
        this.windowSize = windowSize;
        this.threshold = threshold;
        this.sums = new double[width * height];
        this.nFrames = 0;
    }

    /**
     * Saturation ratio of a single frame: the windowed mean of the indicator "value >= threshold".
     */
    public static double[] saturationRatio(double[] frame, int width, int height, int windowSize, double threshold) {
        return WindowStatistics.windowMean(
                PixelIntensityAlgorithms.thresholdIndicator(frame, threshold),
                width, height, windowSize);
    }

    public void add(double[] frame) {
        double[] ratio = saturationRatio(frame, width, height, windowSize, threshold);
        for (int i = 0; i < sums.length; i++) {
            sums[i] += ratio[i];
        }
        nFrames++;
    }

    public void merge(SaturationAccumulator other) {
        Preconditions.checkArgument(other.sums.length == sums.length && other.threshold == threshold,
                "Cannot merge saturation accumulators for different images or thresholds");
        for (int i = 0; i < sums.length; i++) {
            sums[i] += other.sums[i];
        }
        nFrames += other.nFrames;
    }

    public int getFrameCount() {
        return nFrames;
    }

    /**
     * @return the sequence averaged saturation ratio
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
