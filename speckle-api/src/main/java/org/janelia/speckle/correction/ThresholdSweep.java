package org.janelia.speckle.correction;

import com.google.common.base.Preconditions;

/**
 * Saturation ratio and contrast running sums for every threshold level of a run.
 * A sweep is filled by one worker; sweeps of different workers are merged at the end.
 */
class ThresholdSweep {

    private final int width;
    private final int height;
    private final double[] thresholdLevels;
    private final SaturationAccumulator[] saturationAccumulators;
    private final ThresholdSweepContrast[] contrastAccumulators;

    ThresholdSweep(int width, int height, int windowSize, double saturationLevel, double[] thresholdLevels) {
        this.width = width;
        this.height = height;
        this.thresholdLevels = thresholdLevels.clone();
        this.saturationAccumulators = new SaturationAccumulator[thresholdLevels.length];
        this.contrastAccumulators = new ThresholdSweepContrast[thresholdLevels.length];
        for (int l = 0; l < thresholdLevels.length; l++) {
            double threshold = thresholdLevels[l] * saturationLevel;
            saturationAccumulators[l] = new SaturationAccumulator(width, height, windowSize, threshold);
            contrastAccumulators[l] = new ThresholdSweepContrast(width, height, windowSize, threshold);
        }
    }

    void addFrame(double[] frame) {
        Preconditions.checkArgument(frame.length == width * height,
                "Frame has %s pixels instead of %s", frame.length, width * height);
        for (int l = 0; l < thresholdLevels.length; l++) {
            saturationAccumulators[l].add(frame);
            contrastAccumulators[l].add(frame);
        }
    }

    void merge(ThresholdSweep other) {
        for (int l = 0; l < thresholdLevels.length; l++) {
            saturationAccumulators[l].merge(other.saturationAccumulators[l]);
            contrastAccumulators[l].merge(other.contrastAccumulators[l]);
        }
    }

    int getFrameCount() {
        return saturationAccumulators[0].getFrameCount();
    }

    ThresholdSweepResult average() {
        double[][] saturationRatios = new double[thresholdLevels.length][];
        double[][] contrasts = new double[thresholdLevels.length][];
        for (int l = 0; l < thresholdLevels.length; l++) {
            saturationRatios[l] = saturationAccumulators[l].average();
            contrasts[l] = contrastAccumulators[l].average();
        }
        return new ThresholdSweepResult(width, height, getFrameCount(), thresholdLevels, saturationRatios, contrasts);
    }
}
