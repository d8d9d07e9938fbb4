package org.janelia.speckle.correction;

/**
 * Estimates the speckle contrast that would have been measured without saturation
 * from the saturation ratio and contrast maps of a threshold sweep.
 */
public interface ExtrapolationModel {

    /**
     * @return threshold levels, as fractions of the saturation level, that the model needs in the sweep.
     * The first level is always 1.
     */
    double[] getThresholdLevels();

    /**
     * Compute the bias corrected contrast for every pixel. The result is in contrast units and
     * it is not repaired, so it may contain NaN, infinite or negative values.
     *
     * @param sweep sequence averaged maps for the levels returned by {@link #getThresholdLevels()}
     * @return corrected contrast map
     */
    double[] correct(ThresholdSweepResult sweep);
}
