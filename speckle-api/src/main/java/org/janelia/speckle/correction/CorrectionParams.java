package org.janelia.speckle.correction;

import java.io.Serializable;
import java.util.Arrays;

import com.google.common.base.Preconditions;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Calibration and numeric parameters of the over-exposure correction.
 * The defaults were fitted for the low contrast range.
 */
public class CorrectionParams implements Serializable {

    /** Artificial saturation levels, as fractions of the saturation level, used by the two step model. */
    public static final double[] DEFAULT_THRESHOLD_LEVELS = {1.0, 0.8, 0.6};
    /** Coefficients of the rational correction used by the one step model. */
    public static final double DEFAULT_C1 = -0.8;
    public static final double DEFAULT_Q1 = -0.85;
    public static final double DEFAULT_Q2 = 0.25;
    /** Guard added to the denominators that may vanish. */
    public static final double DEFAULT_EPSILON = Math.ulp(1.0);
    /** Corrected values below this are considered diverged and are inpainted. */
    public static final double DEFAULT_INVALID_FLOOR = 0.01;
    public static final int DEFAULT_FILL_MAX_PASSES = 20000;
    /** Inpainting stops when no pixel changes by more than this fraction of the boundary value range. */
    public static final double DEFAULT_FILL_TOLERANCE = 1e-6;

    private double[] thresholdLevels = DEFAULT_THRESHOLD_LEVELS.clone();
    private double c1 = DEFAULT_C1;
    private double q1 = DEFAULT_Q1;
    private double q2 = DEFAULT_Q2;
    private double epsilon = DEFAULT_EPSILON;
    private double invalidFloor = DEFAULT_INVALID_FLOOR;
    private int fillMaxPasses = DEFAULT_FILL_MAX_PASSES;
    private double fillTolerance = DEFAULT_FILL_TOLERANCE;

    public double[] getThresholdLevels() {
        return thresholdLevels.clone();
    }

    /**
     * Set the threshold levels of the two step model. There must be 2 or 3 levels in strictly
     * decreasing order, all in (0, 1], and the first one must be 1.
     */
    public CorrectionParams setThresholdLevels(double... thresholdLevels) {
        Preconditions.checkArgument(thresholdLevels != null && thresholdLevels.length >= 2 && thresholdLevels.length <= 3,
                "Two or three threshold levels are required - got %s", Arrays.toString(thresholdLevels));
        checkThresholdLevelOrder(thresholdLevels);
        this.thresholdLevels = thresholdLevels.clone();
        return this;
    }

    /**
     * Checks that the levels start at 1 and are positive and strictly decreasing.
     */
    static void checkThresholdLevelOrder(double[] thresholdLevels) {
        Preconditions.checkArgument(thresholdLevels[0] == 1.0,
                "The first threshold level must be 1.0 - got %s", thresholdLevels[0]);
        for (int i = 1; i < thresholdLevels.length; i++) {
            Preconditions.checkArgument(thresholdLevels[i] > 0 && thresholdLevels[i] < thresholdLevels[i - 1],
                    "Threshold levels must be positive and strictly decreasing - got %s", Arrays.toString(thresholdLevels));
        }
    }

    public double getC1() {
        return c1;
    }

    public CorrectionParams setC1(double c1) {
        this.c1 = c1;
        return this;
    }

    public double getQ1() {
        return q1;
    }

    public CorrectionParams setQ1(double q1) {
        this.q1 = q1;
        return this;
    }

    public double getQ2() {
        return q2;
    }

    public CorrectionParams setQ2(double q2) {
        this.q2 = q2;
        return this;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public CorrectionParams setEpsilon(double epsilon) {
        Preconditions.checkArgument(epsilon >= 0, "Epsilon must not be negative - got %s", epsilon);
        this.epsilon = epsilon;
        return this;
    }

    public double getInvalidFloor() {
        return invalidFloor;
    }

    public CorrectionParams setInvalidFloor(double invalidFloor) {
        Preconditions.checkArgument(invalidFloor >= 0, "Invalid value floor must not be negative - got %s", invalidFloor);
        this.invalidFloor = invalidFloor;
        return this;
    }

    public int getFillMaxPasses() {
        return fillMaxPasses;
    }

    public CorrectionParams setFillMaxPasses(int fillMaxPasses) {
        Preconditions.checkArgument(fillMaxPasses > 0, "Number of fill passes must be positive - got %s", fillMaxPasses);
        this.fillMaxPasses = fillMaxPasses;
        return this;
    }

    public double getFillTolerance() {
        return fillTolerance;
    }

    public CorrectionParams setFillTolerance(double fillTolerance) {
        Preconditions.checkArgument(fillTolerance >= 0, "Fill tolerance must not be negative - got %s", fillTolerance);
        this.fillTolerance = fillTolerance;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("thresholdLevels", Arrays.toString(thresholdLevels))
                .append("c1", c1)
                .append("q1", q1)
                .append("q2", q2)
                .append("epsilon", epsilon)
                .append("invalidFloor", invalidFloor)
                .append("fillMaxPasses", fillMaxPasses)
                .append("fillTolerance", fillTolerance)
                .toString();
    }
}
