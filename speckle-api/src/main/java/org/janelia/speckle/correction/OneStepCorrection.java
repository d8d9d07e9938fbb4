package org.janelia.speckle.correction;

/**
 * Corrects the contrast of the full saturation level only:
 * <pre>
 *     K = K0 / (1 - R0 + eps) * (1 + c1 * R0) / (1 + q1 * R0 + q2 * R0^2)
 * </pre>
 */
public class OneStepCorrection implements ExtrapolationModel {

    private static final double[] THRESHOLD_LEVELS = {1.0};

    private final double c1;
    private final double q1;
    private final double q2;
    private final double epsilon;

    public OneStepCorrection(CorrectionParams params) {
        this.c1 = params.getC1();
        this.q1 = params.getQ1();
        this.q2 = params.getQ2();
        this.epsilon = params.getEpsilon();
    }

    @Override
    public double[] getThresholdLevels() {
        return THRESHOLD_LEVELS.clone();
    }

    @Override
    public double[] correct(ThresholdSweepResult sweep) {
        double[] k0 = sweep.getContrast(0);
        double[] r0 = sweep.getSaturationRatio(0);
        double[] corrected = new double[k0.length];
        for (int i = 0; i < corrected.length; i++) {
            corrected[i] = correctContrast(k0[i], r0[i]);
        }
        return corrected;
    }

    double correctContrast(double k0, double r0) {
        return k0 / (1 - r0 + epsilon) * (1 + c1 * r0) / (1 + q1 * r0 + q2 * r0 * r0);
    }
}
