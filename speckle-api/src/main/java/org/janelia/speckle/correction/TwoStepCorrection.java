package org.janelia.speckle.correction;

/**
 * Extrapolates the squared contrast to zero saturation ratio assuming it varies linearly
 * with the saturation ratio between neighboring threshold levels:
 * <pre>
 *     KA = K0^2 - R0 * (K1^2 - K0^2) / (R1 - R0 + eps)
 * </pre>
 * With a third level the same extrapolation from levels 1 and 2 gives KB and the two are extrapolated again:
 * <pre>
 *     KC = |KA - R0 * (KB - KA) / (R1 - R0 + eps)|
 * </pre>
 * The result, KA or KC, gets the residual quadratic correction KD = K + R0 / (1 + K) * K^2
 * and the corrected contrast is sqrt(KD).
 */
public class TwoStepCorrection implements ExtrapolationModel {

    private final double[] thresholdLevels;
    private final double epsilon;

    public TwoStepCorrection(CorrectionParams params) {
        this.thresholdLevels = params.getThresholdLevels();
        this.epsilon = params.getEpsilon();
    }

    @Override
    public double[] getThresholdLevels() {
        return thresholdLevels.clone();
    }

    @Override
    public double[] correct(ThresholdSweepResult sweep) {
        if (sweep.getLevelCount() < 2) {
            throw new IllegalArgumentException("Two step correction requires at least two threshold levels - sweep has " + sweep.getLevelCount());
        }
        boolean nested = sweep.getLevelCount() > 2;
        double[] k0 = sweep.getContrast(0);
        double[] r0 = sweep.getSaturationRatio(0);
        double[] k1 = sweep.getContrast(1);
        double[] r1 = sweep.getSaturationRatio(1);
        double[] k2 = nested ? sweep.getContrast(2) : null;
        double[] r2 = nested ? sweep.getSaturationRatio(2) : null;

        double[] corrected = new double[k0.length];
        for (int i = 0; i < corrected.length; i++) {
            double kappa0 = k0[i] * k0[i];
            double kappa1 = k1[i] * k1[i];
            double extrapolated;
            if (nested) {
                double kappa2 = k2[i] * k2[i];
                extrapolated = extrapolateTwice(kappa0, r0[i], kappa1, r1[i], kappa2, r2[i]);
            } else {
                extrapolated = extrapolate(kappa0, r0[i], kappa1, r1[i]);
            }
            corrected[i] = Math.sqrt(residualCorrection(extrapolated, r0[i]));
        }
        return corrected;
    }

    /**
     * Linear extrapolation of the squared contrast to zero saturation ratio.
     */
    double extrapolate(double kappa0, double r0, double kappa1, double r1) {
        return kappa0 - r0 * (kappa1 - kappa0) / (r1 - r0 + epsilon);
    }

    /**
     * Extrapolation of the extrapolated values of levels (0, 1) and (1, 2). The finite difference
     * slope may change sign near an inflection of the squared contrast curve so only the magnitude is kept.
     */
    double extrapolateTwice(double kappa0, double r0, double kappa1, double r1, double kappa2, double r2) {
        double ka = extrapolate(kappa0, r0, kappa1, r1);
        double kb = extrapolate(kappa1, r1, kappa2, r2);
        return Math.abs(signedNestedExtrapolation(ka, kb, r0, r1));
    }

    double signedNestedExtrapolation(double ka, double kb, double r0, double r1) {
        return ka - r0 * (kb - ka) / (r1 - r0 + epsilon);
    }

    double residualCorrection(double kappa, double r0) {
        return kappa + r0 / (1 + kappa) * kappa * kappa;
    }
}
