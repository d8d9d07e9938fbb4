package org.janelia.speckle.correction;

/**
 * Over-exposure correction variants.
 */
public enum CorrectionModel {
    /**
     * Rational correction of the contrast measured at the full saturation level.
     */
    ONE_STEP(1) {
        @Override
        public ExtrapolationModel createModel(CorrectionParams params) {
            return new OneStepCorrection(params);
        }
    },
    /**
     * Linear extrapolation of the squared contrast to zero saturation, nested when three levels are used.
     */
    TWO_STEP(2) {
        @Override
        public ExtrapolationModel createModel(CorrectionParams params) {
            return new TwoStepCorrection(params);
        }
    };

    private final int iterations;

    CorrectionModel(int iterations) {
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }

    public abstract ExtrapolationModel createModel(CorrectionParams params);

    public static CorrectionModel forIterations(int iterations) {
        for (CorrectionModel m : values()) {
            if (m.iterations == iterations) {
                return m;
            }
        }
        throw new IllegalArgumentException("Invalid number of correction iterations: " + iterations + " - valid values are 1 or 2");
    }
}
