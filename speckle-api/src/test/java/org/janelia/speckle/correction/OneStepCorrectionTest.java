package org.janelia.speckle.correction;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class OneStepCorrectionTest {

    private final OneStepCorrection correction = new OneStepCorrection(new CorrectionParams());

    @Test
    public void usesOnlyTheFullSaturationLevel() {
        assertArrayEquals(new double[] {1.0}, correction.getThresholdLevels(), 0);
    }

    @Test
    public void unsaturatedContrastIsUnchanged() {
        assertEquals(0.37, correction.correctContrast(0.37, 0), 1e-15);
    }

    @Test
    public void rationalCorrection() {
        double r0 = 0.5;
        double expected = 0.4 / 0.5 * (1 - 0.8 * r0) / (1 - 0.85 * r0 + 0.25 * r0 * r0);
        assertEquals(expected, correction.correctContrast(0.4, r0), 1e-12);
    }

    @Test
    public void correctionIncreasesSaturatedContrast() {
        for (double r0 = 0.05; r0 < 1; r0 += 0.05) {
            assertTrue("Saturation ratio " + r0, correction.correctContrast(0.3, r0) > 0.3);
        }
    }

    @Test
    public void customCoefficients() {
        OneStepCorrection linearCorrection = new OneStepCorrection(new CorrectionParams().setC1(0).setQ1(0).setQ2(0).setEpsilon(0));
        assertEquals(0.8, linearCorrection.correctContrast(0.4, 0.5), 1e-15);
    }

    @Test
    public void correctMaps() {
        ThresholdSweepResult sweep = new ThresholdSweepResult(2, 1, 1,
                new double[] {1.0},
                new double[][] {{0, 0.5}},
                new double[][] {{0.2, 0.4}});
        double[] corrected = correction.correct(sweep);
        assertEquals(0.2, corrected[0], 1e-15);
        assertEquals(correction.correctContrast(0.4, 0.5), corrected[1], 0);
    }
}
