package org.janelia.speckle.correction;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class CorrectionRepairTest {

    private final CorrectionRepair repair = new CorrectionRepair(new CorrectionParams());

    @Test
    public void undefinedValuesAreReplacedByTheRawContrast() {
        double[] corrected = {Double.NaN, 0.5, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
        double[] raw = {0.3, 0.4, 0.2, 0.1};
        double[] saturationRatio = {0.5, 0.5, 0.5, 0.5};
        RepairSummary summary = repair.repair(corrected, raw, saturationRatio, 4, 1);
        assertArrayEquals(new double[] {0.3, 0.5, 0.2, 0.1}, corrected, 0);
        assertEquals(1, summary.getNanReplaced());
        assertEquals(2, summary.getInfiniteReplaced());
        assertEquals(0, summary.getInpainted());
        assertEquals(0, summary.getKeptRaw());
    }

    @Test
    public void valuesBelowTheFloorAreInpainted() {
        double[] corrected = {0.2, 0.001, -0.5, 0.5};
        double[] raw = {0.1, 0.1, 0.1, 0.1};
        double[] saturationRatio = {0.5, 0.5, 0.5, 0.5};
        RepairSummary summary = repair.repair(corrected, raw, saturationRatio, 4, 1);
        assertEquals(0.3, corrected[1], 1e-5);
        assertEquals(0.4, corrected[2], 1e-5);
        assertEquals(2, summary.getInpainted());
    }

    @Test
    public void undefinedRawContrastIsInpainted() {
        double[] corrected = {0.2, Double.NaN, 0.4};
        double[] raw = {0.2, Double.NaN, 0.4};
        double[] saturationRatio = {0.1, 0.1, 0.1};
        RepairSummary summary = repair.repair(corrected, raw, saturationRatio, 3, 1);
        assertEquals(0.3, corrected[1], 1e-5);
        assertEquals(1, summary.getNanReplaced());
        assertEquals(1, summary.getInpainted());
    }

    @Test
    public void unsaturatedPixelsKeepTheRawContrast() {
        double[] corrected = {0.5, 0.5, 0.5};
        double[] raw = {0.2, Double.NaN, 0.3};
        double[] saturationRatio = {0, 0, 0.2};
        RepairSummary summary = repair.repair(corrected, raw, saturationRatio, 3, 1);
        assertArrayEquals(new double[] {0.2, 0.5, 0.5}, corrected, 0);
        assertEquals(1, summary.getKeptRaw());
    }

    @Test
    public void allInvalidValuesAreZeroed() {
        double[] corrected = {0, 0, 0, 0};
        double[] raw = {0, 0, 0, 0};
        double[] saturationRatio = {1, 1, 1, 1};
        RepairSummary summary = repair.repair(corrected, raw, saturationRatio, 2, 2);
        assertArrayEquals(new double[] {0, 0, 0, 0}, corrected, 0);
        assertEquals(4, summary.getInpainted());
    }

    @Test
    public void wideDivergedBandIsInterpolatedBetweenValidColumns() {
        int width = 302;
        int height = 3;
        double[] corrected = new double[width * height];
        double[] raw = new double[width * height];
        double[] saturationRatio = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                corrected[i] = x == 0 ? 0.1 : (x == width - 1 ? 0.5 : 0.001);
                raw[i] = 0.05;
                saturationRatio[i] = 1;
            }
        }
        RepairSummary summary = repair.repair(corrected, raw, saturationRatio, width, height);
        assertEquals(300 * height, summary.getInpainted());
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                assertEquals("Pixel (" + x + "," + y + ")", 0.1 + 0.4 * x / (width - 1), corrected[y * width + x], 1e-3);
            }
        }
        assertEquals(0.19966777, corrected[width + 75], 1e-3);
    }
}
