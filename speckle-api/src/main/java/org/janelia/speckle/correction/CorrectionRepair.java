package org.janelia.speckle.correction;

import org.janelia.speckle.image.algorithms.RegionFill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes a corrected contrast map finite and non-negative:
 * <ol>
 *     <li>NaN and infinite corrected values are replaced by the raw contrast of the same pixel</li>
 *     <li>values that are still not finite or are below the floor are inpainted from the valid neighbors</li>
 *     <li>pixels that were never saturated (R0 = 0) keep the raw contrast, if it is finite</li>
 * </ol>
 */
public class CorrectionRepair {

    private static final Logger LOG = LoggerFactory.getLogger(CorrectionRepair.class);

    private final double invalidFloor;
    private final RegionFill regionFill;

    public CorrectionRepair(CorrectionParams params) {
        this.invalidFloor = params.getInvalidFloor();
        this.regionFill = new RegionFill(params.getFillMaxPasses(), params.getFillTolerance());
    }

    /**
     * Repair the corrected map in place.
     *
     * @param corrected        corrected contrast; overwritten with the repaired values
     * @param rawContrast      contrast at the full saturation level
     * @param saturationRatio  saturation ratio at the full saturation level
     * @param width            map width
     * @param height           map height
     * @return counts of the repaired pixels
     */
    public RepairSummary repair(double[] corrected, double[] rawContrast, double[] saturationRatio, int width, int height) {
        long nanReplaced = 0;
        long infiniteReplaced = 0;
        for (int i = 0; i < corrected.length; i++) {
            if (Double.isNaN(corrected[i])) {
                corrected[i] = rawContrast[i];
                nanReplaced++;
            } else if (Double.isInfinite(corrected[i])) {
                corrected[i] = rawContrast[i];
                infiniteReplaced++;
            }
        }

        boolean[] invalid = new boolean[corrected.length];
        long nInvalid = 0;
        for (int i = 0; i < corrected.length; i++) {
            if (!Double.isFinite(corrected[i]) || corrected[i] < invalidFloor) {
                invalid[i] = true;
                nInvalid++;
            }
        }
        if (nInvalid > 0) {
            double[] filled = regionFill.fill(corrected, invalid, width, height, 0);
            System.arraycopy(filled, 0, corrected, 0, corrected.length);
        }

        long keptRaw = 0;
        for (int i = 0; i < corrected.length; i++) {
            if (saturationRatio[i] == 0 && Double.isFinite(rawContrast[i])) {
                corrected[i] = rawContrast[i];
                keptRaw++;
            }
        }
        RepairSummary summary = new RepairSummary(nanReplaced, infiniteReplaced, nInvalid, keptRaw);
        LOG.debug("Repaired corrected contrast map: {}", summary);
        return summary;
    }
}
