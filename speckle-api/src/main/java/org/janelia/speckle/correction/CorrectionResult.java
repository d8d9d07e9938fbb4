package org.janelia.speckle.correction;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.speckle.image.ImageAccessUtils;

/**
 * Result of an over-exposure correction run. All maps have the frame dimensions and the contrast
 * maps are in contrast units. Every getter returns a copy of the map so the result cannot be changed
 * by its readers.
 */
public class CorrectionResult {

    private final int width;
    private final int height;
    private final int frameCount;
    private final CorrectionModel model;
    private final double[] rawContrast;
    private final double[] correctedContrast;
    private final double[] saturationRatio;
    private final RepairSummary repairSummary;

    CorrectionResult(int width, int height, int frameCount,
                     CorrectionModel model,
                     double[] rawContrast,
                     double[] correctedContrast,
                     double[] saturationRatio,
                     RepairSummary repairSummary) {
        this.width = width;
        this.height = height;
        this.frameCount = frameCount;
        this.model = model;
        this.rawContrast = rawContrast;
        this.correctedContrast = correctedContrast;
        this.saturationRatio = saturationRatio;
        this.repairSummary = repairSummary;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public CorrectionModel getModel() {
        return model;
    }

    /**
     * @return sequence averaged contrast without any correction (K_raw)
     */
    public Img<DoubleType> getRawContrast() {
        return ImageAccessUtils.wrapAsImg(rawContrast.clone(), width, height);
    }

    /**
     * @return over-exposure corrected contrast (K_corrected), finite and non-negative everywhere
     */
    public Img<DoubleType> getCorrectedContrast() {
        return ImageAccessUtils.wrapAsImg(correctedContrast.clone(), width, height);
    }

    /**
     * @return sequence averaged ratio of saturated pixels in the window, in [0, 1]
     */
    public Img<DoubleType> getSaturationRatio() {
        return ImageAccessUtils.wrapAsImg(saturationRatio.clone(), width, height);
    }

    public double[] getRawContrastValues() {
        return rawContrast.clone();
    }

    public double[] getCorrectedContrastValues() {
        return correctedContrast.clone();
    }

    public double[] getSaturationRatioValues() {
        return saturationRatio.clone();
    }

    public RepairSummary getRepairSummary() {
        return repairSummary;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("width", width)
                .append("height", height)
                .append("frameCount", frameCount)
                .append("model", model)
                .append("repairSummary", repairSummary)
                .toString();
    }
}
