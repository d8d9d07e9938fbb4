package org.janelia.speckle.correction;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.speckle.image.ImageAccessUtils;

/**
 * Sequence averaged saturation ratio and contrast maps, one per threshold level.
 * Level 0 is always the full saturation level. The map getters return copies.
 */
public class ThresholdSweepResult {

    private final int width;
    private final int height;
    private final int frameCount;
    private final double[] thresholdLevels;
    private final double[][] saturationRatios;
    private final double[][] contrasts;

    public ThresholdSweepResult(int width, int height, int frameCount,
                                double[] thresholdLevels,
                                double[][] saturationRatios,
                                double[][] contrasts) {
        if (saturationRatios.length != thresholdLevels.length || contrasts.length != thresholdLevels.length) {
            throw new IllegalArgumentException("Expected one saturation and one contrast map for each of the " +
                    thresholdLevels.length + " threshold levels");
        }
        this.width = width;
        this.height = height;
        this.frameCount = frameCount;
        this.thresholdLevels = thresholdLevels.clone();
        this.saturationRatios = saturationRatios;
        this.contrasts = contrasts;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return width * height;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public int getLevelCount() {
        return thresholdLevels.length;
    }

    public double getThresholdLevel(int level) {
        return thresholdLevels[level];
    }

    public double[] getSaturationRatio(int level) {
        return saturationRatios[level].clone();
    }

    public double[] getContrast(int level) {
        return contrasts[level].clone();
    }

    public Img<DoubleType> getSaturationRatioImage(int level) {
        return ImageAccessUtils.wrapAsImg(saturationRatios[level].clone(), width, height);
    }

    public Img<DoubleType> getContrastImage(int level) {
        return ImageAccessUtils.wrapAsImg(contrasts[level].clone(), width, height);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("width", width)
                .append("height", height)
                .append("frameCount", frameCount)
                .append("levels", thresholdLevels.length)
                .toString();
    }
}
