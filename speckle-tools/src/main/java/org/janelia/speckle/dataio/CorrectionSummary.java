package org.janelia.speckle.dataio;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.speckle.correction.CorrectionParams;
import org.janelia.speckle.correction.CorrectionResult;
import org.janelia.speckle.correction.RepairSummary;

/**
 * JSON summary of a correction run.
 */
public class CorrectionSummary {

    public static CorrectionSummary of(CorrectionResult result,
                                       List<String> inputs,
                                       int windowSize,
                                       double saturationLevel,
                                       CorrectionParams params) {
        CorrectionSummary summary = new CorrectionSummary();
        summary.inputs = new ArrayList<>(inputs);
        summary.frameCount = result.getFrameCount();
        summary.width = result.getWidth();
        summary.height = result.getHeight();
        summary.windowSize = windowSize;
        summary.saturationLevel = saturationLevel;
        summary.iterations = result.getModel().getIterations();
        summary.model = result.getModel().name();
        summary.params = params;
        summary.repairs = result.getRepairSummary();
        summary.maps.put("K_raw", MapStatistics.of(result.getRawContrastValues()));
        summary.maps.put("K_corrected", MapStatistics.of(result.getCorrectedContrastValues()));
        summary.maps.put("R_saturation", MapStatistics.of(result.getSaturationRatioValues()));
        return summary;
    }

    private List<String> inputs;
    private int frameCount;
    private int width;
    private int height;
    private int windowSize;
    private double saturationLevel;
    private int iterations;
    private String model;
    private CorrectionParams params;
    private RepairSummary repairs;
    private final Map<String, MapStatistics> maps = new LinkedHashMap<>();

    public List<String> getInputs() {
        return inputs;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getSaturationLevel() {
        return saturationLevel;
    }

    public int getIterations() {
        return iterations;
    }

    public String getModel() {
        return model;
    }

    public CorrectionParams getParams() {
        return params;
    }

    public RepairSummary getRepairs() {
        return repairs;
    }

    public Map<String, MapStatistics> getMaps() {
        return maps;
    }
}
