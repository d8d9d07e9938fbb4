package org.janelia.speckle.cmd;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.base.Preconditions;

import org.apache.commons.lang3.StringUtils;
import org.janelia.speckle.config.Config;
import org.janelia.speckle.correction.CorrectionModel;
import org.janelia.speckle.correction.CorrectionParams;
import org.janelia.speckle.correction.CorrectionResult;
import org.janelia.speckle.correction.OverExposureCorrection;
import org.janelia.speckle.dataio.ContrastMapWriter;
import org.janelia.speckle.dataio.CorrectionSummary;
import org.janelia.speckle.dataio.FileFrameSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command that corrects the speckle contrast of an over-exposed frame sequence.
 */
class CorrectOverExposureCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(CorrectOverExposureCmd.class);

    @Parameters(commandDescription = "Compute the raw and the over-exposure corrected speckle contrast of a frame sequence")
    static class CorrectOverExposureArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, required = true, variableArity = true,
                description = "Frame files or directories; every slice of a stack is a frame")
        List<String> inputs;

        @Parameter(names = "--pattern", description = "Glob used to select the frame files from the input directories")
        String filePattern;

        @Parameter(names = {"--window-size", "-N"}, description = "Size of the window used for the local statistics")
        Integer windowSize;

        @Parameter(names = "--saturation", description = "Sensor saturation level, e.g. 255 for 8-bit frames")
        Double saturationLevel;

        @Parameter(names = "--iterations", description = "1 for the one step correction, 2 for the two step correction")
        Integer iterations;

        @Parameter(names = "--output-prefix", description = "Prefix of the output file names")
        String outputPrefix = "speckle";

        CorrectOverExposureArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Override
        List<String> validate() {
            List<String> errors = super.validate();
            if (inputs == null || inputs.isEmpty()) {
                errors.add("At least one input is required");
            }
            if (windowSize != null && windowSize <= 0) {
                errors.add("Window size must be a positive integer - current value is " + windowSize);
            }
            if (saturationLevel != null && !(saturationLevel > 0)) {
                errors.add("Saturation level must be a positive number - current value is " + saturationLevel);
            }
            if (StringUtils.isBlank(outputPrefix)) {
                errors.add("Output prefix must not be blank");
            }
            return errors;
        }
    }

    private final CorrectOverExposureArgs args;

    CorrectOverExposureCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new CorrectOverExposureArgs(commonArgs);
    }

    @Override
    CorrectOverExposureArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        Config config = getConfig();
        int windowSize = args.windowSize != null
                ? args.windowSize
                : config.getIntegerPropertyValue("Correction.WindowSize", 7);
        double saturationLevel = args.saturationLevel != null
                ? args.saturationLevel
                : config.getDoublePropertyValue("Correction.SaturationLevel", 255);
        int iterations = args.iterations != null
                ? args.iterations
                : config.getIntegerPropertyValue("Correction.Iterations", 2);
        Preconditions.checkArgument(windowSize > 0, "Window size must be a positive integer - current value is %s", windowSize);
        Preconditions.checkArgument(saturationLevel > 0, "Saturation level must be a positive number - current value is %s", saturationLevel);
        CorrectionModel.forIterations(iterations);
        CorrectionParams params = createCorrectionParams(config);

        long startTime = System.currentTimeMillis();
        FileFrameSource frames = FileFrameSource.fromInputs(
                args.inputs,
                args.filePattern != null ? args.filePattern : config.getStringPropertyValue("Input.Pattern", "*.tif"),
                config.getIntegerPropertyValue("Input.CachedStacks", 4));
        ExecutorService executorService = CmdUtils.createCmdExecutor(args.commonArgs);
        try {
            CorrectionResult result = new OverExposureCorrection(params, executorService, CmdUtils.getTaskConcurrency(args.commonArgs))
                    .correct(frames, windowSize, saturationLevel, iterations);
            checkMemoryUsage();
            ContrastMapWriter writer = new ContrastMapWriter(args.getOutputDir(), args.outputPrefix, !args.commonArgs.noPrettyPrint);
            List<Path> outputFiles = writer.write(result,
                    CorrectionSummary.of(result, args.inputs, windowSize, saturationLevel, params));
            LOG.info("Finished correcting {} frames in {}s - wrote {} files - memory usage {}M out of {}M",
                    result.getFrameCount(),
                    (System.currentTimeMillis() - startTime) / 1000.,
                    outputFiles.size(),
                    usedMemoryInMB(),
                    (maxMemory / _1M));
        } finally {
            executorService.shutdownNow();
        }
    }

    static CorrectionParams createCorrectionParams(Config config) {
        return new CorrectionParams()
                .setThresholdLevels(config.getDoubleArrayPropertyValue("Correction.ThresholdLevels", CorrectionParams.DEFAULT_THRESHOLD_LEVELS))
                .setC1(config.getDoublePropertyValue("Correction.C1", CorrectionParams.DEFAULT_C1))
                .setQ1(config.getDoublePropertyValue("Correction.Q1", CorrectionParams.DEFAULT_Q1))
                .setQ2(config.getDoublePropertyValue("Correction.Q2", CorrectionParams.DEFAULT_Q2))
                .setEpsilon(config.getDoublePropertyValue("Correction.Epsilon", CorrectionParams.DEFAULT_EPSILON))
                .setInvalidFloor(config.getDoublePropertyValue("Correction.InvalidFloor", CorrectionParams.DEFAULT_INVALID_FLOOR))
                .setFillMaxPasses(config.getIntegerPropertyValue("RegionFill.MaxPasses", CorrectionParams.DEFAULT_FILL_MAX_PASSES))
                .setFillTolerance(config.getDoublePropertyValue("RegionFill.Tolerance", CorrectionParams.DEFAULT_FILL_TOLERANCE));
    }
}
