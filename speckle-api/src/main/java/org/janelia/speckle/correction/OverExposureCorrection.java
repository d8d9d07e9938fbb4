package org.janelia.speckle.correction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import org.janelia.speckle.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correction of the laser speckle contrast of over-exposed image sequences.
 *
 * Every frame is artificially saturated at each threshold level of the selected model and its local
 * contrast and local saturation ratio over an NxN window are averaged over the sequence. The model
 * then estimates the contrast without saturation and the estimate is repaired so that the corrected
 * map is finite and non-negative everywhere.
 */
public class OverExposureCorrection {

    private static final Logger LOG = LoggerFactory.getLogger(OverExposureCorrection.class);

    private final CorrectionParams params;
    private final ExecutorService executorService;
    private final int parallelism;

    public OverExposureCorrection() {
        this(new CorrectionParams());
    }

    public OverExposureCorrection(CorrectionParams params) {
        this(params, null, 1);
    }

    /**
     * @param params          calibration parameters
     * @param executorService if not null frames are processed by up to parallelism concurrent tasks
     * @param parallelism     maximum number of concurrent tasks
     */
    public OverExposureCorrection(CorrectionParams params, @Nullable ExecutorService executorService, int parallelism) {
        Preconditions.checkArgument(params != null, "Correction parameters are required");
        this.params = params;
        this.executorService = executorService;
        this.parallelism = Math.max(1, parallelism);
    }

    public CorrectionParams getParams() {
        return params;
    }

    public <T extends RealType<T>> CorrectionResult correct(List<? extends RandomAccessibleInterval<T>> frames,
                                                            int windowSize,
                                                            double saturationLevel,
                                                            int iterations) {
        Preconditions.checkArgument(frames != null, "Frames sequence is required");
        return correct(FrameSource.fromList(frames), windowSize, saturationLevel, iterations);
    }

    /**
     * @param frames          frame sequence
     * @param windowSize      N, the window extent used for the local statistics
     * @param saturationLevel value at or above which a pixel is saturated, e.g. 255 for 8-bit frames
     * @param iterations      1 for the one step correction, 2 for the two step correction
     * @return raw contrast, corrected contrast and saturation ratio maps
     * @throws IllegalArgumentException if the arguments or the frames are not valid
     */
    public <T extends RealType<T>> CorrectionResult correct(FrameSource<T> frames,
                                                            int windowSize,
                                                            double saturationLevel,
                                                            int iterations) {
        Preconditions.checkArgument(frames != null && !frames.isEmpty(), "The frames sequence is empty");
        Preconditions.checkArgument(windowSize > 0, "Window size must be a positive integer - current value is %s", windowSize);
        Preconditions.checkArgument(saturationLevel > 0 && Double.isFinite(saturationLevel),
                "Saturation level must be a positive number - current value is %s", saturationLevel);
        CorrectionModel correctionModel = CorrectionModel.forIterations(iterations);
        ExtrapolationModel extrapolationModel = correctionModel.createModel(params);

        long[] shape = checkFrameShape(frames.getFrame(0));
        int width = (int) shape[0];
        int height = (int) shape[1];

        LOG.info("Correct over-exposure of {} frames of {}x{} with N={}, saturation level={}, model={}, {}",
                frames.size(), width, height, windowSize, saturationLevel, correctionModel, params);

        long startTime = System.currentTimeMillis();
        ThresholdSweep sweep = sweepFrames(frames, width, height, windowSize, saturationLevel, extrapolationModel.getThresholdLevels());
        ThresholdSweepResult sweepResult = sweep.average();
        LOG.info("Computed contrast and saturation maps for {} frames at {} threshold levels in {}s",
                sweepResult.getFrameCount(), sweepResult.getLevelCount(), (System.currentTimeMillis() - startTime) / 1000.);

        long correctionStartTime = System.currentTimeMillis();
        double[] corrected = extrapolationModel.correct(sweepResult);
        double[] rawContrast = sweepResult.getContrast(0);
        double[] saturationRatio = sweepResult.getSaturationRatio(0);
        RepairSummary repairSummary = new CorrectionRepair(params).repair(corrected, rawContrast, saturationRatio, width, height);
        LOG.info("Corrected contrast map in {}s - repairs: {}",
                (System.currentTimeMillis() - correctionStartTime) / 1000., repairSummary);

        return new CorrectionResult(width, height, sweepResult.getFrameCount(),
                correctionModel,
                rawContrast,
                corrected,
                saturationRatio,
                repairSummary);
    }

    /**
     * Compute the threshold sweep only, without extrapolation.
     */
    public <T extends RealType<T>> ThresholdSweepResult sweep(FrameSource<T> frames,
                                                              int windowSize,
                                                              double saturationLevel,
                                                              double[] thresholdLevels) {
        Preconditions.checkArgument(frames != null && !frames.isEmpty(), "The frames sequence is empty");
        Preconditions.checkArgument(windowSize > 0, "Window size must be a positive integer - current value is %s", windowSize);
        Preconditions.checkArgument(saturationLevel > 0 && Double.isFinite(saturationLevel),
                "Saturation level must be a positive number - current value is %s", saturationLevel);
        Preconditions.checkArgument(thresholdLevels != null && thresholdLevels.length > 0, "At least one threshold level is required");
        CorrectionParams.checkThresholdLevelOrder(thresholdLevels);
        long[] shape = checkFrameShape(frames.getFrame(0));
        return sweepFrames(frames, (int) shape[0], (int) shape[1],
                windowSize, saturationLevel, thresholdLevels.clone()).average();
    }

    private static <T extends RealType<T>> long[] checkFrameShape(RandomAccessibleInterval<T> firstFrame) {
        Preconditions.checkArgument(firstFrame != null && firstFrame.numDimensions() == 2,
                "Frames must be 2D single channel images");
        long[] shape = firstFrame.dimensionsAsLongArray();
        Preconditions.checkArgument(ImageAccessUtils.getMaxSize(shape) <= Integer.MAX_VALUE,
                "Frames of size %s are too large", Arrays.toString(shape));
        return shape;
    }

    private <T extends RealType<T>> ThresholdSweep sweepFrames(FrameSource<T> frames,
                                                               int width, int height,
                                                               int windowSize,
                                                               double saturationLevel,
                                                               double[] thresholdLevels) {
        int nFrames = frames.size();
        int nTasks = executorService == null ? 1 : Math.min(parallelism, nFrames);
        if (nTasks == 1) {
            ThresholdSweep sweep = new ThresholdSweep(width, height, windowSize, saturationLevel, thresholdLevels);
            for (int i = 0; i < nFrames; i++) {
                sweep.addFrame(loadFrame(frames, i, width, height));
                LOG.debug("Processed frame {} of {}", i + 1, nFrames);
            }
            return sweep;
        }
        int framesPerTask = (nFrames + nTasks - 1) / nTasks;
        List<Callable<ThresholdSweep>> sweepTasks = new ArrayList<>();
        for (int t = 0; t < nTasks; t++) {
            int from = t * framesPerTask;
            int to = Math.min(nFrames, from + framesPerTask);
            if (from >= to) {
                break;
            }
            sweepTasks.add(() -> {
                ThresholdSweep partialSweep = new ThresholdSweep(width, height, windowSize, saturationLevel, thresholdLevels);
                for (int i = from; i < to; i++) {
                    partialSweep.addFrame(loadFrame(frames, i, width, height));
                    LOG.debug("Processed frame {} of {}", i + 1, nFrames);
                }
                return partialSweep;
            });
        }
        LOG.debug("Process {} frames in {} tasks", nFrames, sweepTasks.size());
        ThresholdSweep sweep = new ThresholdSweep(width, height, windowSize, saturationLevel, thresholdLevels);
        try {
            for (Future<ThresholdSweep> partialSweep : executorService.invokeAll(sweepTasks)) {
                sweep.merge(partialSweep.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        }
        return sweep;
    }

    private <T extends RealType<T>> double[] loadFrame(FrameSource<T> frames, int index, int width, int height) {
        RandomAccessibleInterval<T> frame = frames.getFrame(index);
        Preconditions.checkArgument(frame != null, "Frame %s could not be loaded", index);
        Preconditions.checkArgument(frame.numDimensions() == 2 && frame.dimension(0) == width && frame.dimension(1) == height,
                "Frame %s has shape %s but all frames must be %sx%s",
                index, Arrays.toString(frame.dimensionsAsLongArray()), width, height);
        return ImageAccessUtils.toDoubleArray(frame);
    }
}
