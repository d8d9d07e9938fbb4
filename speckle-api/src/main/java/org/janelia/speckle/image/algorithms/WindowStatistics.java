package org.janelia.speckle.image.algorithms;

import com.google.common.base.Preconditions;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.speckle.image.ImageAccessUtils;

/**
 * Local mean and local standard deviation over an NxN window centered on each pixel.
 *
 * The window of a pixel p spans [p - (N-1)/2, p + N/2] on each axis, which is centered for odd N.
 * Near the border the window is cropped to the image and the statistics are normalized by the
 * number of pixels inside the image. The mean, the mean of squares and therefore the standard
 * deviation all use the same cropped window, so the output has the same size as the input and a
 * constant image has the same mean and a zero standard deviation everywhere.
 * The standard deviation is the population (biased) estimate.
 */
public class WindowStatistics {

    /**
     * Variances below this fraction of the mean of squares are round-off of the window sums and are set to 0.
     */
    static final double VARIANCE_ROUNDOFF = 1e-12;

    private final int width;
    private final int height;
    private final double[] mean;
    private final double[] std;

    private WindowStatistics(int width, int height, double[] mean, double[] std) {
        this.width = width;
        this.height = height;
        this.mean = mean;
        this.std = std;
    }

    public static <T extends RealType<T>> WindowStatistics compute(RandomAccessibleInterval<T> image, int windowSize) {
        Preconditions.checkArgument(image.numDimensions() == 2,
                "Only 2D images are supported - image has %s dimensions", image.numDimensions());
        return compute(ImageAccessUtils.toDoubleArray(image), (int) image.dimension(0), (int) image.dimension(1), windowSize);
    }

    public static WindowStatistics compute(double[] values, int width, int height, int windowSize) {
        checkWindowArgs(values, width, height, windowSize);
        double[] squares = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            squares[i] = values[i] * values[i];
        }
        double[] mean = windowMean(values, width, height, windowSize);
        double[] meanOfSquares = windowMean(squares, width, height, windowSize);
        double[] std = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double var = meanOfSquares[i] - mean[i] * mean[i];
            std[i] = var <= VARIANCE_ROUNDOFF * meanOfSquares[i] ? 0 : Math.sqrt(var);
        }
        return new WindowStatistics(width, height, mean, std);
    }

    /**
     * Box filter over the window cropped to the image, normalized by the number of pixels inside the image.
     *
     * @return the windowed mean of the values
     */
    public static double[] windowMean(double[] values, int width, int height, int windowSize) {
        checkWindowArgs(values, width, height, windowSize);
        double[] sums = new double[values.length];
        Img<DoubleType> rowSums = ArrayImgs.doubles(width, height);
        boxSumInX(ImageAccessUtils.wrapAsImg(values, width, height), rowSums, windowSize);
        boxSumInY(rowSums, ImageAccessUtils.wrapAsImg(sums, width, height), windowSize);

        int lo = (windowSize - 1) / 2;
        int hi = windowSize / 2;
        double[] mean = new double[values.length];
        for (int y = 0; y < height; y++) {
            int ny = Math.min(height - 1, y + hi) - Math.max(0, y - lo) + 1;
            for (int x = 0; x < width; x++) {
                int nx = Math.min(width - 1, x + hi) - Math.max(0, x - lo) + 1;
                int i = y * width + x;
                mean[i] = sums[i] / ((double) nx * ny);
            }
        }
        return mean;
    }

    private static void checkWindowArgs(double[] values, int width, int height, int windowSize) {
        Preconditions.checkArgument(windowSize > 0, "Window size must be a positive integer - current value is %s", windowSize);
        Preconditions.checkArgument(width > 0 && height > 0, "Invalid image size %sx%s", width, height);
        Preconditions.checkArgument(values.length == width * height,
                "Array of length %s does not match a %sx%s image", values.length, width, height);
    }

    /**
     * Sum over the window cropped to the image along the x axis. Both intervals start at the origin.
     */
    public static <T extends RealType<T>> void boxSumInX(RandomAccessibleInterval<T> input,
                                                         RandomAccessibleInterval<DoubleType> output,
                                                         int windowSize) {
        long width = input.dimension(0);
        long height = input.dimension(1);
        int lo = (windowSize - 1) / 2;
        int hi = windowSize / 2;

        RandomAccess<T> inputRA = input.randomAccess();
        RandomAccess<DoubleType> outputRA = output.randomAccess();

        for (int y = 0; y < height; y++) {
            inputRA.setPosition(y, 1);
            outputRA.setPosition(y, 1);
            for (int x = 0; x < width; x++) {
                double s = 0;
                for (long xx = Math.max(0, x - lo); xx <= Math.min(width - 1, x + hi); xx++) {
                    inputRA.setPosition(xx, 0);
                    s += inputRA.get().getRealDouble();
                }
                outputRA.setPosition(x, 0);
                outputRA.get().set(s);
            }
        }
    }

    /**
     * Sum over the window cropped to the image along the y axis. Both intervals start at the origin.
     */
    public static <T extends RealType<T>> void boxSumInY(RandomAccessibleInterval<T> input,
                                                         RandomAccessibleInterval<DoubleType> output,
                                                         int windowSize) {
        long width = input.dimension(0);
        long height = input.dimension(1);
        int lo = (windowSize - 1) / 2;
        int hi = windowSize / 2;

        RandomAccess<T> inputRA = input.randomAccess();
        RandomAccess<DoubleType> outputRA = output.randomAccess();

        for (int x = 0; x < width; x++) {
            inputRA.setPosition(x, 0);
            outputRA.setPosition(x, 0);
            for (int y = 0; y < height; y++) {
                double s = 0;
                for (long yy = Math.max(0, y - lo); yy <= Math.min(height - 1, y + hi); yy++) {
                    inputRA.setPosition(yy, 1);
                    s += inputRA.get().getRealDouble();
                }
                outputRA.setPosition(y, 1);
                outputRA.get().set(s);
            }
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double[] getMean() {
        return mean;
    }

    public double[] getStd() {
        return std;
    }

    public Img<DoubleType> getMeanImage() {
        return ImageAccessUtils.wrapAsImg(mean, width, height);
    }

    public Img<DoubleType> getStdImage() {
        return ImageAccessUtils.wrapAsImg(std, width, height);
    }

    /**
     * Local contrast std / mean. A zero mean yields NaN (zero std) or infinity, which are left
     * for the caller to handle.
     */
    public double[] getContrast() {
        double[] contrast = new double[mean.length];
        for (int i = 0; i < contrast.length; i++) {
            contrast[i] = std[i] / mean[i];
        }
        return contrast;
    }
}
