package org.janelia.speckle.image.algorithms;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills masked pixels by smooth interpolation from the surrounding unmasked pixels.
 *
 * The masked values are the solution of the discrete Laplace equation (4-neighborhood) with the
 * unmasked pixels acting as fixed boundary values and a zero-flux condition at the image border.
 * The solver starts from the average of the unmasked pixels adjacent to the mask and runs successive
 * over-relaxation passes, with the relaxation factor derived from the extent of the masked region,
 * until the largest update of a pass drops below the tolerance times the range of the boundary
 * values or the pass limit is reached. The solution is a convex combination of boundary values so
 * it never leaves their range.
 */
public class RegionFill {

    private static final Logger LOG = LoggerFactory.getLogger(RegionFill.class);

    private final int maxPasses;
    private final double tolerance;

    public RegionFill(int maxPasses, double tolerance) {
        Preconditions.checkArgument(maxPasses > 0, "The number of passes must be positive - current value is %s", maxPasses);
        Preconditions.checkArgument(tolerance >= 0, "Tolerance must not be negative - current value is %s", tolerance);
        this.maxPasses = maxPasses;
        this.tolerance = tolerance;
    }

    /**
     * @param values        pixel values in row-major order; masked values are ignored and may be NaN
     * @param mask          true for the pixels that must be filled
     * @param width         image width
     * @param height        image height
     * @param fallbackValue value used for every masked pixel when no pixel is left unmasked
     * @return a new array with the unmasked values copied and the masked ones filled
     */
    public double[] fill(double[] values, boolean[] mask, int width, int height, double fallbackValue) {
        Preconditions.checkArgument(values.length == width * height && mask.length == values.length,
                "Values (%s) and mask (%s) must both match a %sx%s image", values.length, mask.length, width, height);
        double[] filled = values.clone();
        int nMasked = 0;
        for (boolean m : mask) {
            if (m) nMasked++;
        }
        if (nMasked == 0) {
            return filled;
        }
        if (nMasked == values.length) {
            LOG.warn("All {} pixels are masked - fill them with {}", nMasked, fallbackValue);
            for (int i = 0; i < filled.length; i++) {
                filled[i] = fallbackValue;
            }
            return filled;
        }
        int[] maskedIndexes = new int[nMasked];
        int k = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) maskedIndexes[k++] = i;
        }
        BoundaryValues boundary = boundaryValues(values, mask, width, height, maskedIndexes);
        for (int i : maskedIndexes) {
            filled[i] = boundary.mean;
        }
        double omega = relaxationFactor(maskedIndexes, width);
        double stopChange = tolerance * (boundary.max > boundary.min ? boundary.max - boundary.min : 1);
        int pass = 0;
        double passChange = Double.POSITIVE_INFINITY;
        while (pass < maxPasses && passChange > stopChange) {
            passChange = 0;
            for (int i : maskedIndexes) {
                int x = i % width;
                int y = i / width;
                double s = 0;
                int n = 0;
                if (x > 0) {
                    s += filled[i - 1];
                    n++;
                }
                if (x < width - 1) {
                    s += filled[i + 1];
                    n++;
                }
                if (y > 0) {
                    s += filled[i - width];
                    n++;
                }
                if (y < height - 1) {
                    s += filled[i + width];
                    n++;
                }
                if (n == 0) {
                    continue; // single pixel image
                }
                double update = omega * (s / n - filled[i]);
                passChange = Math.max(passChange, Math.abs(update));
                filled[i] += update;
            }
            pass++;
        }
        if (passChange > stopChange) {
            LOG.warn("Region fill of {} pixels reached the limit of {} passes with a residual change of {} - the filled values are approximate",
                    nMasked, maxPasses, passChange);
        } else {
            LOG.debug("Region fill of {} pixels converged after {} passes (omega={})", nMasked, pass, omega);
        }
        return filled;
    }

    /**
     * Optimal over-relaxation factor of a square region as large as the bounding box of the masked pixels.
     */
    static double relaxationFactor(int[] maskedIndexes, int width) {
        int minX = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxY = Integer.MIN_VALUE;
        for (int i : maskedIndexes) {
            int x = i % width;
            int y = i / width;
            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x);
            minY = Math.min(minY, y);
            maxY = Math.max(maxY, y);
        }
        int extent = Math.max(maxX - minX + 1, maxY - minY + 1);
        return 2 / (1 + Math.sin(Math.PI / (extent + 1)));
    }

    private static class BoundaryValues {
        private final double mean;
        private final double min;
        private final double max;

        BoundaryValues(double mean, double min, double max) {
            this.mean = mean;
            this.min = min;
            this.max = max;
        }
    }

    private BoundaryValues boundaryValues(double[] values, boolean[] mask, int width, int height, int[] maskedIndexes) {
        double s = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        long n = 0;
        boolean[] counted = new boolean[values.length];
        for (int i : maskedIndexes) {
            int x = i % width;
            int y = i / width;
            int[] neighbors = {
                    x > 0 ? i - 1 : -1,
                    x < width - 1 ? i + 1 : -1,
                    y > 0 ? i - width : -1,
                    y < height - 1 ? i + width : -1
            };
            for (int j : neighbors) {
                if (j >= 0 && !mask[j] && !counted[j]) {
                    counted[j] = true;
                    s += values[j];
                    min = Math.min(min, values[j]);
                    max = Math.max(max, values[j]);
                    n++;
                }
            }
        }
        return n > 0 ? new BoundaryValues(s / n, min, max) : new BoundaryValues(0, 0, 0);
    }
}
