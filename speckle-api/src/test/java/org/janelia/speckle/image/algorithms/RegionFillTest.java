package org.janelia.speckle.image.algorithms;

import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class RegionFillTest {

    @Test
    public void fillReproducesLinearRamp() {
        int width = 12;
        int height = 10;
        double[] ramp = new double[width * height];
        double[] values = new double[width * height];
        boolean[] mask = new boolean[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                ramp[i] = 0.1 * x + 0.2 * y + 1;
                if (x >= 3 && x <= 7 && y >= 2 && y <= 6) {
                    mask[i] = true;
                    values[i] = Double.NaN;
                } else {
                    values[i] = ramp[i];
                }
            }
        }
        double[] filled = new RegionFill(20000, 1e-10).fill(values, mask, width, height, 0);
        for (int i = 0; i < filled.length; i++) {
            assertEquals("Pixel " + i, ramp[i], filled[i], 1e-9);
        }
    }

    @Test
    public void filledValuesStayWithinTheRangeOfValidValues() {
        Random random = new Random(3);
        int width = 30;
        int height = 20;
        double[] values = new double[width * height];
        boolean[] mask = new boolean[width * height];
        for (int i = 0; i < values.length; i++) {
            if (random.nextDouble() < 0.3) {
                mask[i] = true;
                values[i] = random.nextBoolean() ? Double.POSITIVE_INFINITY : -5;
            } else {
                values[i] = 1 + random.nextDouble();
            }
        }
        double[] filled = new RegionFill(20000, 1e-10).fill(values, mask, width, height, 0);
        for (int i = 0; i < filled.length; i++) {
            if (mask[i]) {
                assertTrue("Pixel " + i + " = " + filled[i], filled[i] >= 1 - 1e-6 && filled[i] <= 2 + 1e-6);
            } else {
                assertEquals(values[i], filled[i], 0);
            }
        }
    }

    @Test
    public void fillMaskTouchingTheBorder() {
        int width = 6;
        int height = 4;
        double[] values = new double[width * height];
        boolean[] mask = new boolean[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (x < 2) {
                    mask[y * width + x] = true;
                    values[y * width + x] = Double.NaN;
                } else {
                    values[y * width + x] = 0.5;
                }
            }
        }
        double[] filled = new RegionFill(1000, 1e-12).fill(values, mask, width, height, 0);
        for (double v : filled) {
            assertEquals(0.5, v, 1e-12);
        }
    }

    @Test
    public void fillWideBandBetweenTwoColumns() {
        int width = 302;
        int height = 3;
        double[] values = new double[width * height];
        boolean[] mask = new boolean[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                if (x == 0) {
                    values[i] = 0.1;
                } else if (x == width - 1) {
                    values[i] = 0.5;
                } else {
                    mask[i] = true;
                    values[i] = 0.001;
                }
            }
        }
        double[] filled = new RegionFill(20000, 1e-6).fill(values, mask, width, height, 0);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                assertEquals("Pixel (" + x + "," + y + ")", 0.1 + 0.4 * x / (width - 1), filled[y * width + x], 1e-3);
            }
        }
    }

    @Test
    public void relaxationFactorGrowsWithTheExtentOfTheMask() {
        double small = RegionFill.relaxationFactor(new int[] {0, 1, 2}, 10);
        double large = RegionFill.relaxationFactor(new int[] {0, 299}, 300);
        assertTrue(small >= 1 && small < large);
        assertTrue(large < 2);
    }

    @Test
    public void nothingToFill() {
        double[] values = {1, 2, 3, 4};
        double[] filled = new RegionFill(10, 1e-6).fill(values, new boolean[4], 2, 2, 0);
        assertNotSame(values, filled);
        assertArrayEquals(values, filled, 0);
    }

    @Test
    public void everythingMaskedUsesFallbackValue() {
        double[] values = {Double.NaN, 1, -1, Double.NEGATIVE_INFINITY};
        boolean[] mask = {true, true, true, true};
        double[] filled = new RegionFill(10, 1e-6).fill(values, mask, 2, 2, 0.25);
        assertArrayEquals(new double[] {0.25, 0.25, 0.25, 0.25}, filled, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void maskMustMatchValues() {
        new RegionFill(10, 1e-6).fill(new double[4], new boolean[3], 2, 2, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void passesMustBePositive() {
        new RegionFill(0, 1e-6);
    }
}
