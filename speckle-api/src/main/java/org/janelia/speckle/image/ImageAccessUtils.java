package org.janelia.speckle.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    public static long getMaxSize(long[] shape) {
        return Arrays.stream(shape).reduce(1, (a, d) -> a * d);
    }

    /**
     * Copy the pixel values of a real typed image into a flat array. The values are in flat iteration order,
     * i.e. for a 2D image the index of (x, y) is y * width + x.
     *
     * @param image source image
     * @return pixel values widened to double
     */
    public static double[] toDoubleArray(RandomAccessibleInterval<? extends RealType<?>> image) {
        long size = getMaxSize(image.dimensionsAsLongArray());
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image is too large to be copied into an array: " + Arrays.toString(image.dimensionsAsLongArray()));
        }
        double[] values = new double[(int) size];
        Cursor<? extends RealType<?>> cursor = Views.flatIterable(image).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            values[i++] = cursor.next().getRealDouble();
        }
        return values;
    }

    /**
     * Wrap the array as an image without copying it, so changes to the image are visible in the array.
     */
    public static ArrayImg<DoubleType, DoubleArray> wrapAsImg(double[] values, long... shape) {
        if (getMaxSize(shape) != values.length) {
            throw new IllegalArgumentException("Array of length " + values.length + " does not match the shape " + Arrays.toString(shape));
        }
        return ArrayImgs.doubles(values, shape);
    }

    public static double[] fill(int size, double value) {
        double[] a = new double[size];
        Arrays.fill(a, value);
        return a;
    }
}
