package org.janelia.speckle.correction;

import java.util.ArrayList;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;

/**
 * Ordered, finite sequence of single channel 2D frames.
 * When frames are processed in parallel {@link #getFrame(int)} is called concurrently for different indexes.
 *
 * @param <T> pixel type
 */
public interface FrameSource<T extends RealType<T>> {

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @param index frame index in [0, size())
     * @return the frame; the caller does not modify it
     */
    RandomAccessibleInterval<T> getFrame(int index);

    static <T extends RealType<T>> FrameSource<T> fromList(List<? extends RandomAccessibleInterval<T>> frames) {
        List<RandomAccessibleInterval<T>> framesCopy = new ArrayList<>(frames);
        return new FrameSource<T>() {
            @Override
            public int size() {
                return framesCopy.size();
            }

            @Override
            public RandomAccessibleInterval<T> getFrame(int index) {
                return framesCopy.get(index);
            }
        };
    }
}
