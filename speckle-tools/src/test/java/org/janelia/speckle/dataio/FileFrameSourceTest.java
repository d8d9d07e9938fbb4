package org.janelia.speckle.dataio;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class FileFrameSourceTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void directoryContentIsSortedAndFiltered() throws Exception {
        File framesDir = testFolder.newFolder("frames");
        TiffTestUtils.writeByteImage(new File(framesDir, "frame_002.tif"), 2, 2, 2, 2, 2, 2);
        TiffTestUtils.writeByteImage(new File(framesDir, "frame_001.tif"), 2, 2, 1, 1, 1, 1);
        TiffTestUtils.writeByteImage(new File(framesDir, "frame_003.tif"), 2, 2, 3, 3, 3, 3);
        new File(framesDir, "notes.txt").createNewFile();

        List<Path> files = FileFrameSource.listImageFiles(Collections.singletonList(framesDir.getAbsolutePath()), "*.tif");
        assertEquals(3, files.size());
        assertEquals("frame_001.tif", files.get(0).getFileName().toString());
        assertEquals("frame_003.tif", files.get(2).getFileName().toString());

        FileFrameSource frames = FileFrameSource.fromInputs(Collections.singletonList(framesDir.getAbsolutePath()), "*.tif", 2);
        assertEquals(3, frames.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i + 1, pixelValue(frames.getFrame(i), 1, 1), 0);
        }
    }

    @Test
    public void bytePixelsAreUnsigned() throws Exception {
        File frame = TiffTestUtils.writeByteImage(testFolder.newFile("bright.tif"), 3, 1, 0, 128, 255);
        FileFrameSource frames = FileFrameSource.fromInputs(Collections.singletonList(frame.getAbsolutePath()), null, 1);
        RandomAccessibleInterval<FloatType> img = frames.getFrame(0);
        assertArrayEquals(new long[] {3, 1}, img.dimensionsAsLongArray());
        assertEquals(0, pixelValue(img, 0, 0), 0);
        assertEquals(128, pixelValue(img, 1, 0), 0);
        assertEquals(255, pixelValue(img, 2, 0), 0);
    }

    @Test
    public void everyStackSliceIsAFrame() throws Exception {
        File stack = TiffTestUtils.writeShortStack(testFolder.newFile("stack.tif"), 4, 3, 5, 40000);
        File single = TiffTestUtils.writeByteImage(testFolder.newFile("single.tif"), 4, 3, 7);
        FileFrameSource frames = FileFrameSource.fromInputs(
                Arrays.asList(stack.getAbsolutePath(), single.getAbsolutePath()), "*.tif", 1);
        assertEquals(6, frames.size());
        assertEquals(40000, pixelValue(frames.getFrame(0), 0, 0), 0);
        assertEquals(40000 + 4000 + 5, pixelValue(frames.getFrame(4), 1, 1), 0);
        assertEquals(7, pixelValue(frames.getFrame(5), 0, 0), 0);
    }

    @Test
    public void floatPixelsAreReadAsIs() throws Exception {
        File frame = TiffTestUtils.writeFloatStack(testFolder.newFile("float.tif"), 3, 2,
                new float[] {-1.5f, 0.25f, 3.75f, 1e6f, 0f, 65535.5f});
        FileFrameSource frames = FileFrameSource.fromInputs(Collections.singletonList(frame.getAbsolutePath()), null, 1);
        assertEquals(1, frames.size());
        RandomAccessibleInterval<FloatType> img = frames.getFrame(0);
        assertArrayEquals(new long[] {3, 2}, img.dimensionsAsLongArray());
        assertEquals(-1.5, pixelValue(img, 0, 0), 0);
        assertEquals(0.25, pixelValue(img, 1, 0), 0);
        assertEquals(3.75, pixelValue(img, 2, 0), 0);
        assertEquals(1e6, pixelValue(img, 0, 1), 0);
        assertEquals(65535.5, pixelValue(img, 2, 1), 0);
    }

    @Test
    public void everyFloatStackSliceIsAFrame() throws Exception {
        File stack = TiffTestUtils.writeFloatStack(testFolder.newFile("float-stack.tif"), 2, 2,
                new float[] {0.5f, 1.5f, 2.5f, 3.5f},
                new float[] {-0.5f, -1.5f, -2.5f, -3.5f},
                new float[] {10.125f, 20.125f, 30.125f, 40.125f});
        FileFrameSource frames = FileFrameSource.fromInputs(Collections.singletonList(stack.getAbsolutePath()), null, 1);
        assertEquals(3, frames.size());
        assertEquals(1.5, pixelValue(frames.getFrame(0), 1, 0), 0);
        assertEquals(-2.5, pixelValue(frames.getFrame(1), 0, 1), 0);
        assertEquals(40.125, pixelValue(frames.getFrame(2), 1, 1), 0);
    }

    @Test
    public void floatFramesAreCopiesOfTheImagePixels() throws Exception {
        File stack = TiffTestUtils.writeFloatStack(testFolder.newFile("float-copy.tif"), 2, 1,
                new float[] {0.5f, 1.5f},
                new float[] {2.5f, 3.5f});
        FileFrameSource frames = FileFrameSource.fromInputs(Collections.singletonList(stack.getAbsolutePath()), null, 2);
        RandomAccessibleInterval<FloatType> first = frames.getFrame(1);
        RandomAccess<FloatType> ra = first.randomAccess();
        ra.setPosition(new long[] {0, 0});
        ra.get().setReal(-100);
        assertEquals(-100, pixelValue(first, 0, 0), 0);
        assertEquals(2.5, pixelValue(frames.getFrame(1), 0, 0), 0);
    }

    @Test(expected = IllegalStateException.class)
    public void colorImagesAreRejected() throws Exception {
        File frame = TiffTestUtils.writeRGBImage(testFolder.newFile("color.tif"), 4, 4);
        FileFrameSource.fromInputs(Collections.singletonList(frame.getAbsolutePath()), null, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingInput() {
        FileFrameSource.fromInputs(Collections.singletonList(new File(testFolder.getRoot(), "missing").getAbsolutePath()), null, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void noMatchingFiles() throws Exception {
        File framesDir = testFolder.newFolder("empty");
        FileFrameSource.fromInputs(Collections.singletonList(framesDir.getAbsolutePath()), "*.tif", 1);
    }

    private static double pixelValue(RandomAccessibleInterval<FloatType> img, long x, long y) {
        RandomAccess<FloatType> ra = img.randomAccess();
        ra.setPosition(new long[] {x, y});
        return ra.get().getRealDouble();
    }
}
