package org.janelia.speckle.dataio;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;

import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.Opener;
import ij.io.TiffDecoder;
import ij.process.ImageProcessor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.speckle.correction.FrameSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frames read from image files with ImageJ. Every slice of a stack is a frame; files are
 * taken in the given order and directory content is sorted by name.
 * Only 8-bit, 16-bit and 32-bit grayscale images are supported.
 */
public class FileFrameSource implements FrameSource<FloatType> {

    private static final Logger LOG = LoggerFactory.getLogger(FileFrameSource.class);

    private static class FrameLocation {
        private final Path file;
        private final int slice; // 1-based like ImageJ stacks

        FrameLocation(Path file, int slice) {
            this.file = file;
            this.slice = slice;
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this)
                    .append("file", file)
                    .append("slice", slice)
                    .toString();
        }
    }

    /**
     * @param inputs       image files or directories
     * @param filePattern  glob used to select the files from directories, e.g. "*.tif"; blank selects all files
     * @param cachedStacks how many opened files to keep in memory
     */
    public static FileFrameSource fromInputs(List<String> inputs, String filePattern, int cachedStacks) {
        List<Path> files = listImageFiles(inputs, filePattern);
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No image file found in " + inputs);
        }
        return new FileFrameSource(files, cachedStacks);
    }

    static List<Path> listImageFiles(List<String> inputs, String filePattern) {
        PathMatcher fileMatcher = StringUtils.isBlank(filePattern)
                ? p -> true
                : FileSystems.getDefault().getPathMatcher("glob:" + filePattern);
        List<Path> files = new ArrayList<>();
        for (String input : inputs) {
            Path inputPath = Paths.get(input);
            if (Files.isDirectory(inputPath)) {
                try (Stream<Path> dirContent = Files.list(inputPath)) {
                    files.addAll(dirContent
                            .filter(Files::isRegularFile)
                            .filter(p -> fileMatcher.matches(p.getFileName()))
                            .sorted()
                            .collect(Collectors.toList()));
                } catch (IOException e) {
                    throw new UncheckedIOException("Error listing " + inputPath, e);
                }
            } else if (Files.isRegularFile(inputPath)) {
                files.add(inputPath);
            } else {
                throw new IllegalArgumentException("Input " + input + " does not exist");
            }
        }
        return files;
    }

    private final List<FrameLocation> frameLocations;
    private final LoadingCache<Path, ImagePlus> openedImages;

    FileFrameSource(List<Path> files, int cachedStacks) {
        this.openedImages = CacheBuilder.newBuilder()
                .concurrencyLevel(8)
                .maximumSize(Math.max(1, cachedStacks))
                .build(new CacheLoader<Path, ImagePlus>() {
                    @Override
                    public ImagePlus load(Path file) {
                        return openImage(file);
                    }
                });
        List<FrameLocation> locations = new ArrayList<>();
        for (Path f : files) {
            int nSlices = countSlices(f);
            for (int s = 1; s <= nSlices; s++) {
                locations.add(new FrameLocation(f, s));
            }
        }
        this.frameLocations = Collections.unmodifiableList(locations);
        LOG.info("Found {} frames in {} files", frameLocations.size(), files.size());
    }

    @Override
    public int size() {
        return frameLocations.size();
    }

    @Override
    public RandomAccessibleInterval<FloatType> getFrame(int index) {
        FrameLocation frameLocation = frameLocations.get(index);
        ImagePlus image = getImage(frameLocation.file);
        ImageProcessor frameProcessor = image.getStack().getProcessor(frameLocation.slice);
        return ArrayImgs.floats(toFloatPixels(frameProcessor, frameLocation),
                frameProcessor.getWidth(), frameProcessor.getHeight());
    }

    private ImagePlus getImage(Path file) {
        try {
            return openedImages.get(file);
        } catch (ExecutionException | UncheckedExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Error opening " + file, e.getCause());
        }
    }

    private int countSlices(Path file) {
        if (isTiff(file)) {
            try {
                FileInfo[] tiffInfo = new TiffDecoder(
                        file.toAbsolutePath().getParent().toString() + File.separator,
                        file.getFileName().toString()).getTiffInfo();
                if (tiffInfo == null || tiffInfo.length == 0) {
                    throw new IllegalStateException("Invalid TIFF file " + file);
                }
                checkPixelType(tiffInfo[0].getBytesPerPixel(), tiffInfo[0].fileType, file);
                // ImageJ stacks have a single IFD holding the number of images
                return tiffInfo.length > 1 ? tiffInfo.length : Math.max(1, tiffInfo[0].nImages);
            } catch (IOException e) {
                throw new IllegalStateException("Error reading " + file, e);
            }
        } else {
            return getImage(file).getStackSize();
        }
    }

    private static boolean isTiff(Path file) {
        String fileName = file.getFileName().toString();
        return StringUtils.endsWithIgnoreCase(fileName, ".tif") || StringUtils.endsWithIgnoreCase(fileName, ".tiff");
    }

    private static void checkPixelType(int bytesPerPixel, int fileType, Path file) {
        if (fileType == FileInfo.RGB || fileType == FileInfo.RGB48 || fileType == FileInfo.COLOR8 || bytesPerPixel == 3) {
            throw new IllegalStateException("Color image " + file + " is not supported - frames must be grayscale");
        }
    }

    private static ImagePlus openImage(Path file) {
        LOG.debug("Open {}", file);
        ImagePlus image = new Opener().openImage(file.toAbsolutePath().toString());
        if (image == null) {
            throw new IllegalStateException("Could not open " + file);
        }
        switch (image.getType()) {
            case ImagePlus.GRAY8:
            case ImagePlus.GRAY16:
            case ImagePlus.GRAY32:
                return image;
            default:
                throw new IllegalStateException("Image " + file + " of type " + image.getType() + " is not supported - frames must be grayscale");
        }
    }

    private static float[] toFloatPixels(ImageProcessor frameProcessor, FrameLocation frameLocation) {
        Object pixels = frameProcessor.getPixels();
        if (pixels instanceof byte[]) {
            byte[] bytePixels = (byte[]) pixels;
            float[] values = new float[bytePixels.length];
            for (int i = 0; i < bytePixels.length; i++) {
                values[i] = bytePixels[i] & 0xff;
            }
            return values;
        } else if (pixels instanceof short[]) {
            short[] shortPixels = (short[]) pixels;
            float[] values = new float[shortPixels.length];
            for (int i = 0; i < shortPixels.length; i++) {
                values[i] = shortPixels[i] & 0xffff;
            }
            return values;
        } else if (pixels instanceof float[]) {
            return ((float[]) pixels).clone();
        } else {
            throw new IllegalStateException("Unsupported pixel type for " + frameLocation);
        }
    }
}
