package org.janelia.speckle.dataio;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.FloatProcessor;
import org.janelia.speckle.correction.CorrectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the contrast and saturation maps as 32-bit TIFF images and the run summary as JSON.
 */
public class ContrastMapWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ContrastMapWriter.class);

    static final String RAW_CONTRAST_SUFFIX = "_K_raw.tif";
    static final String CORRECTED_CONTRAST_SUFFIX = "_K_corrected.tif";
    static final String SATURATION_RATIO_SUFFIX = "_R_saturation.tif";
    static final String SUMMARY_SUFFIX = "_summary.json";

    private final Path outputDir;
    private final String outputPrefix;
    private final ObjectWriter summaryWriter;

    public ContrastMapWriter(Path outputDir, String outputPrefix, boolean prettyPrint) {
        this.outputDir = outputDir;
        this.outputPrefix = outputPrefix;
        ObjectMapper mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        this.summaryWriter = prettyPrint ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    /**
     * @return the files written, maps first and summary last
     */
    public List<Path> write(CorrectionResult result, CorrectionSummary summary) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Error creating output directory " + outputDir, e);
        }
        Path rawContrastFile = writeMap(result.getRawContrastValues(), result.getWidth(), result.getHeight(), RAW_CONTRAST_SUFFIX);
        Path correctedContrastFile = writeMap(result.getCorrectedContrastValues(), result.getWidth(), result.getHeight(), CORRECTED_CONTRAST_SUFFIX);
        Path saturationRatioFile = writeMap(result.getSaturationRatioValues(), result.getWidth(), result.getHeight(), SATURATION_RATIO_SUFFIX);
        Path summaryFile = outputDir.resolve(outputPrefix + SUMMARY_SUFFIX);
        try {
            summaryWriter.writeValue(summaryFile.toFile(), summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + summaryFile, e);
        }
        LOG.info("Wrote {}, {}, {} and {}", rawContrastFile, correctedContrastFile, saturationRatioFile, summaryFile);
        return Arrays.asList(rawContrastFile, correctedContrastFile, saturationRatioFile, summaryFile);
    }

    private Path writeMap(double[] values, int width, int height, String suffix) {
        float[] pixels = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            pixels[i] = (float) values[i];
        }
        Path mapFile = outputDir.resolve(outputPrefix + suffix);
        ImagePlus mapImage = new ImagePlus(outputPrefix + suffix, new FloatProcessor(width, height, pixels));
        if (!new FileSaver(mapImage).saveAsTiff(mapFile.toString())) {
            throw new IllegalStateException("Error writing " + mapFile);
        }
        return mapFile;
    }
}
