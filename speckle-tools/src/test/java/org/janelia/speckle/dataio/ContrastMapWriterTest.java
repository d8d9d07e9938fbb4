package org.janelia.speckle.dataio;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ij.ImagePlus;
import ij.io.Opener;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.speckle.correction.CorrectionParams;
import org.janelia.speckle.correction.CorrectionResult;
import org.janelia.speckle.correction.OverExposureCorrection;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ContrastMapWriterTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void writeMapsAndSummary() throws Exception {
        Random random = new Random(5);
        float[] pixels = new float[16 * 12];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (float) Math.min(255, Math.round(-150 * Math.log(1 - random.nextDouble())));
        }
        Img<FloatType> frame = ArrayImgs.floats(pixels, 16, 12);
        CorrectionParams params = new CorrectionParams();
        CorrectionResult result = new OverExposureCorrection(params)
                .correct(Collections.singletonList(frame), 3, 255, 2);

        Path outputDir = testFolder.getRoot().toPath().resolve("results");
        List<Path> outputFiles = new ContrastMapWriter(outputDir, "run1", true)
                .write(result, CorrectionSummary.of(result, Collections.singletonList("frames"), 3, 255, params));

        assertEquals(4, outputFiles.size());
        for (Path f : outputFiles) {
            assertTrue(f + " not found", Files.isRegularFile(f));
        }
        ImagePlus correctedImage = new Opener().openImage(outputDir.resolve("run1_K_corrected.tif").toString());
        assertEquals(ImagePlus.GRAY32, correctedImage.getType());
        assertEquals(16, correctedImage.getWidth());
        assertEquals(12, correctedImage.getHeight());
        float[] correctedPixels = (float[]) correctedImage.getProcessor().getPixels();
        for (int i = 0; i < correctedPixels.length; i++) {
            assertEquals((float) result.getCorrectedContrastValues()[i], correctedPixels[i], 0);
        }

        JsonNode summary = new ObjectMapper().readTree(outputDir.resolve("run1_summary.json").toFile());
        assertEquals(1, summary.get("frameCount").asInt());
        assertEquals(16, summary.get("width").asInt());
        assertEquals(2, summary.get("iterations").asInt());
        assertEquals("TWO_STEP", summary.get("model").asText());
        assertEquals(3, summary.get("params").get("thresholdLevels").size());
        assertTrue(summary.get("repairs").has("inpainted"));
        JsonNode saturationStats = summary.get("maps").get("R_saturation");
        assertTrue(saturationStats.get("min").asDouble() >= 0);
        assertTrue(saturationStats.get("max").asDouble() <= 1);
    }

    @Test
    public void mapStatisticsIgnoreUndefinedValues() {
        MapStatistics stats = MapStatistics.of(new double[] {1, Double.NaN, 3, Double.POSITIVE_INFINITY});
        assertEquals(1, stats.getMin(), 0);
        assertEquals(3, stats.getMax(), 0);
        assertEquals(2, stats.getMean(), 0);
        assertEquals(2, stats.getFinitePixels());
        assertEquals(2, stats.getUndefinedPixels());
    }

    @Test
    public void mapStatisticsOfUndefinedMap() {
        MapStatistics stats = MapStatistics.of(new double[] {Double.NaN, Double.NaN});
        assertTrue(Double.isNaN(stats.getMean()));
        assertEquals(0, stats.getFinitePixels());
    }
}
