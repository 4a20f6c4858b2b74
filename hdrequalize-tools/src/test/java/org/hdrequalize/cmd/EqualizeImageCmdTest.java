package org.hdrequalize.cmd;

import java.io.File;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Random;

import net.imglib2.img.array.ArrayImgs;
import org.hdrequalize.equalization.EqualizationMethod;
import org.hdrequalize.equalization.EqualizationParams;
import org.hdrequalize.image.ImageAccessUtils;
import org.hdrequalize.io.RawImageIO;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class EqualizeImageCmdTest {

    private static final int WIDTH = 20;
    private static final int HEIGHT = 16;
    private static final float FILL_VALUE = -1;

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void adaptiveEqualizationKeepsFillPixels() throws Exception {
        File input = writeTestImage(ByteOrder.LITTLE_ENDIAN);
        File output = new File(testFolder.getRoot(), "adaptive.raw");

        int status = EqualizeApp.run(
                "equalize",
                "--input", input.getAbsolutePath(),
                "--output", output.getAbsolutePath(),
                "--width", String.valueOf(WIDTH),
                "--height", String.valueOf(HEIGHT),
                "--fill-value", String.valueOf(FILL_VALUE),
                "--method", "adaptive",
                "--radius", "3",
                "--bins", "32",
                "--log-offset", "0.001",
                "--task-concurrency", "2");

        assertEquals(0, status);
        double[] result = ImageAccessUtils.toDoubleArray(RawImageIO.readFloat32(output.toPath(), WIDTH, HEIGHT, ByteOrder.LITTLE_ENDIAN));
        checkEqualizedImage(result);
    }

    @Test
    public void globalEqualizationOfBigEndianImage() throws Exception {
        File input = writeTestImage(ByteOrder.BIG_ENDIAN);
        File output = new File(testFolder.getRoot(), "global.raw");

        int status = EqualizeApp.run(
                "equalize",
                "-i", input.getAbsolutePath(),
                "-o", output.getAbsolutePath(),
                "--width", String.valueOf(WIDTH),
                "--height", String.valueOf(HEIGHT),
                "--fill-value", String.valueOf(FILL_VALUE),
                "--big-endian");

        assertEquals(0, status);
        double[] result = ImageAccessUtils.toDoubleArray(RawImageIO.readFloat32(output.toPath(), WIDTH, HEIGHT, ByteOrder.BIG_ENDIAN));
        checkEqualizedImage(result);
    }

    @Test
    public void invalidArguments() throws Exception {
        File input = writeTestImage(ByteOrder.LITTLE_ENDIAN);
        String output = new File(testFolder.getRoot(), "invalid.raw").getAbsolutePath();

        // missing required size
        assertEquals(1, EqualizeApp.run("equalize", "--input", input.getAbsolutePath(), "--output", output));
        // unknown method
        assertEquals(1, EqualizeApp.run("equalize", "--input", input.getAbsolutePath(), "--output", output,
                "--width", String.valueOf(WIDTH), "--height", String.valueOf(HEIGHT), "--method", "clahe"));
        // size does not match the file
        assertEquals(1, EqualizeApp.run("equalize", "--input", input.getAbsolutePath(), "--output", output,
                "--width", String.valueOf(WIDTH + 1), "--height", String.valueOf(HEIGHT)));
        // no bins
        assertEquals(1, EqualizeApp.run("equalize", "--input", input.getAbsolutePath(), "--output", output,
                "--width", String.valueOf(WIDTH), "--height", String.valueOf(HEIGHT), "--bins", "0"));
        // no command
        assertEquals(1, EqualizeApp.run());
        assertTrue(!new File(output).exists());
    }

    @Test
    public void commandLineValuesOverrideTheConfiguredOnes() throws Exception {
        File configFile = testFolder.newFile("equalize.properties");
        Files.write(configFile.toPath(), String.join("\n",
                "Equalization.Method=adaptive",
                "Equalization.NumberOfBins=64",
                "Equalization.LocalRadiusPx=10",
                "Equalization.LogOffset=0.001").getBytes(StandardCharsets.UTF_8));
        CommonArgs commonArgs = new CommonArgs();
        commonArgs.configFileName = configFile.getAbsolutePath();
        EqualizeImageCmd cmd = new EqualizeImageCmd("equalize", commonArgs);
        cmd.getArgs().numberOfBins = 128;
        cmd.getArgs().noNormalization = true;

        EqualizationParams params = cmd.getEqualizationParams();

        assertEquals(EqualizationMethod.ADAPTIVE, cmd.getEqualizationMethod());
        assertEquals(128, params.getNumberOfBins());
        assertEquals(10, params.getLocalRadiusPx());
        assertEquals(Double.valueOf(0.001), params.getLogOffset());
        assertEquals(Double.valueOf(EqualizationParams.DEFAULT_STD_MULT_CUTOFF), params.getStdMultCutoff());
        assertNull(params.getClipLimit());
        assertTrue(!params.isZeroToOneNormalization());
    }

    private File writeTestImage(ByteOrder byteOrder) throws Exception {
        Random random = new Random(17L);
        float[] pixels = new float[WIDTH * HEIGHT];
        for (int row = 0; row < HEIGHT; row++) {
            for (int col = 0; col < WIDTH; col++) {
                int i = row * WIDTH + col;
                if (col < 3) {
                    pixels[i] = FILL_VALUE;
                } else if (row == 0 && col == WIDTH - 1) {
                    pixels[i] = Float.NaN;
                } else {
                    pixels[i] = 10 + 100 * random.nextFloat();
                }
            }
        }
        File input = testFolder.newFile();
        RawImageIO.writeFloat32(ArrayImgs.floats(pixels, WIDTH, HEIGHT), input.toPath(), byteOrder);
        return input;
    }

    private void checkEqualizedImage(double[] result) {
        for (int row = 0; row < HEIGHT; row++) {
            for (int col = 0; col < WIDTH; col++) {
                double v = result[row * WIDTH + col];
                if (col < 3) {
                    assertEquals(FILL_VALUE, v, 0);
                } else if (row == 0 && col == WIDTH - 1) {
                    assertTrue(Double.isNaN(v));
                } else {
                    assertTrue("Unexpected value " + v + " at " + row + "," + col, v >= 0 && v <= 1);
                }
            }
        }
    }
}
