package org.hdrequalize.cmd;

import java.nio.ByteOrder;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;
import org.apache.commons.lang3.StringUtils;
import org.hdrequalize.config.Config;
import org.hdrequalize.equalization.EqualizationMethod;
import org.hdrequalize.equalization.EqualizationParams;
import org.hdrequalize.equalization.Equalizer;
import org.hdrequalize.io.RawImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to equalize a raw float32 image. Pixels equal to the fill value and NaN pixels are kept as they are;
 * all other pixels are used for the statistics and are equalized.
 */
class EqualizeImageCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(EqualizeImageCmd.class);

    @Parameters(commandDescription = "Histogram equalization of a raw float32 image")
    static class EqualizeImageArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, description = "Raw float32 input image", required = true)
        String inputImage;

        @Parameter(names = {"--output", "-o"}, description = "Raw float32 output image", required = true)
        String outputImage;

        @Parameter(names = {"--width"}, description = "Image width in pixels", required = true)
        int width;

        @Parameter(names = {"--height"}, description = "Image height in pixels", required = true)
        int height;

        @Parameter(names = {"--big-endian"}, description = "Raw images use big endian byte order", arity = 0)
        boolean bigEndian = false;

        @Parameter(names = {"--fill-value"}, description = "Value that marks pixels without data")
        Double fillValue;

        @Parameter(names = {"--method"}, description = "Equalization method: global or adaptive")
        String method;

        @Parameter(names = {"--bins"}, description = "Number of histogram bins")
        Integer numberOfBins;

        @Parameter(names = {"--std-cutoff"}, description = "Values further than this many standard deviations from the mean are left out of the histogram")
        Double stdMultCutoff;

        @Parameter(names = {"--radius"}, description = "Radius in pixels of the tiles used by the adaptive equalization")
        Integer localRadiusPx;

        @Parameter(names = {"--clip-limit"}, description = "Histogram clip limit")
        Double clipLimit;

        @Parameter(names = {"--slope-limit"}, description = "CDF slope limit")
        Double slopeLimit;

        @Parameter(names = {"--log-offset"}, description = "If set the adaptive equalization works on log(value + offset)")
        Double logOffset;

        @Parameter(names = {"--no-normalization"}, description = "Do not rescale the equalized values to the 0 to 1 range", arity = 0)
        boolean noNormalization = false;

        EqualizeImageArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        ByteOrder getByteOrder() {
            return bigEndian ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        }

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (width < 1 || height < 1) {
                errors.add("Invalid image size: " + width + "x" + height);
            }
            if (StringUtils.isNotBlank(method)) {
                try {
                    EqualizationMethod.fromName(method);
                } catch (IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
            return errors;
        }
    }

    private final EqualizeImageArgs args;

    EqualizeImageCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new EqualizeImageArgs(commonArgs);
    }

    @Override
    EqualizeImageArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        EqualizationMethod method = getEqualizationMethod();
        EqualizationParams params = getEqualizationParams();
        params.validate();
        long startTime = System.currentTimeMillis();
        Img<FloatType> image = RawImageIO.readFloat32(Paths.get(args.inputImage), args.width, args.height, args.getByteOrder());
        Img<BitType> validDataMask = createValidDataMask(image, getFillValue());

        ExecutorService executorService = method == EqualizationMethod.ADAPTIVE
                ? CmdUtils.createCmdExecutor(args.commonArgs)
                : null;
        try {
            Equalizer equalizer = method.createEqualizer(params, executorService);
            LOG.info("Equalize {}x{} image {} using {} equalization with {}",
                    args.width, args.height, args.inputImage, method, params);
            equalizer.equalize(image, validDataMask, validDataMask, image);
        } finally {
            if (executorService != null) {
                executorService.shutdown();
            }
        }
        Path outputPath = Paths.get(args.outputImage);
        RawImageIO.writeFloat32(image, outputPath, args.getByteOrder());
        LOG.info("Finished equalizing {} into {} in {}s - memory usage {}M out of {}M",
                args.inputImage, outputPath, (System.currentTimeMillis() - startTime) / 1000.,
                (maxMemory - Runtime.getRuntime().freeMemory()) / _1M + 1, // round up
                (maxMemory / _1M));
    }

    EqualizationMethod getEqualizationMethod() {
        String methodName = StringUtils.isNotBlank(args.method)
                ? args.method
                : getConfig().getStringPropertyValue("Equalization.Method", EqualizationMethod.GLOBAL.name());
        return EqualizationMethod.fromName(methodName);
    }

    /**
     * Command line values take precedence over the configured ones.
     */
    EqualizationParams getEqualizationParams() {
        Config config = getConfig();
        return new EqualizationParams()
                .setNumberOfBins(args.numberOfBins != null
                        ? args.numberOfBins
                        : config.getIntegerPropertyValue("Equalization.NumberOfBins", EqualizationParams.DEFAULT_NUMBER_OF_BINS))
                .setStdMultCutoff(args.stdMultCutoff != null
                        ? args.stdMultCutoff
                        : config.getDoublePropertyValue("Equalization.StdMultCutoff", EqualizationParams.DEFAULT_STD_MULT_CUTOFF))
                .setLocalRadiusPx(args.localRadiusPx != null
                        ? args.localRadiusPx
                        : config.getIntegerPropertyValue("Equalization.LocalRadiusPx", EqualizationParams.DEFAULT_LOCAL_RADIUS_PX))
                .setClipLimit(args.clipLimit != null
                        ? args.clipLimit
                        : config.getDoublePropertyValue("Equalization.ClipLimit", null))
                .setSlopeLimit(args.slopeLimit != null
                        ? args.slopeLimit
                        : config.getDoublePropertyValue("Equalization.SlopeLimit", null))
                .setLogOffset(args.logOffset != null
                        ? args.logOffset
                        : config.getDoublePropertyValue("Equalization.LogOffset", null))
                .setZeroToOneNormalization(!args.noNormalization
                        && config.getBooleanPropertyValue("Equalization.ZeroToOneNormalization", true));
    }

    private Double getFillValue() {
        return args.fillValue != null
                ? args.fillValue
                : getConfig().getDoublePropertyValue("RawImage.FillValue", null);
    }

    private Img<BitType> createValidDataMask(Img<FloatType> image, Double fillValue) {
        Img<BitType> validDataMask = ArrayImgs.bits(image.dimensionsAsLongArray());
        Cursor<FloatType> imageCursor = image.cursor();
        Cursor<BitType> maskCursor = validDataMask.cursor();
        long invalidPixels = 0;
        while (imageCursor.hasNext()) {
            float v = imageCursor.next().get();
            boolean valid = !Float.isNaN(v) && (fillValue == null || v != fillValue.floatValue());
            maskCursor.next().set(valid);
            if (!valid) {
                invalidPixels++;
            }
        }
        LOG.debug("Found {} pixels without data", invalidPixels);
        return validDataMask;
    }
}
