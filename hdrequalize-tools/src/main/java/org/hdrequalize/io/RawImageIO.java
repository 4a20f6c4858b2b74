package org.hdrequalize.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.hdrequalize.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes headerless 2-D float32 rasters stored row by row.
 */
public class RawImageIO {

    private static final Logger LOG = LoggerFactory.getLogger(RawImageIO.class);

    /**
     * @throws IllegalArgumentException if the file size does not match width x height float values
     */
    public static Img<FloatType> readFloat32(Path imagePath, int width, int height, ByteOrder byteOrder) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Invalid image size " + width + "x" + height);
        }
        long expectedBytes = (long) width * height * Float.BYTES;
        try {
            long fileSize = Files.size(imagePath);
            if (fileSize != expectedBytes) {
                throw new IllegalArgumentException("Raw image " + imagePath + " has " + fileSize +
                        " bytes but a " + width + "x" + height + " float image requires " + expectedBytes);
            }
            LOG.debug("Read {}x{} raw image from {}", width, height, imagePath);
            FloatBuffer pixelsBuffer = ByteBuffer.wrap(Files.readAllBytes(imagePath)).order(byteOrder).asFloatBuffer();
            float[] pixels = new float[pixelsBuffer.remaining()];
            pixelsBuffer.get(pixels);
            return ArrayImgs.floats(pixels, width, height);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + imagePath, e);
        }
    }

    public static <T extends RealType<T>> void writeFloat32(RandomAccessibleInterval<T> image, Path imagePath, ByteOrder byteOrder) {
        int size = ImageAccessUtils.get2DSize(image);
        ByteBuffer pixelsBuffer = ByteBuffer.allocate(size * Float.BYTES).order(byteOrder);
        Cursor<T> imageCursor = Views.flatIterable(image).cursor();
        while (imageCursor.hasNext()) {
            pixelsBuffer.putFloat(imageCursor.next().getRealFloat());
        }
        try {
            Path parentDir = imagePath.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.write(imagePath, pixelsBuffer.array());
            LOG.debug("Wrote {}x{} raw image to {}", image.dimension(0), image.dimension(1), imagePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + imagePath, e);
        }
    }
}
