package com.example.imageenhancer.service.codec;

import com.example.imageenhancer.exception.InvalidImageInputException;
import com.example.imageenhancer.model.ImageFormat;
import com.example.imageenhancer.model.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Converts between encoded image payloads, {@link BufferedImage} and the pipeline's normalized
 * {@link Raster}. Grayscale images decode to one channel, opaque color images to RGB and anything
 * carrying transparency to RGBA.
 */
@Component
public class ImageCodec {

    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    public Raster decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new InvalidImageInputException("Image payload is empty");
        }
        BufferedImage image;
        try (ByteArrayInputStream inputStream = new ByteArrayInputStream(payload)) {
            image = ImageIO.read(inputStream);
        } catch (IOException ex) {
            throw new InvalidImageInputException("Failed to read image payload", ex);
        }
        if (image == null) {
            throw new InvalidImageInputException("Unable to decode image payload");
        }
        return toRaster(image);
    }

    public byte[] encode(Raster raster, ImageFormat format) {
        BufferedImage image = toBufferedImage(raster, format.supportsAlpha());
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, format.imageIoName(), outputStream)) {
                throw new IllegalStateException("No image writer available for " + format);
            }
        } catch (IOException ex) {
            log.error("Failed to encode {} as {}", raster, format, ex);
            throw new IllegalStateException("Failed to encode image as " + format, ex);
        }
        return outputStream.toByteArray();
    }

    public Raster toRaster(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (image.getColorModel().hasAlpha()) {
            return fromArgb(image, 4);
        }
        if (isSingleBandGray(image)) {
            WritableRaster source = image.getRaster();
            double max = (1L << image.getColorModel().getComponentSize(0)) - 1.0;
            float[] samples = new float[Raster.checkedSampleCount(height, width, 1)];
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    samples[y * width + x] = (float) Math.min(1.0, source.getSample(x, y, 0) / max);
                }
            }
            return Raster.wrap(height, width, 1, samples);
        }
        return fromArgb(image, 3);
    }

    /**
     * Builds an 8-bit image for {@code raster}; alpha is dropped when {@code keepAlpha} is false.
     */
    public BufferedImage toBufferedImage(Raster raster, boolean keepAlpha) {
        int width = raster.width();
        int height = raster.height();
        if (raster.channels() == 1) {
            BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            WritableRaster target = gray.getRaster();
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    target.setSample(x, y, 0, raster.unsigned8(y, x, 0));
                }
            }
            return gray;
        }
        boolean alpha = keepAlpha && raster.hasAlpha();
        BufferedImage color = new BufferedImage(width, height, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int a = alpha ? raster.unsigned8(y, x, 3) : 0xFF;
                int r = raster.unsigned8(y, x, 0);
                int g = raster.unsigned8(y, x, 1);
                int b = raster.unsigned8(y, x, 2);
                color.setRGB(x, y, (a << 24) | (r << 16) | (g << 8) | b);
            }
        }
        return color;
    }

    private static boolean isSingleBandGray(BufferedImage image) {
        return image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY
                && image.getColorModel().getNumComponents() == 1
                && image.getRaster().getNumBands() == 1;
    }

    private static Raster fromArgb(BufferedImage image, int channels) {
        int width = image.getWidth();
        int height = image.getHeight();
        float[] samples = new float[Raster.checkedSampleCount(height, width, channels)];
        int index = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                samples[index++] = ((argb >>> 16) & 0xFF) / 255f;
                samples[index++] = ((argb >>> 8) & 0xFF) / 255f;
                samples[index++] = (argb & 0xFF) / 255f;
                if (channels == 4) {
                    samples[index++] = ((argb >>> 24) & 0xFF) / 255f;
                }
            }
        }
        return Raster.wrap(height, width, channels, samples);
    }
}
