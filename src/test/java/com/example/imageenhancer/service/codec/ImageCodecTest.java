package com.example.imageenhancer.service.codec;

import com.example.imageenhancer.exception.InvalidImageInputException;
import com.example.imageenhancer.model.ImageFormat;
import com.example.imageenhancer.model.Raster;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageCodecTest {

    private final ImageCodec codec = new ImageCodec();

    @Test
    void decodesGrayPngToSingleChannel() throws IOException {
        BufferedImage gray = new BufferedImage(3, 2, BufferedImage.TYPE_BYTE_GRAY);
        gray.getRaster().setSample(1, 0, 0, 200);

        Raster raster = codec.decode(png(gray));

        assertThat(raster.channels()).isEqualTo(1);
        assertThat(raster.width()).isEqualTo(3);
        assertThat(raster.height()).isEqualTo(2);
        assertThat(raster.unsigned8(0, 1, 0)).isEqualTo(200);
        assertThat(raster.unsigned8(1, 2, 0)).isZero();
    }

    @Test
    void decodesTransparentPngToRgba() throws IOException {
        BufferedImage argb = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        argb.setRGB(0, 0, 0x80FF2000);

        Raster raster = codec.decode(png(argb));

        assertThat(raster.channels()).isEqualTo(4);
        assertThat(raster.unsigned8(0, 0, 0)).isEqualTo(0xFF);
        assertThat(raster.unsigned8(0, 0, 1)).isEqualTo(0x20);
        assertThat(raster.unsigned8(0, 0, 3)).isEqualTo(0x80);
    }

    @Test
    void pngPreservesRgbSamples() {
        Raster raster = Raster.fromUnsigned8(1, 2, 3, 10, 20, 30, 250, 128, 0);

        Raster decoded = codec.decode(codec.encode(raster, ImageFormat.PNG));

        assertThat(decoded).isEqualTo(raster);
    }

    @Test
    void jpegDropsAlpha() {
        Raster raster = Raster.filled(4, 4, 4, 0.5f);

        Raster decoded = codec.decode(codec.encode(raster, ImageFormat.JPEG));

        assertThat(decoded.channels()).isEqualTo(3);
        assertThat(decoded.width()).isEqualTo(4);
    }

    @Test
    void rejectsEmptyPayload() {
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(InvalidImageInputException.class)
                .hasMessage("Image payload is empty");
    }

    @Test
    void rejectsUndecodableBytes() {
        assertThatThrownBy(() -> codec.decode("not an image".getBytes()))
                .isInstanceOf(InvalidImageInputException.class);
    }

    private static byte[] png(BufferedImage image) throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        ImageIO.write(image, "png", outputStream);
        return outputStream.toByteArray();
    }
}
