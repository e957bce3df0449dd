package com.example.imageenhancer.service;

import com.example.imageenhancer.config.EnhancerProperties;
import com.example.imageenhancer.model.EnhancedImage;
import com.example.imageenhancer.model.EnhancementResult;
import com.example.imageenhancer.model.ImageFormat;
import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.model.Raster;
import com.example.imageenhancer.service.codec.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Boundary between encoded files and the enhancement pipeline: checks the upload's format,
 * decodes it, enhances it and re-encodes the result for download.
 */
@Service
public class ImageEnhancementService {

    private static final Logger log = LoggerFactory.getLogger(ImageEnhancementService.class);

    private final EnhancementPipeline pipeline;
    private final ImageCodec codec;
    private final EnhancerProperties properties;

    public ImageEnhancementService(EnhancementPipeline pipeline, ImageCodec codec, EnhancerProperties properties) {
        this.pipeline = pipeline;
        this.codec = codec;
        this.properties = properties;
    }

    public ParameterSet defaultParameters() {
        return properties.defaults().toParameterSet();
    }

    public EnhancedImage enhance(String fileName, byte[] content, ParameterSet parameters) {
        return enhance(fileName, content, parameters, properties.output().format());
    }

    public EnhancedImage enhance(String fileName, byte[] content, ParameterSet parameters, ImageFormat outputFormat) {
        ImageFormat inputFormat = ImageFormat.requireSupported(fileName);
        Raster original = codec.decode(content);
        log.debug("Decoded {} ({}) as {}", fileName, inputFormat, original);

        EnhancementResult result = pipeline.enhance(original, parameters != null ? parameters : defaultParameters());
        ImageFormat format = outputFormat != null ? outputFormat : properties.output().format();
        byte[] encoded = codec.encode(result.image(), format);
        String downloadName = downloadName(fileName, format);
        log.info("Enhanced {} -> {} ({} bytes, {})", fileName, downloadName, encoded.length,
                result.comparison().summary());
        return new EnhancedImage(downloadName, format, encoded, result.comparison());
    }

    /**
     * Name offered for the enhanced file: the configured prefix, the original name up to its first
     * dot, and the output format's extension.
     */
    public String downloadName(String fileName, ImageFormat format) {
        String baseName = fileName == null ? "" : fileName.replace('\\', '/');
        int slash = baseName.lastIndexOf('/');
        if (slash >= 0) {
            baseName = baseName.substring(slash + 1);
        }
        int dot = baseName.indexOf('.');
        if (dot >= 0) {
            baseName = baseName.substring(0, dot);
        }
        if (baseName.isBlank()) {
            baseName = "image";
        }
        return properties.output().filePrefix() + baseName + "." + format.defaultExtension();
    }
}
