package com.example.imageenhancer.config;

import com.example.imageenhancer.service.stage.NoiseReductionStage;
import com.example.imageenhancer.service.stage.SharpeningStage;
import com.example.imageenhancer.service.stage.ToneAdjustmentStage;
import com.example.imageenhancer.service.stage.UpscalingStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public UpscalingStage upscalingStage(EnhancerProperties properties) {
        long limit = properties.limits().maxOutputSamples();
        log.info("Upscaling limited to {} output samples", limit);
        return new UpscalingStage(limit);
    }

    @Bean
    public ToneAdjustmentStage toneAdjustmentStage() {
        return new ToneAdjustmentStage();
    }

    @Bean
    public SharpeningStage sharpeningStage(EnhancerProperties properties) {
        return new SharpeningStage(properties.sharpening().sigma());
    }

    @Bean
    public NoiseReductionStage noiseReductionStage(EnhancerProperties properties) {
        NoiseReductionStage.Settings settings = properties.noiseReduction().toSettings();
        log.debug("Noise reduction settings: {}", settings);
        return new NoiseReductionStage(settings);
    }
}
