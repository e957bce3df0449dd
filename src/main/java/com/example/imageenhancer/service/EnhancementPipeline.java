package com.example.imageenhancer.service;

import com.example.imageenhancer.exception.InvalidImageInputException;
import com.example.imageenhancer.exception.ResourceExhaustedException;
import com.example.imageenhancer.model.EnhancementResult;
import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.model.Raster;
import com.example.imageenhancer.model.StatisticsRecord;
import com.example.imageenhancer.service.stage.EnhancementStage;
import com.example.imageenhancer.service.stage.NoiseReductionStage;
import com.example.imageenhancer.service.stage.SharpeningStage;
import com.example.imageenhancer.service.stage.ToneAdjustmentStage;
import com.example.imageenhancer.service.stage.UpscalingStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the enhancement stages in their fixed order (upscale, tone and color adjustment,
 * sharpening, noise reduction) and pairs the statistics of the input with those of the result.
 * The pipeline keeps no state between calls and may be shared by concurrent callers. Running out
 * of memory in any stage surfaces as {@link ResourceExhaustedException}.
 */
@Service
public class EnhancementPipeline {

    private static final Logger log = LoggerFactory.getLogger(EnhancementPipeline.class);

    private final UpscalingStage upscaling;
    private final List<EnhancementStage> stages;
    private final StatisticsExtractor statisticsExtractor;

    public EnhancementPipeline(UpscalingStage upscaling,
                               ToneAdjustmentStage toneAdjustment,
                               SharpeningStage sharpening,
                               NoiseReductionStage noiseReduction,
                               StatisticsExtractor statisticsExtractor) {
        this.upscaling = upscaling;
        this.stages = List.of(upscaling, toneAdjustment, sharpening, noiseReduction);
        this.statisticsExtractor = statisticsExtractor;
    }

    /**
     * Pipeline with the built-in stage constants, for use outside a Spring context.
     */
    public static EnhancementPipeline withDefaults() {
        return new EnhancementPipeline(
                new UpscalingStage(),
                new ToneAdjustmentStage(),
                new SharpeningStage(),
                new NoiseReductionStage(),
                new StatisticsExtractor());
    }

    public EnhancementResult enhance(Raster raster, ParameterSet parameters) {
        if (raster == null) {
            throw new InvalidImageInputException("Image is required");
        }
        ParameterSet effective = parameters != null ? parameters : ParameterSet.identity();
        upscaling.ensureCapacity(raster, effective.scaleFactor());

        long started = System.nanoTime();
        StatisticsRecord before = statisticsExtractor.stats(raster);

        Raster current = raster;
        for (EnhancementStage stage : stages) {
            long stageStarted = System.nanoTime();
            Raster next;
            try {
                next = stage.apply(current, effective);
            } catch (OutOfMemoryError e) {
                log.error("Stage {} ran out of memory on {}", stage.name(), current);
                throw new ResourceExhaustedException(String.format(
                        "Not enough memory for stage %s on a %dx%d image; retry with a smaller scale factor or input",
                        stage.name(), current.width(), current.height()), e);
            }
            if (log.isDebugEnabled()) {
                log.debug("Stage {} produced {}x{} in {} ms{}", stage.name(), next.width(), next.height(),
                        elapsedMillis(stageStarted), next == current ? " (skipped)" : "");
            }
            current = next;
        }

        StatisticsRecord after = statisticsExtractor.stats(current);
        long elapsed = elapsedMillis(started);
        log.info("Enhanced {}x{} image to {}x{} in {} ms", raster.width(), raster.height(),
                current.width(), current.height(), elapsed);
        return new EnhancementResult(current, before, after, elapsed);
    }

    public List<EnhancementStage> stages() {
        return stages;
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
