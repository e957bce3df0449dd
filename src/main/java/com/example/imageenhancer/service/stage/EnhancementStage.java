package com.example.imageenhancer.service.stage;

import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.model.Raster;

/**
 * One step of the enhancement pipeline. Implementations are stateless: they never mutate their
 * input, always return a raster with the input's channel count and return the input itself when
 * the relevant parameters are at their identity value.
 */
public interface EnhancementStage {

    String name();

    Raster apply(Raster input, ParameterSet parameters);
}
