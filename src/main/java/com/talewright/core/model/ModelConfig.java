package com.talewright.core.model;

import java.io.Serializable;

/**
 * Model selection for a run.
 *
 * @param model       model identifier passed to the text-generation backend
 * @param temperature sampling temperature
 */
public record ModelConfig(String model, double temperature) implements Serializable {

    public static ModelConfig of(String model) {
        return new ModelConfig(model, 0.8);
    }
}
