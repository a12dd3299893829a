package com.phillippitts.sessionscribe.service.stt;

import java.util.Objects;

/**
 * Identity of a shareable engine instance: engine name plus model.
 */
public record EngineKey(String engine, String model) {

    public EngineKey {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(model, "model");
    }

    @Override
    public String toString() {
        return engine + ':' + model;
    }
}
