package com.example.retrain.store;

import com.example.retrain.engine.EngineState;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-durable {@link StateStore}, for tests and embedded use.
 */
public class InMemoryStateStore implements StateStore {

    private final AtomicReference<EngineState> current;

    public InMemoryStateStore() {
        this(EngineState.initial());
    }

    public InMemoryStateStore(EngineState initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    @Override
    public EngineState load() {
        return current.get();
    }

    @Override
    public void save(EngineState state) {
        current.set(Objects.requireNonNull(state, "state"));
    }
}
