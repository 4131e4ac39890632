package com.example.retrain.store;

import com.example.retrain.engine.EngineState;

/**
 * Durable record of the engine's last-known facts.
 *
 * <p>
 * Implementations must make {@link #save(EngineState)} atomic with respect to concurrent
 * {@link #load()} and {@code save} calls: a reader sees either the previous record or the new
 * one, never a mix. Both operations throw {@link StoreUnavailableException} when the backing
 * medium cannot be read or written; callers must not fall back to an empty state.
 * </p>
 */
public interface StateStore {

    /** @return the stored state, or {@link EngineState#initial()} if nothing was ever saved */
    EngineState load();

    void save(EngineState state);
}
