package io.github.eutro.funclets.region;

/**
 * Notified when a funclet's predecessors become final.
 */
@FunctionalInterface
public interface SealListener {
    SealListener NONE = funclet -> {
    };

    void onSeal(Funclet funclet);
}
