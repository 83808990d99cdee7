package com.stratum.core.apply;

/**
 * Consumer of container-ready notifications. Called under the applier's lock, so
 * implementations must hand work off rather than run it inline.
 */
@FunctionalInterface
public interface ContainerReadyListener {

    void containerReady(ContainerReadyEvent event);
}
