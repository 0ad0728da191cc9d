package com.pinebridge.indicators.registry;

import com.pinebridge.indicators.registry.specs.MomentumSpecs;
import com.pinebridge.indicators.registry.specs.MovingAverageSpecs;
import com.pinebridge.indicators.registry.specs.SignalSpecs;
import com.pinebridge.indicators.registry.specs.TrendSpecs;
import com.pinebridge.indicators.registry.specs.VolatilitySpecs;
import com.pinebridge.indicators.registry.specs.VolumeSpecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the indicator registry with all available indicators.
 */
public final class IndicatorRegistryInitializer {

    private static final Logger log = LoggerFactory.getLogger(IndicatorRegistryInitializer.class);

    private IndicatorRegistryInitializer() {}

    /**
     * Process-wide registry, built on first use.
     */
    public static IndicatorRegistry shared() {
        return Holder.DEFAULT;
    }

    /**
     * Build a fresh registry with every built-in indicator.
     */
    public static IndicatorRegistry createDefault() {
        log.info("Initializing indicator registry...");

        IndicatorRegistry.Builder builder = IndicatorRegistry.builder();
        MovingAverageSpecs.registerAll(builder);
        MomentumSpecs.registerAll(builder);
        VolatilitySpecs.registerAll(builder);
        VolumeSpecs.registerAll(builder);
        SignalSpecs.registerAll(builder);
        TrendSpecs.registerAll(builder);

        IndicatorRegistry registry = builder.build();
        log.info("Indicator registry initialized with {} indicators", registry.size());
        return registry;
    }

    private static final class Holder {
        static final IndicatorRegistry DEFAULT = createDefault();
    }
}
