package com.pinebridge.indicators.registry.specs;

import com.pinebridge.indicators.IndicatorKind;
import com.pinebridge.indicators.registry.IndicatorRegistry;
import com.pinebridge.indicators.registry.IndicatorSpec;

import java.util.List;

import static com.pinebridge.indicators.registry.ParameterSpec.implicit;
import static com.pinebridge.indicators.registry.ParameterSpec.optional;

/**
 * Trend-following indicators computed from high/low/close.
 */
public final class TrendSpecs {

    private TrendSpecs() {}

    public static void registerAll(IndicatorRegistry.Builder registry) {
        registry.registerAll(ADX, DMI, SUPERTREND, SAR);
    }

    public static final IndicatorSpec ADX = IndicatorSpec.single("ta.adx", IndicatorKind.ADX,
        "Average directional index",
        optional("di_length", 14), optional("adx_smoothing", 14),
        implicit("high"), implicit("low"), implicit("close"));

    public static final IndicatorSpec DMI = IndicatorSpec.multiple("ta.dmi", IndicatorKind.DMI,
        "Directional movement index",
        List.of("plus_di", "minus_di", "adx"),
        optional("di_length", 14), optional("adx_smoothing", 14),
        implicit("high"), implicit("low"), implicit("close"));

    public static final IndicatorSpec SUPERTREND = IndicatorSpec.multiple("ta.supertrend", IndicatorKind.SUPERTREND,
        "Supertrend line and direction",
        List.of("supertrend", "direction"),
        optional("factor", 3.0), optional("atr_period", 10),
        implicit("high"), implicit("low"), implicit("close"));

    public static final IndicatorSpec SAR = IndicatorSpec.single("ta.sar", IndicatorKind.SAR,
        "Parabolic SAR",
        optional("start", 0.02), optional("increment", 0.02), optional("maximum", 0.2),
        implicit("high"), implicit("low"));
}
