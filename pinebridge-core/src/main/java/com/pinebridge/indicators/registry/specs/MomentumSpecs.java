package com.pinebridge.indicators.registry.specs;

import com.pinebridge.indicators.IndicatorKind;
import com.pinebridge.indicators.registry.IndicatorRegistry;
import com.pinebridge.indicators.registry.IndicatorSpec;

import java.util.List;

import static com.pinebridge.indicators.registry.ParameterSpec.implicit;
import static com.pinebridge.indicators.registry.ParameterSpec.optional;
import static com.pinebridge.indicators.registry.ParameterSpec.required;

/**
 * Oscillators and momentum measures.
 */
public final class MomentumSpecs {

    private MomentumSpecs() {}

    public static void registerAll(IndicatorRegistry.Builder registry) {
        registry.registerAll(RSI, MACD, STOCH, CCI, MFI, ROC, WPR, MOM);
    }

    public static final IndicatorSpec RSI = IndicatorSpec.single("ta.rsi", IndicatorKind.RSI,
        "Relative strength index", required("source"), required("length"));

    // ========== MACD ==========
    public static final IndicatorSpec MACD = IndicatorSpec.multiple("ta.macd", IndicatorKind.MACD,
        "Moving average convergence divergence",
        List.of("macd", "signal", "histogram"),
        required("source"), optional("fast_length", 12), optional("slow_length", 26),
        optional("signal_length", 9));

    // ========== Stochastic ==========
    public static final IndicatorSpec STOCH = IndicatorSpec.multiple("ta.stoch", IndicatorKind.STOCH,
        "Stochastic oscillator, smoothed %K and %D",
        List.of("k", "d"),
        required("source"), required("high"), required("low"), optional("length", 14),
        optional("smooth_k", 3), optional("smooth_d", 3));

    public static final IndicatorSpec CCI = IndicatorSpec.single("ta.cci", IndicatorKind.CCI,
        "Commodity channel index", required("source"), required("length"));

    public static final IndicatorSpec MFI = IndicatorSpec.single("ta.mfi", IndicatorKind.MFI,
        "Money flow index", required("source"), required("length"), implicit("volume"));

    public static final IndicatorSpec ROC = IndicatorSpec.single("ta.roc", IndicatorKind.ROC,
        "Rate of change in percent", required("source"), required("length"));

    public static final IndicatorSpec WPR = IndicatorSpec.single("ta.wpr", IndicatorKind.WPR,
        "Williams %R", required("length"), implicit("high"), implicit("low"), implicit("close"));

    public static final IndicatorSpec MOM = IndicatorSpec.single("ta.mom", IndicatorKind.MOM,
        "Momentum, difference against length bars ago", required("source"), required("length"));
}
