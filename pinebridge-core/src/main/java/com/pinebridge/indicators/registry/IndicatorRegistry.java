package com.pinebridge.indicators.registry;

import com.pinebridge.indicators.Indicators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Central registry of indicator specifications.
 *
 * Immutable once built. A single instance is shared read-only by every conversion,
 * so concurrent lookups and calculations need no locking.
 */
public final class IndicatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(IndicatorRegistry.class);

    private final Map<String, IndicatorSpec> specs;

    private IndicatorRegistry(Map<String, IndicatorSpec> specs) {
        this.specs = Collections.unmodifiableMap(new TreeMap<>(specs));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get a spec by qualified name.
     *
     * @param name Qualified name (e.g., "ta.rsi", "ta.macd")
     */
    public Optional<IndicatorSpec> getSpec(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    /**
     * Get a spec by qualified name, throwing if not found.
     */
    public IndicatorSpec require(String name) {
        IndicatorSpec spec = specs.get(name);
        if (spec == null) {
            throw new UnknownIndicatorError(name);
        }
        return spec;
    }

    public boolean contains(String name) {
        return specs.containsKey(name);
    }

    /**
     * All registered qualified names, sorted.
     */
    public Set<String> listAll() {
        return specs.keySet();
    }

    public int size() {
        return specs.size();
    }

    // ========== Calculation ==========

    public IndicatorResult calculate(String name, Object... positional) {
        return calculate(name, List.of(positional), Map.of());
    }

    /**
     * Calculate an indicator. Series arguments are {@code double[]}, scalars are numbers.
     *
     * @throws UnknownIndicatorError if the name is not registered
     * @throws IllegalArgumentException if a required parameter is missing or malformed
     */
    public IndicatorResult calculate(String name, List<?> positional, Map<String, ?> named) {
        IndicatorSpec spec = require(name);
        ResolvedParams p = resolve(spec, positional, named);
        log.debug("Calculating {} with {}", name, p.asMap().keySet());
        return compute(spec, p);
    }

    /**
     * Positional arguments bind first, then named ones, then defaults.
     * Implicit price series bind by name only.
     */
    public ResolvedParams resolve(IndicatorSpec spec, List<?> positional, Map<String, ?> named) {
        List<ParameterSpec> slots = spec.positionalParameters();
        if (positional.size() > slots.size()) {
            throw new IllegalArgumentException(spec.qualifiedName() + " takes at most " + slots.size()
                + " positional arguments, got " + positional.size());
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < positional.size(); i++) {
            values.put(slots.get(i).name(), positional.get(i));
        }
        for (Map.Entry<String, ?> e : named.entrySet()) {
            if (!spec.hasParameter(e.getKey())) {
                throw new IllegalArgumentException(spec.qualifiedName() + " has no parameter '" + e.getKey() + "'");
            }
            if (values.containsKey(e.getKey())) {
                throw new IllegalArgumentException(spec.qualifiedName() + ": parameter '" + e.getKey()
                    + "' given both by position and by name");
            }
            values.put(e.getKey(), e.getValue());
        }
        for (ParameterSpec param : spec.parameters()) {
            if (values.containsKey(param.name())) {
                continue;
            }
            if (param.isRequired()) {
                throw new IllegalArgumentException(spec.qualifiedName() + ": missing required parameter '"
                    + param.name() + "'");
            }
            values.put(param.name(), param.defaultValue());
        }
        return new ResolvedParams(spec.qualifiedName(), values);
    }

    private IndicatorResult compute(IndicatorSpec spec, ResolvedParams p) {
        String name = spec.qualifiedName();
        return switch (spec.kind()) {
            // Moving averages
            case SMA -> IndicatorResult.single(name, Indicators.sma(p.series("source"), p.intValue("length")));
            case EMA -> IndicatorResult.single(name, Indicators.ema(p.series("source"), p.intValue("length")));
            case WMA -> IndicatorResult.single(name, Indicators.wma(p.series("source"), p.intValue("length")));
            case RMA -> IndicatorResult.single(name, Indicators.rma(p.series("source"), p.intValue("length")));
            case HMA -> IndicatorResult.single(name, Indicators.hma(p.series("source"), p.intValue("length")));
            case DEMA -> IndicatorResult.single(name, Indicators.dema(p.series("source"), p.intValue("length")));
            case TEMA -> IndicatorResult.single(name, Indicators.tema(p.series("source"), p.intValue("length")));
            case VWMA -> IndicatorResult.single(name,
                Indicators.vwma(p.series("source"), p.series("volume"), p.intValue("length")));
            case ALMA -> IndicatorResult.single(name, Indicators.alma(p.series("source"), p.intValue("length"),
                p.doubleValue("offset"), p.doubleValue("sigma")));

            // Oscillators
            case RSI -> IndicatorResult.single(name, Indicators.rsi(p.series("source"), p.intValue("length")));
            case MACD -> IndicatorResult.multiple(name, spec.resultNames(), Indicators.macd(p.series("source"),
                p.intValue("fast_length"), p.intValue("slow_length"), p.intValue("signal_length")));
            case STOCH -> {
                double[] raw = Indicators.stoch(p.series("source"), p.series("high"), p.series("low"),
                    p.intValue("length"));
                double[] k = Indicators.sma(raw, p.intValue("smooth_k"));
                double[] d = Indicators.sma(k, p.intValue("smooth_d"));
                yield IndicatorResult.multiple(name, spec.resultNames(), new double[][] {k, d});
            }
            case CCI -> IndicatorResult.single(name, Indicators.cci(p.series("source"), p.intValue("length")));
            case MFI -> IndicatorResult.single(name,
                Indicators.mfi(p.series("source"), p.series("volume"), p.intValue("length")));
            case ROC -> IndicatorResult.single(name, Indicators.roc(p.series("source"), p.intValue("length")));
            case MOM -> IndicatorResult.single(name, Indicators.mom(p.series("source"), p.intValue("length")));
            case WPR -> IndicatorResult.single(name,
                Indicators.wpr(p.series("high"), p.series("low"), p.series("close"), p.intValue("length")));

            // Volatility
            case TR -> IndicatorResult.single(name, Indicators.tr(p.series("high"), p.series("low"), p.series("close")));
            case ATR -> IndicatorResult.single(name,
                Indicators.atr(p.series("high"), p.series("low"), p.series("close"), p.intValue("length")));
            case STDEV -> IndicatorResult.single(name, Indicators.stdev(p.series("source"), p.intValue("length")));
            case VARIANCE -> IndicatorResult.single(name,
                Indicators.variance(p.series("source"), p.intValue("length")));
            case BB -> IndicatorResult.multiple(name, spec.resultNames(),
                Indicators.bb(p.series("source"), p.intValue("length"), p.doubleValue("mult")));
            case KC -> IndicatorResult.multiple(name, spec.resultNames(), Indicators.kc(p.series("source"),
                p.series("high"), p.series("low"), p.series("close"), p.intValue("length"), p.doubleValue("mult")));

            // Volume
            case VWAP -> IndicatorResult.single(name, Indicators.vwap(p.series("source"), p.series("volume")));
            case OBV -> IndicatorResult.single(name, Indicators.obv(p.series("close"), p.series("volume")));
            case ACCDIST -> IndicatorResult.single(name, Indicators.accdist(p.series("high"), p.series("low"),
                p.series("close"), p.series("volume")));

            // Pivots and signals
            case PIVOTHIGH -> IndicatorResult.single(name, Indicators.pivotHigh(p.series("source"),
                p.intValue("leftbars"), p.intValue("rightbars")));
            case PIVOTLOW -> IndicatorResult.single(name, Indicators.pivotLow(p.series("source"),
                p.intValue("leftbars"), p.intValue("rightbars")));
            case CROSSOVER -> IndicatorResult.single(name,
                Indicators.crossover(p.series("source1"), p.series("source2")));
            case CROSSUNDER -> IndicatorResult.single(name,
                Indicators.crossunder(p.series("source1"), p.series("source2")));
            case CROSS -> IndicatorResult.single(name, Indicators.cross(p.series("source1"), p.series("source2")));

            // Rolling statistics
            case HIGHEST -> IndicatorResult.single(name, Indicators.highest(p.series("source"), p.intValue("length")));
            case LOWEST -> IndicatorResult.single(name, Indicators.lowest(p.series("source"), p.intValue("length")));
            case RANGE -> IndicatorResult.single(name, Indicators.range(p.series("source"), p.intValue("length")));
            case CHANGE -> IndicatorResult.single(name, Indicators.change(p.series("source"), p.intValue("length")));
            case CUM -> IndicatorResult.single(name, Indicators.cum(p.series("source")));
            case MEDIAN -> IndicatorResult.single(name, Indicators.median(p.series("source"), p.intValue("length")));
            case PERCENTRANK -> IndicatorResult.single(name,
                Indicators.percentrank(p.series("source"), p.intValue("length")));
            case CORRELATION -> IndicatorResult.single(name,
                Indicators.correlation(p.series("source1"), p.series("source2"), p.intValue("length")));
            case COV -> IndicatorResult.single(name,
                Indicators.cov(p.series("source1"), p.series("source2"), p.intValue("length")));

            // Trend
            case ADX -> IndicatorResult.single(name, Indicators.adx(p.series("high"), p.series("low"),
                p.series("close"), p.intValue("di_length"), p.intValue("adx_smoothing")));
            case DMI -> IndicatorResult.multiple(name, spec.resultNames(), Indicators.dmi(p.series("high"),
                p.series("low"), p.series("close"), p.intValue("di_length"), p.intValue("adx_smoothing")));
            case SUPERTREND -> IndicatorResult.multiple(name, spec.resultNames(), Indicators.supertrend(
                p.series("high"), p.series("low"), p.series("close"), p.doubleValue("factor"),
                p.intValue("atr_period")));
            case SAR -> IndicatorResult.single(name, Indicators.sar(p.series("high"), p.series("low"),
                p.doubleValue("start"), p.doubleValue("increment"), p.doubleValue("maximum")));
        };
    }

    // ========== Builder ==========

    /**
     * Collects specs before the registry is frozen.
     */
    public static final class Builder {

        private final Map<String, IndicatorSpec> specs = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Register an indicator spec. Overwrites any existing spec with the same name.
         */
        public Builder register(IndicatorSpec spec) {
            specs.put(spec.qualifiedName(), spec);
            log.debug("Registered indicator: {}", spec.qualifiedName());
            return this;
        }

        public Builder registerAll(IndicatorSpec... specsToRegister) {
            for (IndicatorSpec spec : specsToRegister) {
                register(spec);
            }
            return this;
        }

        public IndicatorRegistry build() {
            return new IndicatorRegistry(specs);
        }
    }
}
