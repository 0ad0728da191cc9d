package com.pinebridge.indicators;

/**
 * Closed set of computations the registry can dispatch to.
 */
public enum IndicatorKind {
    // Moving averages
    SMA, EMA, WMA, RMA, VWMA, HMA, ALMA, DEMA, TEMA,
    // Oscillators
    RSI, MACD, STOCH, CCI, MFI, ROC, WPR, MOM,
    // Volatility
    ATR, TR, BB, KC, STDEV, VARIANCE,
    // Volume
    VWAP, OBV, ACCDIST,
    // Pivots and signals
    PIVOTHIGH, PIVOTLOW, CROSSOVER, CROSSUNDER, CROSS,
    // Rolling statistics
    HIGHEST, LOWEST, CHANGE, CUM, CORRELATION, COV, MEDIAN, PERCENTRANK, RANGE,
    // Trend
    ADX, DMI, SUPERTREND, SAR
}
