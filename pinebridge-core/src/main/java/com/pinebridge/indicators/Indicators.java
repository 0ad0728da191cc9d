package com.pinebridge.indicators;

import java.util.Arrays;

/**
 * Series math for the registered indicators.
 *
 * Every function takes aligned bar series and returns an array of the same length
 * where index corresponds to bar index. Invalid values (warmup period) are Double.NaN.
 * Leading NaN input is skipped, so results can be chained.
 */
public final class Indicators {

    private Indicators() {} // Utility class

    // ========== Moving averages ==========

    public static double[] sma(double[] src, int length) {
        double[] result = nanArray(src.length);
        int start = firstValid(src);
        if (length <= 0 || start < 0 || src.length - start < length) {
            return result;
        }

        double sum = 0;
        for (int i = start; i < start + length; i++) {
            sum += src[i];
        }
        result[start + length - 1] = sum / length;

        // Slide the window
        for (int i = start + length; i < src.length; i++) {
            sum = sum - src[i - length] + src[i];
            result[i] = sum / length;
        }
        return result;
    }

    public static double[] ema(double[] src, int length) {
        return smoothed(src, length, 2.0 / (length + 1));
    }

    /**
     * Wilder's moving average, alpha = 1 / length.
     */
    public static double[] rma(double[] src, int length) {
        return smoothed(src, length, 1.0 / length);
    }

    public static double[] wma(double[] src, int length) {
        double[] result = nanArray(src.length);
        int start = firstValid(src);
        if (length <= 0 || start < 0) {
            return result;
        }
        double norm = length * (length + 1) / 2.0;
        for (int i = start + length - 1; i < src.length; i++) {
            double sum = 0;
            for (int j = 0; j < length; j++) {
                sum += src[i - j] * (length - j);
            }
            result[i] = sum / norm;
        }
        return result;
    }

    public static double[] vwma(double[] src, double[] volume, int length) {
        double[] weighted = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            weighted[i] = src[i] * volume[i];
        }
        double[] num = sma(weighted, length);
        double[] den = sma(volume, length);
        double[] result = nanArray(src.length);
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(num[i]) && den[i] != 0) {
                result[i] = num[i] / den[i];
            }
        }
        return result;
    }

    /**
     * Hull moving average: wma(2 * wma(n/2) - wma(n), sqrt(n)).
     */
    public static double[] hma(double[] src, int length) {
        double[] half = wma(src, Math.max(1, length / 2));
        double[] full = wma(src, length);
        double[] diff = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            diff[i] = 2 * half[i] - full[i];
        }
        return wma(diff, Math.max(1, (int) Math.floor(Math.sqrt(length))));
    }

    /**
     * Arnaud Legoux moving average.
     */
    public static double[] alma(double[] src, int length, double offset, double sigma) {
        double[] result = nanArray(src.length);
        int start = firstValid(src);
        if (length <= 0 || start < 0) {
            return result;
        }
        double m = offset * (length - 1);
        double s = length / sigma;
        double[] weights = new double[length];
        double norm = 0;
        for (int j = 0; j < length; j++) {
            weights[j] = Math.exp(-((j - m) * (j - m)) / (2 * s * s));
            norm += weights[j];
        }
        for (int i = start + length - 1; i < src.length; i++) {
            double sum = 0;
            for (int j = 0; j < length; j++) {
                sum += weights[j] * src[i - length + 1 + j];
            }
            result[i] = sum / norm;
        }
        return result;
    }

    public static double[] dema(double[] src, int length) {
        double[] e1 = ema(src, length);
        double[] e2 = ema(e1, length);
        double[] result = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            result[i] = 2 * e1[i] - e2[i];
        }
        return result;
    }

    public static double[] tema(double[] src, int length) {
        double[] e1 = ema(src, length);
        double[] e2 = ema(e1, length);
        double[] e3 = ema(e2, length);
        double[] result = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            result[i] = 3 * e1[i] - 3 * e2[i] + e3[i];
        }
        return result;
    }

    // ========== Oscillators ==========

    /**
     * Relative Strength Index with Wilder's smoothing.
     */
    public static double[] rsi(double[] src, int length) {
        int n = src.length;
        double[] result = nanArray(n);
        int start = firstValid(src);
        if (length <= 0 || start < 0 || n - start < length + 1) {
            return result;
        }

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = start + 1; i <= start + length; i++) {
            double change = src[i] - src[i - 1];
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= length;
        avgLoss /= length;
        result[start + length] = rsiValue(avgGain, avgLoss);

        for (int i = start + length + 1; i < n; i++) {
            double change = src[i] - src[i - 1];
            double gain = change > 0 ? change : 0;
            double loss = change < 0 ? Math.abs(change) : 0;
            avgGain = (avgGain * (length - 1) + gain) / length;
            avgLoss = (avgLoss * (length - 1) + loss) / length;
            result[i] = rsiValue(avgGain, avgLoss);
        }
        return result;
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return 100;
        }
        double rs = avgGain / avgLoss;
        return 100 - (100 / (1 + rs));
    }

    /**
     * MACD line, signal line and histogram, in that order.
     */
    public static double[][] macd(double[] src, int fast, int slow, int signal) {
        double[] fastEma = ema(src, fast);
        double[] slowEma = ema(src, slow);
        double[] line = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            line[i] = fastEma[i] - slowEma[i];
        }
        double[] signalLine = ema(line, signal);
        double[] histogram = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            histogram[i] = line[i] - signalLine[i];
        }
        return new double[][] {line, signalLine, histogram};
    }

    /**
     * Raw stochastic of source against the high/low range.
     */
    public static double[] stoch(double[] src, double[] high, double[] low, int length) {
        double[] hh = highest(high, length);
        double[] ll = lowest(low, length);
        double[] result = nanArray(src.length);
        for (int i = 0; i < src.length; i++) {
            double range = hh[i] - ll[i];
            if (!Double.isNaN(range)) {
                result[i] = range == 0 ? 0 : 100 * (src[i] - ll[i]) / range;
            }
        }
        return result;
    }

    public static double[] cci(double[] src, int length) {
        double[] mean = sma(src, length);
        double[] result = nanArray(src.length);
        for (int i = 0; i < src.length; i++) {
            if (Double.isNaN(mean[i])) {
                continue;
            }
            double dev = 0;
            for (int j = i - length + 1; j <= i; j++) {
                dev += Math.abs(src[j] - mean[i]);
            }
            dev /= length;
            result[i] = dev == 0 ? 0 : (src[i] - mean[i]) / (0.015 * dev);
        }
        return result;
    }

    /**
     * Money flow index over a typical-price source.
     */
    public static double[] mfi(double[] src, double[] volume, int length) {
        int n = src.length;
        double[] result = nanArray(n);
        for (int i = length; i < n; i++) {
            double up = 0;
            double down = 0;
            for (int j = i - length + 1; j <= i; j++) {
                double flow = src[j] * volume[j];
                if (src[j] > src[j - 1]) {
                    up += flow;
                } else if (src[j] < src[j - 1]) {
                    down += flow;
                }
            }
            result[i] = down == 0 ? 100 : 100 - 100 / (1 + up / down);
        }
        return result;
    }

    public static double[] roc(double[] src, int length) {
        double[] result = nanArray(src.length);
        for (int i = length; i < src.length; i++) {
            if (src[i - length] != 0) {
                result[i] = 100 * (src[i] - src[i - length]) / src[i - length];
            }
        }
        return result;
    }

    public static double[] mom(double[] src, int length) {
        double[] result = nanArray(src.length);
        for (int i = length; i < src.length; i++) {
            result[i] = src[i] - src[i - length];
        }
        return result;
    }

    /**
     * Williams %R.
     */
    public static double[] wpr(double[] high, double[] low, double[] close, int length) {
        double[] hh = highest(high, length);
        double[] ll = lowest(low, length);
        double[] result = nanArray(close.length);
        for (int i = 0; i < close.length; i++) {
            double range = hh[i] - ll[i];
            if (!Double.isNaN(range)) {
                result[i] = range == 0 ? 0 : -100 * (hh[i] - close[i]) / range;
            }
        }
        return result;
    }

    // ========== Volatility ==========

    public static double[] tr(double[] high, double[] low, double[] close) {
        double[] result = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            double hl = high[i] - low[i];
            if (i == 0) {
                result[i] = hl;
            } else {
                double hc = Math.abs(high[i] - close[i - 1]);
                double lc = Math.abs(low[i] - close[i - 1]);
                result[i] = Math.max(hl, Math.max(hc, lc));
            }
        }
        return result;
    }

    public static double[] atr(double[] high, double[] low, double[] close, int length) {
        return rma(tr(high, low, close), length);
    }

    /**
     * Population standard deviation over a rolling window.
     */
    public static double[] stdev(double[] src, int length) {
        double[] var = variance(src, length);
        double[] result = nanArray(src.length);
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(var[i])) {
                result[i] = Math.sqrt(var[i]);
            }
        }
        return result;
    }

    public static double[] variance(double[] src, int length) {
        double[] mean = sma(src, length);
        double[] result = nanArray(src.length);
        for (int i = 0; i < src.length; i++) {
            if (Double.isNaN(mean[i])) {
                continue;
            }
            double sum = 0;
            for (int j = i - length + 1; j <= i; j++) {
                double d = src[j] - mean[i];
                sum += d * d;
            }
            result[i] = sum / length;
        }
        return result;
    }

    /**
     * Bollinger bands: basis, upper, lower.
     */
    public static double[][] bb(double[] src, int length, double mult) {
        double[] basis = sma(src, length);
        double[] dev = stdev(src, length);
        double[] upper = new double[src.length];
        double[] lower = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            upper[i] = basis[i] + mult * dev[i];
            lower[i] = basis[i] - mult * dev[i];
        }
        return new double[][] {basis, upper, lower};
    }

    /**
     * Keltner channels on an EMA basis with a true-range band: basis, upper, lower.
     */
    public static double[][] kc(double[] src, double[] high, double[] low, double[] close,
                                int length, double mult) {
        double[] basis = ema(src, length);
        double[] range = ema(tr(high, low, close), length);
        double[] upper = new double[src.length];
        double[] lower = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            upper[i] = basis[i] + mult * range[i];
            lower[i] = basis[i] - mult * range[i];
        }
        return new double[][] {basis, upper, lower};
    }

    // ========== Volume ==========

    /**
     * Cumulative volume-weighted average price from the first bar.
     */
    public static double[] vwap(double[] src, double[] volume) {
        double[] result = nanArray(src.length);
        double pv = 0;
        double vol = 0;
        for (int i = 0; i < src.length; i++) {
            pv += src[i] * volume[i];
            vol += volume[i];
            if (vol != 0) {
                result[i] = pv / vol;
            }
        }
        return result;
    }

    public static double[] obv(double[] close, double[] volume) {
        double[] result = new double[close.length];
        for (int i = 1; i < close.length; i++) {
            double sign = Math.signum(close[i] - close[i - 1]);
            result[i] = result[i - 1] + sign * volume[i];
        }
        return result;
    }

    /**
     * Accumulation/distribution line.
     */
    public static double[] accdist(double[] high, double[] low, double[] close, double[] volume) {
        double[] result = new double[close.length];
        double total = 0;
        for (int i = 0; i < close.length; i++) {
            double range = high[i] - low[i];
            double mfm = range == 0 ? 0 : ((close[i] - low[i]) - (high[i] - close[i])) / range;
            total += mfm * volume[i];
            result[i] = total;
        }
        return result;
    }

    // ========== Pivots ==========

    /**
     * Pivot high value reported on the bar where it is confirmed (rightBars later).
     */
    public static double[] pivotHigh(double[] src, int leftBars, int rightBars) {
        return pivot(src, leftBars, rightBars, true);
    }

    public static double[] pivotLow(double[] src, int leftBars, int rightBars) {
        return pivot(src, leftBars, rightBars, false);
    }

    private static double[] pivot(double[] src, int leftBars, int rightBars, boolean high) {
        double[] result = nanArray(src.length);
        for (int i = leftBars + rightBars; i < src.length; i++) {
            int p = i - rightBars;
            boolean isPivot = true;
            for (int j = p - leftBars; j <= p + rightBars && isPivot; j++) {
                if (j == p) {
                    continue;
                }
                isPivot = high ? src[p] > src[j] : src[p] < src[j];
            }
            if (isPivot) {
                result[i] = src[p];
            }
        }
        return result;
    }

    // ========== Signals ==========

    /**
     * 1.0 on bars where a crosses above b, else 0.0. The first bar is NaN.
     */
    public static double[] crossover(double[] a, double[] b) {
        double[] result = nanArray(a.length);
        for (int i = 1; i < a.length; i++) {
            result[i] = a[i] > b[i] && a[i - 1] <= b[i - 1] ? 1.0 : 0.0;
        }
        return result;
    }

    public static double[] crossunder(double[] a, double[] b) {
        double[] result = nanArray(a.length);
        for (int i = 1; i < a.length; i++) {
            result[i] = a[i] < b[i] && a[i - 1] >= b[i - 1] ? 1.0 : 0.0;
        }
        return result;
    }

    public static double[] cross(double[] a, double[] b) {
        double[] over = crossover(a, b);
        double[] under = crossunder(a, b);
        double[] result = nanArray(a.length);
        for (int i = 1; i < a.length; i++) {
            result[i] = over[i] == 1.0 || under[i] == 1.0 ? 1.0 : 0.0;
        }
        return result;
    }

    // ========== Rolling statistics ==========

    public static double[] highest(double[] src, int length) {
        double[] result = nanArray(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int j = i - length + 1; j <= i; j++) {
                max = Math.max(max, src[j]);
            }
            result[i] = max;
        }
        return result;
    }

    public static double[] lowest(double[] src, int length) {
        double[] result = nanArray(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double min = Double.POSITIVE_INFINITY;
            for (int j = i - length + 1; j <= i; j++) {
                min = Math.min(min, src[j]);
            }
            result[i] = min;
        }
        return result;
    }

    public static double[] range(double[] src, int length) {
        double[] hh = highest(src, length);
        double[] ll = lowest(src, length);
        double[] result = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            result[i] = hh[i] - ll[i];
        }
        return result;
    }

    public static double[] change(double[] src, int length) {
        return mom(src, length);
    }

    public static double[] cum(double[] src) {
        double[] result = new double[src.length];
        double total = 0;
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(src[i])) {
                total += src[i];
            }
            result[i] = total;
        }
        return result;
    }

    public static double[] cov(double[] a, double[] b, int length) {
        double[] meanA = sma(a, length);
        double[] meanB = sma(b, length);
        double[] result = nanArray(a.length);
        for (int i = 0; i < a.length; i++) {
            if (Double.isNaN(meanA[i]) || Double.isNaN(meanB[i])) {
                continue;
            }
            double sum = 0;
            for (int j = i - length + 1; j <= i; j++) {
                sum += (a[j] - meanA[i]) * (b[j] - meanB[i]);
            }
            result[i] = sum / length;
        }
        return result;
    }

    public static double[] correlation(double[] a, double[] b, int length) {
        double[] covariance = cov(a, b, length);
        double[] sa = stdev(a, length);
        double[] sb = stdev(b, length);
        double[] result = nanArray(a.length);
        for (int i = 0; i < a.length; i++) {
            double den = sa[i] * sb[i];
            if (!Double.isNaN(covariance[i]) && den != 0) {
                result[i] = covariance[i] / den;
            }
        }
        return result;
    }

    public static double[] median(double[] src, int length) {
        double[] result = nanArray(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double[] window = Arrays.copyOfRange(src, i - length + 1, i + 1);
            Arrays.sort(window);
            int mid = length / 2;
            result[i] = length % 2 == 1 ? window[mid] : (window[mid - 1] + window[mid]) / 2;
        }
        return result;
    }

    /**
     * Percentage of the previous {@code length} values less than or equal to the current one.
     */
    public static double[] percentrank(double[] src, int length) {
        double[] result = nanArray(src.length);
        for (int i = length; i < src.length; i++) {
            int count = 0;
            for (int j = i - length; j < i; j++) {
                if (src[j] <= src[i]) {
                    count++;
                }
            }
            result[i] = 100.0 * count / length;
        }
        return result;
    }

    // ========== Trend ==========

    /**
     * Directional movement: +DI, -DI, ADX.
     */
    public static double[][] dmi(double[] high, double[] low, double[] close, int diLength, int adxSmoothing) {
        int n = close.length;
        double[] plusDm = new double[n];
        double[] minusDm = new double[n];
        for (int i = 1; i < n; i++) {
            double up = high[i] - high[i - 1];
            double down = low[i - 1] - low[i];
            plusDm[i] = up > down && up > 0 ? up : 0;
            minusDm[i] = down > up && down > 0 ? down : 0;
        }
        double[] trRma = rma(tr(high, low, close), diLength);
        double[] plusRma = rma(plusDm, diLength);
        double[] minusRma = rma(minusDm, diLength);

        double[] plus = nanArray(n);
        double[] minus = nanArray(n);
        double[] dx = nanArray(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(trRma[i]) || trRma[i] == 0) {
                continue;
            }
            plus[i] = 100 * plusRma[i] / trRma[i];
            minus[i] = 100 * minusRma[i] / trRma[i];
            double sum = plus[i] + minus[i];
            dx[i] = sum == 0 ? 0 : 100 * Math.abs(plus[i] - minus[i]) / sum;
        }
        return new double[][] {plus, minus, rma(dx, adxSmoothing)};
    }

    public static double[] adx(double[] high, double[] low, double[] close, int diLength, int adxSmoothing) {
        return dmi(high, low, close, diLength, adxSmoothing)[2];
    }

    /**
     * Supertrend line and direction (-1 up, 1 down).
     */
    public static double[][] supertrend(double[] high, double[] low, double[] close, double factor, int atrPeriod) {
        int n = close.length;
        double[] atr = atr(high, low, close, atrPeriod);
        double[] line = nanArray(n);
        double[] direction = nanArray(n);
        double prevUpper = Double.NaN;
        double prevLower = Double.NaN;
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(atr[i])) {
                continue;
            }
            double mid = (high[i] + low[i]) / 2;
            double upper = mid + factor * atr[i];
            double lower = mid - factor * atr[i];
            if (!Double.isNaN(prevLower) && !(lower > prevLower || close[i - 1] < prevLower)) {
                lower = prevLower;
            }
            if (!Double.isNaN(prevUpper) && !(upper < prevUpper || close[i - 1] > prevUpper)) {
                upper = prevUpper;
            }
            double dir;
            if (Double.isNaN(line[Math.max(0, i - 1)]) || i == 0) {
                dir = 1;
            } else if (line[i - 1] == prevUpper) {
                dir = close[i] > upper ? -1 : 1;
            } else {
                dir = close[i] < lower ? 1 : -1;
            }
            direction[i] = dir;
            line[i] = dir == -1 ? lower : upper;
            prevUpper = upper;
            prevLower = lower;
        }
        return new double[][] {line, direction};
    }

    /**
     * Parabolic stop and reverse.
     */
    public static double[] sar(double[] high, double[] low, double start, double increment, double maximum) {
        int n = high.length;
        double[] result = nanArray(n);
        if (n < 2) {
            return result;
        }
        boolean up = high[1] >= high[0];
        double af = start;
        double ep = up ? high[1] : low[1];
        double sar = up ? low[0] : high[0];
        result[1] = sar;
        for (int i = 2; i < n; i++) {
            sar = sar + af * (ep - sar);
            if (up) {
                sar = Math.min(sar, Math.min(low[i - 1], low[i - 2]));
                if (low[i] < sar) {
                    up = false;
                    sar = ep;
                    ep = low[i];
                    af = start;
                } else if (high[i] > ep) {
                    ep = high[i];
                    af = Math.min(af + increment, maximum);
                }
            } else {
                sar = Math.max(sar, Math.max(high[i - 1], high[i - 2]));
                if (high[i] > sar) {
                    up = true;
                    sar = ep;
                    ep = high[i];
                    af = start;
                } else if (low[i] < ep) {
                    ep = low[i];
                    af = Math.min(af + increment, maximum);
                }
            }
            result[i] = sar;
        }
        return result;
    }

    // ========== Helpers ==========

    private static double[] smoothed(double[] src, int length, double alpha) {
        double[] result = sma(src, length);
        int start = firstValid(result);
        if (start < 0) {
            return result;
        }
        for (int i = start + 1; i < src.length; i++) {
            result[i] = alpha * src[i] + (1 - alpha) * result[i - 1];
        }
        return result;
    }

    private static int firstValid(double[] src) {
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(src[i])) {
                return i;
            }
        }
        return -1;
    }

    private static double[] nanArray(int n) {
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);
        return result;
    }
}
