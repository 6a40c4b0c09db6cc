package org.nowstart.zonerisk.indicator;

import java.util.Arrays;
import java.util.List;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.springframework.stereotype.Component;

@Component
public class IndicatorCalculator {

    public double[] closes(List<OhlcvCandle> candles) {
        return candles.stream().mapToDouble(OhlcvCandle::close).toArray();
    }

    public double[] simpleMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] sma = fillNaN(n);
        if (length <= 0 || n < length) {
            return sma;
        }

        double window = 0.0;
        for (int i = 0; i < n; i++) {
            window += values[i];
            if (i >= length) {
                window -= values[i - length];
            }
            if (i >= length - 1) {
                sma[i] = window / length;
            }
        }
        return sma;
    }

    public double[] exponentialMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] ema = fillNaN(n);
        if (length <= 0 || n < length) {
            return ema;
        }

        double seed = 0.0;
        for (int i = 0; i < length; i++) {
            seed += values[i];
        }
        ema[length - 1] = seed / length;

        double alpha = 2.0 / (length + 1.0);
        for (int i = length; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    /**
     * Population standard deviation over a trailing window, aligned with {@link #simpleMovingAverage}.
     */
    public double[] rollingStandardDeviation(double[] values, int length) {
        int n = values.length;
        double[] result = fillNaN(n);
        if (length <= 0 || n < length) {
            return result;
        }

        for (int i = length - 1; i < n; i++) {
            double mean = 0.0;
            for (int j = i - length + 1; j <= i; j++) {
                mean += values[j];
            }
            mean /= length;

            double variance = 0.0;
            for (int j = i - length + 1; j <= i; j++) {
                double diff = values[j] - mean;
                variance += diff * diff;
            }
            result[i] = Math.sqrt(variance / length);
        }
        return result;
    }

    public double[] wilderAtr(List<OhlcvCandle> candles, int period) {
        int n = candles.size();
        double[] atr = fillNaN(n);
        if (period <= 0 || n < period) {
            return atr;
        }

        double[] tr = new double[n];
        tr[0] = candles.get(0).range();
        for (int i = 1; i < n; i++) {
            OhlcvCandle candle = candles.get(i);
            double prevClose = candles.get(i - 1).close();
            double highPrevClose = Math.abs(candle.high() - prevClose);
            double lowPrevClose = Math.abs(candle.low() - prevClose);
            tr[i] = Math.max(candle.range(), Math.max(highPrevClose, lowPrevClose));
        }

        double total = 0.0;
        for (int i = 0; i < period; i++) {
            total += tr[i];
        }

        int first = period - 1;
        atr[first] = total / period;
        for (int i = period; i < n; i++) {
            atr[i] = ((atr[i - 1] * (period - 1)) + tr[i]) / period;
        }
        return atr;
    }

    public double latestAtr(List<OhlcvCandle> candles, int period) {
        if (candles == null || candles.isEmpty()) {
            return Double.NaN;
        }
        return last(wilderAtr(candles, period));
    }

    public double last(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return values[values.length - 1];
    }

    private double[] fillNaN(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
