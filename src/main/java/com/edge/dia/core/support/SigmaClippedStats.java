package com.edge.dia.core.support;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;

/**
 * Sigma-clipped 稳健统计量
 * <p>
 * 以中值为中心迭代剔除 |v - median| > sigma * std 的样本，直到收敛或达到迭代上限。
 * 空输入返回全零统计量。
 */
public final class SigmaClippedStats {

    public static final double DEFAULT_SIGMA = 3.0;
    public static final int DEFAULT_ITERATIONS = 5;

    private final double mean;
    private final double median;
    private final double std;
    private final int count;

    private SigmaClippedStats(double mean, double median, double std, int count) {
        this.mean = mean;
        this.median = median;
        this.std = std;
        this.count = count;
    }

    public static SigmaClippedStats of(double[] values) {
        return of(values, values.length, DEFAULT_SIGMA, DEFAULT_ITERATIONS);
    }

    /**
     * @param values   样本，只读取前 length 个
     * @param length   有效样本数
     * @param sigma    剔除阈值（标准差倍数）
     * @param maxIters 最大迭代次数
     */
    public static SigmaClippedStats of(double[] values, int length, double sigma, int maxIters) {
        if (length <= 0) {
            return new SigmaClippedStats(0, 0, 0, 0);
        }
        double[] current = Arrays.copyOf(values, length);
        Median medianFn = new Median();
        StandardDeviation stdFn = new StandardDeviation(false);
        double med = medianFn.evaluate(current);
        double sd = stdFn.evaluate(current);
        for (int iter = 0; iter < maxIters && sd > 0; iter++) {
            double lo = med - sigma * sd;
            double hi = med + sigma * sd;
            int kept = 0;
            for (double v : current) {
                if (v >= lo && v <= hi) {
                    kept++;
                }
            }
            if (kept == current.length || kept == 0) {
                break;
            }
            double[] next = new double[kept];
            int i = 0;
            for (double v : current) {
                if (v >= lo && v <= hi) {
                    next[i++] = v;
                }
            }
            current = next;
            med = medianFn.evaluate(current);
            sd = stdFn.evaluate(current);
        }
        return new SigmaClippedStats(new Mean().evaluate(current), med, sd, current.length);
    }

    /**
     * 对二维数组中满足掩膜的像素求统计量，mask 为 null 时取全部像素
     */
    public static SigmaClippedStats ofPixels(float[][] pixels, boolean[][] mask, boolean nonZeroOnly) {
        int h = pixels.length;
        int w = h == 0 ? 0 : pixels[0].length;
        double[] buffer = new double[w * h];
        int n = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (mask != null && !mask[y][x]) continue;
                float v = pixels[y][x];
                if (nonZeroOnly && v == 0f) continue;
                buffer[n++] = v;
            }
        }
        return of(buffer, n, DEFAULT_SIGMA, DEFAULT_ITERATIONS);
    }

    public double getMean() { return mean; }
    public double getMedian() { return median; }
    public double getStd() { return std; }

    /** 剔除后剩余样本数 */
    public int getCount() { return count; }

    @Override
    public String toString() {
        return String.format("SigmaClippedStats[mean=%.4f, median=%.4f, std=%.4f, n=%d]", mean, median, std, count);
    }
}
