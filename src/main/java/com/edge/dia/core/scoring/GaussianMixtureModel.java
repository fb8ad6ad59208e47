package com.edge.dia.core.scoring;

import com.edge.dia.core.support.SigmaClippedStats;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * 一维两分量高斯混合（背景 + 源），EM 拟合
 * <p>
 * 分量 0 初始化为 sigma-clipped 背景，分量 1 初始化在高百分位处。
 * 拟合后保证分量 1 的均值较大。密度在对数空间计算，远离两个分量的样本不会下溢。
 */
public final class GaussianMixtureModel {

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2 * Math.PI);

    private final double[] weights;
    private final double[] means;
    private final double[] stds;
    private final int iterations;
    private final boolean converged;

    private GaussianMixtureModel(double[] weights, double[] means, double[] stds, int iterations, boolean converged) {
        this.weights = weights;
        this.means = means;
        this.stds = stds;
        this.iterations = iterations;
        this.converged = converged;
    }

    /**
     * @return 拟合结果；样本不足或方差为零时返回 null
     */
    public static GaussianMixtureModel fit(double[] data, int maxIterations, double tolerance) {
        if (data.length < 10) {
            return null;
        }
        SigmaClippedStats bg = SigmaClippedStats.of(data);
        Percentile percentile = new Percentile();
        percentile.setData(data);
        double hi = percentile.evaluate(99.0);
        double lo = percentile.evaluate(1.0);
        double range = hi - lo;
        if (bg.getStd() <= 0 || range <= 0) {
            return null;
        }
        double varFloor = Math.max(1e-12, 1e-6 * range * range);

        double[] w = {0.9, 0.1};
        double[] mu = {bg.getMedian(), hi};
        double[] sd = {bg.getStd(), Math.max(bg.getStd(), (hi - bg.getMedian()) / 2.0)};

        int n = data.length;
        double[] resp = new double[n];
        double previous = Double.NEGATIVE_INFINITY;
        boolean converged = false;
        int iter = 0;
        for (; iter < maxIterations; iter++) {
            // E 步
            double logLik = 0;
            for (int i = 0; i < n; i++) {
                double l0 = Math.log(w[0]) + logNormal(data[i], mu[0], sd[0]);
                double l1 = Math.log(w[1]) + logNormal(data[i], mu[1], sd[1]);
                double m = Math.max(l0, l1);
                double lse = m + Math.log(Math.exp(l0 - m) + Math.exp(l1 - m));
                resp[i] = Math.exp(l1 - lse);
                logLik += lse;
            }
            // M 步
            double n1 = 0;
            double s1 = 0;
            double s0 = 0;
            for (int i = 0; i < n; i++) {
                n1 += resp[i];
                s1 += resp[i] * data[i];
                s0 += (1 - resp[i]) * data[i];
            }
            double n0 = n - n1;
            if (n1 < 1e-9 || n0 < 1e-9) {
                break;
            }
            mu[0] = s0 / n0;
            mu[1] = s1 / n1;
            double v0 = 0;
            double v1 = 0;
            for (int i = 0; i < n; i++) {
                double d0 = data[i] - mu[0];
                double d1 = data[i] - mu[1];
                v0 += (1 - resp[i]) * d0 * d0;
                v1 += resp[i] * d1 * d1;
            }
            sd[0] = Math.sqrt(Math.max(varFloor, v0 / n0));
            sd[1] = Math.sqrt(Math.max(varFloor, v1 / n1));
            w[0] = n0 / n;
            w[1] = n1 / n;

            if (Math.abs(logLik - previous) < tolerance * Math.max(1.0, Math.abs(logLik))) {
                converged = true;
                iter++;
                break;
            }
            previous = logLik;
        }

        if (mu[1] < mu[0]) {
            return new GaussianMixtureModel(new double[]{w[1], w[0]}, new double[]{mu[1], mu[0]},
                new double[]{sd[1], sd[0]}, iter, converged);
        }
        return new GaussianMixtureModel(w, mu, sd, iter, converged);
    }

    /**
     * 样本属于源分量（均值较大者）的后验概率
     * <p>
     * 高于源分量均值的样本按均值处取值，后验对亮度单调不减。
     */
    public double sourcePosterior(double value) {
        double x = Math.min(value, means[1]);
        double l0 = Math.log(weights[0]) + logNormal(x, means[0], stds[0]);
        double l1 = Math.log(weights[1]) + logNormal(x, means[1], stds[1]);
        double m = Math.max(l0, l1);
        return Math.exp(l1 - (m + Math.log(Math.exp(l0 - m) + Math.exp(l1 - m))));
    }

    private static double logNormal(double x, double mu, double sd) {
        double z = (x - mu) / sd;
        return -0.5 * z * z - Math.log(sd) - LOG_SQRT_2PI;
    }

    public double getBackgroundMean() { return means[0]; }
    public double getBackgroundStd() { return stds[0]; }
    public double getSourceMean() { return means[1]; }
    public double getSourceStd() { return stds[1]; }
    public double getSourceWeight() { return weights[1]; }
    public int getIterations() { return iterations; }
    public boolean isConverged() { return converged; }

    @Override
    public String toString() {
        return String.format("GMM[bg=N(%.4f, %.4f) w=%.4f, src=N(%.4f, %.4f) w=%.4f, iter=%d, converged=%s]",
            means[0], stds[0], weights[0], means[1], stds[1], weights[1], iterations, converged);
    }
}
