package com.edge.dia.core.model;

/**
 * 差异图统计量，供提取与评分阶段使用
 */
public final class DifferenceStatistics {

    private final double noiseFloor;
    private final double noiseSigma;
    private final double residualMax;
    private final double residualMin;
    private final double detectionThreshold;
    private final double intensityFloor;
    private final double baselineBackground;
    private final double baselineSigma;

    public DifferenceStatistics(double noiseFloor, double noiseSigma, double residualMax, double residualMin,
                                double detectionThreshold, double intensityFloor,
                                double baselineBackground, double baselineSigma) {
        this.noiseFloor = noiseFloor;
        this.noiseSigma = noiseSigma;
        this.residualMax = residualMax;
        this.residualMin = residualMin;
        this.detectionThreshold = detectionThreshold;
        this.intensityFloor = intensityFloor;
        this.baselineBackground = baselineBackground;
        this.baselineSigma = baselineSigma;
    }

    public static DifferenceStatistics zero() {
        return new DifferenceStatistics(0, 0, 0, 0, 0, 0, 0, 0);
    }

    /** 噪声基底（sigma-clipped 中值） */
    public double getNoiseFloor() { return noiseFloor; }

    /** 噪声标准差（sigma-clipped） */
    public double getNoiseSigma() { return noiseSigma; }

    public double getResidualMax() { return residualMax; }
    public double getResidualMin() { return residualMin; }

    /** noiseFloor + k * noiseSigma */
    public double getDetectionThreshold() { return detectionThreshold; }

    /** 相对最大值的绝对强度下限 */
    public double getIntensityFloor() { return intensityFloor; }

    /** 基准帧（被减去的一帧）的 sigma-clipped 背景 */
    public double getBaselineBackground() { return baselineBackground; }
    public double getBaselineSigma() { return baselineSigma; }

    /**
     * 用于信噪比计算的噪声尺度，退化时取 1
     */
    public double effectiveSigma() {
        return noiseSigma > 0 && Double.isFinite(noiseSigma) ? noiseSigma : 1.0;
    }

    @Override
    public String toString() {
        return String.format("noiseFloor=%.4f, sigma=%.4f, max=%.4f, min=%.4f, threshold=%.4f, intensityFloor=%.4f",
            noiseFloor, noiseSigma, residualMax, residualMin, detectionThreshold, intensityFloor);
    }
}
