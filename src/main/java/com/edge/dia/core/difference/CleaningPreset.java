package com.edge.dia.core.difference;

/**
 * 清理预设
 * <p>
 * 从 strict 到 minimal 依次放宽噪声阈值和最小连通域，
 * 宽松预设同时减小形态学核与平滑强度，保留更多弱信号。
 */
public enum CleaningPreset {
    DEFAULT(4.0, 0.05, 10, 5, 3, 0.8),
    STRICT(5.0, 0.08, 20, 5, 3, 0.8),
    GENTLE(3.0, 0.03, 5, 5, 3, 0.8),
    ULTRA_GENTLE(2.0, 0.01, 3, 3, 3, 0.5),
    MINIMAL(1.5, 0.005, 1, 3, 1, 0.3);

    private final double noiseSigmaMultiplier;
    private final double intensityThreshold;
    private final int minComponentSize;
    private final int morphologyKernelSize;
    private final int medianFilterSize;
    private final double gaussianSigma;

    CleaningPreset(double noiseSigmaMultiplier, double intensityThreshold, int minComponentSize,
                   int morphologyKernelSize, int medianFilterSize, double gaussianSigma) {
        this.noiseSigmaMultiplier = noiseSigmaMultiplier;
        this.intensityThreshold = intensityThreshold;
        this.minComponentSize = minComponentSize;
        this.morphologyKernelSize = morphologyKernelSize;
        this.medianFilterSize = medianFilterSize;
        this.gaussianSigma = gaussianSigma;
    }

    /**
     * 把预设参数写入 options，阶段开关保持不变
     */
    public void applyTo(CleaningOptions options) {
        options.setNoiseSigmaMultiplier(noiseSigmaMultiplier);
        options.setIntensityThreshold(intensityThreshold);
        options.setMinComponentSize(minComponentSize);
        options.setMorphologyKernelSize(morphologyKernelSize);
        options.setMedianFilterSize(medianFilterSize);
        options.setGaussianSigma(gaussianSigma);
    }
}
