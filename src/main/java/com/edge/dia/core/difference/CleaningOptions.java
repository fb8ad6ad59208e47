package com.edge.dia.core.difference;

import com.edge.dia.exception.ConfigurationException;
import lombok.Data;

/**
 * 差分与清理参数
 * <p>
 * 设置了 preset 时，预设参数覆盖同名数值参数；各阶段开关独立生效。
 */
@Data
public class CleaningOptions {

    private DifferenceMode mode = DifferenceMode.SCIENCE_MINUS_REFERENCE;
    private CleaningPreset preset;

    // 阈值
    private boolean thresholdEnabled = true;
    private double noiseSigmaMultiplier = 4.0;
    private double intensityThreshold = 0.05;

    // 小连通域
    private boolean componentFilterEnabled = true;
    private int minComponentSize = 10;

    // 形态学开闭运算
    private boolean morphologyEnabled = true;
    private int morphologyKernelSize = 5;

    // 平滑
    private boolean medianEnabled = true;
    private int medianFilterSize = 3;
    private boolean gaussianEnabled = true;
    private double gaussianSigma = 0.8;

    /**
     * 应用预设后的有效参数（新对象）
     */
    public CleaningOptions effective() {
        CleaningOptions copy = new CleaningOptions();
        copy.setMode(mode);
        copy.setPreset(preset);
        copy.setThresholdEnabled(thresholdEnabled);
        copy.setNoiseSigmaMultiplier(noiseSigmaMultiplier);
        copy.setIntensityThreshold(intensityThreshold);
        copy.setComponentFilterEnabled(componentFilterEnabled);
        copy.setMinComponentSize(minComponentSize);
        copy.setMorphologyEnabled(morphologyEnabled);
        copy.setMorphologyKernelSize(morphologyKernelSize);
        copy.setMedianEnabled(medianEnabled);
        copy.setMedianFilterSize(medianFilterSize);
        copy.setGaussianEnabled(gaussianEnabled);
        copy.setGaussianSigma(gaussianSigma);
        if (preset != null) {
            preset.applyTo(copy);
        }
        return copy;
    }

    public void validate() {
        CleaningOptions e = effective();
        if (e.getMode() == null) {
            throw new ConfigurationException("difference.mode must be set");
        }
        if (e.getNoiseSigmaMultiplier() <= 0) {
            throw new ConfigurationException("difference.noise-sigma-multiplier must be positive: " + e.getNoiseSigmaMultiplier());
        }
        if (e.getIntensityThreshold() < 0 || e.getIntensityThreshold() >= 1) {
            throw new ConfigurationException("difference.intensity-threshold must be in [0, 1): " + e.getIntensityThreshold());
        }
        if (e.getMinComponentSize() < 1) {
            throw new ConfigurationException("difference.min-component-size must be at least 1: " + e.getMinComponentSize());
        }
        if (e.getMorphologyKernelSize() < 1 || e.getMorphologyKernelSize() % 2 == 0) {
            throw new ConfigurationException("difference.morphology-kernel-size must be a positive odd number: " + e.getMorphologyKernelSize());
        }
        int m = e.getMedianFilterSize();
        if (m != 1 && m != 3 && m != 5) {
            throw new ConfigurationException("difference.median-filter-size must be 1, 3 or 5: " + m);
        }
        if (e.getGaussianSigma() < 0) {
            throw new ConfigurationException("difference.gaussian-sigma must not be negative: " + e.getGaussianSigma());
        }
    }
}
