package com.edge.dia.core.detect;

import com.edge.dia.exception.ConfigurationException;
import lombok.Data;

/**
 * 候选提取参数
 */
@Data
public class ExtractionOptions {

    private int minCandidateArea = 3;

    /** 4 或 8 连通 */
    private int connectivity = 8;

    /** 是否按中心距离 + 亮度综合排序 */
    private boolean rankingEnabled = true;
    private double centerWeight = 0.6;
    private double brightnessWeight = 0.4;

    /** 参考源显著性的测量半径（像素） */
    private int referenceWindowRadius = 1;

    public void validate() {
        if (minCandidateArea < 1) {
            throw new ConfigurationException("extraction.min-candidate-area must be at least 1: " + minCandidateArea);
        }
        if (connectivity != 4 && connectivity != 8) {
            throw new ConfigurationException("extraction.connectivity must be 4 or 8: " + connectivity);
        }
        if (referenceWindowRadius < 0) {
            throw new ConfigurationException("extraction.reference-window-radius must not be negative");
        }
        normalizedWeights();
    }

    /**
     * 归一化后的排序权重 {center, brightness}
     *
     * @throws ConfigurationException 权重为负或和不为正时
     */
    public double[] normalizedWeights() {
        if (centerWeight < 0 || brightnessWeight < 0 || !Double.isFinite(centerWeight) || !Double.isFinite(brightnessWeight)) {
            throw new ConfigurationException(String.format(
                "Ranking weights must be non-negative: center=%s, brightness=%s", centerWeight, brightnessWeight));
        }
        double sum = centerWeight + brightnessWeight;
        if (sum <= 0) {
            throw new ConfigurationException("Ranking weights cannot be normalized: sum is " + sum);
        }
        return new double[]{centerWeight / sum, brightnessWeight / sum};
    }
}
