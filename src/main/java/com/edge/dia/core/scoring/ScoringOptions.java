package com.edge.dia.core.scoring;

import com.edge.dia.exception.ConfigurationException;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 评分参数
 */
@Data
public class ScoringOptions {

    private ScoringStrategy strategy = ScoringStrategy.STATISTICAL;

    /** 可靠性阈值，[0, 100] */
    private double reliabilityCutoff = 50.0;

    // 规则门限
    private double snrNoiseCutoff = 3.0;
    private int artifactMaxArea = 5;
    private double artifactSmallElongation = 2.0;
    private double maxElongation = 4.0;
    private double stellarSignificance = 5.0;

    // 特征归一化
    private double snrSaturation = 20.0;
    private double edgeMargin = 20.0;
    private double areaSaturation = 20.0;

    // 可靠性加权
    private double significanceWeight = 0.4;
    private double shapeWeight = 0.2;
    private double edgeWeight = 0.15;
    private double areaWeight = 0.1;
    private double signWeight = 0.15;

    /** 所有内部随机采样的种子 */
    private long randomSeed = 42L;

    // 贝叶斯混合
    private int maxMixtureSamples = 20000;
    private int mixtureIterations = 200;
    private double mixtureTolerance = 1e-7;

    // 多尺度
    private List<Double> scales = new ArrayList<>(Arrays.asList(1.0, 2.0, 4.0));
    private double multiScaleSigma = 3.0;
    private double clusterEps = 15.0;
    private int clusterMinPoints = 3;
    private double clusterPenalty = 0.7;

    // 切片启发式
    private int cutoutSize = 32;
    private double cutoutRealThreshold = 0.5;

    public void validate() {
        if (strategy == null) {
            throw new ConfigurationException("scoring.strategy must be set");
        }
        if (reliabilityCutoff < 0 || reliabilityCutoff > 100 || Double.isNaN(reliabilityCutoff)) {
            throw new ConfigurationException("scoring.reliability-cutoff must be in [0, 100]: " + reliabilityCutoff);
        }
        if (snrSaturation <= 0 || edgeMargin <= 0 || areaSaturation <= 0) {
            throw new ConfigurationException("scoring normalization scales must be positive");
        }
        if (maxElongation < 1 || artifactSmallElongation < 1) {
            throw new ConfigurationException("scoring elongation cutoffs must be at least 1");
        }
        normalizedWeights();
        if (maxMixtureSamples < 10 || mixtureIterations < 1 || mixtureTolerance <= 0) {
            throw new ConfigurationException("scoring mixture parameters are out of range");
        }
        if (scales == null || scales.isEmpty()) {
            throw new ConfigurationException("scoring.scales must not be empty");
        }
        for (Double s : scales) {
            if (s == null || s <= 0) {
                throw new ConfigurationException("scoring.scales must be positive: " + scales);
            }
        }
        if (multiScaleSigma <= 0 || clusterEps <= 0 || clusterMinPoints < 1) {
            throw new ConfigurationException("scoring multi-scale parameters are out of range");
        }
        if (clusterPenalty < 0 || clusterPenalty > 1) {
            throw new ConfigurationException("scoring.cluster-penalty must be in [0, 1]: " + clusterPenalty);
        }
        if (cutoutSize < 4) {
            throw new ConfigurationException("scoring.cutout-size must be at least 4: " + cutoutSize);
        }
        if (cutoutRealThreshold < 0 || cutoutRealThreshold > 1) {
            throw new ConfigurationException("scoring.cutout-real-threshold must be in [0, 1]");
        }
    }

    /**
     * 归一化后的可靠性权重 {significance, shape, edge, area, sign}
     */
    public double[] normalizedWeights() {
        double[] w = {significanceWeight, shapeWeight, edgeWeight, areaWeight, signWeight};
        double sum = 0;
        for (double v : w) {
            if (v < 0 || !Double.isFinite(v)) {
                throw new ConfigurationException("scoring weights must be non-negative: " + Arrays.toString(w));
            }
            sum += v;
        }
        if (sum <= 0) {
            throw new ConfigurationException("scoring weights cannot be normalized: sum is " + sum);
        }
        for (int i = 0; i < w.length; i++) {
            w[i] /= sum;
        }
        return w;
    }
}
