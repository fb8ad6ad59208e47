package com.edge.dia.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 候选源
 * <p>
 * 差异图中的一个连通区域。由提取器创建，评分器通过 {@link #withScore} 生成带标签的新实例。
 * 不变量：面积不小于配置的最小面积，质心位于图像范围内。
 */
public final class Candidate {

    /** 连通域接触图像边界 */
    public static final String FLAG_BOUNDARY = "BOUNDARY";
    /** 多尺度评分中与其他候选聚成一簇 */
    public static final String FLAG_CLUSTERED = "CLUSTERED";
    /** 负通量（变暗） */
    public static final String FLAG_NEGATIVE = "NEGATIVE_FLUX";

    private final int id;
    private final double x;
    private final double y;
    private final int area;
    private final double peak;
    private final double mean;
    private final double total;
    private final double snr;
    private final double elongation;
    private final double compactness;
    private final double netFlux;
    private final boolean touchesBoundary;
    private final double edgeDistance;
    private final double centerDistance;
    private final double referenceSignificance;
    private final double rankScore;
    private final int minX;
    private final int minY;
    private final int maxX;
    private final int maxY;
    private final CandidateLabel label;
    private final double confidence;
    private final double reliability;
    private final Set<String> flags;

    private Candidate(Builder b) {
        this.id = b.id;
        this.x = b.x;
        this.y = b.y;
        this.area = b.area;
        this.peak = b.peak;
        this.mean = b.mean;
        this.total = b.total;
        this.snr = b.snr;
        this.elongation = b.elongation;
        this.compactness = b.compactness;
        this.netFlux = b.netFlux;
        this.touchesBoundary = b.touchesBoundary;
        this.edgeDistance = b.edgeDistance;
        this.centerDistance = b.centerDistance;
        this.referenceSignificance = b.referenceSignificance;
        this.rankScore = b.rankScore;
        this.minX = b.minX;
        this.minY = b.minY;
        this.maxX = b.maxX;
        this.maxY = b.maxY;
        this.label = b.label;
        this.confidence = b.confidence;
        this.reliability = b.reliability;
        this.flags = Collections.unmodifiableSet(new LinkedHashSet<>(b.flags));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.x = x;
        b.y = y;
        b.area = area;
        b.peak = peak;
        b.mean = mean;
        b.total = total;
        b.snr = snr;
        b.elongation = elongation;
        b.compactness = compactness;
        b.netFlux = netFlux;
        b.touchesBoundary = touchesBoundary;
        b.edgeDistance = edgeDistance;
        b.centerDistance = centerDistance;
        b.referenceSignificance = referenceSignificance;
        b.rankScore = rankScore;
        b.minX = minX;
        b.minY = minY;
        b.maxX = maxX;
        b.maxY = maxY;
        b.label = label;
        b.confidence = confidence;
        b.reliability = reliability;
        b.flags = new LinkedHashSet<>(flags);
        return b;
    }

    /**
     * 评分后的副本
     */
    public Candidate withScore(CandidateLabel label, double confidence, double reliability, Set<String> extraFlags) {
        Builder b = toBuilder().label(label).confidence(confidence).reliability(reliability);
        if (extraFlags != null) {
            b.flags.addAll(extraFlags);
        }
        return b.build();
    }

    public Candidate withRankScore(double rankScore) {
        return toBuilder().rankScore(rankScore).build();
    }

    public int getId() { return id; }
    public double getX() { return x; }
    public double getY() { return y; }
    public int getArea() { return area; }
    public double getPeak() { return peak; }
    public double getMean() { return mean; }
    public double getTotal() { return total; }
    public double getSnr() { return snr; }

    /** 主轴长度比 a/b，不小于 1 */
    public double getElongation() { return elongation; }

    /** 4πA/P²，范围 (0, 1] */
    public double getCompactness() { return compactness; }

    /** 带符号残差之和，正值为增亮 */
    public double getNetFlux() { return netFlux; }

    public boolean isTouchesBoundary() { return touchesBoundary; }
    public double getEdgeDistance() { return edgeDistance; }
    public double getCenterDistance() { return centerDistance; }

    /** 参考图像在质心处相对背景的显著性（sigma 单位） */
    public double getReferenceSignificance() { return referenceSignificance; }

    /** 中心距离 + 亮度的综合排序分 */
    public double getRankScore() { return rankScore; }

    public int getMinX() { return minX; }
    public int getMinY() { return minY; }
    public int getMaxX() { return maxX; }
    public int getMaxY() { return maxY; }
    public CandidateLabel getLabel() { return label; }
    public double getConfidence() { return confidence; }
    public double getReliability() { return reliability; }
    public Set<String> getFlags() { return flags; }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    @Override
    public String toString() {
        return String.format("Candidate#%d(%.2f, %.2f) area=%d snr=%.2f elong=%.2f label=%s rel=%.1f",
            id, x, y, area, snr, elongation, label, reliability);
    }

    public static final class Builder {
        private int id;
        private double x;
        private double y;
        private int area;
        private double peak;
        private double mean;
        private double total;
        private double snr;
        private double elongation = 1.0;
        private double compactness = 1.0;
        private double netFlux;
        private boolean touchesBoundary;
        private double edgeDistance;
        private double centerDistance;
        private double referenceSignificance;
        private double rankScore;
        private int minX;
        private int minY;
        private int maxX;
        private int maxY;
        private CandidateLabel label = CandidateLabel.UNCLASSIFIED;
        private double confidence;
        private double reliability;
        private Set<String> flags = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder id(int id) { this.id = id; return this; }
        public Builder x(double x) { this.x = x; return this; }
        public Builder y(double y) { this.y = y; return this; }
        public Builder area(int area) { this.area = area; return this; }
        public Builder peak(double peak) { this.peak = peak; return this; }
        public Builder mean(double mean) { this.mean = mean; return this; }
        public Builder total(double total) { this.total = total; return this; }
        public Builder snr(double snr) { this.snr = snr; return this; }
        public Builder elongation(double elongation) { this.elongation = elongation; return this; }
        public Builder compactness(double compactness) { this.compactness = compactness; return this; }
        public Builder netFlux(double netFlux) { this.netFlux = netFlux; return this; }
        public Builder touchesBoundary(boolean touchesBoundary) { this.touchesBoundary = touchesBoundary; return this; }
        public Builder edgeDistance(double edgeDistance) { this.edgeDistance = edgeDistance; return this; }
        public Builder centerDistance(double centerDistance) { this.centerDistance = centerDistance; return this; }
        public Builder referenceSignificance(double s) { this.referenceSignificance = s; return this; }
        public Builder rankScore(double rankScore) { this.rankScore = rankScore; return this; }
        public Builder label(CandidateLabel label) { this.label = label; return this; }
        public Builder confidence(double confidence) { this.confidence = confidence; return this; }
        public Builder reliability(double reliability) { this.reliability = reliability; return this; }

        public Builder bounds(int minX, int minY, int maxX, int maxY) {
            this.minX = minX;
            this.minY = minY;
            this.maxX = maxX;
            this.maxY = maxY;
            return this;
        }

        public Builder flag(String flag) {
            this.flags.add(flag);
            return this;
        }

        public Candidate build() {
            return new Candidate(this);
        }
    }
}
