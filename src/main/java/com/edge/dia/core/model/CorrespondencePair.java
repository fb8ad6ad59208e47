package com.edge.dia.core.model;

/**
 * 匹配点对：科学图像特征点 -> 参考图像特征点，附匹配距离（越小越好）
 */
public final class CorrespondencePair {

    private final FeaturePoint science;
    private final FeaturePoint reference;
    private final double distance;

    public CorrespondencePair(FeaturePoint science, FeaturePoint reference, double distance) {
        this.science = science;
        this.reference = reference;
        this.distance = distance;
    }

    public FeaturePoint getScience() { return science; }
    public FeaturePoint getReference() { return reference; }
    public double getDistance() { return distance; }

    @Override
    public String toString() {
        return "CorrespondencePair{" + science + " -> " + reference + ", d=" + distance + '}';
    }
}
