package com.edge.dia.core.annotate;

import com.edge.dia.exception.ConfigurationException;

/**
 * 指标到圆半径的线性映射
 * <p>
 * radius = minRadius + clamp01((metric - metricMin) / (metricMax - metricMin)) * (maxRadius - minRadius)，
 * metricMin == metricMax 时取中点半径。
 */
public final class RadiusMapper {

    private final double minRadius;
    private final double maxRadius;

    public RadiusMapper(double minRadius, double maxRadius) {
        if (minRadius > maxRadius) {
            throw new ConfigurationException("min radius " + minRadius + " exceeds max radius " + maxRadius);
        }
        this.minRadius = minRadius;
        this.maxRadius = maxRadius;
    }

    public double radius(double metric, double metricMin, double metricMax) {
        if (metricMax == metricMin) {
            return (minRadius + maxRadius) / 2.0;
        }
        double t = (metric - metricMin) / (metricMax - metricMin);
        if (Double.isNaN(t)) {
            t = 0;
        }
        t = Math.max(0.0, Math.min(1.0, t));
        return minRadius + t * (maxRadius - minRadius);
    }
}
