package com.edge.dia.core.annotate;

import com.edge.dia.exception.ConfigurationException;
import lombok.Data;

/**
 * 标记图参数
 */
@Data
public class AnnotationOptions {

    private int minRadius = 3;
    private int maxRadius = 20;
    private MarkerMetric markerMetric = MarkerMetric.FLUX;
    private MarkerStyle markerStyle = MarkerStyle.RING;

    /** 标记绘制在哪幅图像上 */
    private BaseImage baseImage = BaseImage.DIFFERENCE;

    /** 标记强度超出图像动态范围的比例 */
    private double markerOffset = 0.2;

    public enum BaseImage {
        DIFFERENCE,
        REFERENCE,
        SCIENCE
    }

    public void validate() {
        if (minRadius < 1) {
            throw new ConfigurationException("annotation.min-radius must be at least 1: " + minRadius);
        }
        if (minRadius > maxRadius) {
            throw new ConfigurationException(String.format(
                "annotation.min-radius (%d) must not exceed annotation.max-radius (%d)", minRadius, maxRadius));
        }
        if (markerMetric == null || markerStyle == null || baseImage == null) {
            throw new ConfigurationException("annotation.marker-metric, marker-style and base-image must be set");
        }
        if (markerOffset < 0) {
            throw new ConfigurationException("annotation.marker-offset must not be negative: " + markerOffset);
        }
    }
}
