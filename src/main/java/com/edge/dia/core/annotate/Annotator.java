package com.edge.dia.core.annotate;

import com.edge.dia.config.NativeLibraryLoader;
import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.support.OpenCvMats;
import com.edge.dia.exception.InputException;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 标记图生成
 * <p>
 * 在输入图像的副本上为每个已接受候选画圆，半径编码所选指标。
 * 正通量候选的标记强度高于图像最大值，负通量候选低于最小值，偏移量为动态范围的固定比例。
 * 输入图像不会被修改。
 */
public class Annotator {

    private static final Logger logger = LoggerFactory.getLogger(Annotator.class);

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private final AnnotationOptions options;
    private final RadiusMapper radiusMapper;

    public Annotator(AnnotationOptions options) {
        options.validate();
        this.options = options;
        this.radiusMapper = new RadiusMapper(options.getMinRadius(), options.getMaxRadius());
    }

    public Image annotate(Image base, List<Candidate> accepted) {
        if (base == null) {
            throw new InputException("Base image is required for annotation");
        }
        if (accepted == null || accepted.isEmpty()) {
            return base.derive(base.toArray());
        }

        MarkerMetric metric = options.getMarkerMetric();
        double metricMin = Double.POSITIVE_INFINITY;
        double metricMax = Double.NEGATIVE_INFINITY;
        for (Candidate c : accepted) {
            double v = metric.valueOf(c);
            metricMin = Math.min(metricMin, v);
            metricMax = Math.max(metricMax, v);
        }

        double imageMax = base.max();
        double imageMin = base.min();
        double range = imageMax - imageMin;
        if (range <= 0) {
            range = Math.abs(imageMax) > 0 ? Math.abs(imageMax) : 1.0;
        }
        double positiveMarker = imageMax + options.getMarkerOffset() * range;
        double negativeMarker = imageMin - options.getMarkerOffset() * range;
        int thickness = options.getMarkerStyle() == MarkerStyle.FILLED ? -1 : 1;

        Mat canvas = OpenCvMats.toMat(base);
        try {
            for (Candidate c : accepted) {
                int radius = (int) Math.round(radiusMapper.radius(metric.valueOf(c), metricMin, metricMax));
                double value = c.getNetFlux() < 0 ? negativeMarker : positiveMarker;
                Imgproc.circle(canvas, new Point(Math.round(c.getX()), Math.round(c.getY())), radius,
                    new Scalar(value), thickness);
            }
            logger.debug("Marked {} candidates ({} style, metric {})", accepted.size(), options.getMarkerStyle(), metric);
            return base.derive(OpenCvMats.toArray(canvas));
        } finally {
            canvas.release();
        }
    }

    public RadiusMapper getRadiusMapper() {
        return radiusMapper;
    }

    public AnnotationOptions getOptions() {
        return options;
    }
}
