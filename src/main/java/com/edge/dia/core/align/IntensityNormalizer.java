package com.edge.dia.core.align;

import com.edge.dia.config.NativeLibraryLoader;
import com.edge.dia.core.model.Image;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * 强度归一化
 * <p>
 * 按百分位裁剪后线性映射到 [0, 1]，ORB 需要时再量化到 8 位。
 */
public class IntensityNormalizer {

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private final double lowPercentile;
    private final double highPercentile;

    public IntensityNormalizer(double lowPercentile, double highPercentile) {
        this.lowPercentile = lowPercentile;
        this.highPercentile = highPercentile;
    }

    public Image normalize(Image image) {
        float[] flat = image.toFlatArray();
        double[] values = new double[flat.length];
        for (int i = 0; i < flat.length; i++) {
            values[i] = flat[i];
        }
        Percentile percentile = new Percentile();
        percentile.setData(values);
        double lo = lowPercentile <= 0 ? image.min() : percentile.evaluate(lowPercentile);
        double hi = highPercentile >= 100 ? image.max() : percentile.evaluate(highPercentile);
        double range = hi - lo;

        float[][] out = new float[image.getHeight()][image.getWidth()];
        if (range <= 0 || !Double.isFinite(range)) {
            // 常数图像
            return image.derive(out);
        }
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                double v = (image.get(x, y) - lo) / range;
                out[y][x] = (float) Math.max(0.0, Math.min(1.0, v));
            }
        }
        return image.derive(out);
    }

    /**
     * [0, 1] 图像量化为 CV_8U
     */
    public static Mat toEightBit(Image normalized) {
        int w = normalized.getWidth();
        int h = normalized.getHeight();
        byte[] data = new byte[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int v = (int) Math.round(normalized.get(x, y) * 255.0);
                data[y * w + x] = (byte) Math.max(0, Math.min(255, v));
            }
        }
        Mat mat = new Mat(h, w, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }
}
