package com.edge.dia.core;

import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.Image;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 测试用合成星场：平坦背景 + 高斯噪声 + 高斯点源
 */
public final class SyntheticSky {

    public static final double BACKGROUND = 100.0;
    public static final double NOISE_SIGMA = 5.0;
    public static final double STAR_SIGMA = 2.0;

    private SyntheticSky() {
    }

    public static float[][] background(int width, int height, double level, double noiseSigma, long seed) {
        Random random = new Random(seed);
        float[][] p = new float[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                p[y][x] = (float) (level + (noiseSigma > 0 ? random.nextGaussian() * noiseSigma : 0));
            }
        }
        return p;
    }

    public static void addStar(float[][] p, double cx, double cy, double peak, double sigma) {
        int h = p.length;
        int w = p[0].length;
        int r = (int) Math.ceil(5 * sigma);
        for (int y = Math.max(0, (int) cy - r); y <= Math.min(h - 1, (int) cy + r); y++) {
            for (int x = Math.max(0, (int) cx - r); x <= Math.min(w - 1, (int) cx + r); x++) {
                double d2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);
                p[y][x] += (float) (peak * Math.exp(-d2 / (2 * sigma * sigma)));
            }
        }
    }

    /**
     * 在 [margin, size - margin) 内随机生成彼此相距至少 minSeparation 的位置
     */
    public static List<double[]> positions(int count, int width, int height, int margin, double minSeparation,
                                           List<double[]> avoid, long seed) {
        Random random = new Random(seed);
        List<double[]> out = new ArrayList<>();
        int attempts = 0;
        while (out.size() < count && attempts < 100000) {
            attempts++;
            double x = margin + random.nextDouble() * (width - 2 * margin);
            double y = margin + random.nextDouble() * (height - 2 * margin);
            if (farFrom(x, y, out, minSeparation) && farFrom(x, y, avoid, minSeparation)) {
                out.add(new double[]{x, y});
            }
        }
        if (out.size() < count) {
            throw new IllegalStateException("Could not place " + count + " sources");
        }
        return out;
    }

    private static boolean farFrom(double x, double y, List<double[]> points, double minSeparation) {
        for (double[] p : points) {
            if (Math.hypot(p[0] - x, p[1] - y) < minSeparation) {
                return false;
            }
        }
        return true;
    }

    /**
     * 参考图像与科学图像对
     * <p>
     * truth 为注入源在参考坐标系中的位置；科学图像由 transform 的逆映射渲染。
     */
    public static final class Pair {
        public final Image reference;
        public final Image science;
        public final AlignmentTransform transform;
        public final List<double[]> truth;

        Pair(Image reference, Image science, AlignmentTransform transform, List<double[]> truth) {
            this.reference = reference;
            this.science = science;
            this.transform = transform;
            this.truth = truth;
        }
    }

    public static Pair pair(int size, int sharedStars, double sharedPeak, int injected, double injectedPeak,
                            AlignmentTransform scienceToReference, long seed) {
        List<double[]> shared = positions(sharedStars, size, size, 25, 25, List.of(), seed);
        List<double[]> truth = positions(injected, size, size, 40, 30, shared, seed + 1);

        float[][] ref = background(size, size, BACKGROUND, NOISE_SIGMA, seed + 2);
        float[][] sci = background(size, size, BACKGROUND, NOISE_SIGMA, seed + 3);
        AlignmentTransform toScience = scienceToReference.inverse();
        for (int i = 0; i < shared.size(); i++) {
            double[] s = shared.get(i);
            double peak = sharedPeak * (1.0 + 0.1 * i);
            addStar(ref, s[0], s[1], peak, STAR_SIGMA);
            double[] q = toScience.apply(s[0], s[1]);
            addStar(sci, q[0], q[1], peak, STAR_SIGMA);
        }
        for (double[] t : truth) {
            double[] q = toScience.apply(t[0], t[1]);
            addStar(sci, q[0], q[1], injectedPeak, STAR_SIGMA);
        }
        return new Pair(new Image(ref), new Image(sci), scienceToReference, truth);
    }
}
