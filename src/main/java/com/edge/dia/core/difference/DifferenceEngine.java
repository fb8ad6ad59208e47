package com.edge.dia.core.difference;

import com.edge.dia.config.NativeLibraryLoader;
import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.CleaningReport;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.DifferenceStatistics;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.support.ConnectedComponents;
import com.edge.dia.core.support.OpenCvMats;
import com.edge.dia.core.support.SigmaClippedStats;
import com.edge.dia.exception.InputException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 差分引擎
 * <p>
 * 把科学图像重采样到参考帧后做像素差，再按固定顺序清理：
 * 1. 噪声阈值（noise_floor + k*sigma 与相对最大值的强度下限）
 * 2. 小连通域剔除
 * 3. 形态学开运算 + 闭运算
 * 4. 中值滤波 + 高斯平滑（只作用于已有支撑区域，不扩大非零区域）
 * <p>
 * 每个阶段可单独关闭。退化输入（常数残差等）跳过对应阶段并记录在报告中。
 */
public class DifferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(DifferenceEngine.class);

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    public static final String STAGE_RESIDUAL = "residual";
    public static final String STAGE_THRESHOLD = "threshold";
    public static final String STAGE_COMPONENTS = "components";
    public static final String STAGE_MORPHOLOGY = "morphology";
    public static final String STAGE_MEDIAN = "median";
    public static final String STAGE_GAUSSIAN = "gaussian";

    private final CleaningOptions options;

    public DifferenceEngine(CleaningOptions options) {
        options.validate();
        this.options = options.effective();
    }

    /**
     * 计算并清理差异图
     *
     * @param reference 参考图像，输出与其同尺寸
     * @param science   科学图像
     * @param transform 科学 -> 参考变换
     */
    public DifferenceMap compute(Image reference, Image science, AlignmentTransform transform) {
        if (reference == null || science == null || transform == null) {
            throw new InputException("Reference, science and transform are required to compute a difference");
        }
        int w = reference.getWidth();
        int h = reference.getHeight();

        float[][] aligned;
        boolean[][] coverage;
        if (transform.isIdentity(1e-12) && science.getWidth() == w && science.getHeight() == h) {
            aligned = science.toArray();
            coverage = new boolean[h][w];
            for (boolean[] row : coverage) {
                Arrays.fill(row, true);
            }
        } else {
            Mat matrix = toMat(transform);
            try {
                aligned = warp(science, matrix, w, h);
                coverage = coverage(science, matrix, w, h);
            } finally {
                matrix.release();
            }
        }
        Image alignedScience = science.derive(aligned);

        float[][] ref = reference.toArray();
        DifferenceMode mode = options.getMode();
        // 残差与差分方向同号，正值总是被减帧之外的多余通量
        float sign = mode == DifferenceMode.REFERENCE_MINUS_SCIENCE ? -1f : 1f;
        float[][] residual = new float[h][w];
        float[][] diff = new float[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!coverage[y][x]) {
                    continue;
                }
                float r = sign * (aligned[y][x] - ref[y][x]);
                residual[y][x] = r;
                diff[y][x] = mode == DifferenceMode.ABSOLUTE ? Math.abs(r) : r;
            }
        }

        Image baseline = mode == DifferenceMode.REFERENCE_MINUS_SCIENCE ? alignedScience : reference;
        SigmaClippedStats baseStats = SigmaClippedStats.ofPixels(baseline.toArray(), coverage, false);
        return clean(diff, residual, coverage, reference, reference, alignedScience, baseline,
            baseStats.getMedian(), baseStats.getStd());
    }

    /**
     * 只做清理：输入为调用方已计算好的原始差异图，全幅视为有效覆盖
     */
    public DifferenceMap clean(Image rawDifference) {
        if (rawDifference == null) {
            throw new InputException("Raw difference image is required");
        }
        int w = rawDifference.getWidth();
        int h = rawDifference.getHeight();
        boolean[][] coverage = new boolean[h][w];
        for (boolean[] row : coverage) {
            Arrays.fill(row, true);
        }
        float[][] diff = rawDifference.toArray();
        return clean(diff, rawDifference.toArray(), coverage, rawDifference, null, null, null, 0, 0);
    }

    private DifferenceMap clean(float[][] diff, float[][] residual, boolean[][] coverage, Image template,
                                Image reference, Image alignedScience, Image baseline,
                                double refBackground, double refSigma) {
        int h = diff.length;
        int w = diff[0].length;
        CleaningReport report = new CleaningReport();
        int nonZero = countNonZero(diff);
        report.recordStage(STAGE_RESIDUAL, nonZero);

        if (nonZero == 0) {
            report.addWarning("Residual has no non-zero pixels");
            logger.warn("Difference residual is empty, returning all-zero difference map");
            DifferenceStatistics stats = new DifferenceStatistics(0, 0, 0, 0, 0, 0, refBackground, refSigma);
            return new DifferenceMap(template.derive(new float[h][w]), residual, coverage, reference,
                alignedScience, baseline, stats, report, true);
        }

        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!coverage[y][x]) continue;
                max = Math.max(max, diff[y][x]);
                min = Math.min(min, diff[y][x]);
            }
        }

        SigmaClippedStats noise = SigmaClippedStats.ofPixels(diff, coverage, true);
        double floor = noise.getMedian();
        double sigma = noise.getStd();
        double threshold = floor + options.getNoiseSigmaMultiplier() * sigma;
        double intensityFloor = options.getIntensityThreshold() * max;
        logger.debug("Noise statistics: floor={}, sigma={}, threshold={}, intensityFloor={}",
            floor, sigma, threshold, intensityFloor);

        float[][] current = diff;

        // 1. 阈值
        if (!options.isThresholdEnabled()) {
            report.recordSkipped(STAGE_THRESHOLD, "disabled");
        } else if (sigma <= 0 || !Double.isFinite(sigma)) {
            report.recordSkipped(STAGE_THRESHOLD, "degenerate noise estimate");
        } else {
            current = threshold(current, coverage, threshold, intensityFloor);
            report.recordStage(STAGE_THRESHOLD, countNonZero(current));
        }

        // 2. 小连通域
        if (!options.isComponentFilterEnabled()) {
            report.recordSkipped(STAGE_COMPONENTS, "disabled");
        } else if (countNonZero(current) == 0) {
            report.recordSkipped(STAGE_COMPONENTS, "empty map");
        } else {
            current = ConnectedComponents.label(current, 8).removeSmall(current, options.getMinComponentSize());
            report.recordStage(STAGE_COMPONENTS, countNonZero(current));
        }

        // 3. 形态学
        if (!options.isMorphologyEnabled() || options.getMorphologyKernelSize() <= 1) {
            report.recordSkipped(STAGE_MORPHOLOGY, "disabled");
        } else if (countNonZero(current) == 0) {
            report.recordSkipped(STAGE_MORPHOLOGY, "empty map");
        } else {
            current = morphology(current, coverage, options.getMorphologyKernelSize());
            report.recordStage(STAGE_MORPHOLOGY, countNonZero(current));
        }

        // 4. 平滑
        if (!options.isMedianEnabled() || options.getMedianFilterSize() <= 1) {
            report.recordSkipped(STAGE_MEDIAN, "disabled");
        } else if (countNonZero(current) == 0) {
            report.recordSkipped(STAGE_MEDIAN, "empty map");
        } else {
            current = smoothWithinSupport(current, true, options.getMedianFilterSize(), 0);
            report.recordStage(STAGE_MEDIAN, countNonZero(current));
        }
        if (!options.isGaussianEnabled() || options.getGaussianSigma() <= 0) {
            report.recordSkipped(STAGE_GAUSSIAN, "disabled");
        } else if (countNonZero(current) == 0) {
            report.recordSkipped(STAGE_GAUSSIAN, "empty map");
        } else {
            current = smoothWithinSupport(current, false, 0, options.getGaussianSigma());
            report.recordStage(STAGE_GAUSSIAN, countNonZero(current));
        }

        DifferenceStatistics stats = new DifferenceStatistics(floor, sigma, max, min, threshold, intensityFloor,
            refBackground, refSigma);
        logger.info("Difference cleaned: {} -> {} non-zero pixels ({})",
            nonZero, countNonZero(current), report.getStagePixelCounts());
        return new DifferenceMap(template.derive(current), residual, coverage, reference, alignedScience,
            baseline, stats, report, false);
    }

    private static float[][] threshold(float[][] src, boolean[][] coverage, double threshold, double intensityFloor) {
        int h = src.length;
        int w = src[0].length;
        float[][] out = new float[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float v = src[y][x];
                if (coverage[y][x] && v >= threshold && v >= intensityFloor && v != 0f) {
                    out[y][x] = v;
                }
            }
        }
        return out;
    }

    private static float[][] morphology(float[][] src, boolean[][] coverage, int kernelSize) {
        Mat mat = OpenCvMats.toMat(src);
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(kernelSize, kernelSize));
        Mat opened = new Mat();
        Mat closed = new Mat();
        try {
            Imgproc.morphologyEx(mat, opened, Imgproc.MORPH_OPEN, kernel);
            Imgproc.morphologyEx(opened, closed, Imgproc.MORPH_CLOSE, kernel);
            float[][] out = OpenCvMats.toArray(closed);
            for (int y = 0; y < out.length; y++) {
                for (int x = 0; x < out[0].length; x++) {
                    if (!coverage[y][x] || out[y][x] < 0) {
                        out[y][x] = 0f;
                    }
                }
            }
            return out;
        } finally {
            OpenCvMats.release(mat, kernel, opened, closed);
        }
    }

    /**
     * 平滑后只保留原来非零的像素
     */
    private static float[][] smoothWithinSupport(float[][] src, boolean median, int medianSize, double sigma) {
        Mat mat = OpenCvMats.toMat(src);
        Mat smoothed = new Mat();
        try {
            if (median) {
                Imgproc.medianBlur(mat, smoothed, medianSize);
            } else {
                Imgproc.GaussianBlur(mat, smoothed, new Size(0, 0), sigma);
            }
            float[][] out = OpenCvMats.toArray(smoothed);
            for (int y = 0; y < out.length; y++) {
                for (int x = 0; x < out[0].length; x++) {
                    if (src[y][x] == 0f || out[y][x] < 0) {
                        out[y][x] = 0f;
                    }
                }
            }
            return out;
        } finally {
            OpenCvMats.release(mat, smoothed);
        }
    }

    private static float[][] warp(Image science, Mat matrix, int w, int h) {
        Mat src = OpenCvMats.toMat(science);
        Mat dst = new Mat();
        try {
            Imgproc.warpPerspective(src, dst, matrix, new Size(w, h), Imgproc.INTER_LINEAR,
                Core.BORDER_CONSTANT, new Scalar(0));
            return OpenCvMats.toArray(dst);
        } finally {
            OpenCvMats.release(src, dst);
        }
    }

    /**
     * 科学图像在参考帧中的覆盖掩膜，腐蚀 1 像素去掉插值边缘
     */
    private static boolean[][] coverage(Image science, Mat matrix, int w, int h) {
        Mat ones = new Mat(science.getHeight(), science.getWidth(), CvType.CV_8UC1, new Scalar(255));
        Mat warped = new Mat();
        Mat eroded = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
        try {
            Imgproc.warpPerspective(ones, warped, matrix, new Size(w, h), Imgproc.INTER_NEAREST,
                Core.BORDER_CONSTANT, new Scalar(0));
            Imgproc.erode(warped, eroded, kernel, new org.opencv.core.Point(-1, -1), 1,
                Core.BORDER_CONSTANT, new Scalar(0));
            return OpenCvMats.toBooleanMask(eroded);
        } finally {
            OpenCvMats.release(ones, warped, eroded, kernel);
        }
    }

    private static Mat toMat(AlignmentTransform transform) {
        Mat m = new Mat(3, 3, CvType.CV_64FC1);
        double[][] a = transform.getMatrix();
        for (int r = 0; r < 3; r++) {
            m.put(r, 0, a[r]);
        }
        return m;
    }

    private static int countNonZero(float[][] pixels) {
        int n = 0;
        for (float[] row : pixels) for (float v : row) if (v != 0f) n++;
        return n;
    }

    public CleaningOptions getOptions() {
        return options;
    }
}
