package com.edge.dia.core.model;

import java.util.Arrays;

/**
 * 差异图
 * <p>
 * {@code pixels} 是清理后的差异图（低于阈值的像素为 0），单位与输入图像相同（ADU），不除以噪声；
 * 噪声归一化的量由 {@link DifferenceStatistics#getNoiseSigma()} 给出，信噪比、阈值与评分都在其上计算，
 * 目录和标记图因此保留物理通量。
 * <p>
 * {@code residual} 是未清理的带符号残差，符号与差分方向一致：正值表示被减帧之外的多余通量
 * （science - reference 模式下为增亮，reference - science 模式下为变暗）。absolute 模式下残差取
 * science - reference。{@code baseline} 是被减去的一帧，用于判断候选是否落在已有恒星上。
 * {@code coverage} 标记参考帧中被对齐后科学图像覆盖的像素。
 * 仅在完整差分流程中 {@code reference}、{@code alignedScience} 与 {@code baseline} 非空，纯清理调用时为空。
 */
public final class DifferenceMap {

    private final Image pixels;
    private final float[][] residual;
    private final boolean[][] coverage;
    private final Image reference;
    private final Image alignedScience;
    private final Image baseline;
    private final DifferenceStatistics statistics;
    private final CleaningReport report;
    private final boolean emptyResidual;

    public DifferenceMap(Image pixels, float[][] residual, boolean[][] coverage, Image reference, Image alignedScience,
                         DifferenceStatistics statistics, CleaningReport report, boolean emptyResidual) {
        this(pixels, residual, coverage, reference, alignedScience, reference, statistics, report, emptyResidual);
    }

    public DifferenceMap(Image pixels, float[][] residual, boolean[][] coverage, Image reference, Image alignedScience,
                         Image baseline, DifferenceStatistics statistics, CleaningReport report,
                         boolean emptyResidual) {
        this.pixels = pixels;
        this.residual = residual;
        this.coverage = coverage;
        this.reference = reference;
        this.alignedScience = alignedScience;
        this.baseline = baseline;
        this.statistics = statistics;
        this.report = report;
        this.emptyResidual = emptyResidual;
    }

    /**
     * 直接把一幅图像当作已清理的差异图，残差等于像素本身，全幅覆盖
     */
    public static DifferenceMap fromCleanedImage(Image image, DifferenceStatistics statistics) {
        boolean[][] coverage = new boolean[image.getHeight()][image.getWidth()];
        for (boolean[] row : coverage) {
            Arrays.fill(row, true);
        }
        return new DifferenceMap(image, image.toArray(), coverage, null, null, statistics, new CleaningReport(),
            image.countNonZero() == 0);
    }

    public Image getPixels() { return pixels; }
    public int getWidth() { return pixels.getWidth(); }
    public int getHeight() { return pixels.getHeight(); }

    public float get(int x, int y) {
        return pixels.get(x, y);
    }

    public float getResidual(int x, int y) {
        return residual[y][x];
    }

    public boolean isCovered(int x, int y) {
        return coverage[y][x];
    }

    /** 带符号残差的拷贝 */
    public float[][] residualCopy() {
        float[][] copy = new float[residual.length][];
        for (int y = 0; y < residual.length; y++) {
            copy[y] = Arrays.copyOf(residual[y], residual[y].length);
        }
        return copy;
    }

    public int coveredPixelCount() {
        int n = 0;
        for (boolean[] row : coverage) for (boolean b : row) if (b) n++;
        return n;
    }

    public Image getReference() { return reference; }
    public Image getAlignedScience() { return alignedScience; }
    public Image getBaseline() { return baseline; }
    public DifferenceStatistics getStatistics() { return statistics; }
    public CleaningReport getReport() { return report; }

    /**
     * 残差全零时的警告标志（不是错误）
     */
    public boolean isEmptyResidual() { return emptyResidual; }

    public int countNonZero() {
        return pixels.countNonZero();
    }

    @Override
    public String toString() {
        return "DifferenceMap{" + getWidth() + "x" + getHeight() + ", nonZero=" + countNonZero()
            + ", emptyResidual=" + emptyResidual + ", " + statistics + '}';
    }
}
