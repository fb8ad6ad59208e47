package com.edge.dia.core.support;

import com.edge.dia.config.NativeLibraryLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * 非零像素的连通域标记（OpenCV connectedComponentsWithStats）
 */
public final class ConnectedComponents {

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private final int width;
    private final int height;
    private final int[] labels;
    private final int count;
    private final int[] areas;

    private ConnectedComponents(int width, int height, int[] labels, int count, int[] areas) {
        this.width = width;
        this.height = height;
        this.labels = labels;
        this.count = count;
        this.areas = areas;
    }

    /**
     * @param pixels       输入图像，非零像素为前景
     * @param connectivity 4 或 8
     */
    public static ConnectedComponents label(float[][] pixels, int connectivity) {
        int h = pixels.length;
        int w = pixels[0].length;
        Mat mask = OpenCvMats.nonZeroMask(pixels);
        Mat labelMat = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        try {
            int n = Imgproc.connectedComponentsWithStats(mask, labelMat, stats, centroids, connectivity, CvType.CV_32S);
            int[] labels = OpenCvMats.toIntArray(labelMat);
            int[] areas = new int[n];
            int[] row = new int[stats.cols()];
            for (int i = 0; i < n; i++) {
                stats.get(i, 0, row);
                areas[i] = row[Imgproc.CC_STAT_AREA];
            }
            // 标签 0 为背景
            return new ConnectedComponents(w, h, labels, n - 1, areas);
        } finally {
            OpenCvMats.release(mask, labelMat, stats, centroids);
        }
    }

    /** 前景连通域数量（不含背景） */
    public int getCount() {
        return count;
    }

    /** 像素 (x, y) 的标签，0 为背景，前景为 1..count */
    public int labelAt(int x, int y) {
        return labels[y * width + x];
    }

    /** 标签 1..count 的面积 */
    public int areaOf(int label) {
        return areas[label];
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * 将面积小于 minArea 的连通域置零，返回新数组
     */
    public float[][] removeSmall(float[][] pixels, int minArea) {
        float[][] out = new float[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int l = labels[y * width + x];
                if (l > 0 && areas[l] >= minArea) {
                    out[y][x] = pixels[y][x];
                }
            }
        }
        return out;
    }
}
