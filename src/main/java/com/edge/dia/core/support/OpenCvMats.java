package com.edge.dia.core.support;

import com.edge.dia.config.NativeLibraryLoader;
import com.edge.dia.core.model.Image;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * float[][] 与 OpenCV Mat 之间的转换
 * <p>
 * 统一使用 CV_32F 单通道，medianBlur 等函数不支持 CV_64F。
 */
public final class OpenCvMats {

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private OpenCvMats() {
    }

    public static Mat toMat(Image image) {
        return toMat(image.toFlatArray(), image.getWidth(), image.getHeight());
    }

    public static Mat toMat(float[][] pixels) {
        int h = pixels.length;
        int w = pixels[0].length;
        float[] flat = new float[w * h];
        for (int y = 0; y < h; y++) {
            System.arraycopy(pixels[y], 0, flat, y * w, w);
        }
        return toMat(flat, w, h);
    }

    public static Mat toMat(float[] flat, int width, int height) {
        Mat mat = new Mat(height, width, CvType.CV_32FC1);
        mat.put(0, 0, flat);
        return mat;
    }

    /**
     * 二值掩膜 -> CV_8U（255 / 0）
     */
    public static Mat toMask(boolean[][] mask) {
        int h = mask.length;
        int w = mask[0].length;
        byte[] flat = new byte[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                flat[y * w + x] = mask[y][x] ? (byte) 255 : 0;
            }
        }
        Mat mat = new Mat(h, w, CvType.CV_8UC1);
        mat.put(0, 0, flat);
        return mat;
    }

    /**
     * 非零像素 -> CV_8U 掩膜
     */
    public static Mat nonZeroMask(float[][] pixels) {
        int h = pixels.length;
        int w = pixels[0].length;
        boolean[][] mask = new boolean[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                mask[y][x] = pixels[y][x] != 0f;
            }
        }
        return toMask(mask);
    }

    /**
     * CV_32F Mat -> float[][]，其他类型先转换
     */
    public static float[][] toArray(Mat mat) {
        Mat source = mat;
        boolean converted = false;
        if (mat.type() != CvType.CV_32FC1) {
            source = new Mat();
            mat.convertTo(source, CvType.CV_32F);
            converted = true;
        }
        int h = source.rows();
        int w = source.cols();
        float[] flat = new float[w * h];
        source.get(0, 0, flat);
        if (converted) {
            source.release();
        }
        float[][] out = new float[h][w];
        for (int y = 0; y < h; y++) {
            System.arraycopy(flat, y * w, out[y], 0, w);
        }
        return out;
    }

    public static boolean[][] toBooleanMask(Mat mask) {
        int h = mask.rows();
        int w = mask.cols();
        byte[] flat = new byte[w * h];
        Mat source = mask;
        if (mask.type() != CvType.CV_8UC1) {
            source = new Mat();
            mask.convertTo(source, CvType.CV_8U);
        }
        source.get(0, 0, flat);
        if (source != mask) {
            source.release();
        }
        boolean[][] out = new boolean[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out[y][x] = flat[y * w + x] != 0;
            }
        }
        return out;
    }

    /**
     * 以 int 数组读取 CV_32S 标签图
     */
    public static int[] toIntArray(Mat labels) {
        int[] flat = new int[labels.rows() * labels.cols()];
        labels.get(0, 0, flat);
        return flat;
    }

    public static void release(Mat... mats) {
        for (Mat m : mats) {
            if (m != null) {
                m.release();
            }
        }
    }
}
