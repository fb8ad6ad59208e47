package com.edge.dia.core.model;

import com.edge.dia.exception.InputException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 二维浮点图像
 * <p>
 * 像素按 [row][col] 存放，行数为高度、列数为宽度。附带一个不透明的头信息表（FITS header）。
 * 构造时执行一次清洗：NaN/Inf 像素替换为 3x3 邻域内有限值的中值，邻域内无有限值时置 0。
 * 实例不可变，所有派生图像（对齐图、差异图、标记图）都是新对象。
 */
public final class Image {

    private final float[][] pixels;
    private final int width;
    private final int height;
    private final Map<String, String> header;
    private final int repairedPixels;

    public Image(float[][] pixels) {
        this(pixels, Collections.emptyMap());
    }

    public Image(float[][] pixels, Map<String, String> header) {
        validateShape(pixels);
        this.height = pixels.length;
        this.width = pixels[0].length;
        float[][] copy = new float[height][];
        for (int y = 0; y < height; y++) {
            copy[y] = Arrays.copyOf(pixels[y], width);
        }
        this.repairedPixels = repairInvalidPixels(copy);
        this.pixels = copy;
        this.header = header == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(header));
    }

    /**
     * 从任意 Java 数组构建图像
     * <p>
     * 支持 float/double/int/short/byte/long 二维数组，三维数组取第一个平面。
     * 一维数组或其他类型抛出 {@link InputException}。
     */
    public static Image fromArray(Object data, Map<String, String> header) {
        if (data == null) {
            throw new InputException("Image data is null");
        }
        Object plane = data;
        if (data instanceof Object[] && ((Object[]) data).length > 0 && ((Object[]) data)[0] instanceof Object[]) {
            // 三维数据取第一个平面
            plane = ((Object[]) data)[0];
        }
        if (plane instanceof float[][]) {
            return new Image((float[][]) plane, header);
        }
        if (plane instanceof double[][]) {
            double[][] d = (double[][]) plane;
            return new Image(convert(d.length, d.length > 0 ? d[0].length : 0, (y, x) -> (float) d[y][x], d), header);
        }
        if (plane instanceof int[][]) {
            int[][] d = (int[][]) plane;
            return new Image(convert(d.length, d.length > 0 ? d[0].length : 0, (y, x) -> d[y][x], d), header);
        }
        if (plane instanceof short[][]) {
            short[][] d = (short[][]) plane;
            return new Image(convert(d.length, d.length > 0 ? d[0].length : 0, (y, x) -> d[y][x], d), header);
        }
        if (plane instanceof byte[][]) {
            byte[][] d = (byte[][]) plane;
            return new Image(convert(d.length, d.length > 0 ? d[0].length : 0, (y, x) -> d[y][x] & 0xFF, d), header);
        }
        if (plane instanceof long[][]) {
            long[][] d = (long[][]) plane;
            return new Image(convert(d.length, d.length > 0 ? d[0].length : 0, (y, x) -> (float) d[y][x], d), header);
        }
        if (plane.getClass().isArray() && !(plane instanceof Object[])) {
            throw new InputException("Expected a 2-D array but got a 1-D " + plane.getClass().getComponentType() + " array");
        }
        throw new InputException("Unsupported image data type: " + plane.getClass().getName());
    }

    /**
     * 创建全零图像
     */
    public static Image zeros(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InputException("Image size must be positive: " + width + "x" + height);
        }
        return new Image(new float[height][width]);
    }

    private interface PixelSource {
        float get(int y, int x);
    }

    private static float[][] convert(int rows, int cols, PixelSource source, Object[] raw) {
        if (rows == 0 || cols == 0) {
            throw new InputException("Image is empty: " + rows + "x" + cols);
        }
        float[][] out = new float[rows][cols];
        for (int y = 0; y < rows; y++) {
            int rowLength = java.lang.reflect.Array.getLength(raw[y]);
            if (rowLength != cols) {
                throw new InputException("Image is not rectangular: row " + y + " has " + rowLength + " columns, expected " + cols);
            }
            for (int x = 0; x < cols; x++) {
                out[y][x] = source.get(y, x);
            }
        }
        return out;
    }

    private static void validateShape(float[][] pixels) {
        if (pixels == null) {
            throw new InputException("Image data is null");
        }
        if (pixels.length == 0 || pixels[0] == null || pixels[0].length == 0) {
            throw new InputException("Image is empty (zero-sized)");
        }
        int cols = pixels[0].length;
        for (int y = 0; y < pixels.length; y++) {
            if (pixels[y] == null || pixels[y].length != cols) {
                throw new InputException("Image is not rectangular at row " + y);
            }
        }
    }

    private static int repairInvalidPixels(float[][] data) {
        int h = data.length;
        int w = data[0].length;
        int repaired = 0;
        float[] window = new float[9];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (Float.isFinite(data[y][x])) {
                    continue;
                }
                int n = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int yy = y + dy;
                        int xx = x + dx;
                        if (yy < 0 || yy >= h || xx < 0 || xx >= w) continue;
                        float v = data[yy][xx];
                        if (Float.isFinite(v)) {
                            window[n++] = v;
                        }
                    }
                }
                if (n == 0) {
                    data[y][x] = 0f;
                } else {
                    Arrays.sort(window, 0, n);
                    data[y][x] = (n % 2 == 1) ? window[n / 2] : (window[n / 2 - 1] + window[n / 2]) / 2f;
                }
                repaired++;
            }
        }
        return repaired;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public Map<String, String> getHeader() { return header; }

    /**
     * 清洗阶段被替换的无效像素数
     */
    public int getRepairedPixels() { return repairedPixels; }

    public float get(int x, int y) {
        return pixels[y][x];
    }

    public boolean contains(double x, double y) {
        return x >= 0 && y >= 0 && x <= width - 1 && y <= height - 1;
    }

    /**
     * 返回像素的深拷贝
     */
    public float[][] toArray() {
        float[][] copy = new float[height][];
        for (int y = 0; y < height; y++) {
            copy[y] = Arrays.copyOf(pixels[y], width);
        }
        return copy;
    }

    /**
     * 按行展开的像素拷贝
     */
    public float[] toFlatArray() {
        float[] flat = new float[width * height];
        for (int y = 0; y < height; y++) {
            System.arraycopy(pixels[y], 0, flat, y * width, width);
        }
        return flat;
    }

    /**
     * 截取子区域
     */
    public Image crop(int x0, int y0, int w, int h) {
        if (x0 < 0 || y0 < 0 || w <= 0 || h <= 0 || x0 + w > width || y0 + h > height) {
            throw new InputException(String.format("Crop window (%d,%d,%d,%d) outside %dx%d image", x0, y0, w, h, width, height));
        }
        float[][] out = new float[h][w];
        for (int y = 0; y < h; y++) {
            System.arraycopy(pixels[y0 + y], x0, out[y], 0, w);
        }
        return new Image(out, header);
    }

    /**
     * 用新的像素生成派生图像，保留头信息
     */
    public Image derive(float[][] newPixels) {
        return new Image(newPixels, header);
    }

    public Image withHeader(Map<String, String> newHeader) {
        return new Image(pixels, newHeader);
    }

    public float min() {
        float m = Float.POSITIVE_INFINITY;
        for (float[] row : pixels) for (float v : row) if (v < m) m = v;
        return m;
    }

    public float max() {
        float m = Float.NEGATIVE_INFINITY;
        for (float[] row : pixels) for (float v : row) if (v > m) m = v;
        return m;
    }

    public int countNonZero() {
        int n = 0;
        for (float[] row : pixels) for (float v : row) if (v != 0f) n++;
        return n;
    }

    @Override
    public String toString() {
        return String.format("Image[%dx%d, headerCards=%d]", width, height, header.size());
    }
}
