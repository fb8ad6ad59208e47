package com.edge.dia.core.model;

import java.util.Arrays;

/**
 * 对齐变换
 * <p>
 * 3x3 齐次矩阵，将科学图像坐标映射到参考图像坐标。矩阵在构造时归一化，保证右下角元素为 1。
 * 刚体和相似变换的左上 2x2 块为（带缩放的）正交矩阵。实例不可变。
 */
public final class AlignmentTransform {

    private static final double EPS = 1e-12;

    private final double[][] matrix;
    private final TransformClass transformClass;

    public AlignmentTransform(double[][] matrix, TransformClass transformClass) {
        if (matrix == null || matrix.length != 3) {
            throw new IllegalArgumentException("Transform matrix must be 3x3");
        }
        for (double[] row : matrix) {
            if (row == null || row.length != 3) {
                throw new IllegalArgumentException("Transform matrix must be 3x3");
            }
        }
        double w = matrix[2][2];
        if (Math.abs(w) < EPS) {
            throw new IllegalArgumentException("Transform matrix has zero bottom-right element");
        }
        double[][] m = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                m[r][c] = matrix[r][c] / w;
                if (!Double.isFinite(m[r][c])) {
                    throw new IllegalArgumentException("Transform matrix contains non-finite values");
                }
            }
        }
        m[2][2] = 1.0;
        this.matrix = m;
        this.transformClass = transformClass;
    }

    public static AlignmentTransform identity(TransformClass transformClass) {
        return new AlignmentTransform(new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}}, transformClass);
    }

    /**
     * 刚体变换，角度为弧度，逆时针为正
     */
    public static AlignmentTransform rigid(double theta, double tx, double ty) {
        return similarity(1.0, theta, tx, ty, TransformClass.RIGID);
    }

    public static AlignmentTransform similarity(double scale, double theta, double tx, double ty) {
        return similarity(scale, theta, tx, ty, TransformClass.SIMILARITY);
    }

    private static AlignmentTransform similarity(double scale, double theta, double tx, double ty, TransformClass c) {
        double a = scale * Math.cos(theta);
        double b = scale * Math.sin(theta);
        return new AlignmentTransform(new double[][]{{a, -b, tx}, {b, a, ty}, {0, 0, 1}}, c);
    }

    /**
     * 对点 (x, y) 应用变换
     *
     * @return 长度为 2 的数组 {x', y'}
     */
    public double[] apply(double x, double y) {
        double w = matrix[2][0] * x + matrix[2][1] * y + matrix[2][2];
        if (Math.abs(w) < EPS) {
            return new double[]{Double.NaN, Double.NaN};
        }
        double u = (matrix[0][0] * x + matrix[0][1] * y + matrix[0][2]) / w;
        double v = (matrix[1][0] * x + matrix[1][1] * y + matrix[1][2]) / w;
        return new double[]{u, v};
    }

    /**
     * 逆变换（参考 -> 科学）
     */
    public AlignmentTransform inverse() {
        double[][] m = matrix;
        double c00 = m[1][1] * m[2][2] - m[1][2] * m[2][1];
        double c01 = m[1][2] * m[2][0] - m[1][0] * m[2][2];
        double c02 = m[1][0] * m[2][1] - m[1][1] * m[2][0];
        double det = m[0][0] * c00 + m[0][1] * c01 + m[0][2] * c02;
        if (Math.abs(det) < EPS) {
            throw new IllegalStateException("Transform is singular and cannot be inverted");
        }
        double[][] inv = new double[3][3];
        inv[0][0] = c00 / det;
        inv[0][1] = (m[0][2] * m[2][1] - m[0][1] * m[2][2]) / det;
        inv[0][2] = (m[0][1] * m[1][2] - m[0][2] * m[1][1]) / det;
        inv[1][0] = c01 / det;
        inv[1][1] = (m[0][0] * m[2][2] - m[0][2] * m[2][0]) / det;
        inv[1][2] = (m[0][2] * m[1][0] - m[0][0] * m[1][2]) / det;
        inv[2][0] = c02 / det;
        inv[2][1] = (m[0][1] * m[2][0] - m[0][0] * m[2][1]) / det;
        inv[2][2] = (m[0][0] * m[1][1] - m[0][1] * m[1][0]) / det;
        return new AlignmentTransform(inv, transformClass);
    }

    /**
     * 旋转角（度），由线性部分估计
     */
    public double getRotationDegrees() {
        return Math.toDegrees(Math.atan2(matrix[1][0] - matrix[0][1], matrix[0][0] + matrix[1][1]));
    }

    /**
     * 平均缩放因子（线性部分行列式的平方根）
     */
    public double getScale() {
        double det = matrix[0][0] * matrix[1][1] - matrix[0][1] * matrix[1][0];
        return Math.sqrt(Math.abs(det));
    }

    /**
     * X/Y 方向缩放比，用于区分相似变换与非均匀变换
     */
    public double getAnisotropy() {
        double sx = Math.hypot(matrix[0][0], matrix[1][0]);
        double sy = Math.hypot(matrix[0][1], matrix[1][1]);
        return sy < EPS ? Double.POSITIVE_INFINITY : sx / sy;
    }

    public double getTranslationX() {
        return matrix[0][2];
    }

    public double getTranslationY() {
        return matrix[1][2];
    }

    public boolean isIdentity(double tolerance) {
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                double expected = r == c ? 1.0 : 0.0;
                if (Math.abs(matrix[r][c] - expected) > tolerance) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * 按实际矩阵判断变换性质：rigid / similarity / non-uniform / perspective
     */
    public String classify() {
        if (Math.abs(matrix[2][0]) > 1e-9 || Math.abs(matrix[2][1]) > 1e-9) {
            return "perspective";
        }
        if (Math.abs(getAnisotropy() - 1.0) > 0.01) {
            return "non-uniform";
        }
        return Math.abs(getScale() - 1.0) <= 0.01 ? "rigid" : "similarity";
    }

    /**
     * 返回矩阵深拷贝
     */
    public double[][] getMatrix() {
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) {
            copy[r] = Arrays.copyOf(matrix[r], 3);
        }
        return copy;
    }

    public double get(int row, int col) {
        return matrix[row][col];
    }

    public TransformClass getTransformClass() {
        return transformClass;
    }

    public String describe() {
        return String.format("%s[rotation=%.4f deg, scale=%.6f, translation=(%.3f, %.3f), kind=%s]",
            transformClass, getRotationDegrees(), getScale(), getTranslationX(), getTranslationY(), classify());
    }

    @Override
    public String toString() {
        return describe();
    }
}
