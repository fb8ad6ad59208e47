package com.edge.dia.core.align;

import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.TransformClass;

/**
 * 刚体变换的最小二乘拟合（Procrustes，尺度固定为 1）
 * <p>
 * OpenCV 没有只含旋转和平移的 RANSAC 估计器，内点由相似模型给出后在这里重新拟合。
 */
final class TransformFitter {

    private TransformFitter() {
    }

    /**
     * @param src  科学图像坐标 {x, y}
     * @param dst  参考图像坐标 {x, y}
     * @param mask 参与拟合的内点
     * @return 退化输入（内点不足 2 个或全部重合）时返回 null
     */
    static AlignmentTransform fitRigid(double[][] src, double[][] dst, boolean[] mask) {
        double csx = 0, csy = 0, cdx = 0, cdy = 0;
        int n = 0;
        for (int i = 0; i < src.length; i++) {
            if (!mask[i]) continue;
            csx += src[i][0];
            csy += src[i][1];
            cdx += dst[i][0];
            cdy += dst[i][1];
            n++;
        }
        if (n < 2) {
            return null;
        }
        csx /= n;
        csy /= n;
        cdx /= n;
        cdy /= n;

        double a = 0, b = 0, s = 0;
        for (int i = 0; i < src.length; i++) {
            if (!mask[i]) continue;
            double sx = src[i][0] - csx;
            double sy = src[i][1] - csy;
            double dx = dst[i][0] - cdx;
            double dy = dst[i][1] - cdy;
            a += sx * dx + sy * dy;
            b += sx * dy - sy * dx;
            s += sx * sx + sy * sy;
        }
        if (s < 1e-12) {
            return null;
        }
        double theta = Math.atan2(b, a);
        double c = Math.cos(theta);
        double d = Math.sin(theta);
        double tx = cdx - (c * csx - d * csy);
        double ty = cdy - (d * csx + c * csy);
        return new AlignmentTransform(new double[][]{{c, -d, tx}, {d, c, ty}, {0, 0, 1}}, TransformClass.RIGID);
    }
}
