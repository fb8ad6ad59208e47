package com.edge.dia.core.model;

import java.util.Arrays;

/**
 * 特征点：位置 + 定长描述子
 * <p>
 * 只在匹配阶段临时使用，不持久化。二进制描述子（ORB）按字节值存放在 float 数组中。
 */
public final class FeaturePoint {

    private final double x;
    private final double y;
    private final float response;
    private final float[] descriptor;

    public FeaturePoint(double x, double y, float response, float[] descriptor) {
        this.x = x;
        this.y = y;
        this.response = response;
        this.descriptor = descriptor == null ? new float[0] : Arrays.copyOf(descriptor, descriptor.length);
    }

    public double getX() { return x; }
    public double getY() { return y; }

    /**
     * 检测器响应强度（星点为峰值亮度）
     */
    public float getResponse() { return response; }

    public float[] getDescriptor() {
        return Arrays.copyOf(descriptor, descriptor.length);
    }

    public int getDescriptorLength() {
        return descriptor.length;
    }

    /**
     * 平移后的副本，用于把子窗口坐标还原到整幅图像
     */
    public FeaturePoint offset(double dx, double dy) {
        return new FeaturePoint(x + dx, y + dy, response, descriptor);
    }

    public double distanceTo(FeaturePoint other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    @Override
    public String toString() {
        return String.format("FeaturePoint(%.2f, %.2f, r=%.3f)", x, y, response);
    }
}
