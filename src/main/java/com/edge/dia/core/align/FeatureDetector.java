package com.edge.dia.core.align;

import com.edge.dia.core.model.FeaturePoint;
import com.edge.dia.core.model.Image;

import java.util.List;

/**
 * 特征检测器接口
 * <p>
 * 输入为已归一化到 [0, 1] 的图像，返回带描述子的特征点，坐标为输入图像的像素坐标。
 */
public interface FeatureDetector {

    /**
     * 检测器名称
     */
    String name();

    /**
     * 检测特征点并计算描述子
     *
     * @param image 归一化后的图像
     * @return 特征点列表，可能为空
     */
    List<FeaturePoint> detectAndDescribe(Image image);
}
