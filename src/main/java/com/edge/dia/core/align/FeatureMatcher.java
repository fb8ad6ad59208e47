package com.edge.dia.core.align;

import com.edge.dia.core.model.CorrespondencePair;
import com.edge.dia.core.model.FeaturePoint;

import java.util.List;

/**
 * 特征匹配器接口
 */
public interface FeatureMatcher {

    /**
     * 匹配两组特征点
     *
     * @param science   科学图像特征点
     * @param reference 参考图像特征点
     * @return 匹配点对，按距离升序
     */
    List<CorrespondencePair> match(List<FeaturePoint> science, List<FeaturePoint> reference);
}
