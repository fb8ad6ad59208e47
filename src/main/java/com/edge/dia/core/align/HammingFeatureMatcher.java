package com.edge.dia.core.align;

import com.edge.dia.config.NativeLibraryLoader;
import com.edge.dia.core.model.CorrespondencePair;
import com.edge.dia.core.model.FeaturePoint;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.DMatch;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.features2d.BFMatcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 二进制描述子匹配：BFMatcher(NORM_HAMMING, crossCheck=true) 保证互为最近邻，再按距离上限过滤
 */
public class HammingFeatureMatcher implements FeatureMatcher {

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private final int distanceCutoff;

    public HammingFeatureMatcher(int distanceCutoff) {
        this.distanceCutoff = distanceCutoff;
    }

    @Override
    public List<CorrespondencePair> match(List<FeaturePoint> science, List<FeaturePoint> reference) {
        List<CorrespondencePair> pairs = new ArrayList<>();
        if (science.isEmpty() || reference.isEmpty()) {
            return pairs;
        }
        Mat sciDesc = toDescriptorMat(science);
        Mat refDesc = toDescriptorMat(reference);
        MatOfDMatch matches = new MatOfDMatch();
        try {
            BFMatcher matcher = BFMatcher.create(Core.NORM_HAMMING, true);
            matcher.match(sciDesc, refDesc, matches);
            for (DMatch m : matches.toArray()) {
                if (m.distance <= distanceCutoff) {
                    pairs.add(new CorrespondencePair(science.get(m.queryIdx), reference.get(m.trainIdx), m.distance));
                }
            }
        } finally {
            sciDesc.release();
            refDesc.release();
            matches.release();
        }
        pairs.sort(Comparator.comparingDouble(CorrespondencePair::getDistance));
        return pairs;
    }

    private static Mat toDescriptorMat(List<FeaturePoint> points) {
        int length = points.get(0).getDescriptorLength();
        byte[] data = new byte[points.size() * length];
        for (int i = 0; i < points.size(); i++) {
            float[] d = points.get(i).getDescriptor();
            if (d.length != length) {
                throw new IllegalArgumentException("Descriptor length mismatch: " + d.length + " vs " + length);
            }
            for (int j = 0; j < length; j++) {
                data[i * length + j] = (byte) (int) d[j];
            }
        }
        Mat mat = new Mat(points.size(), length, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }
}
