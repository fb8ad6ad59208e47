package com.edge.dia.core.align;

import com.edge.dia.config.NativeLibraryLoader;
import com.edge.dia.core.model.FeaturePoint;
import com.edge.dia.core.model.Image;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.KeyPoint;
import org.opencv.features2d.ORB;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * ORB 特征检测器
 * <p>
 * 参数：scaleFactor=1.2, nlevels=8, edgeThreshold=31, WTA_K=2, HARRIS 评分, patchSize=31, fastThreshold=20。
 * 描述子为 32 字节，按字节值存入 FeaturePoint。
 */
public class OrbFeatureDetector implements FeatureDetector {

    private static final Logger logger = LoggerFactory.getLogger(OrbFeatureDetector.class);

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private final int maxFeatures;

    public OrbFeatureDetector(int maxFeatures) {
        this.maxFeatures = maxFeatures;
    }

    @Override
    public String name() {
        return "orb";
    }

    @Override
    public List<FeaturePoint> detectAndDescribe(Image image) {
        Mat gray = IntensityNormalizer.toEightBit(image);
        MatOfKeyPoint keyPoints = new MatOfKeyPoint();
        Mat descriptors = new Mat();
        try {
            ORB orb = ORB.create(maxFeatures, 1.2f, 8, 31, 0, 2, ORB.HARRIS_SCORE, 31, 20);
            orb.detectAndCompute(gray, new Mat(), keyPoints, descriptors);

            KeyPoint[] kps = keyPoints.toArray();
            List<FeaturePoint> points = new ArrayList<>(kps.length);
            if (descriptors.empty()) {
                logger.debug("ORB found no descriptors");
                return points;
            }
            int length = descriptors.cols();
            byte[] row = new byte[length];
            for (int i = 0; i < kps.length; i++) {
                descriptors.get(i, 0, row);
                float[] desc = new float[length];
                for (int j = 0; j < length; j++) {
                    desc[j] = row[j] & 0xFF;
                }
                points.add(new FeaturePoint(kps[i].pt.x, kps[i].pt.y, kps[i].response, desc));
            }
            logger.debug("ORB detected {} keypoints", points.size());
            return points;
        } finally {
            gray.release();
            keyPoints.release();
            descriptors.release();
        }
    }
}
