package com.edge.dia.core.model;

/**
 * 配准统计
 */
public final class MatchStatistics {

    private final int referenceKeypoints;
    private final int scienceKeypoints;
    private final int correspondences;
    private final int inliers;

    public MatchStatistics(int referenceKeypoints, int scienceKeypoints, int correspondences, int inliers) {
        this.referenceKeypoints = referenceKeypoints;
        this.scienceKeypoints = scienceKeypoints;
        this.correspondences = correspondences;
        this.inliers = inliers;
    }

    public static MatchStatistics empty() {
        return new MatchStatistics(0, 0, 0, 0);
    }

    public int getReferenceKeypoints() { return referenceKeypoints; }
    public int getScienceKeypoints() { return scienceKeypoints; }
    public int getCorrespondences() { return correspondences; }
    public int getInliers() { return inliers; }

    public double getInlierRatio() {
        return correspondences == 0 ? 0.0 : (double) inliers / correspondences;
    }

    @Override
    public String toString() {
        return String.format("keypoints(ref=%d, sci=%d), correspondences=%d, inliers=%d (%.1f%%)",
            referenceKeypoints, scienceKeypoints, correspondences, inliers, getInlierRatio() * 100);
    }
}
