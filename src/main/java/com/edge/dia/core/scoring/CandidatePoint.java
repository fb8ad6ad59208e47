package com.edge.dia.core.scoring;

import com.edge.dia.core.model.Candidate;
import org.apache.commons.math3.ml.clustering.Clusterable;

/**
 * 用于 DBSCAN 聚类的候选位置
 */
final class CandidatePoint implements Clusterable {

    private final int index;
    private final double[] point;

    CandidatePoint(int index, Candidate candidate) {
        this.index = index;
        this.point = new double[]{candidate.getX(), candidate.getY()};
    }

    int getIndex() {
        return index;
    }

    @Override
    public double[] getPoint() {
        return point;
    }
}
