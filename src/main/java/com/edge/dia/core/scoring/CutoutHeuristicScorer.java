package com.edge.dia.core.scoring;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.DifferenceMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 切片启发式评分，代替神经网络 real/bogus 分类器
 * <p>
 * 以候选为中心取 cutoutSize x cutoutSize 的残差切片：
 * 若 max > mean + 3*std 且 std > 0.1，score = min(0.9, max / (mean + 3*std))，否则 score = 0.1。
 * score 不超过 realThreshold 判为伪源。
 */
public class CutoutHeuristicScorer extends RuleBasedScorer {

    public CutoutHeuristicScorer(ScoringOptions options) {
        super(options);
    }

    @Override
    public ScoringStrategy strategy() {
        return ScoringStrategy.CUTOUT_HEURISTIC;
    }

    @Override
    protected List<Assessment> assess(List<Candidate> candidates, DifferenceMap map) {
        List<Assessment> out = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            double score = cutoutScore(map, c);
            boolean bogus = score <= options.getCutoutRealThreshold();
            out.add(new Assessment(score, bogus, Collections.emptySet()));
        }
        return out;
    }

    double cutoutScore(DifferenceMap map, Candidate c) {
        int half = options.getCutoutSize() / 2;
        int cx = (int) Math.round(c.getX());
        int cy = (int) Math.round(c.getY());
        int x0 = Math.max(0, cx - half);
        int y0 = Math.max(0, cy - half);
        int x1 = Math.min(map.getWidth(), cx + half);
        int y1 = Math.min(map.getHeight(), cy + half);

        double sum = 0;
        double sumSq = 0;
        double max = Double.NEGATIVE_INFINITY;
        int n = 0;
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                double v = map.getResidual(x, y);
                sum += v;
                sumSq += v * v;
                max = Math.max(max, v);
                n++;
            }
        }
        if (n == 0) {
            return 0.1;
        }
        double mean = sum / n;
        double std = Math.sqrt(Math.max(0, sumSq / n - mean * mean));
        double level = mean + 3 * std;
        if (max > level && std > 0.1) {
            return level > 0 ? Math.min(0.9, max / level) : 0.9;
        }
        return 0.1;
    }
}
