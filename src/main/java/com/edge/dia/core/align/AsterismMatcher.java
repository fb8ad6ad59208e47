package com.edge.dia.core.align;

import com.edge.dia.core.model.CorrespondencePair;
import com.edge.dia.core.model.FeaturePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 星点三角形匹配
 * <p>
 * 在两幅图像最亮的 N 颗星中枚举所有三角形，边长降序 L0 >= L1 >= L2，
 * 以 (L1/L0, L2/L1) 作为相似不变量。不变量在容差内且朝向一致的三角形对，
 * 按对边顺序为三个顶点各投一票。最后保留互为最高票且票数不少于阈值的星点对。
 */
public class AsterismMatcher implements FeatureMatcher {

    private static final Logger logger = LoggerFactory.getLogger(AsterismMatcher.class);

    /** 三角形最短边下限（像素） */
    private static final double MIN_SIDE = 3.0;

    private final int maxTriangleStars;
    private final double tolerance;
    private final int minVotes;

    public AsterismMatcher(int maxTriangleStars, double tolerance, int minVotes) {
        this.maxTriangleStars = maxTriangleStars;
        this.tolerance = tolerance;
        this.minVotes = minVotes;
    }

    @Override
    public List<CorrespondencePair> match(List<FeaturePoint> science, List<FeaturePoint> reference) {
        List<FeaturePoint> sci = brightest(science);
        List<FeaturePoint> ref = brightest(reference);
        List<CorrespondencePair> pairs = new ArrayList<>();
        if (sci.size() < 3 || ref.size() < 3) {
            return pairs;
        }

        List<Triangle> sciTriangles = triangles(sci);
        List<Triangle> refTriangles = triangles(ref);
        refTriangles.sort(Comparator.comparingDouble(t -> t.ratio1));
        double[] refKeys = new double[refTriangles.size()];
        for (int i = 0; i < refKeys.length; i++) {
            refKeys[i] = refTriangles.get(i).ratio1;
        }

        int[][] votes = new int[sci.size()][ref.size()];
        int matchedTriangles = 0;
        for (Triangle s : sciTriangles) {
            int start = lowerBound(refKeys, s.ratio1 - tolerance);
            for (int i = start; i < refKeys.length && refKeys[i] <= s.ratio1 + tolerance; i++) {
                Triangle r = refTriangles.get(i);
                if (Math.abs(r.ratio2 - s.ratio2) > tolerance || r.orientation != s.orientation) {
                    continue;
                }
                matchedTriangles++;
                for (int k = 0; k < 3; k++) {
                    votes[s.vertices[k]][r.vertices[k]]++;
                }
            }
        }

        for (int i = 0; i < sci.size(); i++) {
            int best = argMaxRow(votes, i);
            if (best < 0 || votes[i][best] < minVotes) {
                continue;
            }
            if (argMaxColumn(votes, best) != i) {
                continue;
            }
            pairs.add(new CorrespondencePair(sci.get(i), ref.get(best), 1.0 / votes[i][best]));
        }
        pairs.sort(Comparator.comparingDouble(CorrespondencePair::getDistance));
        logger.debug("Asterism matching: triangles(sci={}, ref={}), matched triangles={}, pairs={}",
            sciTriangles.size(), refTriangles.size(), matchedTriangles, pairs.size());
        return pairs;
    }

    private List<FeaturePoint> brightest(List<FeaturePoint> points) {
        List<FeaturePoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingDouble((FeaturePoint p) -> -p.getResponse()));
        return sorted.size() > maxTriangleStars ? new ArrayList<>(sorted.subList(0, maxTriangleStars)) : sorted;
    }

    private List<Triangle> triangles(List<FeaturePoint> stars) {
        List<Triangle> out = new ArrayList<>();
        int n = stars.size();
        for (int a = 0; a < n; a++) {
            for (int b = a + 1; b < n; b++) {
                for (int c = b + 1; c < n; c++) {
                    Triangle t = Triangle.of(stars, a, b, c, tolerance);
                    if (t != null) {
                        out.add(t);
                    }
                }
            }
        }
        return out;
    }

    private static int lowerBound(double[] keys, double value) {
        int lo = 0;
        int hi = keys.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (keys[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * 行最大值所在列；并列最大时返回 -1
     */
    private static int argMaxRow(int[][] votes, int row) {
        int best = -1;
        int bestVotes = 0;
        boolean tie = false;
        for (int j = 0; j < votes[row].length; j++) {
            if (votes[row][j] > bestVotes) {
                best = j;
                bestVotes = votes[row][j];
                tie = false;
            } else if (votes[row][j] == bestVotes && bestVotes > 0) {
                tie = true;
            }
        }
        return tie ? -1 : best;
    }

    private static int argMaxColumn(int[][] votes, int col) {
        int best = -1;
        int bestVotes = 0;
        boolean tie = false;
        for (int i = 0; i < votes.length; i++) {
            if (votes[i][col] > bestVotes) {
                best = i;
                bestVotes = votes[i][col];
                tie = false;
            } else if (votes[i][col] == bestVotes && bestVotes > 0) {
                tie = true;
            }
        }
        return tie ? -1 : best;
    }

    /**
     * 顶点按对边长度降序排列的三角形
     */
    private static final class Triangle {
        final int[] vertices;
        final double ratio1;
        final double ratio2;
        final int orientation;

        private Triangle(int[] vertices, double ratio1, double ratio2, int orientation) {
            this.vertices = vertices;
            this.ratio1 = ratio1;
            this.ratio2 = ratio2;
            this.orientation = orientation;
        }

        static Triangle of(List<FeaturePoint> stars, int a, int b, int c, double tolerance) {
            FeaturePoint pa = stars.get(a);
            FeaturePoint pb = stars.get(b);
            FeaturePoint pc = stars.get(c);
            // 各顶点对边长度
            double[] opposite = {pb.distanceTo(pc), pa.distanceTo(pc), pa.distanceTo(pb)};
            int[] idx = {a, b, c};
            FeaturePoint[] pts = {pa, pb, pc};
            Integer[] order = {0, 1, 2};
            java.util.Arrays.sort(order, (i, j) -> Double.compare(opposite[j], opposite[i]));
            double l0 = opposite[order[0]];
            double l1 = opposite[order[1]];
            double l2 = opposite[order[2]];
            if (l2 < MIN_SIDE) {
                return null;
            }
            // 边长过于接近时顶点顺序不稳定
            if ((l0 - l1) < tolerance * l0 || (l1 - l2) < tolerance * l0) {
                return null;
            }
            FeaturePoint v0 = pts[order[0]];
            FeaturePoint v1 = pts[order[1]];
            FeaturePoint v2 = pts[order[2]];
            double cross = (v1.getX() - v0.getX()) * (v2.getY() - v0.getY())
                - (v1.getY() - v0.getY()) * (v2.getX() - v0.getX());
            int[] vertices = {idx[order[0]], idx[order[1]], idx[order[2]]};
            return new Triangle(vertices, l1 / l0, l2 / l1, cross >= 0 ? 1 : -1);
        }
    }
}
