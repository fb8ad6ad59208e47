package com.edge.dia.core.scoring;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.DifferenceMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 贝叶斯混合模型评分
 * <p>
 * 对覆盖区域内的带符号残差（超过上限时按固定种子随机抽样）拟合背景 + 源两分量高斯混合，
 * 显著性 = 0.5 * 候选峰值的源后验 + 0.5 * SNR 显著性。拟合退化时只用 SNR 显著性。
 */
public class BayesianMixtureScorer extends RuleBasedScorer {

    private static final Logger logger = LoggerFactory.getLogger(BayesianMixtureScorer.class);

    public BayesianMixtureScorer(ScoringOptions options) {
        super(options);
    }

    @Override
    public ScoringStrategy strategy() {
        return ScoringStrategy.BAYESIAN_MIXTURE;
    }

    @Override
    protected List<Assessment> assess(List<Candidate> candidates, DifferenceMap map) {
        GaussianMixtureModel model = GaussianMixtureModel.fit(sample(map), options.getMixtureIterations(),
            options.getMixtureTolerance());
        if (model == null) {
            logger.warn("Mixture fit is degenerate, using SNR significance only");
        } else {
            logger.debug("Residual mixture: {}", model);
        }
        List<Assessment> out = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            double snr = snrSignificance(c);
            double significance = model == null ? snr : 0.5 * model.sourcePosterior(c.getPeak()) + 0.5 * snr;
            out.add(new Assessment(significance));
        }
        return out;
    }

    private double[] sample(DifferenceMap map) {
        int w = map.getWidth();
        int h = map.getHeight();
        int covered = map.coveredPixelCount();
        int limit = options.getMaxMixtureSamples();
        if (covered <= limit) {
            double[] data = new double[covered];
            int n = 0;
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    if (map.isCovered(x, y)) {
                        data[n++] = map.getResidual(x, y);
                    }
                }
            }
            return data;
        }
        Random random = new Random(options.getRandomSeed());
        double[] data = new double[limit];
        int n = 0;
        while (n < limit) {
            int x = random.nextInt(w);
            int y = random.nextInt(h);
            if (map.isCovered(x, y)) {
                data[n++] = map.getResidual(x, y);
            }
        }
        return data;
    }
}
