package com.edge.dia.core.annotate;

import com.edge.dia.core.model.Candidate;

/**
 * 标记圆半径所编码的指标
 */
public enum MarkerMetric {
    /** 像素面积 */
    AREA {
        @Override
        public double valueOf(Candidate c) {
            return c.getArea();
        }
    },
    /** 总信号 */
    FLUX {
        @Override
        public double valueOf(Candidate c) {
            return Math.abs(c.getTotal());
        }
    },
    /** 信噪比 */
    SNR {
        @Override
        public double valueOf(Candidate c) {
            return c.getSnr();
        }
    };

    public abstract double valueOf(Candidate c);
}
