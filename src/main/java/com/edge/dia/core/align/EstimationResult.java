package com.edge.dia.core.align;

import com.edge.dia.core.model.AlignmentTransform;

import java.util.Arrays;

/**
 * 稳健估计结果
 */
public final class EstimationResult {

    private final AlignmentTransform transform;
    private final boolean[] inlierMask;
    private final int inlierCount;
    private final double rmsError;
    private final boolean success;
    private final String message;

    EstimationResult(AlignmentTransform transform, boolean[] inlierMask, int inlierCount, double rmsError,
                     boolean success, String message) {
        this.transform = transform;
        this.inlierMask = inlierMask;
        this.inlierCount = inlierCount;
        this.rmsError = rmsError;
        this.success = success;
        this.message = message;
    }

    static EstimationResult failure(int correspondences, String message) {
        return new EstimationResult(null, new boolean[correspondences], 0, Double.NaN, false, message);
    }

    /** 估计的变换，完全无法拟合时为 null */
    public AlignmentTransform getTransform() { return transform; }

    public boolean[] getInlierMask() {
        return Arrays.copyOf(inlierMask, inlierMask.length);
    }

    public int getInlierCount() { return inlierCount; }

    /** 内点重投影误差的均方根（像素） */
    public double getRmsError() { return rmsError; }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
}
