package com.edge.dia.core.model;

/**
 * 配准结果
 * <p>
 * 配准失败用 {@code success=false} 表示，不抛异常。失败时 transform 为恒等变换。
 */
public final class AlignmentResult {

    private final AlignmentTransform transform;
    private final boolean success;
    private final MatchStatistics statistics;
    private final String message;

    private AlignmentResult(AlignmentTransform transform, boolean success, MatchStatistics statistics, String message) {
        this.transform = transform;
        this.success = success;
        this.statistics = statistics;
        this.message = message;
    }

    public static AlignmentResult success(AlignmentTransform transform, MatchStatistics statistics) {
        return new AlignmentResult(transform, true, statistics, "aligned");
    }

    public static AlignmentResult failure(TransformClass transformClass, MatchStatistics statistics, String message) {
        return new AlignmentResult(AlignmentTransform.identity(transformClass), false, statistics, message);
    }

    public AlignmentTransform getTransform() { return transform; }
    public boolean isSuccess() { return success; }
    public MatchStatistics getStatistics() { return statistics; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "AlignmentResult{success=" + success + ", " + statistics + ", message='" + message + "', transform=" + transform + '}';
    }
}
