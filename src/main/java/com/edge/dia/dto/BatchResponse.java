package com.edge.dia.dto;

import com.edge.dia.io.RunReport;

import java.util.List;

/**
 * 批量处理结果，报告顺序与请求中的图像对顺序一致
 */
public class BatchResponse {
    private int total;
    private int succeeded;
    private int failed;
    private long elapsedMillis;
    private List<RunReport> reports;

    public static BatchResponse of(List<RunReport> reports, long elapsedMillis) {
        BatchResponse response = new BatchResponse();
        response.total = reports.size();
        response.succeeded = (int) reports.stream().filter(RunReport::isSuccess).count();
        response.failed = response.total - response.succeeded;
        response.elapsedMillis = elapsedMillis;
        response.reports = reports;
        return response;
    }

    public int getTotal() { return total; }
    public void setTotal(int total) { this.total = total; }

    public int getSucceeded() { return succeeded; }
    public void setSucceeded(int succeeded) { this.succeeded = succeeded; }

    public int getFailed() { return failed; }
    public void setFailed(int failed) { this.failed = failed; }

    public long getElapsedMillis() { return elapsedMillis; }
    public void setElapsedMillis(long elapsedMillis) { this.elapsedMillis = elapsedMillis; }

    public List<RunReport> getReports() { return reports; }
    public void setReports(List<RunReport> reports) { this.reports = reports; }
}
