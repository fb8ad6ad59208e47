package com.edge.dia.dto;

/**
 * 单对图像处理请求
 * <p>
 * 提供 referencePath + sciencePath 时走完整流程；只提供 differencePath 时跳过配准，直接处理已有差异图。
 */
public class ProcessRequest {
    private String referencePath;
    private String sciencePath;
    private String differencePath;
    private String outputName;        // 输出文件名前缀，默认取科学图像文件名
    private String outputDirectory;   // 为空时使用配置的输出目录

    public ProcessRequest() {
    }

    public static ProcessRequest of(String referencePath, String sciencePath) {
        ProcessRequest request = new ProcessRequest();
        request.referencePath = referencePath;
        request.sciencePath = sciencePath;
        return request;
    }

    public static ProcessRequest ofDifference(String differencePath) {
        ProcessRequest request = new ProcessRequest();
        request.differencePath = differencePath;
        return request;
    }

    public ProcessRequest copy() {
        ProcessRequest copy = new ProcessRequest();
        copy.referencePath = referencePath;
        copy.sciencePath = sciencePath;
        copy.differencePath = differencePath;
        copy.outputName = outputName;
        copy.outputDirectory = outputDirectory;
        return copy;
    }

    /** 作为输出名来源的输入文件：差异图模式取 differencePath，否则取 sciencePath */
    public String sourcePath() {
        return isDifferenceOnly() ? differencePath : sciencePath;
    }

    public boolean isDifferenceOnly() {
        return differencePath != null && !differencePath.isBlank()
            && (referencePath == null || referencePath.isBlank());
    }

    // Getters and Setters
    public String getReferencePath() { return referencePath; }
    public void setReferencePath(String referencePath) { this.referencePath = referencePath; }

    public String getSciencePath() { return sciencePath; }
    public void setSciencePath(String sciencePath) { this.sciencePath = sciencePath; }

    public String getDifferencePath() { return differencePath; }
    public void setDifferencePath(String differencePath) { this.differencePath = differencePath; }

    public String getOutputName() { return outputName; }
    public void setOutputName(String outputName) { this.outputName = outputName; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }
}
