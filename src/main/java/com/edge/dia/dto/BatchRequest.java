package com.edge.dia.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量处理请求
 * <p>
 * 可显式列出图像对，也可给出参考目录与科学目录，按同名文件配对。
 */
public class BatchRequest {
    private List<ProcessRequest> pairs = new ArrayList<>();
    private String referenceDirectory;
    private String scienceDirectory;
    private String outputDirectory;

    public List<ProcessRequest> getPairs() { return pairs; }
    public void setPairs(List<ProcessRequest> pairs) { this.pairs = pairs; }

    public String getReferenceDirectory() { return referenceDirectory; }
    public void setReferenceDirectory(String referenceDirectory) { this.referenceDirectory = referenceDirectory; }

    public String getScienceDirectory() { return scienceDirectory; }
    public void setScienceDirectory(String scienceDirectory) { this.scienceDirectory = scienceDirectory; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }
}
