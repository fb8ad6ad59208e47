package com.edge.dia.dto;

/**
 * 运行时参数更新请求，只应用非空字段
 */
public class ConfigUpdateRequest {
    private String transformClass;       // rigid / similarity / homography
    private String featureDetector;      // asterism / orb
    private Boolean useCentralRegion;
    private Integer centralRegionSize;
    private String preset;               // default / strict / gentle / ultra-gentle / minimal
    private Double noiseSigmaMultiplier;
    private Integer minCandidateArea;
    private String scoringStrategy;
    private Double reliabilityCutoff;
    private Integer minRadius;
    private Integer maxRadius;
    private String markerMetric;         // area / flux / snr

    public String getTransformClass() { return transformClass; }
    public void setTransformClass(String transformClass) { this.transformClass = transformClass; }

    public String getFeatureDetector() { return featureDetector; }
    public void setFeatureDetector(String featureDetector) { this.featureDetector = featureDetector; }

    public Boolean getUseCentralRegion() { return useCentralRegion; }
    public void setUseCentralRegion(Boolean useCentralRegion) { this.useCentralRegion = useCentralRegion; }

    public Integer getCentralRegionSize() { return centralRegionSize; }
    public void setCentralRegionSize(Integer centralRegionSize) { this.centralRegionSize = centralRegionSize; }

    public String getPreset() { return preset; }
    public void setPreset(String preset) { this.preset = preset; }

    public Double getNoiseSigmaMultiplier() { return noiseSigmaMultiplier; }
    public void setNoiseSigmaMultiplier(Double noiseSigmaMultiplier) { this.noiseSigmaMultiplier = noiseSigmaMultiplier; }

    public Integer getMinCandidateArea() { return minCandidateArea; }
    public void setMinCandidateArea(Integer minCandidateArea) { this.minCandidateArea = minCandidateArea; }

    public String getScoringStrategy() { return scoringStrategy; }
    public void setScoringStrategy(String scoringStrategy) { this.scoringStrategy = scoringStrategy; }

    public Double getReliabilityCutoff() { return reliabilityCutoff; }
    public void setReliabilityCutoff(Double reliabilityCutoff) { this.reliabilityCutoff = reliabilityCutoff; }

    public Integer getMinRadius() { return minRadius; }
    public void setMinRadius(Integer minRadius) { this.minRadius = minRadius; }

    public Integer getMaxRadius() { return maxRadius; }
    public void setMaxRadius(Integer maxRadius) { this.maxRadius = maxRadius; }

    public String getMarkerMetric() { return markerMetric; }
    public void setMarkerMetric(String markerMetric) { this.markerMetric = markerMetric; }
}
