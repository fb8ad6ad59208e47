package com.edge.dia.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 候选星表
 * <p>
 * 有序的已接受候选列表，按排序分（若未排序则按可靠性）降序排列，行号即 rank。
 * 运行结束时创建一次，之后只读。
 */
public final class Catalog {

    private final int imageWidth;
    private final int imageHeight;
    private final Map<String, Object> parameters;
    private final List<Candidate> rows;

    public Catalog(int imageWidth, int imageHeight, Map<String, Object> parameters, List<Candidate> candidates) {
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(Candidate::getRankScore).reversed()
            .thenComparing(Comparator.comparingDouble(Candidate::getReliability).reversed())
            .thenComparingInt(Candidate::getId));
        this.rows = Collections.unmodifiableList(sorted);
    }

    public int getImageWidth() { return imageWidth; }
    public int getImageHeight() { return imageHeight; }
    public Map<String, Object> getParameters() { return parameters; }
    public List<Candidate> getRows() { return rows; }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
