package com.edge.dia.core.annotate;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.Catalog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 星表文本序列化
 * <p>
 * 头部为 '#' 开头的注释行（图像尺寸、参数、列名），之后每个候选一行，列固定：
 * rank id x y area peak flux snr center_dist score reliability elongation compactness label confidence flags
 */
public class CatalogWriter {

    public static final List<String> COLUMNS = List.of(
        "rank", "id", "x", "y", "area", "peak", "flux", "snr", "center_dist", "score",
        "reliability", "elongation", "compactness", "label", "confidence", "flags");

    private final CatalogOptions options;

    public CatalogWriter(CatalogOptions options) {
        options.validate();
        this.options = options;
    }

    public String format(Catalog catalog) {
        String sep = options.getDelimiter() == CatalogOptions.Delimiter.COMMA ? "," : " ";
        StringBuilder sb = new StringBuilder();
        sb.append("# Difference image candidate catalog\n");
        sb.append("# image_width: ").append(catalog.getImageWidth()).append('\n');
        sb.append("# image_height: ").append(catalog.getImageHeight()).append('\n');
        sb.append("# candidates: ").append(catalog.size()).append('\n');
        for (Map.Entry<String, Object> e : catalog.getParameters().entrySet()) {
            sb.append("# ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        }
        sb.append("# columns: ").append(String.join(sep, COLUMNS)).append('\n');

        int rank = 1;
        for (Candidate c : catalog.getRows()) {
            List<String> cells = new ArrayList<>(COLUMNS.size());
            cells.add(Integer.toString(rank++));
            cells.add(Integer.toString(c.getId()));
            cells.add(num(c.getX()));
            cells.add(num(c.getY()));
            cells.add(Integer.toString(c.getArea()));
            cells.add(num(c.getPeak()));
            cells.add(num(c.getTotal()));
            cells.add(num(c.getSnr()));
            cells.add(num(c.getCenterDistance()));
            cells.add(num(c.getRankScore()));
            cells.add(num(c.getReliability()));
            cells.add(num(c.getElongation()));
            cells.add(num(c.getCompactness()));
            cells.add(c.getLabel().name());
            cells.add(num(c.getConfidence()));
            cells.add(c.getFlags().isEmpty() ? "-" : String.join("|", c.getFlags()));
            sb.append(String.join(sep, cells)).append('\n');
        }
        return sb.toString();
    }

    public void write(Catalog catalog, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, format(catalog), StandardCharsets.UTF_8);
    }

    private String num(double v) {
        return String.format(Locale.ROOT, "%." + options.getPrecision() + "f", v);
    }
}
