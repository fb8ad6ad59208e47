package com.edge.dia.core.annotate;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.CandidateLabel;
import com.edge.dia.core.model.Catalog;
import com.edge.dia.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogWriterTest {

    private static Catalog catalog() {
        Candidate bright = Candidate.builder().id(4).x(12.5).y(40.25).area(15).peak(300).total(2500)
            .snr(41.6667).centerDistance(10).rankScore(0.9).elongation(1.1).compactness(0.8).netFlux(2500)
            .build().withScore(CandidateLabel.CANDIDATE, 0.95, 88.123456, null);
        Candidate faint = Candidate.builder().id(2).x(80).y(5).area(6).peak(40).total(200)
            .snr(8).centerDistance(60).rankScore(0.3).elongation(1.5).compactness(0.7).netFlux(200)
            .flag(Candidate.FLAG_BOUNDARY).flag(Candidate.FLAG_CLUSTERED)
            .build().withScore(CandidateLabel.CANDIDATE, 0.6, 55, null);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("scoring_strategy", "STATISTICAL");
        params.put("reliability_cutoff", 50.0);
        return new Catalog(100, 64, params, List.of(faint, bright));
    }

    @Test
    void writesHeaderThenRankedRows() {
        String text = new CatalogWriter(new CatalogOptions()).format(catalog());
        List<String> lines = text.lines().toList();

        assertEquals("# Difference image candidate catalog", lines.get(0));
        assertEquals("# image_width: 100", lines.get(1));
        assertEquals("# image_height: 64", lines.get(2));
        assertEquals("# candidates: 2", lines.get(3));
        assertEquals("# scoring_strategy: STATISTICAL", lines.get(4));
        assertEquals("# reliability_cutoff: 50.0", lines.get(5));
        assertEquals("# columns: " + String.join(" ", CatalogWriter.COLUMNS), lines.get(6));
        assertEquals(9, lines.size());

        String[] first = lines.get(7).split(" ");
        assertEquals(CatalogWriter.COLUMNS.size(), first.length);
        assertEquals("1", first[0]);
        assertEquals("4", first[1]);
        assertEquals("12.500", first[2]);
        assertEquals("88.123", first[10]);
        assertEquals("CANDIDATE", first[13]);
        assertEquals("-", first[15]);

        String[] second = lines.get(8).split(" ");
        assertEquals("2", second[0]);
        assertEquals("BOUNDARY|CLUSTERED", second[15]);
    }

    @Test
    void commaDelimiterAndPrecision() {
        CatalogOptions options = new CatalogOptions();
        options.setDelimiter(CatalogOptions.Delimiter.COMMA);
        options.setPrecision(1);
        String row = new CatalogWriter(options).format(catalog()).lines()
            .filter(l -> !l.startsWith("#")).findFirst().orElseThrow();
        assertTrue(row.startsWith("1,4,12.5,40.3,15,"), row);
    }

    @Test
    void writeCreatesParentDirectories(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("nested/out/catalog.txt");
        new CatalogWriter(new CatalogOptions()).write(catalog(), target);
        String text = Files.readString(target, StandardCharsets.UTF_8);
        assertTrue(text.contains("# candidates: 2"));
    }

    @Test
    void rejectsBadPrecision() {
        CatalogOptions options = new CatalogOptions();
        options.setPrecision(12);
        assertThrows(ConfigurationException.class, () -> new CatalogWriter(options));
    }
}
