package com.edge.dia.service;

import com.edge.dia.config.DiaProperties;
import com.edge.dia.core.SyntheticSky;
import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.scoring.ScoringStrategy;
import com.edge.dia.core.difference.CleaningPreset;
import com.edge.dia.dto.ConfigUpdateRequest;
import com.edge.dia.dto.ProcessRequest;
import com.edge.dia.exception.ConfigurationException;
import com.edge.dia.io.FitsImageIO;
import com.edge.dia.io.RunReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class DiaServiceTest {

    @Autowired
    private DiaService diaService;

    @Autowired
    private DiaProperties properties;

    @Autowired
    private FitsImageIO fitsImageIO;

    @Test
    void processWritesAllOutputs(@TempDir Path dir) throws Exception {
        SyntheticSky.Pair pair = SyntheticSky.pair(300, 12, 400, 3, 1500,
            AlignmentTransform.rigid(Math.toRadians(1.5), 4.3, -3.1), 21);
        Path ref = dir.resolve("ref/field.fits");
        Path sci = dir.resolve("sci/field.fits");
        fitsImageIO.save(pair.reference, ref);
        fitsImageIO.save(pair.science, sci);

        ProcessRequest request = ProcessRequest.of(ref.toString(), sci.toString());
        request.setOutputDirectory(dir.resolve("out").toString());
        RunReport report = diaService.process(request);

        assertTrue(report.isSuccess(), report.getMessage());
        assertEquals(3, report.getCandidates().size());
        assertTrue(report.getAlignment().isSuccess());
        for (String key : new String[]{"aligned", "difference", "marked", "catalog", "report"}) {
            assertTrue(Files.isRegularFile(Path.of(report.getOutputs().get(key))), key);
        }
        assertTrue(report.getOutputs().get("catalog").endsWith("field_catalog.txt"));
        assertEquals(300, fitsImageIO.load(Path.of(report.getOutputs().get("difference"))).getWidth());
    }

    @Test
    void unreadableInputGivesFailureReport(@TempDir Path dir) throws Exception {
        ProcessRequest request = ProcessRequest.of(dir.resolve("none.fits").toString(), dir.resolve("none2.fits").toString());
        RunReport report = diaService.process(request);
        assertFalse(report.isSuccess());
        assertEquals("INPUT_ERROR", report.getFailureReason());
    }

    @Test
    void invalidUpdateLeavesConfigurationUntouched() {
        double before = properties.getScoring().getReliabilityCutoff();
        ConfigUpdateRequest update = new ConfigUpdateRequest();
        update.setScoringStrategy("multi-scale");
        update.setReliabilityCutoff(150.0);

        assertThrows(ConfigurationException.class, () -> diaService.updateConfig(update));
        assertEquals(before, properties.getScoring().getReliabilityCutoff());
        assertEquals(ScoringStrategy.STATISTICAL, properties.getScoring().getStrategy());

        ConfigUpdateRequest unknown = new ConfigUpdateRequest();
        unknown.setPreset("aggressive");
        assertThrows(ConfigurationException.class, () -> diaService.updateConfig(unknown));
    }

    @Test
    @DirtiesContext
    void validUpdateIsApplied() {
        ConfigUpdateRequest update = new ConfigUpdateRequest();
        update.setScoringStrategy("bayesian-mixture");
        update.setPreset("ultra-gentle");
        update.setReliabilityCutoff(60.0);

        diaService.updateConfig(update);

        assertEquals(ScoringStrategy.BAYESIAN_MIXTURE, properties.getScoring().getStrategy());
        assertEquals(60.0, properties.getScoring().getReliabilityCutoff());
        assertEquals(CleaningPreset.ULTRA_GENTLE, properties.getDifference().getPreset());
    }

    @Test
    void parsesEnumNamesLeniently() {
        assertEquals(ScoringStrategy.CUTOUT_HEURISTIC,
            DiaService.parseEnum(ScoringStrategy.class, " cutout-heuristic ", "scoringStrategy"));
        assertThrows(ConfigurationException.class,
            () -> DiaService.parseEnum(ScoringStrategy.class, "neural", "scoringStrategy"));
    }
}
