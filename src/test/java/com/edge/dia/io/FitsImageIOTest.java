package com.edge.dia.io;

import com.edge.dia.core.model.Image;
import com.edge.dia.exception.InputException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
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

class FitsImageIOTest {

    private final FitsImageIO io = new FitsImageIO();

    @Test
    void savedImageLoadsBackWithHeaderAndHistory(@TempDir Path dir) throws Exception {
        float[][] pixels = {
            {1.5f, 2.25f, -3f},
            {4f, 5.125f, 6f}
        };
        Map<String, String> header = new LinkedHashMap<>();
        header.put("OBJECT", "M31");
        header.put("EXPTIME", "30.5");
        header.put("NCOMBINE", "4");
        header.put("NAXIS1", "999");
        Path path = dir.resolve("out/sample.fits");

        io.save(new Image(pixels, header), path, List.of("DIA run test"));
        Image loaded = io.load(path);

        assertEquals(3, loaded.getWidth());
        assertEquals(2, loaded.getHeight());
        assertEquals(5.125f, loaded.get(1, 1));
        assertEquals(-3f, loaded.get(2, 0));
        assertEquals("M31", loaded.getHeader().get("OBJECT"));
        assertEquals(30.5, Double.parseDouble(loaded.getHeader().get("EXPTIME")), 1e-9);
        assertEquals("4", loaded.getHeader().get("NCOMBINE"));
        assertEquals("3", loaded.getHeader().get("NAXIS1"));

        String raw = new String(Files.readAllBytes(path), StandardCharsets.US_ASCII);
        assertTrue(raw.contains("HISTORY DIA run test"));
    }

    @Test
    void overwritesExistingFile(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("again.fits");
        io.save(new Image(new float[][]{{1f, 1f}, {1f, 1f}}), path);
        io.save(new Image(new float[][]{{7f, 7f}, {7f, 7f}}), path);
        assertEquals(7f, io.load(path).get(0, 0));
    }

    @Test
    void appliesScaling(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("scaled.fits");
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(new short[][]{{1, 2}, {3, 4}});
            hdu.getHeader().addValue("BZERO", 100.0, "");
            hdu.getHeader().addValue("BSCALE", 2.0, "");
            fits.addHDU(hdu);
            fits.write(path.toFile());
        }
        Image loaded = io.load(path);
        assertEquals(102f, loaded.get(0, 0));
        assertEquals(108f, loaded.get(1, 1));
    }

    @Test
    void rejectsUnusableFiles(@TempDir Path dir) throws Exception {
        assertThrows(InputException.class, () -> io.load(dir.resolve("missing.fits")));

        Path text = dir.resolve("notes.fits");
        Files.writeString(text, "this is not a FITS file");
        assertThrows(InputException.class, () -> io.load(text));

        Path vector = dir.resolve("vector.fits");
        try (Fits fits = new Fits()) {
            fits.addHDU(Fits.makeHDU(new float[]{1f, 2f, 3f}));
            fits.write(vector.toFile());
        }
        assertThrows(InputException.class, () -> io.load(vector));
    }
}
