package com.edge.dia.io;

import com.edge.dia.core.model.Image;
import com.edge.dia.exception.InputException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * FITS 图像读写
 * <p>
 * 读取主 HDU：支持 BITPIX 8/16/32/64/-32/-64，应用 BZERO/BSCALE，三维数据取第一个平面。
 * 写出 32 位浮点图像，附带头部关键字与 HISTORY 记录。
 */
public class FitsImageIO {

    private static final Logger logger = LoggerFactory.getLogger(FitsImageIO.class);

    /** 由数据本身决定、写出时不从头部复制的关键字 */
    private static final Set<String> STRUCTURAL_KEYS = Set.of(
        "SIMPLE", "BITPIX", "NAXIS", "EXTEND", "BZERO", "BSCALE", "END",
        "XTENSION", "PCOUNT", "GCOUNT", "HISTORY", "COMMENT");

    private static final int MAX_STRING_VALUE = 68;

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eEdD][+-]?\\d+)?");

    public Image load(Path path) {
        if (path == null || !Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new InputException("FITS file is not readable: " + path);
        }
        try (Fits fits = new Fits(path.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new InputException("FITS file has no primary HDU: " + path);
            }
            Object kernel = hdu.getKernel();
            if (kernel == null) {
                throw new InputException("FITS primary HDU has no image data: " + path);
            }
            Map<String, String> header = readHeader(hdu.getHeader());
            Image image = Image.fromArray(kernel, header);

            double bzero = hdu.getBZero();
            double bscale = hdu.getBScale();
            if (bzero != 0.0 || bscale != 1.0) {
                float[][] pixels = image.toArray();
                for (float[] row : pixels) {
                    for (int x = 0; x < row.length; x++) {
                        row[x] = (float) (row[x] * bscale + bzero);
                    }
                }
                image = image.derive(pixels);
            }
            if (image.getRepairedPixels() > 0) {
                logger.warn("Replaced {} non-finite pixels in {}", image.getRepairedPixels(), path.getFileName());
            }
            logger.info("Loaded FITS {} ({}x{})", path.getFileName(), image.getWidth(), image.getHeight());
            return image;
        } catch (FitsException | IOException e) {
            throw new InputException("Unreadable FITS file " + path + ": " + e.getMessage(), e);
        }
    }

    public void save(Image image, Path path) throws IOException {
        save(image, path, Collections.emptyList());
    }

    /**
     * 写出 32 位浮点 FITS 文件，已存在的文件被覆盖
     *
     * @param history 追加为 HISTORY 卡片的处理记录
     */
    public void save(Image image, Path path, List<String> history) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.deleteIfExists(path);
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(image.toArray());
            Header header = hdu.getHeader();
            for (Map.Entry<String, String> e : image.getHeader().entrySet()) {
                if (isCopyable(e.getKey())) {
                    addCard(header, e.getKey(), e.getValue());
                }
            }
            for (String line : history) {
                header.insertHistory(truncate(line));
            }
            fits.addHDU(hdu);
            fits.write(path.toFile());
        } catch (FitsException e) {
            throw new IOException("Failed to write FITS file " + path + ": " + e.getMessage(), e);
        }
        logger.debug("Saved FITS {}", path);
    }

    private static Map<String, String> readHeader(Header header) {
        Map<String, String> map = new LinkedHashMap<>();
        Cursor<String, HeaderCard> cursor = header.iterator();
        while (cursor.hasNext()) {
            HeaderCard card = cursor.next();
            String key = card.getKey();
            if (key == null || key.isBlank() || card.getValue() == null) {
                continue;
            }
            map.put(key, card.getValue());
        }
        return map;
    }

    private static boolean isCopyable(String key) {
        if (key == null || key.isBlank() || key.length() > 8) {
            return false;
        }
        return !STRUCTURAL_KEYS.contains(key) && !key.startsWith("NAXIS");
    }

    private static void addCard(Header header, String key, String value) throws FitsException {
        String v = value.trim();
        if ("T".equals(v) || "F".equals(v)) {
            header.addValue(key, "T".equals(v), "");
        } else if (INTEGER.matcher(v).matches()) {
            header.addValue(key, Long.parseLong(v), "");
        } else if (DECIMAL.matcher(v).matches()) {
            header.addValue(key, Double.parseDouble(v.replace('D', 'E').replace('d', 'e')), "");
        } else {
            header.addValue(key, truncate(value), "");
        }
    }

    private static String truncate(String value) {
        return value.length() > MAX_STRING_VALUE ? value.substring(0, MAX_STRING_VALUE) : value;
    }
}
