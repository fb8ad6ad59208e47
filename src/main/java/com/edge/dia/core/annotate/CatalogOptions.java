package com.edge.dia.core.annotate;

import com.edge.dia.exception.ConfigurationException;
import lombok.Data;

/**
 * 星表输出参数
 */
@Data
public class CatalogOptions {

    private Delimiter delimiter = Delimiter.WHITESPACE;

    /** 浮点列小数位数 */
    private int precision = 3;

    public enum Delimiter {
        COMMA,
        WHITESPACE
    }

    public void validate() {
        if (delimiter == null) {
            throw new ConfigurationException("catalog.delimiter must be set");
        }
        if (precision < 0 || precision > 10) {
            throw new ConfigurationException("catalog.precision must be in [0, 10]: " + precision);
        }
    }
}
