package com.edge.dia.exception;

/**
 * 输入错误
 * <p>
 * 图像为空、非二维数组、文件无法读取等情况，立即抛出，不做重试
 */
public class InputException extends IllegalArgumentException {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
