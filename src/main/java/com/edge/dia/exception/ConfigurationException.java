package com.edge.dia.exception;

/**
 * 配置错误
 * <p>
 * 参数越界（如 minRadius > maxRadius、权重无法归一化），在处理开始前检测并拒绝
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
