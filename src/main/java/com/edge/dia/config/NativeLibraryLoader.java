package com.edge.dia.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV JNI 库，库文件由 openpnp 从 jar 中解压
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    /**
     * 预加载 OpenCV native 库
     * 必须在任何使用 OpenCV 的代码之前调用，重复调用无副作用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }
        logger.info("Loading OpenCV via openpnp...");
        nu.pattern.OpenCV.loadLocally();
        logger.info("OpenCV loaded successfully via openpnp");
        loaded = true;
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}
