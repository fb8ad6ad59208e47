package com.edge.dia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 差异图像分析服务
 *
 * <p>对同一天区不同时间拍摄的两幅 FITS 图像做配准、相减，提取并评估暂现源候选。
 *
 * @see com.edge.dia.core.pipeline.DiaPipeline
 * @see com.edge.dia.service.DiaService
 */
@SpringBootApplication
public class EdgeDiaApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeDiaApplication.class, args);
    }
}
