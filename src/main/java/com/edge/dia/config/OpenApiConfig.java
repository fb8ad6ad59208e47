package com.edge.dia.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI edgeDiaOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge DIA System API")
                        .description("""
                                差异图像分析 (Difference Image Analysis) 系统 API 文档

                                ## 功能概述

                                对同一天区两个时刻拍摄的 FITS 图像进行配准与相减，提取暂现源候选并评分。

                                ### 处理流程
                                1. **配准**：恒星三角形匹配或 ORB 特征匹配，RANSAC 稳健估计刚体/相似/单应变换
                                2. **差异**：变换科学图像到参考网格后相减，按噪声阈值、连通域、形态学与平滑清理
                                3. **提取**：连通域分析得到候选及其形状、通量、信噪比
                                4. **评分**：规则门限加加权可靠性，策略可选
                                5. **输出**：标记 FITS、星表文本、JSON 运行报告

                                ### 评分策略
                                | 策略 | 说明 |
                                |------|------|
                                | `STATISTICAL` | 信噪比门限与特征加权 |
                                | `BAYESIAN_MIXTURE` | 残差双分量高斯混合后验 |
                                | `MULTI_SCALE` | 多尺度复检与 DBSCAN 聚类惩罚 |
                                | `CUTOUT_HEURISTIC` | 候选小图启发式真假判别 |

                                ### API 响应格式
                                所有接口返回统一的 JSON 格式：
                                ```json
                                {
                                  "status": "success | error | warning",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Edge DIA Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口添加统一的响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getGet() != null) {
                pathItem.getGet().getResponses().addApiResponse("200", envelope("成功", "success"));
            }
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("200", envelope("成功", "success"));
                pathItem.getPost().getResponses().addApiResponse("400", envelope("请求错误", "error"));
            }
            if (pathItem.getPut() != null) {
                pathItem.getPut().getResponses().addApiResponse("400", envelope("参数非法", "error"));
            }
        });
    }

    private ApiResponse envelope(String description, String status) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error/warning").example(status),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）")
        ));

        return new ApiResponse()
                .description(description)
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
