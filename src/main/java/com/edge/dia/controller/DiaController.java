package com.edge.dia.controller;

import com.edge.dia.core.pipeline.FailureReason;
import com.edge.dia.dto.BatchRequest;
import com.edge.dia.dto.BatchResponse;
import com.edge.dia.dto.ConfigUpdateRequest;
import com.edge.dia.dto.ProcessRequest;
import com.edge.dia.exception.ConfigurationException;
import com.edge.dia.exception.InputException;
import com.edge.dia.io.RunReport;
import com.edge.dia.service.BatchDiaService;
import com.edge.dia.service.DiaService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 差异图像分析控制器
 */
@RestController
@RequestMapping("/api/dia")
@Tag(name = "差异图像分析", description = "图像对处理、批量处理与参数管理")
public class DiaController {

    private static final Logger logger = LoggerFactory.getLogger(DiaController.class);

    @Autowired
    private DiaService diaService;

    @Autowired
    private BatchDiaService batchDiaService;

    /**
     * 处理一对图像
     */
    @PostMapping("/process")
    @Operation(
            summary = "处理一对 FITS 图像",
            description = """
                    读取参考图像与科学图像，配准、相减、提取并评分候选，输出文件写到输出目录。

                    **请求示例**：
                    ```json
                    {
                      "referencePath": "/data/ref/M31.fits",
                      "sciencePath": "/data/sci/M31.fits"
                    }
                    ```
                    只提供 `differencePath` 时跳过配准，直接处理已有的差异图。

                    配准失败且未启用恒等回退时返回 `warning`，报告中 `failureReason` 为 `ALIGNMENT_FAILED`。
                    """
    )
    public ResponseEntity<Map<String, Object>> process(@RequestBody ProcessRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            RunReport report = diaService.process(request);
            response.put("data", report);
            if (report.isSuccess()) {
                response.put("status", "success");
                return ResponseEntity.ok(response);
            }
            response.put("message", report.getMessage());
            if (FailureReason.INPUT_ERROR.name().equals(report.getFailureReason())) {
                response.put("status", "error");
                return ResponseEntity.badRequest().body(response);
            }
            if (FailureReason.ALIGNMENT_FAILED.name().equals(report.getFailureReason())) {
                response.put("status", "warning");
                return ResponseEntity.ok(response);
            }
            response.put("status", "error");
            return ResponseEntity.status(500).body(response);

        } catch (InputException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Failed to process image pair", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    /**
     * 批量处理
     */
    @PostMapping("/batch")
    @Operation(
            summary = "批量处理图像对",
            description = """
                    并行处理多个图像对。可在 `pairs` 中逐一列出，或提供 `referenceDirectory` 与
                    `scienceDirectory`，按同名 FITS 文件配对。单个图像对失败不影响其他图像对。
                    """
    )
    public ResponseEntity<Map<String, Object>> batch(@RequestBody BatchRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            BatchResponse result = batchDiaService.process(request);
            response.put("status", result.getFailed() == 0 ? "success" : "warning");
            response.put("data", result);
            if (result.getFailed() > 0) {
                response.put("message", result.getFailed() + " of " + result.getTotal() + " pairs failed");
            }
            return ResponseEntity.ok(response);

        } catch (InputException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Batch processing failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    /**
     * 获取当前参数
     */
    @GetMapping("/config")
    @Operation(summary = "获取当前参数", description = "返回配准、差异、提取、评分、标记等全部参数组")
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", diaService.currentConfig());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to get config", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    /**
     * 更新参数
     */
    @PutMapping("/config")
    @Operation(
            summary = "更新参数",
            description = """
                    只应用请求中非空的字段，校验通过后立即重建流水线，正在运行的任务不受影响。

                    **示例**：
                    ```json
                    { "scoringStrategy": "bayesian-mixture", "reliabilityCutoff": 60, "preset": "gentle" }
                    ```
                    """
    )
    public ResponseEntity<Map<String, Object>> updateConfig(@RequestBody ConfigUpdateRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            Map<String, Object> config = diaService.updateConfig(request);
            response.put("status", "success");
            response.put("message", "参数已更新");
            response.put("data", config);
            return ResponseEntity.ok(response);

        } catch (ConfigurationException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Failed to update config", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }
}
