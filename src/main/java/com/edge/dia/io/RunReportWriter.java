package com.edge.dia.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 运行报告 JSON 读写
 */
public class RunReportWriter {

    private final ObjectMapper objectMapper;

    public RunReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(RunReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), report);
    }

    public RunReport read(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), RunReport.class);
    }

    public String toJson(RunReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }
}
