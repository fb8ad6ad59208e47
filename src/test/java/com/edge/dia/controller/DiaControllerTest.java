package com.edge.dia.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DiaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void returnsCurrentConfiguration() throws Exception {
        mockMvc.perform(get("/api/dia/config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.data.scoring.strategy").value("STATISTICAL"))
            .andExpect(jsonPath("$.data.annotation.maxRadius").value(20));
    }

    @Test
    void unreadableInputIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/dia/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"referencePath\":\"/nonexistent/ref.fits\",\"sciencePath\":\"/nonexistent/sci.fits\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.data.failureReason").value("INPUT_ERROR"));
    }

    @Test
    void invalidConfigUpdateIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/dia/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"minRadius\":30,\"maxRadius\":10}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void emptyBatchIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/dia/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());
    }
}
