package com.vcsight.ingestor.api;

import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.service.FileValidationService;
import com.vcsight.ingestor.service.FileValidationService.FileValidation;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FileController.class)
class FileControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean FileValidationService validationService;

    @Test
    void validate_returnsDryRunReport() throws Exception {
        when(validationService.validate(Path.of("/in/vms.json"))).thenReturn(new FileValidation(
                "/in/vms.json", true, true, 120, true, true, 3, 1,
                new EnvironmentTag("development", "internal", "unknown"), null));

        mockMvc.perform(post("/api/files/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filePath\":\"/in/vms.json\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.vmCount").value(3))
                .andExpect(jsonPath("$.environment.environment").value("development"));
    }

    @Test
    void validate_missingPath_returns400() throws Exception {
        mockMvc.perform(post("/api/files/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }
}
