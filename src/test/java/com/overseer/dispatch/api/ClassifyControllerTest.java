package com.overseer.dispatch.api;

import com.overseer.core.classifier.ClassificationRules;
import com.overseer.core.classifier.RequestClassifier;
import com.overseer.core.risk.RiskClassifier;
import com.overseer.core.risk.RiskRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ClassifyController.class)
@Import(ClassifyControllerTest.Rules.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ClassifyControllerTest {

    @TestConfiguration
    static class Rules {
        @Bean
        RequestClassifier requestClassifier() {
            return new RequestClassifier(ClassificationRules.defaults(), new RiskClassifier(RiskRules.defaults()));
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("A trivial request classifies as DIRECT at T0")
    void trivialRequest() throws Exception {
        mockMvc.perform(post("/api/v1/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"request\": \"fix typo in README\", \"file_hints\": [\"README.md\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.workflow_class").value("DIRECT"))
                .andExpect(jsonPath("$.tier").value("T0"))
                .andExpect(jsonPath("$.phases", contains("execute")))
                .andExpect(jsonPath("$.scores", aMapWithSize(8)))
                .andExpect(jsonPath("$.rule").value("simple-direct"))
                .andExpect(jsonPath("$.alternatives[0].workflow_class").value("STANDARD"))
                .andExpect(jsonPath("$.confidence", greaterThan(0.0)));
    }

    @Test
    @DisplayName("A blank request returns 400")
    void blankRequest() throws Exception {
        mockMvc.perform(post("/api/v1/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"request\": \"\"}"))
                .andExpect(status().isBadRequest());
    }
}
