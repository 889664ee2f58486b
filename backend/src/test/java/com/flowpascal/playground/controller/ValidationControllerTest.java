package com.flowpascal.playground.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public final class ValidationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void returnsLexemeTable() throws Exception {
        mockMvc.perform(post("/api/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(TranslateControllerTest.body("@startuml\\nstart\\n:Ввод: x;\\nstop\\n@enduml")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("Validation completed"))
            .andExpect(jsonPath("$.tokens", hasSize(7)))
            .andExpect(jsonPath("$.tokens[0].tokenClass").value("KEYWORD"))
            .andExpect(jsonPath("$.tokens[0].classCode").value(1))
            .andExpect(jsonPath("$.tokens[3].tokenClass").value("ACTION_CONTENT"))
            .andExpect(jsonPath("$.tokens[3].text").value("Ввод: x"))
            .andExpect(jsonPath("$.tokens[3].line").value(3))
            .andExpect(jsonPath("$.tokens[3].pos").value(2));
    }

    @Test
    void errorsAreStillOk() throws Exception {
        mockMvc.perform(post("/api/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(TranslateControllerTest.body("@startuml\\nstart\\nfoo\\nstop\\n@enduml")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message").value("Errors found"))
            .andExpect(jsonPath("$.errors[0].source").value("lexer"));
    }

    @Test
    void missingSourceIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0].source").value("request"));
    }
}
