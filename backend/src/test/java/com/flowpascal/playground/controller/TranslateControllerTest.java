package com.flowpascal.playground.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public final class TranslateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void translatesValidDiagram() throws Exception {
        mockMvc.perform(post("/api/translate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("@startuml\\nstart\\n:Ввод: x;\\n:Вывод: x;\\nstop\\n@enduml")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.resultType").value("success"))
            .andExpect(jsonPath("$.pascalCode", containsString("readln(x);")))
            .andExpect(jsonPath("$.errors", hasSize(0)))
            .andExpect(jsonPath("$.symbols[0].name").value("x"))
            .andExpect(jsonPath("$.symbols[0].type").value("integer"))
            .andExpect(jsonPath("$.ast.type").value("program"))
            .andExpect(jsonPath("$.astDebug", containsString("action_content: Ввод: x")));
    }

    @Test
    void acceptsPlantumlFieldAlias() throws Exception {
        mockMvc.perform(post("/api/translate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"plantuml\": \"@startuml\\nstart\\nstop\\n@enduml\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pascalCode", containsString("PROGRAM Generated;")));
    }

    @Test
    void semanticErrorIsBadRequestWithDiagnostic() throws Exception {
        mockMvc.perform(post("/api/translate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("@startuml\\nstart\\n:???;\\nstop\\n@enduml")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.pascalCode").value(""))
            .andExpect(jsonPath("$.resultType").value("semantic_error"))
            .andExpect(jsonPath("$.errors", hasSize(1)))
            .andExpect(jsonPath("$.errors[0].type").value("error"))
            .andExpect(jsonPath("$.errors[0].source").value("semantic"))
            .andExpect(jsonPath("$.errors[0].line").value(3))
            .andExpect(jsonPath("$.errors[0].pos").value(2))
            .andExpect(jsonPath("$.errors[0].error").doesNotExist());
    }

    @Test
    void parseErrorAtEndOfInputHasNoPosition() throws Exception {
        mockMvc.perform(post("/api/translate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("@startuml\\nstart")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0].source").value("parser"))
            .andExpect(jsonPath("$.errors[0].line").value(-1))
            .andExpect(jsonPath("$.errors[0].pos").value(-1));
    }

    @Test
    void blankSourceIsRejected() throws Exception {
        mockMvc.perform(post("/api/translate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("   ")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0].source").value("request"))
            .andExpect(jsonPath("$.errors[0].line").value(-1));
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mockMvc.perform(post("/api/translate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.resultType").value("request_error"));
    }

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("healthy")));
    }

    static String body(String escapedSource) {
        return "{\"sourceCode\": \"" + escapedSource + "\"}";
    }
}
