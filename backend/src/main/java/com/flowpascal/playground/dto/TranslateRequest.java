package com.flowpascal.playground.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TranslateRequest(
    @NotBlank(message = "Diagram source cannot be blank")
    @Size(max = 10000, message = "Diagram source cannot exceed 10,000 characters")
    @JsonAlias("plantuml")
    String sourceCode
) {

    public String sanitizedSourceCode() {
        if (sourceCode == null) {
            return "";
        }

        return sourceCode
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
