package com.flowpascal.playground.service;

import com.flowpascal.playground.config.TranslatorProperties;
import com.flowpascal.playground.exception.TranslationException;

import org.springframework.stereotype.Component;

@Component
public class SourceGuard {

    private final TranslatorProperties properties;

    public SourceGuard(TranslatorProperties properties) {
        this.properties = properties;
    }

    public String check(String sourceCode) throws TranslationException {
        if (sourceCode == null || sourceCode.trim().isEmpty()) {
            throw new TranslationException("Diagram source was not provided");
        }

        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            throw new TranslationException(
                "Diagram source exceeds maximum length of " + properties.maxSourceCodeLength() + " characters"
            );
        }
        return sourceCode;
    }
}
