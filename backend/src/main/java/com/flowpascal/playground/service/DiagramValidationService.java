package com.flowpascal.playground.service;

import com.flowpascal.playground.config.TranslatorProperties;
import com.flowpascal.playground.dto.DiagramToken;
import com.flowpascal.playground.dto.ValidateResponse;
import com.flowpascal.playground.exception.TranslationException;
import com.flowpascal.playground.translator.TranslationPipeline;
import com.flowpascal.playground.translator.TranslationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DiagramValidationService {

    private static final Logger logger = LoggerFactory.getLogger(DiagramValidationService.class);

    private final SourceGuard sourceGuard;
    private final TranslationPipeline pipeline;

    public DiagramValidationService(TranslatorProperties properties, SourceGuard sourceGuard) {
        this.sourceGuard = sourceGuard;
        this.pipeline = new TranslationPipeline(
                properties.programName(),
                properties.indentUnit(),
                properties.arrayBounds());
    }

    public ValidateResponse validate(String sourceCode) {
        long startTime = System.currentTimeMillis();

        try {
            String source = sourceGuard.check(sourceCode);
            logger.info("=== Starting validation for {} characters ===", source.length());

            TranslationResult result = pipeline.validate(source);
            List<DiagramToken> tokens = result.tokens().stream()
                    .map(DiagramToken::from)
                    .toList();

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.info("=== Validation completed in {}ms: {} tokens, {} errors, {} warnings ===",
                    analysisTime, tokens.size(), result.errors().size(), result.warnings().size());

            return ValidateResponse.of(result.errors(), result.warnings(), tokens, analysisTime);

        } catch (TranslationException e) {
            logger.warn("Validation request rejected: {}", e.getMessage());
            return ValidateResponse.requestError(e.toDiagnostic());
        }
    }
}
