package com.flowpascal.playground.service;

import com.flowpascal.playground.config.TranslatorProperties;
import com.flowpascal.playground.dto.AstNodeView;
import com.flowpascal.playground.dto.SymbolInfo;
import com.flowpascal.playground.dto.TranslateResponse;
import com.flowpascal.playground.exception.TranslationException;
import com.flowpascal.playground.translator.TranslationPipeline;
import com.flowpascal.playground.translator.TranslationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class DiagramTranslationService {

    private static final Logger logger = LoggerFactory.getLogger(DiagramTranslationService.class);

    private final TranslatorProperties properties;
    private final SourceGuard sourceGuard;
    private final TranslationPipeline pipeline;

    public DiagramTranslationService(TranslatorProperties properties, SourceGuard sourceGuard) {
        this.properties = properties;
        this.sourceGuard = sourceGuard;
        this.pipeline = new TranslationPipeline(
                properties.programName(),
                properties.indentUnit(),
                properties.arrayBounds());
    }

    public TranslateResponse translate(String sourceCode) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        long startTime = System.currentTimeMillis();

        try {
            String source = sourceGuard.check(sourceCode);
            logger.debug("Run {} source:\n{}", runId, source);

            TranslationResult result = pipeline.translate(source);
            long translationTime = System.currentTimeMillis() - startTime;

            if (!result.generated()) {
                logger.info("Run {} stopped before code generation: {} errors, {} warnings",
                           runId, result.errors().size(), result.warnings().size());
                result.errors().forEach(error -> logger.debug("Run {} - {}", runId, error));
                return TranslateResponse.stageFailure(result.errors(), result.warnings(), translationTime);
            }

            List<SymbolInfo> symbols = result.symbolTable().getAllSymbols().stream()
                    .map(SymbolInfo::from)
                    .toList();

            String astDebug = null;
            AstNodeView ast = null;
            if (properties.includeAstDump()) {
                astDebug = result.ast().toTreeString();
                ast = AstNodeView.from(result.ast());
            }

            if (!result.success()) {
                logger.warn("Run {} generated code with {} errors", runId, result.errors().size());
            }
            logger.info("Run {} translated in {}ms ({} symbols, {} warnings)",
                       runId, translationTime, symbols.size(), result.warnings().size());

            return TranslateResponse.generated(
                    result.code(),
                    result.errors(),
                    result.warnings(),
                    symbols,
                    astDebug,
                    ast,
                    translationTime);

        } catch (TranslationException e) {
            logger.warn("Run {} rejected: {}", runId, e.getMessage());
            return TranslateResponse.requestError(e.toDiagnostic());
        }
    }
}
