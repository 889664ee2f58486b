package com.flowpascal.playground.controller;

import com.flowpascal.playground.dto.TranslateRequest;
import com.flowpascal.playground.dto.TranslateResponse;
import com.flowpascal.playground.service.DiagramTranslationService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class TranslateController {

    private static final Logger logger = LoggerFactory.getLogger(TranslateController.class);

    private final DiagramTranslationService translationService;

    public TranslateController(DiagramTranslationService translationService) {
        this.translationService = translationService;
    }

    @PostMapping("/translate")
    public ResponseEntity<TranslateResponse> translate(@Valid @RequestBody TranslateRequest request) {
        logger.info("Received translation request (length: {} chars)",
                   request.sourceCode() != null ? request.sourceCode().length() : 0);

        try {
            TranslateResponse response = translationService.translate(request.sanitizedSourceCode());

            logger.info("Translation completed - Success: {}, Type: {}",
                       response.success(), response.resultType());

            if (!response.reachedGeneration()) {
                return ResponseEntity.badRequest().body(response);
            }
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during translation: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(TranslateResponse.requestError(RequestErrors.internal(e)));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("FlowPascal Playground Backend is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<TranslateResponse> handleValidationException(MethodArgumentNotValidException e) {
        TranslateResponse response = TranslateResponse.requestError(RequestErrors.invalidArguments(e));
        logger.warn("{}", response.errors().get(0).message());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<TranslateResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable translation request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(TranslateResponse.requestError(RequestErrors.unreadableBody()));
    }
}
