package com.flowpascal.playground.controller;

import com.flowpascal.playground.dto.TranslateRequest;
import com.flowpascal.playground.dto.ValidateResponse;
import com.flowpascal.playground.service.DiagramValidationService;

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
public class ValidationController {

    private static final Logger logger = LoggerFactory.getLogger(ValidationController.class);

    private final DiagramValidationService validationService;

    public ValidationController(DiagramValidationService validationService) {
        this.validationService = validationService;
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidateResponse> validate(@Valid @RequestBody TranslateRequest request) {
        try {
            logger.debug("Received validation request for {} characters", request.sourceCode().length());

            ValidateResponse response = validationService.validate(request.sanitizedSourceCode());

            logger.debug("Validation completed: success={}, errors={}",
                response.success(), response.errors().size());

            if (response.rejected()) {
                return ResponseEntity.badRequest().body(response);
            }
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during validation", e);
            return ResponseEntity.internalServerError()
                .body(ValidateResponse.requestError(RequestErrors.internal(e)));
        }
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidateResponse> handleValidationException(MethodArgumentNotValidException e) {
        ValidateResponse response = ValidateResponse.requestError(RequestErrors.invalidArguments(e));
        logger.warn("{}", response.errors().get(0).message());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidateResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable validation request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ValidateResponse.requestError(RequestErrors.unreadableBody()));
    }
}
