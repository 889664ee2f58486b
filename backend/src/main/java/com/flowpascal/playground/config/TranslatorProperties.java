package com.flowpascal.playground.config;

import com.flowpascal.playground.translator.semantic.ArrayBounds;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

@ConfigurationProperties(prefix = "translator")
@Validated
public record TranslatorProperties(
    @NotBlank
    String programName,

    @NotNull
    String indentUnit,

    @Positive
    Integer maxSourceCodeLength,

    @NotNull
    Integer arrayLowBound,

    @NotNull
    Integer arrayHighBound,

    boolean includeAstDump,

    @NotEmpty
    List<String> allowedOrigins
) {

    @ConstructorBinding
    public TranslatorProperties(
            @DefaultValue("Generated") String programName,
            @DefaultValue("    ") String indentUnit,
            @DefaultValue("10000") Integer maxSourceCodeLength,
            @DefaultValue("0") Integer arrayLowBound,
            @DefaultValue("100") Integer arrayHighBound,
            @DefaultValue("true") boolean includeAstDump,
            @DefaultValue("*") List<String> allowedOrigins) {
        this.programName = programName;
        this.indentUnit = indentUnit;
        this.maxSourceCodeLength = maxSourceCodeLength;
        this.arrayLowBound = arrayLowBound;
        this.arrayHighBound = arrayHighBound;
        this.includeAstDump = includeAstDump;
        this.allowedOrigins = allowedOrigins;
    }

    public TranslatorProperties() {
        this(
            "Generated",
            "    ",
            10000,
            0,
            100,
            true,
            List.of("*")
        );
    }

    public ArrayBounds arrayBounds() {
        return new ArrayBounds(arrayLowBound, arrayHighBound);
    }
}
