package com.flowpascal.playground.translator;

import com.flowpascal.playground.translator.ast.Node;
import com.flowpascal.playground.translator.codegen.PascalCodeGenerator;
import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.lexer.DiagramScanner;
import com.flowpascal.playground.translator.lexer.ScanResult;
import com.flowpascal.playground.translator.parser.DiagramParser;
import com.flowpascal.playground.translator.parser.ParseResult;
import com.flowpascal.playground.translator.semantic.ArrayBounds;
import com.flowpascal.playground.translator.semantic.SemanticAnalyzer;
import com.flowpascal.playground.translator.semantic.SemanticResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class TranslationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(TranslationPipeline.class);

    private final String programName;
    private final String indentUnit;
    private final ArrayBounds defaultBounds;

    public TranslationPipeline() {
        this(PascalCodeGenerator.DEFAULT_PROGRAM_NAME, PascalCodeGenerator.DEFAULT_INDENT_UNIT, ArrayBounds.DEFAULT);
    }

    public TranslationPipeline(String programName, String indentUnit, ArrayBounds defaultBounds) {
        this.programName = programName;
        this.indentUnit = indentUnit;
        this.defaultBounds = defaultBounds;
    }

    public TranslationResult translate(String source) {
        return run(source, true);
    }

    public TranslationResult validate(String source) {
        return run(source, false);
    }

    private TranslationResult run(String source, boolean generate) {
        ScanResult scan = new DiagramScanner(source).scan();
        if (!scan.success()) {
            logger.debug("Scanning failed with {} errors", scan.diagnostics().size());
            return stopped(scan.diagnostics(), List.of(), scan, null, null);
        }

        ParseResult parse = new DiagramParser(scan.tokens()).parse();
        if (!parse.success()) {
            logger.debug("Parsing failed with {} errors", parse.diagnostics().size());
            return stopped(parse.diagnostics(), List.of(), scan, parse.root(), null);
        }

        SemanticResult semantic = new SemanticAnalyzer(defaultBounds).analyze(parse.root());
        if (!semantic.success() || !generate) {
            return stopped(semantic.errors(), semantic.warnings(), scan, parse.root(), semantic);
        }

        PascalCodeGenerator generator = new PascalCodeGenerator(parse.root(), semantic.symbolTable(),
                programName, indentUnit);
        String code = generator.generate();

        return new TranslationResult(
                code,
                true,
                generator.getDiagnostics(),
                semantic.warnings(),
                scan.tokens(),
                parse.root(),
                semantic.symbolTable());
    }

    private static TranslationResult stopped(List<Diagnostic> errors, List<Diagnostic> warnings, ScanResult scan,
            Node ast, SemanticResult semantic) {
        return new TranslationResult(
                "",
                false,
                List.copyOf(errors),
                List.copyOf(warnings),
                scan.tokens(),
                ast,
                semantic != null ? semantic.symbolTable() : null);
    }
}
