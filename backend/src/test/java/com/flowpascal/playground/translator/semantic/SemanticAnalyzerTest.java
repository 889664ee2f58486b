package com.flowpascal.playground.translator.semantic;

import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.diagnostic.DiagnosticSource;
import com.flowpascal.playground.translator.lexer.DiagramScanner;
import com.flowpascal.playground.translator.lexer.ScanResult;
import com.flowpascal.playground.translator.parser.DiagramParser;
import com.flowpascal.playground.translator.parser.ParseResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public final class SemanticAnalyzerTest {

    @Test
    void inputDeclaresIntegers() {
        SemanticResult result = analyze(":Ввод: x, y;\n");

        assertTrue(result.success());
        assertTrue(result.warnings().isEmpty());
        Symbol x = result.symbolTable().lookup("x").orElseThrow();
        assertEquals(BaseType.INTEGER, x.getBaseType());
        assertTrue(x.isDeclared());
        assertEquals(3, x.getLine());
        assertEquals(List.of("x", "y"), names(result));
    }

    @Test
    void divisionWidensToReal() {
        SemanticResult result = analyze(":Ввод: x;\n:y := x / 2;\n");

        assertTrue(result.success());
        assertEquals(BaseType.REAL, result.symbolTable().lookup("y").orElseThrow().getBaseType());
    }

    @Test
    void typeOnlyWidensFromIntegerToReal() {
        SemanticResult widened = analyze(":a := 1;\n:a := 2.5;\n");
        SemanticResult kept = analyze(":a := 2.5;\n:a := 1;\n");

        assertEquals(BaseType.REAL, widened.symbolTable().lookup("a").orElseThrow().getBaseType());
        assertEquals(BaseType.REAL, kept.symbolTable().lookup("a").orElseThrow().getBaseType());
    }

    @Test
    void outputBeforeDeclarationWarnsOnce() {
        SemanticResult result = analyze(":Вывод: y;\n:y := 1;\n");

        assertTrue(result.success());
        assertEquals(1, result.warnings().size());
        Diagnostic warning = result.warnings().get(0);
        assertEquals(DiagnosticSource.SEMANTIC, warning.source());
        assertFalse(warning.isError());
        assertEquals("Variable 'y' is used in output before it is declared", warning.message());
        assertTrue(result.symbolTable().lookup("y").orElseThrow().isDeclared());
    }

    @Test
    void expressionOperandBeforeDeclarationWarns() {
        SemanticResult result = analyze(":z := w + 1;\n");

        assertEquals(1, result.warnings().size());
        assertEquals("Variable 'w' is used in an expression before it is declared",
            result.warnings().get(0).message());
        assertFalse(result.symbolTable().lookup("w").orElseThrow().isDeclared());
    }

    @Test
    void selfReferenceAndBuiltinsDoNotWarn() {
        SemanticResult result = analyze(":Ввод: x;\n:x := x + 1;\n:y := abs(x);\n");

        assertTrue(result.warnings().isEmpty(), () -> result.warnings().toString());
    }

    @Test
    void invalidActionIsTheOnlyError() {
        SemanticResult result = analyze(":???;\n");

        assertFalse(result.success());
        assertEquals(1, result.errors().size());
        Diagnostic error = result.errors().get(0);
        assertEquals(DiagnosticSource.SEMANTIC, error.source());
        assertTrue(error.message().startsWith("Invalid block content: '???'"));
        assertEquals(3, error.line());
    }

    @Test
    void invalidInputNameIsAnError() {
        SemanticResult result = analyze(":Ввод: 1x, ok;\n");

        assertEquals(1, result.errors().size());
        assertEquals("Invalid variable name in input: '1x'", result.errors().get(0).message());
        assertTrue(result.symbolTable().contains("ok"));
    }

    @Test
    void emptyOutputIsAWarning() {
        SemanticResult result = analyze(":Вывод:;\n");

        assertTrue(result.success());
        assertEquals("Empty output", result.warnings().get(0).message());
    }

    @Test
    void outputLiteralsAreNotSymbols() {
        SemanticResult result = analyze(":Вывод: \"Hello, world\", 'x';\n");

        assertTrue(result.warnings().isEmpty());
        assertEquals(0, result.symbolTable().size());
    }

    @Test
    void countingLoopDeclaresCounterAndReferencesBounds() {
        SemanticResult result = analyze("""
            while (i := 1 to n) is (yes)
              :Вывод: i;
            endwhile
            """);

        assertTrue(result.success());
        assertTrue(result.warnings().isEmpty(), () -> result.warnings().toString());
        assertTrue(result.symbolTable().lookup("i").orElseThrow().isDeclared());
        Symbol n = result.symbolTable().lookup("n").orElseThrow();
        assertFalse(n.isDeclared());
        assertEquals(BaseType.INTEGER, n.getBaseType());
    }

    @Test
    void unknownConditionVariableWarnsThenCountsAsDeclared() {
        SemanticResult result = analyze("""
            if (z > 0) then (yes)
              :Вывод: z;
            endif
            """);

        assertEquals(1, result.warnings().size());
        assertEquals("Variable 'z' is used in a condition before it is declared",
            result.warnings().get(0).message());
        assertTrue(result.symbolTable().lookup("z").orElseThrow().isDeclared());
    }

    @Test
    void arrayAssignmentDeclaresArrayWithElementType() {
        SemanticResult result = analyze(":Ввод: i;\n:a[i] := 1.5;\n");

        Symbol a = result.symbolTable().lookup("a").orElseThrow();
        assertTrue(a.isArray());
        assertEquals("array[0..100] of real", a.getType());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void configuredBoundsApplyToNewArrays() {
        SemanticResult result = analyze(":a[1] := 2;\n", new ArrayBounds(1, 10));

        assertEquals("array[1..10] of integer", result.symbolTable().lookup("a").orElseThrow().getType());
    }

    static SemanticResult analyze(String body) {
        return analyze(body, ArrayBounds.DEFAULT);
    }

    static SemanticResult analyze(String body, ArrayBounds bounds) {
        ScanResult scan = new DiagramScanner("@startuml\nstart\n" + body + "stop\n@enduml\n").scan();
        assertTrue(scan.success(), () -> scan.diagnostics().toString());
        ParseResult parse = new DiagramParser(scan.tokens()).parse();
        assertTrue(parse.success(), () -> parse.diagnostics().toString());
        return new SemanticAnalyzer(bounds).analyze(parse.root());
    }

    private static List<String> names(SemanticResult result) {
        return result.symbolTable().getAllSymbols().stream().map(Symbol::getName).toList();
    }
}
