package com.flowpascal.playground.translator.pascal;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public final class ActionContentTest {

    @Test
    void inputListIsSplitAndTrimmed() {
        ActionContent content = ActionContent.classify("Ввод: a , b,,c");

        assertEquals(new ActionContent.Input(List.of("a", "b", "c")), content);
    }

    @Test
    void outputSplitKeepsCommasInsideQuotes() {
        ActionContent content = ActionContent.classify("Вывод: \"x, y\", z");

        assertEquals(new ActionContent.Output(List.of("\"x, y\"", "z")), content);
    }

    @Test
    void arrayAssignmentIsCheckedBeforeScalar() {
        ActionContent content = ActionContent.classify("a[i + 1] := a[i] * 2");

        assertEquals(new ActionContent.ArrayAssignment("a", "i + 1", "a[i] * 2"), content);
    }

    @Test
    void plainEqualsIsAcceptedAsAssignment() {
        assertEquals(new ActionContent.ScalarAssignment("s", "0"), ActionContent.classify("s = 0"));
    }

    @Test
    void anythingElseIsInvalid() {
        assertInstanceOf(ActionContent.Invalid.class, ActionContent.classify("???"));
        assertInstanceOf(ActionContent.Invalid.class, ActionContent.classify("print x"));
    }
}
