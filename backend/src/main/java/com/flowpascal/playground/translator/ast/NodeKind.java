package com.flowpascal.playground.translator.ast;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeKind {
    PROGRAM("program"),
    STARTUML("startuml_keyword"),
    START("start_node"),
    STOP("stop_node"),
    ENDUML("enduml_keyword"),
    ACTION("action_node"),
    ACTION_CONTENT("action_content"),
    IF("if_statement"),
    THEN_BRANCH("then_branch"),
    ELSE_BRANCH("else_branch"),
    BRANCH_LABEL("branch_label"),
    ELSE_BRANCH_LABEL("else_branch_label"),
    WHILE_LOOP("while_loop_node"),
    WHILE_BODY("while_body"),
    REPEAT_UNTIL_LOOP("repeat_until_loop_node"),
    REPEAT_BODY("repeat_body"),
    REPEAT_UNTIL_BRANCH_LABEL("repeat_until_branch_label"),
    CONDITION_CONTENT("condition_content");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
