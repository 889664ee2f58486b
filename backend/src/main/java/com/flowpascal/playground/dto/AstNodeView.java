package com.flowpascal.playground.dto;

import com.flowpascal.playground.translator.ast.Node;

import java.util.List;

public record AstNodeView(
    String type,
    String value,
    int line,
    int pos,
    List<AstNodeView> children
) {

    public static AstNodeView from(Node node) {
        return new AstNodeView(
                node.kind().label(),
                node.value(),
                node.line(),
                node.pos(),
                node.children().stream().map(AstNodeView::from).toList());
    }
}
