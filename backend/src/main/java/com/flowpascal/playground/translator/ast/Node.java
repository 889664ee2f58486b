package com.flowpascal.playground.translator.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class Node {

    private final NodeKind kind;
    private final String value;
    private final int line;
    private final int pos;
    private final List<Node> children = new ArrayList<>();

    public Node(NodeKind kind, String value, int line, int pos) {
        this.kind = kind;
        this.value = value;
        this.line = line;
        this.pos = pos;
    }

    public Node(NodeKind kind, int line, int pos) {
        this(kind, null, line, pos);
    }

    // null is ignored so partial parses can be linked unconditionally
    public void addChild(Node child) {
        if (child != null) {
            children.add(child);
        }
    }

    public NodeKind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    public int line() {
        return line;
    }

    public int pos() {
        return pos;
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<Node> firstChild(NodeKind childKind) {
        return children.stream().filter(child -> child.kind == childKind).findFirst();
    }

    public List<Node> childrenOf(NodeKind childKind) {
        return children.stream().filter(child -> child.kind == childKind).toList();
    }

    public String toTreeString() {
        StringBuilder out = new StringBuilder();
        render(out, "", true, true);
        return out.toString();
    }

    private void render(StringBuilder out, String indent, boolean last, boolean root) {
        out.append(indent);
        if (!root) {
            out.append(last ? "└── " : "├── ");
        }
        out.append(kind.label());
        if (value != null) {
            out.append(": ").append(value);
        }
        if (line > 0) {
            out.append(" (line: ").append(line).append(", pos: ").append(pos).append(')');
        }
        out.append('\n');

        String childIndent = root ? indent : indent + (last ? "    " : "│   ");
        for (int i = 0; i < children.size(); i++) {
            children.get(i).render(out, childIndent, i == children.size() - 1, false);
        }
    }

    @Override
    public String toString() {
        return kind.label() + (value != null ? "(" + value + ")" : "") + children;
    }
}
