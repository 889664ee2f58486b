package com.flowpascal.playground.translator.semantic;

public class Symbol {

    private final String name;
    private BaseType baseType;
    private boolean array;
    private ArrayBounds bounds;
    private boolean declared;
    private int line;
    private int pos;

    Symbol(String name, BaseType baseType, boolean array, ArrayBounds bounds, boolean declared, int line, int pos) {
        this.name = name;
        this.baseType = baseType;
        this.array = array;
        this.bounds = bounds;
        this.declared = declared;
        this.line = line;
        this.pos = pos;
    }

    public String getName() {
        return name;
    }

    public BaseType getBaseType() {
        return baseType;
    }

    public boolean isArray() {
        return array;
    }

    public ArrayBounds getBounds() {
        return bounds;
    }

    public boolean isDeclared() {
        return declared;
    }

    public int getLine() {
        return line;
    }

    public int getPos() {
        return pos;
    }

    public String getType() {
        if (array) {
            return "array[" + bounds.low() + ".." + bounds.high() + "] of " + baseType.pascalName();
        }
        return baseType.pascalName();
    }

    void widenTo(BaseType type) {
        if (type == BaseType.REAL && baseType == BaseType.INTEGER) {
            baseType = BaseType.REAL;
        }
    }

    void markArray(ArrayBounds newBounds) {
        array = true;
        if (newBounds != null) {
            bounds = newBounds;
        }
    }

    void markDeclared() {
        declared = true;
    }

    void moveTo(int newLine, int newPos) {
        line = newLine;
        pos = newPos;
    }

    @Override
    public String toString() {
        return name + ": " + getType() + (declared ? "" : " (implicit)") + " @" + line + ":" + pos;
    }
}
