package com.corvid.ir.mir;

/**
 * MIR 字段。
 */
public class MirField {

    private final String name;
    private final MirType type;

    public MirField(String name, MirType type) {
        this.name = name;
        this.type = type;
    }

    public String getName() { return name; }
    public MirType getType() { return type; }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
