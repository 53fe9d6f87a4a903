package com.corvid.ir.mir;

/**
 * MIR 局部变量。索引同时是定义它的指令的标识，降级过程中不会改变。
 */
public final class MirLocal {

    /** 降级时由 {@link MirBuilder} 生成的临时变量名前缀 */
    public static final String TEMP_PREFIX = "$t";

    private final int index;
    private final String name;
    private final MirType type;

    public MirLocal(int index, String name, MirType type) {
        this.index = index;
        this.name = name;
        this.type = type;
    }

    public int getIndex() { return index; }
    public String getName() { return name; }
    public MirType getType() { return type; }

    public boolean isTemporary() {
        return name.startsWith(TEMP_PREFIX);
    }

    @Override
    public String toString() {
        return "%" + index + " " + name + ": " + type;
    }
}
