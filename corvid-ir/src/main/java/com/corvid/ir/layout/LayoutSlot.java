package com.corvid.ir.layout;

import com.corvid.ir.mir.MirType;

/**
 * 一个字段的布局槽位：字段名、相对可见指针的位偏移、类型（决定位宽）。
 */
public final class LayoutSlot {

    private final String fieldName;
    private final long bitOffset;
    private final MirType type;

    public LayoutSlot(String fieldName, long bitOffset, MirType type) {
        this.fieldName = fieldName;
        this.bitOffset = bitOffset;
        this.type = type;
    }

    public String getFieldName() { return fieldName; }
    public long getBitOffset() { return bitOffset; }
    public MirType getType() { return type; }

    public long getBitSize() {
        return type.getBitSize();
    }

    /** 槽位之后第一个位 */
    public long getEndBit() {
        return bitOffset + type.getBitSize();
    }

    @Override
    public String toString() {
        return fieldName + "@" + bitOffset + ":" + type;
    }
}
