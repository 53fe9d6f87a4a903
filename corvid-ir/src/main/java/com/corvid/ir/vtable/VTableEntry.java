package com.corvid.ir.vtable;

import com.corvid.ir.mir.ConstValue;

/**
 * vtable 请求中的一项：某个类在该槽位上暴露的值。
 */
public final class VTableEntry {

    private final String className;
    private final ConstValue value;

    public VTableEntry(String className, ConstValue value) {
        this.className = className;
        this.value = value;
    }

    public String getClassName() { return className; }
    public ConstValue getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VTableEntry)) return false;
        VTableEntry e = (VTableEntry) o;
        return className.equals(e.className) && value.equals(e.value);
    }

    @Override
    public int hashCode() {
        return className.hashCode() * 31 + value.hashCode();
    }

    @Override
    public String toString() {
        return className + "=" + value;
    }
}
