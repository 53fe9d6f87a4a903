package com.corvid.ir.vtable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个尚未定位的 vtable 槽位：每个具体类在此槽位上必须暴露的值。
 *
 * <p>entries 按类名排序、类名唯一。相等性只看 entries，名字仅用于诊断。</p>
 */
public final class VTableRequest {

    private final List<VTableEntry> entries;
    private final String name;
    private final int id;

    VTableRequest(List<VTableEntry> entries, String name, int id) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.name = name;
        this.id = id;
    }

    public List<VTableEntry> getEntries() { return entries; }
    public String getName() { return name; }
    public int getId() { return id; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VTableRequest)) return false;
        return entries.equals(((VTableRequest) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "request#" + id + " " + name;
    }
}
