package com.corvid.ir.vtable;

import com.corvid.ir.mir.ConstValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * vtable 填充结果：请求 → 字节偏移，类 → vtable 内容。
 */
public final class VTableLayout {

    /** 每个槽位占用的字节数 */
    public static final int SLOT_BYTES = 8;

    private final Map<Integer, Long> offsets = new LinkedHashMap<>();
    private final Map<String, VTable> vtables = new LinkedHashMap<>();

    public void assign(VTableRequest request, long offset) {
        offsets.put(request.getId(), offset);
        for (VTableEntry entry : request.getEntries()) {
            vtableOf(entry.getClassName()).slots.put(offset, entry.getValue());
        }
    }

    public VTable vtableOf(String className) {
        return vtables.computeIfAbsent(className, VTable::new);
    }

    /**
     * 请求被分配到的字节偏移。
     *
     * @throws IllegalArgumentException 请求未被分配
     */
    public long getOffset(int requestId) {
        Long offset = offsets.get(requestId);
        if (offset == null) {
            throw new IllegalArgumentException("vtable request #" + requestId + " has no assigned offset");
        }
        return offset;
    }

    public VTable getVTable(String className) {
        return vtables.get(className);
    }

    public Map<String, VTable> getVTables() {
        return Collections.unmodifiableMap(vtables);
    }

    public int getRequestCount() {
        return offsets.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (VTable vtable : vtables.values()) {
            sb.append(vtable).append('\n');
        }
        return sb.toString();
    }

    /**
     * 一个类的 vtable。
     */
    public static final class VTable {
        private final String className;
        private final SortedMap<Long, ConstValue> slots = new TreeMap<>();

        VTable(String className) {
            this.className = className;
        }

        public String getClassName() { return className; }
        public SortedMap<Long, ConstValue> getSlots() { return Collections.unmodifiableSortedMap(slots); }

        public boolean isOccupied(long offset) {
            return slots.containsKey(offset);
        }

        /** vtable 字节数（最后一个槽位之后） */
        public long getByteSize() {
            return slots.isEmpty() ? 0 : slots.lastKey() + SLOT_BYTES;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("vtable ").append(className).append(" {");
            for (Map.Entry<Long, ConstValue> e : slots.entrySet()) {
                sb.append(' ').append(e.getKey()).append(": ").append(e.getValue()).append(';');
            }
            return sb.append(" }").toString();
        }
    }
}
