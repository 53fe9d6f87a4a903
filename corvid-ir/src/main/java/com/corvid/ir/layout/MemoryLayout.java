package com.corvid.ir.layout;

/**
 * 64 位目标上的对象/数组内存布局常量。偏移均相对于程序可见的指针。
 *
 * <pre>
 * 对象: [vtable:8][字段区]                    可见指针 = 分配起点 + 8
 * 数组: [count:4][hash:4][vtable:8][元素...]  可见指针 = 分配起点 + 16
 * </pre>
 */
public final class MemoryLayout {

    public static final int WORD_BITS = 64;
    public static final int VTABLE_POINTER_BYTES = 8;

    /** 对象头（vtable 指针）字节数 */
    public static final int OBJECT_HEADER_BYTES = VTABLE_POINTER_BYTES;
    /** 数组头字节数 */
    public static final int ARRAY_HEADER_BYTES = 4 + 4 + VTABLE_POINTER_BYTES;

    /** vtable 字相对可见指针的位偏移（对象与数组相同） */
    public static final long VTABLE_BIT_OFFSET = -64;
    public static final long ARRAY_COUNT_BIT_OFFSET = -128;
    public static final long ARRAY_HASH_BIT_OFFSET = -96;

    /** vtable 指针字中的冻结标志位；vtable 按 8 字节对齐，低 3 位空闲 */
    public static final long FROZEN_FLAG = 1L;
    public static final long FLAG_BITS = 7L;

    private MemoryLayout() {
    }

    public static long roundUpBits(long bits, long alignment) {
        return (bits + alignment - 1) / alignment * alignment;
    }

    public static long alignUp8(long bytes) {
        return (bytes + 7) & ~7L;
    }

    public static long alignDown8(long bytes) {
        return bytes & ~7L;
    }
}
