package com.corvid.ir.mir;

/**
 * LOAD/STORE 的访存描述：相对基址的位偏移（可为负）、访问类型，以及是否可被后续 CSE 缓存。
 *
 * <p>位偏移不是 8 的倍数或类型不足一个字节时（bool 位域），后端负责读-改-写。</p>
 */
public final class MemoryAccess {

    private final long bitOffset;
    private final MirType type;
    private final boolean cacheable;

    public MemoryAccess(long bitOffset, MirType type, boolean cacheable) {
        this.bitOffset = bitOffset;
        this.type = type;
        this.cacheable = cacheable;
    }

    public long getBitOffset() { return bitOffset; }
    public MirType getType() { return type; }

    /** 该位置在对象生命周期内不变，重复读取可合并 */
    public boolean isCacheable() { return cacheable; }

    public boolean isByteAligned() {
        return bitOffset % 8 == 0 && type.getBitSize() % 8 == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type);
        if (bitOffset % 8 == 0) {
            sb.append(" @").append(bitOffset / 8);
        } else {
            sb.append(" @bit").append(bitOffset);
        }
        if (cacheable) sb.append(" cacheable");
        return sb.toString();
    }
}
