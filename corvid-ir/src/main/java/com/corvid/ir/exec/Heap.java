package com.corvid.ir.exec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 字节寻址的小端堆，位粒度读写。
 *
 * <p>分配按 8 字节对齐；不清零的分配填充 {@link #GARBAGE}，任何未写入的位都会暴露出来。
 * 地址 0 到 {@link #BASE} 之间保留（空指针附近的访问直接报错）。</p>
 */
public class Heap {

    public static final byte GARBAGE = (byte) 0xA5;
    public static final long BASE = 16;

    private byte[] memory = new byte[4096];
    private long top = BASE;
    private final List<StoreRecord> stores = new ArrayList<>();

    /**
     * @return 分配起始地址
     */
    public long allocate(long bytes, boolean zeroFill) {
        if (bytes < 0) {
            throw new IllegalStateException("negative allocation size " + bytes);
        }
        long start = (top + 7) & ~7L;
        long end = start + ((bytes + 7) & ~7L);
        ensureCapacity(end);
        Arrays.fill(memory, (int) start, (int) end, zeroFill ? 0 : GARBAGE);
        top = end;
        return start;
    }

    public long read(long address, long bitOffset, int bitSize) {
        long bit = address * 8 + bitOffset;
        check(bit, bitSize);
        long result = 0;
        if (bit % 8 == 0 && bitSize % 8 == 0) {
            int at = (int) (bit / 8);
            for (int i = bitSize / 8 - 1; i >= 0; i--) {
                result = (result << 8) | (memory[at + i] & 0xFFL);
            }
            return result;
        }
        for (int i = 0; i < bitSize; i++) {
            long b = bit + i;
            long value = (memory[(int) (b >> 3)] >> (b & 7)) & 1L;
            result |= value << i;
        }
        return result;
    }

    public void write(long address, long bitOffset, int bitSize, long value) {
        long bit = address * 8 + bitOffset;
        check(bit, bitSize);
        stores.add(new StoreRecord(bit, bitSize, value));
        if (bit % 8 == 0 && bitSize % 8 == 0) {
            int at = (int) (bit / 8);
            for (int i = 0; i < bitSize / 8; i++) {
                memory[at + i] = (byte) (value >>> (8 * i));
            }
            return;
        }
        // 读-改-写
        for (int i = 0; i < bitSize; i++) {
            long b = bit + i;
            int index = (int) (b >> 3);
            int mask = 1 << (b & 7);
            if (((value >>> i) & 1L) != 0) {
                memory[index] = (byte) (memory[index] | mask);
            } else {
                memory[index] = (byte) (memory[index] & ~mask);
            }
        }
    }

    public void copy(long dst, long src, long bytes) {
        if (bytes == 0) return;
        check(src * 8, bytes * 8);
        check(dst * 8, bytes * 8);
        System.arraycopy(memory, (int) src, memory, (int) dst, (int) bytes);
    }

    public byte[] readBytes(long address, int length) {
        check(address * 8, (long) length * 8);
        return Arrays.copyOfRange(memory, (int) address, (int) address + length);
    }

    /** 按时间顺序的全部写入（不含 memcpy 与分配填充） */
    public List<StoreRecord> getStores() {
        return Collections.unmodifiableList(stores);
    }

    public void clearStores() {
        stores.clear();
    }

    private void check(long bit, long bitCount) {
        if (bit < BASE * 8 || bit + bitCount > top * 8) {
            throw new IllegalStateException("heap access out of bounds: bit " + bit + " (+" + bitCount
                    + "), heap ends at byte " + top);
        }
    }

    private void ensureCapacity(long end) {
        if (end > Integer.MAX_VALUE) {
            throw new IllegalStateException("heap exhausted");
        }
        if (end > memory.length) {
            memory = Arrays.copyOf(memory, (int) Math.max(end, memory.length * 2L));
        }
    }

    /**
     * 一次写入：绝对位地址、位宽、值。
     */
    public static final class StoreRecord {
        private final long bitAddress;
        private final int bitSize;
        private final long value;

        StoreRecord(long bitAddress, int bitSize, long value) {
            this.bitAddress = bitAddress;
            this.bitSize = bitSize;
            this.value = value;
        }

        public long getBitAddress() { return bitAddress; }
        public int getBitSize() { return bitSize; }
        public long getValue() { return value; }

        @Override
        public String toString() {
            return "store " + bitSize + "b @bit" + bitAddress + " = " + value;
        }
    }
}
