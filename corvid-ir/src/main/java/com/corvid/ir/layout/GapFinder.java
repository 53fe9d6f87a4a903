package com.corvid.ir.layout;

import com.corvid.ir.LoweringException;
import com.corvid.ir.SourceLocation;

import java.util.List;

/**
 * 在有序布局中查找未被任何字段覆盖的位，保证构造出的对象每一位都被确定地写入。
 */
public final class GapFinder {

    private GapFinder() {
    }

    /**
     * 从 fromBit 开始第一个不被任何槽位覆盖的位偏移。
     *
     * @param sorted 按位偏移递增、互不重叠的槽位
     */
    public static long nextGap(List<LayoutSlot> sorted, long fromBit) {
        long pos = fromBit;
        for (LayoutSlot slot : sorted) {
            if (slot.getEndBit() <= pos) continue;
            if (slot.getBitOffset() > pos) return pos;
            pos = slot.getEndBit();
        }
        return pos;
    }

    /**
     * 字段区内含有空隙位的 64 位字下标（按递增顺序）。
     *
     * @param regionBits 字段区位数（64 的倍数）
     */
    public static long[] gapWords(List<LayoutSlot> sorted, long regionBits) {
        long[] words = new long[(int) (regionBits / MemoryLayout.WORD_BITS)];
        int count = 0;
        long pos = 0;
        while (pos < regionBits) {
            long gap = nextGap(sorted, pos);
            if (gap >= regionBits) break;
            long word = gap / MemoryLayout.WORD_BITS;
            words[count++] = word;
            pos = (word + 1) * MemoryLayout.WORD_BITS;
        }
        long[] result = new long[count];
        System.arraycopy(words, 0, result, 0, count);
        return result;
    }

    /**
     * 校验槽位按偏移递增且互不重叠。
     */
    public static void validate(List<LayoutSlot> slots, String className, SourceLocation location) {
        long end = 0;
        for (LayoutSlot slot : slots) {
            if (slot.getBitOffset() < end) {
                throw new LoweringException("Layout of " + className + " is not sorted or overlaps at field '"
                        + slot.getFieldName() + "' (bit " + slot.getBitOffset() + ")", location);
            }
            end = slot.getEndBit();
        }
    }

    /** 槽位覆盖的最高位（不含） */
    public static long maxEndBit(List<LayoutSlot> slots) {
        long end = 0;
        for (LayoutSlot slot : slots) {
            end = Math.max(end, slot.getEndBit());
        }
        return end;
    }
}
