package com.corvid.ir.layout;

import com.corvid.ir.mir.MirType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 数组元素布局：每个元素是一个元组，tupleBitOffsets[i] 为第 i 个分量在元素内的位偏移。
 */
public final class ArraySlotInfo {

    private final long elementBitSize;
    private final List<Long> tupleBitOffsets;
    private final List<MirType> tupleTypes;

    public ArraySlotInfo(long elementBitSize, List<Long> tupleBitOffsets, List<MirType> tupleTypes) {
        if (tupleBitOffsets.size() != tupleTypes.size()) {
            throw new IllegalArgumentException("tuple offsets and types differ in length: "
                    + tupleBitOffsets.size() + " vs " + tupleTypes.size());
        }
        this.elementBitSize = elementBitSize;
        this.tupleBitOffsets = Collections.unmodifiableList(new ArrayList<>(tupleBitOffsets));
        this.tupleTypes = Collections.unmodifiableList(new ArrayList<>(tupleTypes));
    }

    public long getElementBitSize() { return elementBitSize; }
    public List<Long> getTupleBitOffsets() { return tupleBitOffsets; }
    public List<MirType> getTupleTypes() { return tupleTypes; }

    public int getArity() {
        return tupleTypes.size();
    }

    /** 元素跨度（字节），不足一字节的部分向上取整 */
    public long getElementByteSize() {
        return (elementBitSize + 7) / 8;
    }

    @Override
    public String toString() {
        return "ArraySlotInfo{bits=" + elementBitSize + ", offsets=" + tupleBitOffsets
                + ", types=" + tupleTypes + "}";
    }
}
