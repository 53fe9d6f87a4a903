package com.corvid.ir.layout;

import java.util.List;

/**
 * 类布局查询（只读）。布局算法本身不属于降级 pass。
 *
 * <p>无法回答的查询（未知类、未知字段、无法布局的类型）抛出 {@link IllegalArgumentException}，
 * 由降级一方补上源码位置。子类布局必须以超类布局为前缀。</p>
 */
public interface LayoutOracle {

    /**
     * 类的字段槽位，按位偏移递增排列且互不重叠。
     */
    List<LayoutSlot> getLayout(String className);

    /**
     * 数组类的元素布局。
     */
    ArraySlotInfo getArraySlotInfo(String className);

    /**
     * 字段在声明顺序中的下标（构造指令的操作数按声明顺序给出）。
     */
    int getFieldIndex(String className, String fieldName);
}
