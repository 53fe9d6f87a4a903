package com.corvid.ir.layout;

import com.corvid.ir.mir.MirClass;
import com.corvid.ir.mir.MirField;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.resolve.ClassHierarchy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 默认布局算法。
 *
 * <p>子类布局以超类布局为前缀：继承字段沿用超类中的位偏移，本类新增的字段排在其后，
 * 按对齐要求从大到小排列（同对齐保持声明顺序），各自自然对齐；
 * bool 占 1 位，紧密打包在末尾。数组元素的元组分量按声明顺序自然对齐，
 * 元素跨度至少对齐到字节。</p>
 */
public class DefaultLayoutOracle implements LayoutOracle {

    private final ClassHierarchy hierarchy;

    public DefaultLayoutOracle(ClassHierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    @Override
    public List<LayoutSlot> getLayout(String className) {
        MirClass cls = lookup(className);
        List<LayoutSlot> slots = new ArrayList<>(cls.getFields().size());
        Set<String> inherited = new HashSet<>();
        long pos = 0;
        // 超类的槽位原样保留：经由超类引用访问子类对象时位偏移一致
        if (cls.getSuperClass() != null) {
            for (LayoutSlot slot : getLayout(cls.getSuperClass())) {
                MirField field = cls.findField(slot.getFieldName());
                if (field == null || !field.getType().equals(slot.getType())) {
                    throw new IllegalArgumentException("Class " + className + " does not carry inherited field "
                            + slot.getFieldName() + ": " + slot.getType() + " of " + cls.getSuperClass());
                }
                slots.add(slot);
                inherited.add(slot.getFieldName());
                pos = Math.max(pos, slot.getEndBit());
            }
        }
        List<MirField> own = new ArrayList<>();
        for (MirField field : cls.getFields()) {
            if (!inherited.contains(field.getName())) own.add(field);
        }
        // List.sort 是稳定排序
        own.sort(Comparator.comparingLong((MirField f) -> alignmentOf(f.getType())).reversed());
        for (MirField field : own) {
            long offset = MemoryLayout.roundUpBits(pos, alignmentOf(field.getType()));
            slots.add(new LayoutSlot(field.getName(), offset, field.getType()));
            pos = offset + field.getType().getBitSize();
        }
        return Collections.unmodifiableList(slots);
    }

    @Override
    public ArraySlotInfo getArraySlotInfo(String className) {
        MirClass cls = lookup(className);
        if (!cls.isArray()) {
            throw new IllegalArgumentException(className + " is not an array class");
        }
        List<MirType> types = cls.getArrayElementTypes();
        if (types.isEmpty()) {
            throw new IllegalArgumentException("Array class " + className + " has an empty element tuple");
        }
        List<Long> offsets = new ArrayList<>(types.size());
        long pos = 0;
        long maxAlign = 8;
        for (MirType type : types) {
            long align = alignmentOf(type);
            long offset = MemoryLayout.roundUpBits(pos, align);
            offsets.add(offset);
            pos = offset + type.getBitSize();
            maxAlign = Math.max(maxAlign, align);
        }
        return new ArraySlotInfo(MemoryLayout.roundUpBits(pos, maxAlign), offsets, types);
    }

    @Override
    public int getFieldIndex(String className, String fieldName) {
        List<MirField> fields = lookup(className).getFields();
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(fieldName)) return i;
        }
        throw new IllegalArgumentException("Class " + className + " has no field " + fieldName);
    }

    private MirClass lookup(String className) {
        MirClass cls = hierarchy.find(className);
        if (cls == null) {
            throw new IllegalArgumentException("Unknown class " + className);
        }
        return cls;
    }

    static long alignmentOf(MirType type) {
        if (type.isTuple()) {
            throw new IllegalArgumentException("Tuple-typed field cannot be laid out: " + type);
        }
        return Math.max(1, type.getBitSize());
    }
}
