package com.corvid.ir.lowering;

import com.corvid.ir.LoweringException;
import com.corvid.ir.SourceLocation;
import com.corvid.ir.layout.ArraySlotInfo;
import com.corvid.ir.layout.GapFinder;
import com.corvid.ir.layout.LayoutSlot;
import com.corvid.ir.layout.MemoryLayout;
import com.corvid.ir.mir.BinaryOp;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.ConvertOp;
import com.corvid.ir.mir.MemoryAccess;
import com.corvid.ir.mir.MirBuilder;
import com.corvid.ir.mir.MirClass;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 对象/数组构造、字段与元素访问、"with" 记录更新的降级。
 *
 * <p>构造出的对象与数组每一位都被确定地写入：不可变值按原始字节比较做驻留，
 * 未初始化的空隙位会让相等的值比较为不等。</p>
 */
public class AllocationLowering {

    private final LoweringContext ctx;
    private final FunctionLowering fl;
    private final MirBuilder b;

    AllocationLowering(LoweringContext ctx, FunctionLowering fl) {
        this.ctx = ctx;
        this.fl = fl;
        this.b = fl.getBuilder();
    }

    // ========== 对象 ==========

    void lowerNewObject(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        String className = inst.extraAs();
        MirClass cls = requireObjectClass(className, loc);
        if (cls.isAbstract()) {
            throw new LoweringException("Cannot instantiate abstract class " + className, loc);
        }
        List<LayoutSlot> slots = objectLayout(cls, loc);
        if (inst.getOperands().length != cls.getFields().size()) {
            throw new LoweringException("new " + className + " has " + inst.getOperands().length
                    + " field values but the class declares " + cls.getFields().size(), loc);
        }
        long regionBits = MemoryLayout.roundUpBits(GapFinder.maxEndBit(slots), MemoryLayout.WORD_BITS);
        int size = b.emitConstLong(MemoryLayout.OBJECT_HEADER_BYTES + regionBits / 8, loc);
        int base = b.emitAlloc(size, false, loc);
        storeVTablePointer(base, 0, className, loc);
        int dest = inst.getDest();
        b.emitPtrAddTo(dest, base, MemoryLayout.OBJECT_HEADER_BYTES, loc);

        // 先把含空隙的整字清零，字段写入在其后
        long[] gapWords = GapFinder.gapWords(slots, regionBits);
        if (gapWords.length > 0) {
            int zero = b.emitConstLong(0, loc);
            for (long word : gapWords) {
                b.emitStore(dest, zero, new MemoryAccess(word * MemoryLayout.WORD_BITS, MirType.ofI64(), false), loc);
            }
        }
        for (LayoutSlot slot : slots) {
            int value = inst.operand(fieldIndex(className, slot.getFieldName(), loc));
            b.emitStore(dest, value, new MemoryAccess(slot.getBitOffset(), slot.getType(), false), loc);
        }
        ctx.getRegistry().requireVTable(className);
    }

    /**
     * dest = src with { f = v, ... }：整块浅拷贝（连同 vtable 字，保留类与冻结标志），再写覆盖字段。
     */
    void lowerWith(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        int src = inst.operand(0);
        String className = refClassOf(src, loc);
        MirClass cls = requireObjectClass(className, loc);
        List<String> fieldNames = inst.extraAs();
        if (fieldNames.size() != inst.getOperands().length - 1) {
            throw new LoweringException("with-expression has " + fieldNames.size() + " field names but "
                    + (inst.getOperands().length - 1) + " values", loc);
        }
        List<String> concrete = ctx.getMethodResolver().concreteSubclasses(className);
        if (concrete.size() != 1 || !concrete.get(0).equals(className)) {
            throw new LoweringException("with-expression on " + className
                    + " requires an exact concrete class, found " + concrete, loc);
        }
        List<LayoutSlot> slots = objectLayout(cls, loc);
        long regionBits = MemoryLayout.roundUpBits(GapFinder.maxEndBit(slots), MemoryLayout.WORD_BITS);
        int size = b.emitConstLong(MemoryLayout.OBJECT_HEADER_BYTES + regionBits / 8, loc);
        int base = b.emitAlloc(size, false, loc);
        int srcBase = b.emitPtrAdd(src, -MemoryLayout.OBJECT_HEADER_BYTES, loc);
        b.emitMemcpy(base, srcBase, size, loc);
        int dest = inst.getDest();
        b.emitPtrAddTo(dest, base, MemoryLayout.OBJECT_HEADER_BYTES, loc);
        for (int i = 0; i < fieldNames.size(); i++) {
            LayoutSlot slot = slotNamed(slots, className, fieldNames.get(i), loc);
            b.emitStore(dest, inst.operand(i + 1), new MemoryAccess(slot.getBitOffset(), slot.getType(), false), loc);
        }
    }

    void lowerGetField(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        int object = inst.operand(0);
        String className = refClassOf(object, loc);
        MirClass cls = requireObjectClass(className, loc);
        LayoutSlot slot = slotNamed(objectLayout(cls, loc), className, inst.<String>extraAs(), loc);
        boolean cacheable = isFrozen(object);
        b.emitLoadTo(inst.getDest(), object, new MemoryAccess(slot.getBitOffset(), slot.getType(), cacheable), loc);
    }

    void lowerSetField(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        int object = inst.operand(0);
        String className = refClassOf(object, loc);
        MirClass cls = requireObjectClass(className, loc);
        LayoutSlot slot = slotNamed(objectLayout(cls, loc), className, inst.<String>extraAs(), loc);
        b.emitStore(object, inst.operand(1), new MemoryAccess(slot.getBitOffset(), slot.getType(), false), loc);
    }

    // ========== 数组 ==========

    /**
     * 数组字面量：区域清零后按 元素 → 分量（位偏移递增）写入，静态全零的值跳过。
     */
    void lowerNewArray(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        String className = inst.extraAs();
        ArraySlotInfo info = arrayInfo(className, loc);
        int arity = info.getArity();
        if (inst.getOperands().length % arity != 0) {
            throw new LoweringException("Array literal of " + className + " has " + inst.getOperands().length
                    + " components, not a multiple of the element arity " + arity, loc);
        }
        long count = inst.getOperands().length / arity;
        int dest = inst.getDest();
        allocateArray(className, info, count, -1, true, dest, loc);

        List<Integer> order = componentsByOffset(info);
        long elemBits = info.getElementByteSize() * 8;
        for (int e = 0; e < count; e++) {
            for (int k : order) {
                int value = inst.operand(e * arity + k);
                ConstValue constant = fl.constantOf(value);
                if (constant != null && constant.isAllZeroBits()) continue;
                long bitOffset = e * elemBits + info.getTupleBitOffsets().get(k);
                b.emitStore(dest, value, new MemoryAccess(bitOffset, info.getTupleTypes().get(k), false), loc);
            }
        }
    }

    void lowerNewArrayZeroed(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        String className = inst.extraAs();
        ArraySlotInfo info = arrayInfo(className, loc);
        int countLocal = inst.operand(0);
        Long constant = fl.constantLong(countLocal);
        if (constant != null) {
            allocateArray(className, info, constant, -1, true, inst.getDest(), loc);
        } else {
            allocateArray(className, info, -1, countLocal, true, inst.getDest(), loc);
        }
    }

    /**
     * 克隆：不清零分配（内容随即被整体覆盖），再一次性拷贝元素区。
     */
    void lowerArrayClone(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        int src = inst.operand(0);
        String className = refClassOf(src, loc);
        ArraySlotInfo info = arrayInfo(className, loc);
        Long known = fl.staticArrayCount(src);
        int contentBytes;
        if (known != null) {
            contentBytes = allocateArray(className, info, known, -1, false, inst.getDest(), loc);
        } else {
            int count32 = b.emitLoad(src, new MemoryAccess(MemoryLayout.ARRAY_COUNT_BIT_OFFSET, MirType.ofI32(), true), loc);
            int count = b.emitConvert(ConvertOp.ZEXT, count32, MirType.ofI64(), loc);
            contentBytes = allocateArray(className, info, -1, count, false, inst.getDest(), loc);
        }
        b.emitMemcpy(inst.getDest(), src, contentBytes, loc);
    }

    /**
     * 数组长度/哈希：固定负偏移处的 32 位值，零扩展到目标宽度。
     */
    void lowerArrayHeaderLoad(MirInst inst, long bitOffset) {
        SourceLocation loc = inst.getLocation();
        int word = b.emitLoad(inst.operand(0), new MemoryAccess(bitOffset, MirType.ofI32(), true), loc);
        b.emitConvertTo(inst.getDest(), ConvertOp.ZEXT, word, loc);
    }

    void lowerArrayGet(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        int array = inst.operand(0);
        ArraySlotInfo info = arrayInfoOf(array, loc);
        int k = componentIndex(inst, info);
        int address = elementAddress(array, inst.operand(1), info, loc);
        MemoryAccess access = new MemoryAccess(info.getTupleBitOffsets().get(k), info.getTupleTypes().get(k),
                isFrozen(array));
        b.emitLoadTo(inst.getDest(), address, access, loc);
    }

    void lowerArraySet(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        int array = inst.operand(0);
        ArraySlotInfo info = arrayInfoOf(array, loc);
        int k = componentIndex(inst, info);
        int address = elementAddress(array, inst.operand(1), info, loc);
        MemoryAccess access = new MemoryAccess(info.getTupleBitOffsets().get(k), info.getTupleTypes().get(k), false);
        b.emitStore(address, inst.operand(2), access, loc);
    }

    /**
     * 共用的数组分配：count 为编译期常量（constCount >= 0）或动态局部变量 countLocal。
     * 返回保存元素区字节数的局部变量。
     */
    private int allocateArray(String className, ArraySlotInfo info, long constCount, int countLocal,
                              boolean zeroFill, int dest, SourceLocation loc) {
        long elemBytes = info.getElementByteSize();
        boolean constant = constCount >= 0;
        int contentBytes;
        int size;
        int count64 = -1;
        if (constant) {
            if (constCount > 0xFFFFFFFFL) {
                throw new LoweringException("Array of " + className + " with " + constCount
                        + " elements exceeds the 32-bit length field", loc);
            }
            contentBytes = b.emitConstLong(constCount * elemBytes, loc);
            size = b.emitConstLong(MemoryLayout.ARRAY_HEADER_BYTES + constCount * elemBytes, loc);
        } else {
            count64 = widenToI64(countLocal, loc);
            int elem = b.emitConstLong(elemBytes, loc);
            contentBytes = b.emitBinary(BinaryOp.MUL, count64, elem, MirType.ofI64(), loc);
            int header = b.emitConstLong(MemoryLayout.ARRAY_HEADER_BYTES, loc);
            size = b.emitBinary(BinaryOp.ADD, contentBytes, header, MirType.ofI64(), loc);
        }
        int base = b.emitAlloc(size, zeroFill, loc);
        b.emitPtrAddTo(dest, base, MemoryLayout.ARRAY_HEADER_BYTES, loc);

        if (!zeroFill) {
            if (constant) {
                storeConstantTail(dest, constCount * elemBytes, loc);
            } else if (elemBytes % 8 != 0) {
                storeDynamicTail(dest, contentBytes, loc);
            }
        }

        // 头部在尾部清零之后写入：动态尾部在长度为 0 时会落在 vtable 字上
        int count32;
        if (constant) {
            count32 = b.emitConst(ConstValue.scalar(MirType.ofI32(), constCount), MirType.ofI32(), loc);
        } else {
            count32 = b.emitConvert(ConvertOp.TRUNC, count64, MirType.ofI32(), loc);
        }
        b.emitStore(dest, count32, new MemoryAccess(MemoryLayout.ARRAY_COUNT_BIT_OFFSET, MirType.ofI32(), false), loc);
        if (!zeroFill) {
            int zero32 = b.emitConst(ConstValue.scalar(MirType.ofI32(), 0), MirType.ofI32(), loc);
            b.emitStore(dest, zero32, new MemoryAccess(MemoryLayout.ARRAY_HASH_BIT_OFFSET, MirType.ofI32(), false), loc);
        }
        storeVTablePointer(dest, MemoryLayout.VTABLE_BIT_OFFSET, className, loc);
        ctx.getRegistry().requireVTable(className);
        return contentBytes;
    }

    /**
     * 元素区字节数不是 8 的倍数时，用恰好覆盖到对齐边界的最大对齐写清零尾部。
     */
    private void storeConstantTail(int array, long contentBytes, SourceLocation loc) {
        long pad = MemoryLayout.alignUp8(contentBytes) - contentBytes;
        if (pad == 0) return;
        MirType type;
        long byteOffset;
        if (pad == 4) {
            type = MirType.ofI32();
            byteOffset = contentBytes;
        } else if (pad == 2) {
            type = MirType.ofI16();
            byteOffset = contentBytes;
        } else if (pad == 1) {
            type = MirType.ofI8();
            byteOffset = contentBytes;
        } else {
            type = MirType.ofI64();
            byteOffset = MemoryLayout.alignDown8(contentBytes);
        }
        int zero = b.emitConst(ConstValue.scalar(type, 0), type, loc);
        b.emitStore(array, zero, new MemoryAccess(byteOffset * 8, type, false), loc);
    }

    /**
     * 动态长度：清零元素区最后一个（向上对齐后的）整字。
     */
    private void storeDynamicTail(int array, int contentBytes, SourceLocation loc) {
        int seven = b.emitConstLong(7, loc);
        int rounded = b.emitBinary(BinaryOp.ADD, contentBytes, seven, MirType.ofI64(), loc);
        int mask = b.emitConstLong(~7L, loc);
        int aligned = b.emitBinary(BinaryOp.BAND, rounded, mask, MirType.ofI64(), loc);
        int lastWord = b.emitPtrAddIndexed(array, aligned, -8, loc);
        int zero = b.emitConstLong(0, loc);
        b.emitStore(lastWord, zero, new MemoryAccess(0, MirType.ofI64(), false), loc);
    }

    private int elementAddress(int array, int index, ArraySlotInfo info, SourceLocation loc) {
        int index64 = widenToI64(index, loc);
        int elem = b.emitConstLong(info.getElementByteSize(), loc);
        int offset = b.emitBinary(BinaryOp.MUL, index64, elem, MirType.ofI64(), loc);
        return b.emitPtrAddIndexed(array, offset, 0, loc);
    }

    private int widenToI64(int local, SourceLocation loc) {
        MirType type = b.typeOf(local);
        if (type.getKind() == MirType.Kind.I64) return local;
        if (!type.isInteger()) {
            throw new LoweringException("Array count/index must be an integer, found " + type, loc);
        }
        return b.emitConvert(ConvertOp.ZEXT, local, MirType.ofI64(), loc);
    }

    private static List<Integer> componentsByOffset(ArraySlotInfo info) {
        List<Integer> order = new ArrayList<>();
        for (int k = 0; k < info.getArity(); k++) order.add(k);
        order.sort(Comparator.comparingLong(k -> info.getTupleBitOffsets().get(k)));
        return order;
    }

    private static int componentIndex(MirInst inst, ArraySlotInfo info) {
        int k = inst.<Integer>extraAs();
        if (k < 0 || k >= info.getArity()) {
            throw new LoweringException("Tuple component " + k + " out of range for element arity "
                    + info.getArity(), inst.getLocation());
        }
        return k;
    }

    // ========== 公共 ==========

    private void storeVTablePointer(int base, long bitOffset, String className, SourceLocation loc) {
        int vtable = b.emitConst(new ConstValue.VTableRef(className), MirType.ofPtr(), loc);
        b.emitStore(base, vtable, new MemoryAccess(bitOffset, MirType.ofPtr(), false), loc);
    }

    private List<LayoutSlot> objectLayout(MirClass cls, SourceLocation loc) {
        List<LayoutSlot> slots;
        try {
            slots = ctx.getLayoutOracle().getLayout(cls.getName());
        } catch (IllegalArgumentException e) {
            throw oracleFailure(e, loc);
        }
        if (slots.size() != cls.getFields().size()) {
            throw new LoweringException("Layout of " + cls.getName() + " has " + slots.size()
                    + " slots but the class declares " + cls.getFields().size() + " fields", loc);
        }
        GapFinder.validate(slots, cls.getName(), loc);
        return slots;
    }

    private static LayoutSlot slotNamed(List<LayoutSlot> slots, String className, String fieldName,
                                        SourceLocation loc) {
        for (LayoutSlot slot : slots) {
            if (slot.getFieldName().equals(fieldName)) return slot;
        }
        throw new LoweringException("Class " + className + " has no field " + fieldName, loc);
    }

    private MirClass requireObjectClass(String className, SourceLocation loc) {
        MirClass cls = ctx.getHierarchy().require(className, loc);
        if (!cls.isReference()) {
            throw new LoweringException("Value class " + className + " has no heap representation", loc);
        }
        if (cls.isArray()) {
            throw new LoweringException("Array class " + className + " used as an object", loc);
        }
        return cls;
    }

    private MirClass requireArrayClass(String className, SourceLocation loc) {
        MirClass cls = ctx.getHierarchy().require(className, loc);
        if (!cls.isReference() || !cls.isArray()) {
            throw new LoweringException(className + " is not a reference array class", loc);
        }
        if (cls.getArrayElementTypes().isEmpty()) {
            throw new LoweringException("Array class " + className + " has an empty element tuple", loc);
        }
        return cls;
    }

    private ArraySlotInfo arrayInfoOf(int array, SourceLocation loc) {
        return arrayInfo(refClassOf(array, loc), loc);
    }

    private ArraySlotInfo arrayInfo(String className, SourceLocation loc) {
        requireArrayClass(className, loc);
        try {
            return ctx.getLayoutOracle().getArraySlotInfo(className);
        } catch (IllegalArgumentException e) {
            throw oracleFailure(e, loc);
        }
    }

    private int fieldIndex(String className, String fieldName, SourceLocation loc) {
        try {
            return ctx.getLayoutOracle().getFieldIndex(className, fieldName);
        } catch (IllegalArgumentException e) {
            throw oracleFailure(e, loc);
        }
    }

    /**
     * 布局查询以 IllegalArgumentException 报告的错误，附上当前指令的位置。
     */
    private static LoweringException oracleFailure(IllegalArgumentException e, SourceLocation loc) {
        LoweringException located = new LoweringException("Layout query failed: " + e.getMessage(), loc);
        located.initCause(e);
        return located;
    }

    private String refClassOf(int local, SourceLocation loc) {
        MirType type = b.typeOf(local);
        if (!type.isRef()) {
            throw new LoweringException("Expected a reference, found %" + local + ": " + type, loc);
        }
        return type.getClassName();
    }

    private boolean isFrozen(int local) {
        return b.typeOf(local).getMutability() == MirType.Mutability.FROZEN;
    }
}
