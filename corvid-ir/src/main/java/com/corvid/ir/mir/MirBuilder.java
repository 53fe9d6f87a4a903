package com.corvid.ir.mir;

import com.corvid.ir.SourceLocation;
import com.corvid.ir.vtable.VTableRequest;

import java.util.List;

/**
 * MIR 构建辅助类。
 * 封装创建指令、基本块、局部变量的便捷方法。降级 pass 与测试夹具共用。
 */
public class MirBuilder {

    private final MirFunction function;
    private BasicBlock currentBlock;

    public MirBuilder(MirFunction function) {
        this.function = function;
        this.currentBlock = function.newBlock(); // entry block
    }

    /** 绑定到已有函数和基本块（不创建新 block） */
    public MirBuilder(MirFunction function, BasicBlock existingBlock) {
        this.function = function;
        this.currentBlock = existingBlock;
    }

    public MirFunction getFunction() { return function; }
    public BasicBlock getCurrentBlock() { return currentBlock; }

    // ========== 基本块操作 ==========

    public BasicBlock newBlock() {
        return function.newBlock();
    }

    public void switchToBlock(BasicBlock block) {
        this.currentBlock = block;
    }

    public void terminate(MirTerminator terminator) {
        currentBlock.setTerminator(terminator);
    }

    // ========== 局部变量 ==========

    public int newLocal(String name, MirType type) {
        return function.newLocal(name, type);
    }

    public int newTemp(MirType type) {
        return function.newLocal(MirLocal.TEMP_PREFIX + function.getLocals().size(), type);
    }

    public int newParam(String name, MirType type) {
        return function.newParam(name, type);
    }

    public MirType typeOf(int local) {
        return function.getLocalType(local);
    }

    // ========== 指令发射 ==========

    public void emit(MirInst inst) {
        currentBlock.addInstruction(inst);
    }

    private int emitNew(MirOp op, MirType type, int[] operands, Object extra, SourceLocation loc) {
        int dest = newTemp(type);
        emit(new MirInst(op, dest, operands, extra, loc));
        return dest;
    }

    public int emitConst(ConstValue value, MirType type, SourceLocation loc) {
        return emitNew(MirOp.CONST, type, null, value, loc);
    }

    public void emitConstTo(int dest, ConstValue value, SourceLocation loc) {
        emit(new MirInst(MirOp.CONST, dest, null, value, loc));
    }

    public int emitConstLong(long value, SourceLocation loc) {
        return emitConst(ConstValue.ofI64(value), MirType.ofI64(), loc);
    }

    public int emitMove(int src, MirType type, SourceLocation loc) {
        return emitNew(MirOp.MOVE, type, new int[]{src}, null, loc);
    }

    /**
     * 将值从 src 移动到指定的 dest 局部变量。
     */
    public void emitMoveTo(int src, int dest, SourceLocation loc) {
        emit(new MirInst(MirOp.MOVE, dest, new int[]{src}, null, loc));
    }

    public int emitBinary(BinaryOp op, int left, int right, MirType type, SourceLocation loc) {
        return emitNew(MirOp.BINARY, type, new int[]{left, right}, op, loc);
    }

    public int emitConvert(ConvertOp op, int src, MirType type, SourceLocation loc) {
        return emitNew(MirOp.CONVERT, type, new int[]{src}, op, loc);
    }

    public void emitConvertTo(int dest, ConvertOp op, int src, SourceLocation loc) {
        emit(new MirInst(MirOp.CONVERT, dest, new int[]{src}, op, loc));
    }

    public int emitTuple(int[] components, MirType type, SourceLocation loc) {
        return emitNew(MirOp.TUPLE, type, components, null, loc);
    }

    public int emitExtract(int tuple, int index, MirType type, SourceLocation loc) {
        return emitNew(MirOp.EXTRACT, type, new int[]{tuple}, index, loc);
    }

    // ========== 内存 ==========

    /**
     * 申请 sizeLocal 字节的堆内存，返回分配起始地址。
     */
    public int emitAlloc(int sizeLocal, boolean zeroFill, SourceLocation loc) {
        return emitNew(MirOp.ALLOC, MirType.ofPtr(), new int[]{sizeLocal}, zeroFill, loc);
    }

    public int emitPtrAdd(int base, long byteDisplacement, SourceLocation loc) {
        return emitNew(MirOp.PTR_ADD, MirType.ofPtr(), new int[]{base}, byteDisplacement, loc);
    }

    public void emitPtrAddTo(int dest, int base, long byteDisplacement, SourceLocation loc) {
        emit(new MirInst(MirOp.PTR_ADD, dest, new int[]{base}, byteDisplacement, loc));
    }

    /** dest = base + offsetLocal + byteDisplacement */
    public int emitPtrAddIndexed(int base, int offsetLocal, long byteDisplacement, SourceLocation loc) {
        return emitNew(MirOp.PTR_ADD, MirType.ofPtr(), new int[]{base, offsetLocal}, byteDisplacement, loc);
    }

    public int emitLoad(int base, MemoryAccess access, SourceLocation loc) {
        return emitNew(MirOp.LOAD, access.getType(), new int[]{base}, access, loc);
    }

    public void emitLoadTo(int dest, int base, MemoryAccess access, SourceLocation loc) {
        emit(new MirInst(MirOp.LOAD, dest, new int[]{base}, access, loc));
    }

    public void emitStore(int base, int value, MemoryAccess access, SourceLocation loc) {
        emit(new MirInst(MirOp.STORE, -1, new int[]{base, value}, access, loc));
    }

    public void emitMemcpy(int dst, int src, int byteCount, SourceLocation loc) {
        emit(new MirInst(MirOp.MEMCPY, -1, new int[]{dst, src, byteCount}, null, loc));
    }

    public int emitLoadVTableSlot(int vtableWord, VTableRequest request, MirType type, SourceLocation loc) {
        return emitNew(MirOp.LOAD_VTABLE_SLOT, type, new int[]{vtableWord}, request, loc);
    }

    // ========== 调用 ==========

    public int emitCallStatic(String functionName, int[] args, MirType returnType, SourceLocation loc) {
        if (returnType.getKind() == MirType.Kind.VOID) {
            emit(new MirInst(MirOp.CALL_STATIC, -1, args, functionName, loc));
            return -1;
        }
        return emitNew(MirOp.CALL_STATIC, returnType, args, functionName, loc);
    }

    public void emitCallIndirectTo(int dest, int[] fnAndArgs, SourceLocation loc) {
        emit(new MirInst(MirOp.CALL_INDIRECT, dest, fnAndArgs, null, loc));
    }

    public void emitCallRuntime(String runtimeFunction, int[] args, SourceLocation loc) {
        emit(new MirInst(MirOp.CALL_RUNTIME, -1, args, runtimeFunction, loc));
    }

    // ========== 对象模型（降级前） ==========

    public int emitNewObject(String className, int[] fieldValues, SourceLocation loc) {
        return emitNew(MirOp.NEW_OBJECT, MirType.ofRef(className, MirType.Mutability.MUTABLE),
                fieldValues, className, loc);
    }

    /**
     * 数组字面量。components 按元素展开：每个元素依次给出全部元组分量。
     */
    public int emitNewArray(String className, int[] components, SourceLocation loc) {
        return emitNew(MirOp.NEW_ARRAY, MirType.ofRef(className, MirType.Mutability.MUTABLE),
                components, className, loc);
    }

    public int emitNewArrayZeroed(String className, int count, SourceLocation loc) {
        return emitNew(MirOp.NEW_ARRAY_ZEROED, MirType.ofRef(className, MirType.Mutability.MUTABLE),
                new int[]{count}, className, loc);
    }

    public int emitArrayClone(int src, SourceLocation loc) {
        MirType srcType = typeOf(src);
        return emitNew(MirOp.ARRAY_CLONE, MirType.ofRef(srcType.getClassName(), MirType.Mutability.MUTABLE),
                new int[]{src}, null, loc);
    }

    public int emitArraySize(int array, SourceLocation loc) {
        return emitNew(MirOp.ARRAY_SIZE, MirType.ofI64(), new int[]{array}, null, loc);
    }

    public int emitArrayHash(int array, SourceLocation loc) {
        return emitNew(MirOp.ARRAY_HASH, MirType.ofI64(), new int[]{array}, null, loc);
    }

    public int emitArrayGet(int array, int index, int component, MirType type, SourceLocation loc) {
        return emitNew(MirOp.ARRAY_GET, type, new int[]{array, index}, component, loc);
    }

    public void emitArraySet(int array, int index, int component, int value, SourceLocation loc) {
        emit(new MirInst(MirOp.ARRAY_SET, -1, new int[]{array, index, value}, component, loc));
    }

    public int emitGetField(int object, String fieldName, MirType type, SourceLocation loc) {
        return emitNew(MirOp.GET_FIELD, type, new int[]{object}, fieldName, loc);
    }

    public void emitSetField(int object, String fieldName, int value, SourceLocation loc) {
        emit(new MirInst(MirOp.SET_FIELD, -1, new int[]{object, value}, fieldName, loc));
    }

    /**
     * src with { fieldNames[i] = values[i] }。
     */
    public int emitWith(int src, List<String> fieldNames, int[] values, SourceLocation loc) {
        int[] operands = new int[values.length + 1];
        operands[0] = src;
        System.arraycopy(values, 0, operands, 1, values.length);
        MirType srcType = typeOf(src);
        return emitNew(MirOp.WITH, MirType.ofRef(srcType.getClassName(), MirType.Mutability.MUTABLE),
                operands, fieldNames, loc);
    }

    /**
     * 虚调用，args[0] 为接收者。
     */
    public int emitCallVirtual(String methodName, int[] args, MirType returnType, SourceLocation loc) {
        if (returnType.getKind() == MirType.Kind.VOID) {
            emit(new MirInst(MirOp.CALL_VIRTUAL, -1, args, methodName, loc));
            return -1;
        }
        return emitNew(MirOp.CALL_VIRTUAL, returnType, args, methodName, loc);
    }

    public int emitFreeze(int value, SourceLocation loc) {
        MirType type = typeOf(value);
        MirType frozen = type.isRef() ? MirType.ofRef(type.getClassName(), MirType.Mutability.FROZEN) : type;
        return emitNew(MirOp.FREEZE, frozen, new int[]{value}, null, loc);
    }

    // ========== 终止指令 ==========

    public void emitGoto(Successor target, SourceLocation loc) {
        terminate(new MirTerminator.Goto(loc, target));
    }

    public void emitBranch(int cond, Successor thenTarget, Successor elseTarget, SourceLocation loc) {
        terminate(new MirTerminator.Branch(loc, cond, thenTarget, elseTarget));
    }

    public void emitReturn(int value, SourceLocation loc) {
        terminate(new MirTerminator.Return(loc, value));
    }

    public void emitUnreachable(SourceLocation loc) {
        terminate(new MirTerminator.Unreachable(loc));
    }
}
