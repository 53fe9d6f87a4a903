package com.corvid.ir.mir;

/**
 * MIR 指令操作码。
 *
 * <p>前半部分是感知对象模型的高层操作，由 {@code ObjectModelLowering} 消除；
 * 后半部分是降级后仍然合法的底层操作。</p>
 */
public enum MirOp {
    // ===== 高层：对象/数组构造 =====
    NEW_OBJECT,         // dest = new Class(fields...)            extra: 类名
    NEW_ARRAY,          // dest = Array[e0, e1, ...]             extra: 类名
    NEW_ARRAY_ZEROED,   // dest = Array(count) 全零               extra: 类名
    ARRAY_CLONE,        // dest = clone(src)
    ARRAY_SIZE,         // dest = src.size
    ARRAY_HASH,         // dest = src.hash
    ARRAY_GET,          // dest = arr[index].component           extra: 元组分量下标
    ARRAY_SET,          // arr[index].component = value          extra: 元组分量下标
    GET_FIELD,          // dest = obj.field                      extra: 字段名
    SET_FIELD,          // obj.field = value                     extra: 字段名
    WITH,               // dest = src with { f = v, ... }        extra: 字段名列表

    // ===== 高层：分派/冻结 =====
    CALL_VIRTUAL,       // dest = recv.method(args)              extra: 方法名
    FREEZE,             // dest = freeze(value)

    // ===== 底层 =====
    EXTRACT,            // dest = tuple.#i                       extra: 分量下标
    TUPLE,              // dest = (a, b, ...)
    CONST,              // dest = 常量                            extra: ConstValue
    MOVE,               // dest = src
    BINARY,             // dest = a op b                         extra: BinaryOp
    CONVERT,            // dest = zext/sext/trunc src            extra: ConvertOp
    ALLOC,              // dest = alloc(byteSize)                extra: Boolean 是否清零
    PTR_ADD,            // dest = base (+ offset) + disp         extra: Long 字节位移
    LOAD,               // dest = *(base + bitOffset)            extra: MemoryAccess
    STORE,              // *(base + bitOffset) = value           extra: MemoryAccess
    MEMCPY,             // memcpy(dst, src, byteCount)
    LOAD_VTABLE_SLOT,   // dest = vtable[slot(request)]          extra: VTableRequest
    CALL_STATIC,        // dest = function(args)                 extra: 函数名
    CALL_INDIRECT,      // dest = (*fn)(args)
    CALL_RUNTIME;       // runtimeFunction(args)                 extra: 运行时函数名

    /**
     * 是否为降级 pass 必须消除的高层操作。
     */
    public boolean isObjectModel() {
        return ordinal() <= FREEZE.ordinal();
    }
}
