package com.corvid.ir.exec;

import com.corvid.ir.mir.MirFunction;

/**
 * MIR 解释器栈帧。
 *
 * <p>{@code values[]} 保存每个局部变量的原始位模式（指针即堆地址），
 * 元组值放在并行的 {@code tuples[]} 中。</p>
 */
final class MirFrame {

    final MirFunction function;
    final long[] values;
    final long[][] tuples;
    int currentBlockId;

    MirFrame(MirFunction function) {
        this.function = function;
        int size = function.getLocals().size();
        this.values = new long[size];
        this.tuples = new long[size][];
        this.currentBlockId = 0;
    }

    void copy(int src, int dest) {
        values[dest] = values[src];
        tuples[dest] = tuples[src];
    }
}
