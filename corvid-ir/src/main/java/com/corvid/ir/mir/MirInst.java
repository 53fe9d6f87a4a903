package com.corvid.ir.mir;

import com.corvid.ir.SourceLocation;

/**
 * MIR 指令。
 *
 * <p>dest 既是结果局部变量，也是指令的标识：降级时替换序列中恰好有一条指令沿用原 dest，
 * 已有的使用者因此仍然有效。</p>
 */
public class MirInst {

    private final MirOp op;
    private final int dest;            // 目标局部变量索引（-1 = 无返回值）
    private final int[] operands;      // 操作数（局部变量索引）
    private final Object extra;        // 额外数据（常量、类名、方法名、访存描述等）
    private final SourceLocation location;

    public MirInst(MirOp op, int dest, int[] operands, Object extra, SourceLocation location) {
        this.op = op;
        this.dest = dest;
        this.operands = operands != null ? operands : new int[0];
        this.extra = extra;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public MirOp getOp() { return op; }
    public int getDest() { return dest; }
    public int[] getOperands() { return operands; }
    public Object getExtra() { return extra; }
    public SourceLocation getLocation() { return location; }

    public boolean hasDest() {
        return dest >= 0;
    }

    /**
     * 获取第 n 个操作数。
     */
    public int operand(int n) {
        return operands[n];
    }

    /**
     * extra 作为指定类型。
     */
    @SuppressWarnings("unchecked")
    public <T> T extraAs() {
        return (T) extra;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (dest >= 0) sb.append('%').append(dest).append(" = ");
        sb.append(op.name());
        for (int i = 0; i < operands.length; i++) {
            sb.append(i == 0 ? " %" : ", %").append(operands[i]);
        }
        if (extra != null) sb.append(" [").append(extra).append(']');
        return sb.toString();
    }
}
