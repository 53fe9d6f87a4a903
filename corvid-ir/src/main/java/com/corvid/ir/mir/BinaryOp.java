package com.corvid.ir.mir;

/**
 * MIR 二元运算操作符。比较运算的结果为 bool。
 */
public enum BinaryOp {
    ADD, SUB, MUL, DIV, MOD,
    EQ, NE, LT, GT, LE, GE,
    SHL, SHR, USHR,
    BAND, BOR, BXOR;

    public boolean isComparison() {
        switch (this) {
            case EQ: case NE: case LT: case GT: case LE: case GE: return true;
            default: return false;
        }
    }
}
