package com.corvid.ir.mir;

/**
 * 整数宽度转换。
 */
public enum ConvertOp {
    ZEXT, SEXT, TRUNC
}
