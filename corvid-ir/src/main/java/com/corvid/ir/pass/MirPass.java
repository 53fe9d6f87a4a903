package com.corvid.ir.pass;

import com.corvid.ir.mir.MirModule;

/**
 * MIR pass 接口。
 */
public interface MirPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对 MIR 模块执行变换。
     */
    MirModule run(MirModule module);
}
