package com.corvid.ir.lowering;

import com.corvid.ir.mir.BasicBlock;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.MirFunction;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.mir.MirOp;
import com.corvid.ir.vtable.VTableRequestRegistry;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 遍历将被序列化的常量图，确保每个常量对象/结构体的类都会得到 vtable。
 * 常量图可能共享子结构甚至成环，按引用去重。
 */
public final class ConstantScavenger {

    private ConstantScavenger() {
    }

    /**
     * @return 访问到的聚合常量个数
     */
    public static int scavenge(MirModule module, VTableRequestRegistry registry) {
        Deque<ConstValue> work = new ArrayDeque<>(module.getConstants().values());
        for (MirFunction function : module.getFunctions()) {
            for (BasicBlock block : function.getBlocks()) {
                for (MirInst inst : block.getInstructions()) {
                    if (inst.getOp() == MirOp.CONST && inst.getExtra() != null) {
                        work.add(inst.<ConstValue>extraAs());
                    }
                }
            }
        }
        Set<ConstValue> seen = Collections.newSetFromMap(new IdentityHashMap<ConstValue, Boolean>());
        int aggregates = 0;
        while (!work.isEmpty()) {
            ConstValue value = work.pop();
            if (!seen.add(value)) continue;
            if (value instanceof ConstValue.Aggregate) {
                ConstValue.Aggregate aggregate = (ConstValue.Aggregate) value;
                registry.requireVTable(aggregate.getClassName());
                aggregates++;
                for (ConstValue component : aggregate.getComponents()) {
                    if (component != null) work.push(component);
                }
            } else if (value instanceof ConstValue.VTableRef) {
                registry.requireVTable(((ConstValue.VTableRef) value).getClassName());
            }
        }
        return aggregates;
    }
}
