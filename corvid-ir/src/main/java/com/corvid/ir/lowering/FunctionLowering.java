package com.corvid.ir.lowering;

import com.corvid.ir.LoweringException;
import com.corvid.ir.SourceLocation;
import com.corvid.ir.layout.MemoryLayout;
import com.corvid.ir.mir.BasicBlock;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.MirBuilder;
import com.corvid.ir.mir.MirClass;
import com.corvid.ir.mir.MirFunction;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirOp;
import com.corvid.ir.mir.MirTerminator;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.resolve.Implementation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 单个函数的对象模型降级。
 *
 * <p>按原有块的顺序逐块重写：清空块后把每条指令的替换序列发射回去。
 * 替换序列中恰好有一条指令沿用原 dest。遇到必须拆块的降级（陷阱、冻结检查）时，
 * 剩余指令与原终止指令落在最后一个新块中。</p>
 */
public class FunctionLowering {

    private static final Logger LOG = Logger.getLogger(FunctionLowering.class.getName());

    private final LoweringContext ctx;
    private final MirFunction function;
    private final MirBuilder builder;
    private final AllocationLowering allocation;
    private final DispatchLowering dispatch;
    private final FreezeLowering freeze;

    /** 只被定义一次的 CONST 局部变量 → 常量 */
    private final Map<Integer, ConstValue> constants = new HashMap<>();
    /** 元素个数静态已知的数组局部变量 → 个数 */
    private final Map<Integer, Long> staticArrayCounts = new HashMap<>();
    /** 调用点 → 可达实现（每个调用点只查询一次） */
    private final Map<Object, List<Implementation>> implementations = new IdentityHashMap<>();
    /** 结果不存在的调用（无任何实现）的 dest */
    private final Set<Integer> unreachableCalls = new HashSet<>();

    public FunctionLowering(LoweringContext ctx, MirFunction function) {
        this.ctx = ctx;
        this.function = function;
        this.builder = new MirBuilder(function, function.getEntryBlock());
        this.allocation = new AllocationLowering(ctx, this);
        this.dispatch = new DispatchLowering(ctx, this);
        this.freeze = new FreezeLowering(this);
    }

    public MirFunction getFunction() { return function; }
    public MirBuilder getBuilder() { return builder; }

    public void lower() {
        analyze();
        List<BasicBlock> original = new ArrayList<>(function.getBlocks());
        for (BasicBlock block : original) {
            List<MirInst> insts = new ArrayList<>(block.getInstructions());
            MirTerminator terminator = block.getTerminator();
            if (terminator == null) {
                throw new LoweringException("Block B" + block.getId() + " of " + function.getName()
                        + " has no terminator", SourceLocation.UNKNOWN);
            }
            block.getInstructions().clear();
            block.setTerminator(null);
            builder.switchToBlock(block);
            for (MirInst inst : insts) {
                lowerInstruction(inst);
            }
            lowerTerminator(terminator);
        }
        verifyLowered(function);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("lowered " + function.getName() + ": " + original.size() + " -> "
                    + function.getBlocks().size() + " blocks");
        }
    }

    private void lowerInstruction(MirInst inst) {
        switch (inst.getOp()) {
            case NEW_OBJECT:
                allocation.lowerNewObject(inst);
                break;
            case NEW_ARRAY:
                allocation.lowerNewArray(inst);
                break;
            case NEW_ARRAY_ZEROED:
                allocation.lowerNewArrayZeroed(inst);
                break;
            case ARRAY_CLONE:
                allocation.lowerArrayClone(inst);
                break;
            case ARRAY_SIZE:
                allocation.lowerArrayHeaderLoad(inst, MemoryLayout.ARRAY_COUNT_BIT_OFFSET);
                break;
            case ARRAY_HASH:
                allocation.lowerArrayHeaderLoad(inst, MemoryLayout.ARRAY_HASH_BIT_OFFSET);
                break;
            case ARRAY_GET:
                allocation.lowerArrayGet(inst);
                break;
            case ARRAY_SET:
                allocation.lowerArraySet(inst);
                break;
            case GET_FIELD:
                allocation.lowerGetField(inst);
                break;
            case SET_FIELD:
                allocation.lowerSetField(inst);
                break;
            case WITH:
                allocation.lowerWith(inst);
                break;
            case CALL_VIRTUAL:
                dispatch.lowerVirtualCall(inst);
                break;
            case FREEZE:
                freeze.lowerFreeze(inst);
                break;
            case EXTRACT:
                lowerExtract(inst);
                break;
            case TUPLE:
            case CONST:
            case MOVE:
            case BINARY:
            case CONVERT:
            case ALLOC:
            case PTR_ADD:
            case LOAD:
            case STORE:
            case MEMCPY:
            case LOAD_VTABLE_SLOT:
            case CALL_STATIC:
            case CALL_INDIRECT:
            case CALL_RUNTIME:
                builder.emit(inst);
                break;
            default:
                throw new LoweringException("Unhandled MIR op " + inst.getOp(), inst.getLocation());
        }
    }

    private void lowerTerminator(MirTerminator terminator) {
        switch (terminator.kind) {
            case MirTerminator.KIND_TYPE_SWITCH:
                dispatch.lowerTypeSwitch((MirTerminator.TypeSwitch) terminator);
                break;
            case MirTerminator.KIND_INVOKE_VIRTUAL:
                dispatch.lowerInvokeVirtual((MirTerminator.InvokeVirtual) terminator);
                break;
            default:
                builder.terminate(terminator);
                break;
        }
    }

    /**
     * 来源调用不可达时，分量提取退化为该分量类型的零值。
     */
    private void lowerExtract(MirInst inst) {
        if (!unreachableCalls.contains(inst.operand(0))) {
            builder.emit(inst);
            return;
        }
        MirType type = function.getLocalType(inst.getDest());
        ConstValue zero = type.zeroValue();
        if (zero == null) {
            throw new LoweringException("Cannot substitute a zero value of type " + type
                    + " for an extraction from an unreachable call", inst.getLocation());
        }
        builder.emitConstTo(inst.getDest(), zero, inst.getLocation());
    }

    // ========== 预分析 ==========

    private void analyze() {
        Map<Integer, Integer> defCounts = new HashMap<>();
        for (int param : function.getParams()) {
            defCounts.merge(param, 1, Integer::sum);
        }
        for (BasicBlock block : function.getBlocks()) {
            for (int param : block.getParams()) {
                defCounts.merge(param, 1, Integer::sum);
            }
            for (MirInst inst : block.getInstructions()) {
                if (inst.hasDest()) defCounts.merge(inst.getDest(), 1, Integer::sum);
            }
            MirTerminator t = block.getTerminator();
            if (t instanceof MirTerminator.InvokeVirtual && ((MirTerminator.InvokeVirtual) t).getDest() >= 0) {
                defCounts.merge(((MirTerminator.InvokeVirtual) t).getDest(), 1, Integer::sum);
            }
        }
        for (BasicBlock block : function.getBlocks()) {
            for (MirInst inst : block.getInstructions()) {
                if (inst.getOp() == MirOp.CONST && defCounts.get(inst.getDest()) == 1) {
                    constants.put(inst.getDest(), inst.<ConstValue>extraAs());
                }
            }
        }
        for (BasicBlock block : function.getBlocks()) {
            for (MirInst inst : block.getInstructions()) {
                if (inst.hasDest() && defCounts.get(inst.getDest()) == 1) {
                    recordStaticCount(inst);
                }
                if (inst.getOp() == MirOp.CALL_VIRTUAL) {
                    List<Implementation> impls = implementationsFor(inst,
                            function.getLocalType(inst.operand(0)), inst.<String>extraAs(), inst.getLocation());
                    if (impls.isEmpty() && inst.hasDest()) unreachableCalls.add(inst.getDest());
                }
            }
            if (block.getTerminator() instanceof MirTerminator.InvokeVirtual) {
                MirTerminator.InvokeVirtual invoke = (MirTerminator.InvokeVirtual) block.getTerminator();
                List<Implementation> impls = implementationsFor(invoke,
                        function.getLocalType(invoke.getReceiver()), invoke.getMethodName(), invoke.getLocation());
                if (impls.isEmpty() && invoke.getDest() >= 0) unreachableCalls.add(invoke.getDest());
            }
        }
    }

    private void recordStaticCount(MirInst inst) {
        if (inst.getOp() == MirOp.NEW_ARRAY) {
            MirClass cls = ctx.getHierarchy().find(inst.<String>extraAs());
            if (cls != null && cls.isArray() && !cls.getArrayElementTypes().isEmpty()) {
                staticArrayCounts.put(inst.getDest(),
                        (long) (inst.getOperands().length / cls.getArrayElementTypes().size()));
            }
        } else if (inst.getOp() == MirOp.NEW_ARRAY_ZEROED) {
            Long count = constantLong(inst.operand(0));
            if (count != null) staticArrayCounts.put(inst.getDest(), count);
        }
    }

    // ========== 供各降级组件使用 ==========

    List<Implementation> implementationsFor(Object site, MirType receiver, String methodName,
                                            SourceLocation location) {
        List<Implementation> cached = implementations.get(site);
        if (cached != null) return cached;
        List<Implementation> impls;
        try {
            impls = ctx.getMethodResolver().allImplementations(receiver, methodName);
        } catch (LoweringException e) {
            throw relocate(e, location);
        }
        implementations.put(site, impls);
        return impls;
    }

    /** 只被定义一次的常量局部变量的值，否则为 null */
    ConstValue constantOf(int local) {
        return constants.get(local);
    }

    Long constantLong(int local) {
        ConstValue value = constants.get(local);
        if (value instanceof ConstValue.Scalar && ((ConstValue.Scalar) value).getType().isInteger()) {
            return ((ConstValue.Scalar) value).getBits();
        }
        return null;
    }

    Long staticArrayCount(int local) {
        return staticArrayCounts.get(local);
    }

    /**
     * 发射运行时诊断陷阱调用：trap(message, subject)。
     */
    void emitTrap(String message, int subject, SourceLocation location) {
        int msg = builder.emitConst(new ConstValue.Str(message), MirType.ofPtr(), location);
        builder.emitCallRuntime(ctx.getConfig().getTrapFunction(), new int[]{msg, subject}, location);
    }

    /**
     * 当前块已以 unreachable 终止，后续指令转入一个没有前驱的新块。
     */
    void continueInDeadBlock() {
        builder.switchToBlock(builder.newBlock());
    }

    static LoweringException relocate(LoweringException e, SourceLocation location) {
        if (!SourceLocation.UNKNOWN.equals(e.getLocation())) return e;
        LoweringException located = new LoweringException(e.getRawMessage(), location);
        located.initCause(e);
        return located;
    }

    /**
     * 降级后不应再出现任何对象模型操作。
     */
    public static void verifyLowered(MirFunction function) {
        for (BasicBlock block : function.getBlocks()) {
            for (MirInst inst : block.getInstructions()) {
                if (inst.getOp().isObjectModel()) {
                    throw new LoweringException("Object-model op " + inst.getOp() + " survived lowering in "
                            + function.getName(), inst.getLocation());
                }
            }
            MirTerminator t = block.getTerminator();
            if (t == null || t.isObjectModel()) {
                throw new LoweringException("Block B" + block.getId() + " of " + function.getName()
                        + " is not properly terminated after lowering",
                        t != null ? t.getLocation() : SourceLocation.UNKNOWN);
            }
        }
    }
}
