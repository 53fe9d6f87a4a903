package com.corvid.ir.lowering;

import com.corvid.ir.LoweringException;
import com.corvid.ir.SourceLocation;
import com.corvid.ir.layout.MemoryLayout;
import com.corvid.ir.mir.BasicBlock;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.ConvertOp;
import com.corvid.ir.mir.MemoryAccess;
import com.corvid.ir.mir.MirBuilder;
import com.corvid.ir.mir.MirClass;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirTerminator;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.mir.Successor;
import com.corvid.ir.mir.TypeCase;
import com.corvid.ir.resolve.Implementation;
import com.corvid.ir.vtable.VTableEntry;
import com.corvid.ir.vtable.VTableRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 虚调用与运行时类型分派的降级。
 *
 * <p>所有分派信息都以 vtable 请求的形式表达：每个具体类在一个尚未定位的槽位上暴露一个常量
 * （函数入口、布尔、代码标签或分派下标），运行时经接收者的 vtable 指针读出。</p>
 */
public class DispatchLowering {

    private static final Logger LOG = Logger.getLogger(DispatchLowering.class.getName());

    private final LoweringContext ctx;
    private final FunctionLowering fl;
    private final MirBuilder b;

    DispatchLowering(LoweringContext ctx, FunctionLowering fl) {
        this.ctx = ctx;
        this.fl = fl;
        this.b = fl.getBuilder();
    }

    // ========== 虚调用 ==========

    void lowerVirtualCall(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        String method = inst.extraAs();
        int[] args = inst.getOperands();
        int receiver = args[0];
        MirType receiverType = b.typeOf(receiver);
        List<Implementation> impls = fl.implementationsFor(inst, receiverType, method, loc);
        if (impls.isEmpty()) {
            emitUnreachableCall(method, receiverType, receiver, inst.getDest(), loc);
            fl.continueInDeadBlock();
            return;
        }
        int fn = loadEntryPoint(receiver, method, impls, loc);
        b.emitCallIndirectTo(inst.getDest(), prepend(fn, args), loc);
    }

    void lowerInvokeVirtual(MirTerminator.InvokeVirtual invoke) {
        SourceLocation loc = invoke.getLocation();
        int receiver = invoke.getReceiver();
        MirType receiverType = b.typeOf(receiver);
        List<Implementation> impls = fl.implementationsFor(invoke, receiverType, invoke.getMethodName(), loc);
        if (impls.isEmpty()) {
            emitUnreachableCall(invoke.getMethodName(), receiverType, receiver, invoke.getDest(), loc);
            return;
        }
        int fn = loadEntryPoint(receiver, invoke.getMethodName(), impls, loc);
        b.terminate(new MirTerminator.InvokeIndirect(loc, invoke.getDest(), prepend(fn, invoke.getArgs()),
                invoke.getNormal(), invoke.getUnwind()));
    }

    private int loadEntryPoint(int receiver, String method, List<Implementation> impls, SourceLocation loc) {
        List<VTableEntry> entries = new ArrayList<>(impls.size());
        for (Implementation impl : impls) {
            requireReferenceClass(impl.getClassName(), "virtual call to " + method, loc);
            entries.add(new VTableEntry(impl.getClassName(), new ConstValue.FunctionRef(impl.getFunctionName())));
        }
        VTableRequest request = ctx.getRegistry().submit(entries, method, loc);
        int vtable = loadVTableWord(receiver, loc);
        return b.emitLoadVTableSlot(vtable, request, MirType.ofPtr(), loc);
    }

    /**
     * 没有任何实现的调用：陷阱 + unreachable；有标量结果时以零值代替，后续提取同样退化为零。
     */
    private void emitUnreachableCall(String method, MirType receiverType, int receiver, int dest,
                                     SourceLocation loc) {
        fl.emitTrap("unreachable call to " + method + " on " + receiverType, receiver, loc);
        if (dest >= 0) {
            MirType resultType = b.typeOf(dest);
            if (resultType.isScalar()) {
                b.emitConstTo(dest, resultType.zeroValue(), loc);
            }
        }
        b.emitUnreachable(loc);
    }

    // ========== 类型分派 ==========

    void lowerTypeSwitch(MirTerminator.TypeSwitch typeSwitch) {
        SourceLocation loc = typeSwitch.getLocation();
        int value = typeSwitch.getValue();
        List<TypeCase> cases = typeSwitch.getCases();
        for (TypeCase c : cases) {
            requireReferenceClass(c.getClassName(), "type switch case", loc);
        }
        MirType valueType = b.typeOf(value);
        if (!valueType.isRef()) {
            throw new LoweringException("Type switch on non-reference value %" + value + ": " + valueType, loc);
        }
        List<String> concrete = ctx.getMethodResolver().concreteSubclasses(valueType.getClassName());
        if (concrete.isEmpty()) {
            fl.emitTrap("unreachable type switch on " + valueType.getClassName(), value, loc);
            b.emitUnreachable(loc);
            return;
        }

        // 每个具体类选中的后继
        Map<String, Successor> chosen = new LinkedHashMap<>();
        boolean[] used = new boolean[cases.size()];
        for (String cls : concrete) {
            requireReferenceClass(cls, "type switch subject", loc);
            int index;
            try {
                index = ctx.getMethodResolver().findTypeSwitchSuccessor(cls, cases);
            } catch (LoweringException e) {
                throw FunctionLowering.relocate(e, loc);
            }
            used[index] = true;
            chosen.put(cls, cases.get(index).getSuccessor());
        }
        List<Successor> distinct = new ArrayList<>();
        for (int i = 0; i < cases.size(); i++) {
            Successor s = cases.get(i).getSuccessor();
            if (used[i] && !distinct.contains(s)) distinct.add(s);
        }

        String site = fl.getFunction().getName() + ":B" + b.getCurrentBlock().getId();
        if (tryLoadAndJump(value, chosen, distinct, site, loc)) {
            LOG.finer(() -> "type switch " + site + ": load-and-jump");
            return;
        }
        if (distinct.size() == 2) {
            LOG.finer(() -> "type switch " + site + ": boolean branch");
            emitBooleanBranch(value, chosen, distinct, site, loc);
        } else if (ctx.getConfig().isComputedJumpsSupported()) {
            LOG.finer(() -> "type switch " + site + ": computed jump over " + distinct.size() + " targets");
            emitComputedJump(value, chosen, distinct, site, loc);
        } else {
            LOG.finer(() -> "type switch " + site + ": dense switch over " + distinct.size() + " targets");
            emitDenseSwitch(value, chosen, distinct, site, loc);
        }
    }

    /**
     * 策略 1：所有后继指向同一块。每个实参位置要么各类相同（直接传递），要么是随类变化的常量
     * （放进 vtable 读出）。有非常量的变化实参时失败，此时不发射任何代码。
     */
    private boolean tryLoadAndJump(int value, Map<String, Successor> chosen, List<Successor> distinct,
                                   String site, SourceLocation loc) {
        int target = distinct.get(0).getTargetBlockId();
        for (Successor s : distinct) {
            if (s.getTargetBlockId() != target) return false;
        }
        int arity = distinct.get(0).getArgs().length;
        int[] newArgs = new int[arity];
        // 位置 → 每个类的常量；null 表示直接传递
        List<Map<String, ConstValue>> varying = new ArrayList<>(arity);
        for (int pos = 0; pos < arity; pos++) {
            int first = distinct.get(0).getArgs()[pos];
            boolean same = true;
            for (Successor s : distinct) {
                if (s.getArgs()[pos] != first) {
                    same = false;
                    break;
                }
            }
            if (same) {
                newArgs[pos] = first;
                varying.add(null);
                continue;
            }
            Map<String, ConstValue> perClass = new LinkedHashMap<>();
            for (Map.Entry<String, Successor> e : chosen.entrySet()) {
                ConstValue constant = fl.constantOf(e.getValue().getArgs()[pos]);
                if (constant == null) return false;
                perClass.put(e.getKey(), constant);
            }
            varying.add(perClass);
        }

        BasicBlock targetBlock = fl.getFunction().getBlock(target);
        int vtable = -1;
        for (int pos = 0; pos < arity; pos++) {
            Map<String, ConstValue> perClass = varying.get(pos);
            if (perClass == null) continue;
            MirType paramType = fl.getFunction().getLocalType(targetBlock.getParams().get(pos));
            if (allEqual(perClass)) {
                newArgs[pos] = b.emitConst(perClass.values().iterator().next(), paramType, loc);
                continue;
            }
            List<VTableEntry> entries = new ArrayList<>(perClass.size());
            for (Map.Entry<String, ConstValue> e : perClass.entrySet()) {
                entries.add(new VTableEntry(e.getKey(), e.getValue()));
            }
            VTableRequest request = ctx.getRegistry().submit(entries, "typeswitch " + site + " arg" + pos, loc);
            if (vtable < 0) vtable = loadVTableWord(value, loc);
            newArgs[pos] = b.emitLoadVTableSlot(vtable, request, paramType, loc);
        }
        b.terminate(new MirTerminator.Goto(loc, new Successor(target, newArgs)));
        return true;
    }

    /**
     * 策略 2：恰好两个不同后继，每个类一个布尔。
     */
    private void emitBooleanBranch(int value, Map<String, Successor> chosen, List<Successor> distinct,
                                   String site, SourceLocation loc) {
        Successor first = distinct.get(0);
        List<VTableEntry> entries = new ArrayList<>(chosen.size());
        for (Map.Entry<String, Successor> e : chosen.entrySet()) {
            entries.add(new VTableEntry(e.getKey(), ConstValue.ofBool(e.getValue().equals(first))));
        }
        VTableRequest request = ctx.getRegistry().submit(entries, "typeswitch " + site, loc);
        int vtable = loadVTableWord(value, loc);
        int cond = b.emitLoadVTableSlot(vtable, request, MirType.ofBool(), loc);
        b.terminate(new MirTerminator.Branch(loc, cond, first, distinct.get(1)));
    }

    /**
     * 策略 3a：vtable 中存代码标签，间接跳转。带实参的后继经跳板块转发。
     */
    private void emitComputedJump(int value, Map<String, Successor> chosen, List<Successor> distinct,
                                  String site, SourceLocation loc) {
        String fnName = fl.getFunction().getName();
        Map<Successor, Integer> labelBlocks = new LinkedHashMap<>();
        List<Successor> targets = new ArrayList<>(distinct.size());
        for (Successor s : distinct) {
            int blockId;
            if (s.getArgs().length == 0) {
                blockId = s.getTargetBlockId();
            } else {
                BasicBlock trampoline = b.newBlock();
                trampoline.setTerminator(new MirTerminator.Goto(loc, s));
                blockId = trampoline.getId();
            }
            labelBlocks.put(s, blockId);
            targets.add(new Successor(blockId));
        }
        List<VTableEntry> entries = new ArrayList<>(chosen.size());
        for (Map.Entry<String, Successor> e : chosen.entrySet()) {
            entries.add(new VTableEntry(e.getKey(), new ConstValue.Label(fnName, labelBlocks.get(e.getValue()))));
        }
        VTableRequest request = ctx.getRegistry().submit(entries, "typeswitch " + site, loc);
        int vtable = loadVTableWord(value, loc);
        int address = b.emitLoadVTableSlot(vtable, request, MirType.ofLabel(), loc);
        b.terminate(new MirTerminator.IndirectJump(loc, address, targets));
    }

    /**
     * 策略 3b：vtable 中存最小宽度的分派下标，零扩展后做稠密 switch，默认分支不可达。
     */
    private void emitDenseSwitch(int value, Map<String, Successor> chosen, List<Successor> distinct,
                                 String site, SourceLocation loc) {
        MirType indexType = MirType.smallestUnsignedFor(distinct.size() - 1);
        List<VTableEntry> entries = new ArrayList<>(chosen.size());
        for (Map.Entry<String, Successor> e : chosen.entrySet()) {
            entries.add(new VTableEntry(e.getKey(), ConstValue.scalar(indexType, distinct.indexOf(e.getValue()))));
        }
        VTableRequest request = ctx.getRegistry().submit(entries, "typeswitch " + site, loc);
        int vtable = loadVTableWord(value, loc);
        int index = b.emitLoadVTableSlot(vtable, request, indexType, loc);
        int key = b.emitConvert(ConvertOp.ZEXT, index, MirType.ofI64(), loc);
        Map<Long, Successor> switchCases = new LinkedHashMap<>();
        for (int i = 0; i < distinct.size(); i++) {
            switchCases.put((long) i, distinct.get(i));
        }
        b.terminate(new MirTerminator.Switch(loc, key, switchCases, null));
    }

    // ========== 公共 ==========

    /**
     * vtable 指针字。冻结会改写它的标志位，因此不可缓存。
     */
    private int loadVTableWord(int reference, SourceLocation loc) {
        return b.emitLoad(reference, new MemoryAccess(MemoryLayout.VTABLE_BIT_OFFSET, MirType.ofPtr(), false), loc);
    }

    private void requireReferenceClass(String className, String what, SourceLocation loc) {
        MirClass cls = ctx.getHierarchy().require(className, loc);
        if (!cls.isReference()) {
            throw new LoweringException("Value class " + className + " reached " + what
                    + "; it should have been dispatched statically", loc);
        }
    }

    private static boolean allEqual(Map<String, ConstValue> perClass) {
        ConstValue first = null;
        for (ConstValue v : perClass.values()) {
            if (first == null) first = v;
            else if (!first.equals(v)) return false;
        }
        return true;
    }

    private static int[] prepend(int first, int[] rest) {
        int[] result = new int[rest.length + 1];
        result[0] = first;
        System.arraycopy(rest, 0, result, 1, rest.length);
        return result;
    }
}
