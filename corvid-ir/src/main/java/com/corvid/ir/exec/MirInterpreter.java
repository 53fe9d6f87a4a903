package com.corvid.ir.exec;

import com.corvid.ir.TargetConfig;
import com.corvid.ir.layout.MemoryLayout;
import com.corvid.ir.mir.BasicBlock;
import com.corvid.ir.mir.BinaryOp;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.ConvertOp;
import com.corvid.ir.mir.MemoryAccess;
import com.corvid.ir.mir.MirFunction;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.mir.MirTerminator;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.mir.Successor;
import com.corvid.ir.vtable.VTableLayout;
import com.corvid.ir.vtable.VTableRequest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 降级后 MIR 的解释器。
 *
 * <p>只接受底层操作：对象模型操作、类型分派与虚调用终止指令一律拒绝。
 * vtable 按模块上的 {@link VTableLayout} 物化到堆中，函数、代码标签和字符串用带标记的句柄表示。</p>
 */
public class MirInterpreter {

    private static final Logger LOG = Logger.getLogger(MirInterpreter.class.getName());

    static final long FUNCTION_TAG = 0x7F00_0000_0000_0000L;
    static final long LABEL_TAG = 0x7E00_0000_0000_0000L;
    static final long STRING_TAG = 0x7D00_0000_0000_0000L;
    static final long TAG_MASK = 0xFF00_0000_0000_0000L;

    private final MirModule module;
    private final TargetConfig config;
    private final Heap heap = new Heap();
    private final Map<String, Integer> functionIndex = new HashMap<>();
    private final Map<String, Long> vtableAddresses = new HashMap<>();
    private final Map<Long, String> vtableClasses = new HashMap<>();
    private final List<String> strings = new ArrayList<>();
    private long maxSteps = 1_000_000;
    private long steps;

    public MirInterpreter(MirModule module) {
        this(module, new TargetConfig());
    }

    public MirInterpreter(MirModule module, TargetConfig config) {
        this.module = module;
        this.config = config;
        for (int i = 0; i < module.getFunctions().size(); i++) {
            functionIndex.put(module.getFunctions().get(i).getName(), i);
        }
        materializeVTables();
    }

    public Heap getHeap() { return heap; }

    public void setMaxSteps(long maxSteps) {
        this.maxSteps = maxSteps;
    }

    /** 类的 vtable 地址（未生成 vtable 时为 null） */
    public Long vtableAddress(String className) {
        return vtableAddresses.get(className);
    }

    /**
     * 调用函数。返回值：void 为空数组，标量为单元素数组，元组为全部分量。
     */
    public long[] call(String functionName, long... args) {
        steps = 0;
        return invoke(requireFunction(functionName), args);
    }

    private void materializeVTables() {
        VTableLayout layout = module.getVTableLayout();
        if (layout == null) return;
        for (VTableLayout.VTable vtable : layout.getVTables().values()) {
            long address = heap.allocate(Math.max(VTableLayout.SLOT_BYTES, vtable.getByteSize()), true);
            vtableAddresses.put(vtable.getClassName(), address);
            vtableClasses.put(address, vtable.getClassName());
        }
        for (VTableLayout.VTable vtable : layout.getVTables().values()) {
            long address = vtableAddresses.get(vtable.getClassName());
            for (Map.Entry<Long, ConstValue> slot : vtable.getSlots().entrySet()) {
                heap.write(address + slot.getKey(), 0, 64, encode(slot.getValue()));
            }
        }
        heap.clearStores();
        LOG.fine(() -> "materialized " + vtableAddresses.size() + " vtables");
    }

    // ========== 执行 ==========

    private long[] invoke(MirFunction function, long[] args) {
        if (!function.hasBody()) {
            throw new IllegalStateException("Function " + function.getName() + " has no body");
        }
        if (args.length != function.getParams().size()) {
            throw new IllegalStateException("Function " + function.getName() + " expects "
                    + function.getParams().size() + " arguments, got " + args.length);
        }
        MirFrame frame = new MirFrame(function);
        for (int i = 0; i < args.length; i++) {
            frame.values[function.getParams().get(i)] = args[i];
        }
        while (true) {
            BasicBlock block = function.getBlock(frame.currentBlockId);
            for (MirInst inst : block.getInstructions()) {
                if (++steps > maxSteps) {
                    throw new IllegalStateException("step limit exceeded in " + function.getName());
                }
                execute(frame, inst);
            }
            MirTerminator t = block.getTerminator();
            switch (t.kind) {
                case MirTerminator.KIND_GOTO:
                    transfer(frame, ((MirTerminator.Goto) t).getTarget());
                    break;
                case MirTerminator.KIND_BRANCH: {
                    MirTerminator.Branch br = (MirTerminator.Branch) t;
                    transfer(frame, frame.values[br.getCondition()] != 0 ? br.getThenTarget() : br.getElseTarget());
                    break;
                }
                case MirTerminator.KIND_SWITCH: {
                    MirTerminator.Switch sw = (MirTerminator.Switch) t;
                    Successor target = sw.getCases().get(frame.values[sw.getKey()]);
                    if (target == null) target = sw.getDefaultTarget();
                    if (target == null) {
                        throw new IllegalStateException("Reached unreachable switch default with key "
                                + frame.values[sw.getKey()] + " in " + function.getName());
                    }
                    transfer(frame, target);
                    break;
                }
                case MirTerminator.KIND_INDIRECT_JUMP: {
                    MirTerminator.IndirectJump jump = (MirTerminator.IndirectJump) t;
                    long handle = frame.values[jump.getAddress()];
                    if ((handle & TAG_MASK) != LABEL_TAG) {
                        throw new IllegalStateException("Indirect jump to non-label value " + handle);
                    }
                    int blockId = (int) (handle & ~TAG_MASK);
                    Successor target = null;
                    for (Successor s : jump.getTargets()) {
                        if (s.getTargetBlockId() == blockId) target = s;
                    }
                    if (target == null) {
                        throw new IllegalStateException("Indirect jump to undeclared target B" + blockId);
                    }
                    transfer(frame, target);
                    break;
                }
                case MirTerminator.KIND_RETURN: {
                    int value = ((MirTerminator.Return) t).getValueLocal();
                    if (value < 0) return new long[0];
                    if (frame.tuples[value] != null) return frame.tuples[value].clone();
                    return new long[]{frame.values[value]};
                }
                case MirTerminator.KIND_UNREACHABLE:
                    throw new IllegalStateException("Reached unreachable terminator in " + function.getName()
                            + " B" + block.getId());
                case MirTerminator.KIND_INVOKE_INDIRECT: {
                    MirTerminator.InvokeIndirect invoke = (MirTerminator.InvokeIndirect) t;
                    long[] result = callIndirect(frame, invoke.getArgs());
                    storeResult(frame, invoke.getDest(), result);
                    transfer(frame, invoke.getNormal());
                    break;
                }
                default:
                    throw new IllegalStateException("Terminator " + t + " has not been lowered");
            }
        }
    }

    private void transfer(MirFrame frame, Successor target) {
        BasicBlock block = frame.function.getBlock(target.getTargetBlockId());
        int[] args = target.getArgs();
        List<Integer> params = block.getParams();
        if (args.length != params.size()) {
            throw new IllegalStateException("Edge to B" + block.getId() + " passes " + args.length
                    + " arguments for " + params.size() + " parameters");
        }
        long[] values = new long[args.length];
        long[][] tuples = new long[args.length][];
        for (int i = 0; i < args.length; i++) {
            values[i] = frame.values[args[i]];
            tuples[i] = frame.tuples[args[i]];
        }
        for (int i = 0; i < args.length; i++) {
            frame.values[params.get(i)] = values[i];
            frame.tuples[params.get(i)] = tuples[i];
        }
        frame.currentBlockId = block.getId();
    }

    private void execute(MirFrame frame, MirInst inst) {
        long[] v = frame.values;
        int[] ops = inst.getOperands();
        switch (inst.getOp()) {
            case CONST:
                v[inst.getDest()] = encode(inst.<ConstValue>extraAs());
                break;
            case MOVE:
                frame.copy(ops[0], inst.getDest());
                break;
            case TUPLE: {
                long[] tuple = new long[ops.length];
                for (int i = 0; i < ops.length; i++) tuple[i] = v[ops[i]];
                frame.tuples[inst.getDest()] = tuple;
                break;
            }
            case EXTRACT:
                v[inst.getDest()] = frame.tuples[ops[0]][inst.<Integer>extraAs()];
                break;
            case BINARY:
                v[inst.getDest()] = binary(inst.extraAs(), v[ops[0]], v[ops[1]],
                        frame.function.getLocalType(ops[0]), typeOf(frame, inst.getDest()));
                break;
            case CONVERT:
                v[inst.getDest()] = convert(inst.extraAs(), v[ops[0]],
                        frame.function.getLocalType(ops[0]), typeOf(frame, inst.getDest()));
                break;
            case ALLOC:
                v[inst.getDest()] = heap.allocate(v[ops[0]], inst.<Boolean>extraAs());
                break;
            case PTR_ADD: {
                long address = v[ops[0]] + inst.<Long>extraAs();
                if (ops.length > 1) address += v[ops[1]];
                v[inst.getDest()] = address;
                break;
            }
            case LOAD: {
                MemoryAccess access = inst.extraAs();
                v[inst.getDest()] = heap.read(v[ops[0]], access.getBitOffset(), access.getType().getBitSize());
                break;
            }
            case STORE: {
                MemoryAccess access = inst.extraAs();
                int bits = access.getType().getBitSize();
                heap.write(v[ops[0]], access.getBitOffset(), bits, mask(v[ops[1]], bits));
                break;
            }
            case MEMCPY:
                heap.copy(v[ops[0]], v[ops[1]], v[ops[2]]);
                break;
            case LOAD_VTABLE_SLOT:
                v[inst.getDest()] = loadVTableSlot(v[ops[0]], inst.extraAs(), typeOf(frame, inst.getDest()));
                break;
            case CALL_STATIC: {
                long[] args = new long[ops.length];
                for (int i = 0; i < ops.length; i++) args[i] = v[ops[i]];
                storeResult(frame, inst.getDest(), invoke(requireFunction(inst.extraAs()), args));
                break;
            }
            case CALL_INDIRECT:
                storeResult(frame, inst.getDest(), callIndirect(frame, ops));
                break;
            case CALL_RUNTIME:
                callRuntime(frame, inst);
                break;
            default:
                throw new IllegalStateException("MIR op " + inst.getOp() + " has not been lowered");
        }
    }

    private long[] callIndirect(MirFrame frame, int[] fnAndArgs) {
        long handle = frame.values[fnAndArgs[0]];
        if ((handle & TAG_MASK) != FUNCTION_TAG) {
            throw new IllegalStateException("Indirect call through non-function value " + handle);
        }
        MirFunction target = module.getFunctions().get((int) (handle & ~TAG_MASK));
        long[] args = new long[fnAndArgs.length - 1];
        for (int i = 1; i < fnAndArgs.length; i++) args[i - 1] = frame.values[fnAndArgs[i]];
        return invoke(target, args);
    }

    private void callRuntime(MirFrame frame, MirInst inst) {
        String name = inst.extraAs();
        if (name.equals(config.getTrapFunction())) {
            int[] ops = inst.getOperands();
            String message = ops.length > 0 ? decodeString(frame.values[ops[0]]) : "trap";
            long subject = ops.length > 1 ? frame.values[ops[1]] : 0;
            throw new TrapException(message, subject);
        }
        throw new IllegalStateException("Unknown runtime function " + name);
    }

    private static void storeResult(MirFrame frame, int dest, long[] result) {
        if (dest < 0) return;
        if (frame.function.getLocalType(dest).isTuple()) {
            frame.tuples[dest] = result;
        } else {
            frame.values[dest] = result.length > 0 ? result[0] : 0;
        }
    }

    private long loadVTableSlot(long vtableWord, VTableRequest request, MirType type) {
        long vtable = vtableWord & ~MemoryLayout.FLAG_BITS;
        String className = vtableClasses.get(vtable);
        if (className == null) {
            throw new IllegalStateException("Value " + vtableWord + " is not a vtable pointer");
        }
        VTableLayout layout = module.getVTableLayout();
        long offset = layout.getOffset(request.getId());
        if (!layout.getVTable(className).isOccupied(offset)) {
            throw new IllegalStateException("vtable of " + className + " has no slot for " + request);
        }
        return heap.read(vtable + offset, 0, type.getBitSize());
    }

    // ========== 值编码 ==========

    private long encode(ConstValue value) {
        if (value instanceof ConstValue.Scalar) {
            ConstValue.Scalar s = (ConstValue.Scalar) value;
            return mask(s.getBits(), s.getType().getBitSize());
        }
        if (value instanceof ConstValue.Null) return 0L;
        if (value instanceof ConstValue.Str) {
            strings.add(((ConstValue.Str) value).getValue());
            return STRING_TAG | (strings.size() - 1);
        }
        if (value instanceof ConstValue.FunctionRef) {
            String name = ((ConstValue.FunctionRef) value).getFunctionName();
            Integer index = functionIndex.get(name);
            if (index == null) throw new IllegalStateException("Unknown function @" + name);
            return FUNCTION_TAG | index;
        }
        if (value instanceof ConstValue.Label) {
            return LABEL_TAG | ((ConstValue.Label) value).getBlockId();
        }
        if (value instanceof ConstValue.VTableRef) {
            String className = ((ConstValue.VTableRef) value).getClassName();
            Long address = vtableAddresses.get(className);
            if (address == null) throw new IllegalStateException("No vtable was generated for " + className);
            return address;
        }
        throw new IllegalStateException("Constant " + value + " cannot be materialized by the interpreter");
    }

    private String decodeString(long handle) {
        if ((handle & TAG_MASK) != STRING_TAG) return String.valueOf(handle);
        return strings.get((int) (handle & ~TAG_MASK));
    }

    // ========== 算术 ==========

    private static long binary(BinaryOp op, long a, long b, MirType operandType, MirType resultType) {
        if (operandType.isFloat()) {
            return floatBinary(op, a, b, operandType);
        }
        int bits = operandType.getBitSize();
        long x = signExtend(a, bits);
        long y = signExtend(b, bits);
        long r;
        switch (op) {
            case ADD:  r = x + y; break;
            case SUB:  r = x - y; break;
            case MUL:  r = x * y; break;
            case DIV:
                if (y == 0) throw new ArithmeticException("division by zero");
                r = x / y;
                break;
            case MOD:
                if (y == 0) throw new ArithmeticException("division by zero");
                r = x % y;
                break;
            case EQ:   return mask(a, bits) == mask(b, bits) ? 1 : 0;
            case NE:   return mask(a, bits) != mask(b, bits) ? 1 : 0;
            case LT:   return x < y ? 1 : 0;
            case GT:   return x > y ? 1 : 0;
            case LE:   return x <= y ? 1 : 0;
            case GE:   return x >= y ? 1 : 0;
            case SHL:  r = x << y; break;
            case SHR:  r = x >> y; break;
            case USHR: r = mask(a, bits) >>> y; break;
            case BAND: r = a & b; break;
            case BOR:  r = a | b; break;
            case BXOR: r = a ^ b; break;
            default: throw new IllegalStateException("Unknown binary op " + op);
        }
        return mask(r, resultType.getBitSize());
    }

    private static long floatBinary(BinaryOp op, long a, long b, MirType type) {
        boolean f64 = type.getKind() == MirType.Kind.F64;
        double x = f64 ? Double.longBitsToDouble(a) : Float.intBitsToFloat((int) a);
        double y = f64 ? Double.longBitsToDouble(b) : Float.intBitsToFloat((int) b);
        double r;
        switch (op) {
            case ADD: r = x + y; break;
            case SUB: r = x - y; break;
            case MUL: r = x * y; break;
            case DIV: r = x / y; break;
            case MOD: r = x % y; break;
            case EQ:  return x == y ? 1 : 0;
            case NE:  return x != y ? 1 : 0;
            case LT:  return x < y ? 1 : 0;
            case GT:  return x > y ? 1 : 0;
            case LE:  return x <= y ? 1 : 0;
            case GE:  return x >= y ? 1 : 0;
            default: throw new IllegalStateException("Binary op " + op + " is not defined on " + type);
        }
        return f64 ? Double.doubleToRawLongBits(r) : Float.floatToRawIntBits((float) r) & 0xFFFFFFFFL;
    }

    private static long convert(ConvertOp op, long value, MirType from, MirType to) {
        switch (op) {
            case ZEXT:  return mask(value, from.getBitSize());
            case SEXT:  return mask(signExtend(value, from.getBitSize()), to.getBitSize());
            case TRUNC: return mask(value, to.getBitSize());
            default: throw new IllegalStateException("Unknown conversion " + op);
        }
    }

    static long mask(long value, int bits) {
        if (bits >= 64) return value;
        if (bits <= 0) return 0;
        return value & ((1L << bits) - 1);
    }

    static long signExtend(long value, int bits) {
        if (bits >= 64 || bits <= 0) return value;
        int shift = 64 - bits;
        return (value << shift) >> shift;
    }

    private static MirType typeOf(MirFrame frame, int local) {
        return frame.function.getLocalType(local);
    }

    private MirFunction requireFunction(String name) {
        Integer index = functionIndex.get(name);
        if (index == null) {
            throw new IllegalStateException("Unknown function @" + name);
        }
        return module.getFunctions().get(index);
    }
}
