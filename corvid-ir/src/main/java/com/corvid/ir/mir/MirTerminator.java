package com.corvid.ir.mir;

import com.corvid.ir.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MIR 基本块终止指令。每个基本块必须恰好有一个终止指令。
 */
public abstract class MirTerminator {

    // ===== 快速分派标记 =====
    public static final int KIND_GOTO = 0;
    public static final int KIND_BRANCH = 1;
    public static final int KIND_SWITCH = 2;
    public static final int KIND_INDIRECT_JUMP = 3;
    public static final int KIND_RETURN = 4;
    public static final int KIND_UNREACHABLE = 5;
    public static final int KIND_TYPE_SWITCH = 6;
    public static final int KIND_INVOKE_VIRTUAL = 7;
    public static final int KIND_INVOKE_INDIRECT = 8;

    protected final SourceLocation location;
    /** 子类类型标记，消除执行时的 instanceof 链。 */
    public final int kind;

    protected MirTerminator(SourceLocation location, int kind) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.kind = kind;
    }

    public SourceLocation getLocation() { return location; }

    /**
     * 所有出边（可能重复）。
     */
    public abstract List<Successor> getSuccessors();

    /**
     * 是否为必须由降级 pass 消除的高层终止指令。
     */
    public boolean isObjectModel() {
        return kind == KIND_TYPE_SWITCH || kind == KIND_INVOKE_VIRTUAL;
    }

    /**
     * 无条件跳转。
     */
    public static class Goto extends MirTerminator {
        private final Successor target;

        public Goto(SourceLocation location, Successor target) {
            super(location, KIND_GOTO);
            this.target = target;
        }

        public Successor getTarget() { return target; }

        @Override
        public List<Successor> getSuccessors() {
            return Collections.singletonList(target);
        }

        @Override
        public String toString() {
            return "goto " + target;
        }
    }

    /**
     * 条件分支。
     */
    public static class Branch extends MirTerminator {
        private final int condition;    // 条件局部变量
        private final Successor thenTarget;
        private final Successor elseTarget;

        public Branch(SourceLocation location, int condition, Successor thenTarget, Successor elseTarget) {
            super(location, KIND_BRANCH);
            this.condition = condition;
            this.thenTarget = thenTarget;
            this.elseTarget = elseTarget;
        }

        public int getCondition() { return condition; }
        public Successor getThenTarget() { return thenTarget; }
        public Successor getElseTarget() { return elseTarget; }

        @Override
        public List<Successor> getSuccessors() {
            List<Successor> succ = new ArrayList<>(2);
            succ.add(thenTarget);
            succ.add(elseTarget);
            return succ;
        }

        @Override
        public String toString() {
            return "branch %" + condition + " ? " + thenTarget + " : " + elseTarget;
        }
    }

    /**
     * 稠密整数 Switch（多路分支）。defaultTarget 为 null 表示默认分支不可达。
     */
    public static class Switch extends MirTerminator {
        private final int key;
        private final Map<Long, Successor> cases;
        private final Successor defaultTarget;

        public Switch(SourceLocation location, int key, Map<Long, Successor> cases, Successor defaultTarget) {
            super(location, KIND_SWITCH);
            this.key = key;
            this.cases = new LinkedHashMap<>(cases);
            this.defaultTarget = defaultTarget;
        }

        public int getKey() { return key; }
        public Map<Long, Successor> getCases() { return cases; }
        public Successor getDefaultTarget() { return defaultTarget; }

        public boolean isDefaultUnreachable() {
            return defaultTarget == null;
        }

        @Override
        public List<Successor> getSuccessors() {
            List<Successor> succ = new ArrayList<>(cases.values());
            if (defaultTarget != null) succ.add(defaultTarget);
            return succ;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("switch %").append(key).append(" [");
            boolean first = true;
            for (Map.Entry<Long, Successor> e : cases.entrySet()) {
                if (!first) sb.append(", ");
                first = false;
                sb.append(e.getKey()).append(": ").append(e.getValue());
            }
            sb.append("] default=").append(defaultTarget != null ? defaultTarget.toString() : "unreachable");
            return sb.toString();
        }
    }

    /**
     * 跳转到运行时装载的代码标签；targets 列出全部可能目标（均无块参数）。
     */
    public static class IndirectJump extends MirTerminator {
        private final int address;
        private final List<Successor> targets;

        public IndirectJump(SourceLocation location, int address, List<Successor> targets) {
            super(location, KIND_INDIRECT_JUMP);
            this.address = address;
            this.targets = new ArrayList<>(targets);
        }

        public int getAddress() { return address; }
        public List<Successor> getTargets() { return targets; }

        @Override
        public List<Successor> getSuccessors() {
            return Collections.unmodifiableList(targets);
        }

        @Override
        public String toString() {
            return "jump %" + address + " " + targets;
        }
    }

    /**
     * 返回。
     */
    public static class Return extends MirTerminator {
        private final int valueLocal;   // -1 = void

        public Return(SourceLocation location, int valueLocal) {
            super(location, KIND_RETURN);
            this.valueLocal = valueLocal;
        }

        public int getValueLocal() { return valueLocal; }

        @Override
        public List<Successor> getSuccessors() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return valueLocal >= 0 ? "return %" + valueLocal : "return";
        }
    }

    /**
     * 不可达。
     */
    public static class Unreachable extends MirTerminator {
        public Unreachable(SourceLocation location) {
            super(location, KIND_UNREACHABLE);
        }

        @Override
        public List<Successor> getSuccessors() {
            return Collections.emptyList();
        }

        @Override
        public String toString() { return "unreachable"; }
    }

    /**
     * 运行时类型分派（高层）。cases 覆盖 value 静态类型的每个具体子类。
     */
    public static class TypeSwitch extends MirTerminator {
        private final int value;
        private final List<TypeCase> cases;

        public TypeSwitch(SourceLocation location, int value, List<TypeCase> cases) {
            super(location, KIND_TYPE_SWITCH);
            this.value = value;
            this.cases = new ArrayList<>(cases);
        }

        public int getValue() { return value; }
        public List<TypeCase> getCases() { return cases; }

        @Override
        public List<Successor> getSuccessors() {
            List<Successor> succ = new ArrayList<>(cases.size());
            for (TypeCase c : cases) succ.add(c.getSuccessor());
            return succ;
        }

        @Override
        public String toString() {
            return "typeswitch %" + value + " " + cases;
        }
    }

    /**
     * 带异常边的虚调用（高层）。dest 在 normal 边上可用。
     */
    public static class InvokeVirtual extends MirTerminator {
        private final int dest;
        private final String methodName;
        private final int[] args;       // args[0] 为接收者
        private final Successor normal;
        private final Successor unwind;

        public InvokeVirtual(SourceLocation location, int dest, String methodName, int[] args,
                             Successor normal, Successor unwind) {
            super(location, KIND_INVOKE_VIRTUAL);
            this.dest = dest;
            this.methodName = methodName;
            this.args = args;
            this.normal = normal;
            this.unwind = unwind;
        }

        public int getDest() { return dest; }
        public String getMethodName() { return methodName; }
        public int[] getArgs() { return args; }
        public int getReceiver() { return args[0]; }
        public Successor getNormal() { return normal; }
        public Successor getUnwind() { return unwind; }

        @Override
        public List<Successor> getSuccessors() {
            List<Successor> succ = new ArrayList<>(2);
            succ.add(normal);
            succ.add(unwind);
            return succ;
        }

        @Override
        public String toString() {
            return (dest >= 0 ? "%" + dest + " = " : "") + "invoke " + methodName
                    + " " + argsToString(args) + " to " + normal + " unwind " + unwind;
        }
    }

    /**
     * 带异常边的间接调用（降级产物）。args[0] 为函数地址。
     */
    public static class InvokeIndirect extends MirTerminator {
        private final int dest;
        private final int[] args;
        private final Successor normal;
        private final Successor unwind;

        public InvokeIndirect(SourceLocation location, int dest, int[] args,
                              Successor normal, Successor unwind) {
            super(location, KIND_INVOKE_INDIRECT);
            this.dest = dest;
            this.args = args;
            this.normal = normal;
            this.unwind = unwind;
        }

        public int getDest() { return dest; }
        public int[] getArgs() { return args; }
        public int getFunction() { return args[0]; }
        public Successor getNormal() { return normal; }
        public Successor getUnwind() { return unwind; }

        @Override
        public List<Successor> getSuccessors() {
            List<Successor> succ = new ArrayList<>(2);
            succ.add(normal);
            succ.add(unwind);
            return succ;
        }

        @Override
        public String toString() {
            return (dest >= 0 ? "%" + dest + " = " : "") + "invoke_indirect "
                    + argsToString(args) + " to " + normal + " unwind " + unwind;
        }
    }

    static String argsToString(int[] args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            sb.append(i == 0 ? "%" : ", %").append(args[i]);
        }
        return sb.toString();
    }
}
