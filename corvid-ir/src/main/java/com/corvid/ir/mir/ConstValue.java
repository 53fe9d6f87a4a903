package com.corvid.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 编译期常量。既是 {@link MirOp#CONST} 指令的载荷，也是 vtable 槽位中存放的值，
 * 还用于描述序列化的常量数据（{@link Aggregate}）。
 */
public abstract class ConstValue {

    protected ConstValue() {
    }

    /**
     * 常量的位模式是否全为 0（整数 0、+0.0、空指针）。
     */
    public abstract boolean isAllZeroBits();

    public static Scalar scalar(MirType type, long bits) {
        return new Scalar(type, bits);
    }

    public static Scalar ofBool(boolean value) {
        return new Scalar(MirType.ofBool(), value ? 1L : 0L);
    }

    public static Scalar ofI64(long value) {
        return new Scalar(MirType.ofI64(), value);
    }

    public static Scalar ofF64(double value) {
        return new Scalar(MirType.ofF64(), Double.doubleToRawLongBits(value));
    }

    public static Null nullValue() {
        return Null.INSTANCE;
    }

    /**
     * 整数/浮点/布尔标量，按原始位模式保存。
     */
    public static final class Scalar extends ConstValue {
        private final MirType type;
        private final long bits;

        private Scalar(MirType type, long bits) {
            this.type = type;
            this.bits = bits;
        }

        public MirType getType() { return type; }
        public long getBits() { return bits; }

        @Override
        public boolean isAllZeroBits() {
            return bits == 0L;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Scalar)) return false;
            Scalar s = (Scalar) o;
            return bits == s.bits && type.equals(s.type);
        }

        @Override
        public int hashCode() {
            return type.hashCode() * 31 + Long.hashCode(bits);
        }

        @Override
        public String toString() {
            switch (type.getKind()) {
                case BOOL: return bits != 0 ? "true" : "false";
                case F32:  return Float.intBitsToFloat((int) bits) + "f32";
                case F64:  return Double.longBitsToDouble(bits) + "f64";
                default:   return bits + type.toString();
            }
        }
    }

    /**
     * 空指针。
     */
    public static final class Null extends ConstValue {
        static final Null INSTANCE = new Null();

        private Null() {
        }

        @Override
        public boolean isAllZeroBits() {
            return true;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    /**
     * 字符串字面量（诊断消息使用）。
     */
    public static final class Str extends ConstValue {
        private final String value;

        public Str(String value) {
            this.value = value;
        }

        public String getValue() { return value; }

        @Override
        public boolean isAllZeroBits() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Str && value.equals(((Str) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return '"' + value.replace("\"", "\\\"") + '"';
        }
    }

    /**
     * 函数入口地址。
     */
    public static final class FunctionRef extends ConstValue {
        private final String functionName;

        public FunctionRef(String functionName) {
            this.functionName = functionName;
        }

        public String getFunctionName() { return functionName; }

        @Override
        public boolean isAllZeroBits() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FunctionRef && functionName.equals(((FunctionRef) o).functionName);
        }

        @Override
        public int hashCode() {
            return functionName.hashCode() * 17;
        }

        @Override
        public String toString() {
            return "@" + functionName;
        }
    }

    /**
     * 函数内某个基本块的代码标签（计算跳转的目标）。
     */
    public static final class Label extends ConstValue {
        private final String functionName;
        private final int blockId;

        public Label(String functionName, int blockId) {
            this.functionName = functionName;
            this.blockId = blockId;
        }

        public String getFunctionName() { return functionName; }
        public int getBlockId() { return blockId; }

        @Override
        public boolean isAllZeroBits() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Label)) return false;
            Label l = (Label) o;
            return blockId == l.blockId && functionName.equals(l.functionName);
        }

        @Override
        public int hashCode() {
            return functionName.hashCode() * 31 + blockId;
        }

        @Override
        public String toString() {
            return "label " + functionName + ":B" + blockId;
        }
    }

    /**
     * 某个类的 vtable 地址（由 vtable 填充阶段决定具体值）。
     */
    public static final class VTableRef extends ConstValue {
        private final String className;

        public VTableRef(String className) {
            this.className = className;
        }

        public String getClassName() { return className; }

        @Override
        public boolean isAllZeroBits() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof VTableRef && className.equals(((VTableRef) o).className);
        }

        @Override
        public int hashCode() {
            return className.hashCode() * 13;
        }

        @Override
        public String toString() {
            return "vtable " + className;
        }
    }

    /**
     * 序列化常量数据中的对象/结构体/数组。组件可以共享子结构（驻留），
     * 因此相等性按引用判断。
     */
    public static final class Aggregate extends ConstValue {
        private final String className;
        private final List<ConstValue> components;

        public Aggregate(String className, List<ConstValue> components) {
            this.className = Objects.requireNonNull(className, "className");
            this.components = new ArrayList<>(components);
        }

        public String getClassName() { return className; }

        public List<ConstValue> getComponents() {
            return Collections.unmodifiableList(components);
        }

        /** 构造环形常量图时回填组件 */
        public void setComponent(int index, ConstValue value) {
            components.set(index, value);
        }

        @Override
        public boolean isAllZeroBits() {
            return false;
        }

        @Override
        public String toString() {
            return "const " + className + "[" + components.size() + "]";
        }
    }
}
