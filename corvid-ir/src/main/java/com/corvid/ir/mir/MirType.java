package com.corvid.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * MIR 类型。降级前后共用：降级前引用类型携带类名与可变性，降级后只剩位宽。
 */
public final class MirType {

    public enum Kind {
        VOID, BOOL, I8, I16, I32, I64, F32, F64, PTR, LABEL, REF, TUPLE
    }

    /**
     * 引用类型的静态可变性。
     */
    public enum Mutability {
        /** 静态可证明深度不可变 */
        FROZEN,
        /** 静态已知可变 */
        MUTABLE,
        /** 可能已冻结（可能位于只读存储中） */
        MAYBE_FROZEN
    }

    private static final MirType VOID = new MirType(Kind.VOID, null, null, null);
    private static final MirType BOOL = new MirType(Kind.BOOL, null, null, null);
    private static final MirType I8 = new MirType(Kind.I8, null, null, null);
    private static final MirType I16 = new MirType(Kind.I16, null, null, null);
    private static final MirType I32 = new MirType(Kind.I32, null, null, null);
    private static final MirType I64 = new MirType(Kind.I64, null, null, null);
    private static final MirType F32 = new MirType(Kind.F32, null, null, null);
    private static final MirType F64 = new MirType(Kind.F64, null, null, null);
    private static final MirType PTR = new MirType(Kind.PTR, null, null, null);
    private static final MirType LABEL = new MirType(Kind.LABEL, null, null, null);

    private final Kind kind;
    private final String className;       // REF 时使用
    private final Mutability mutability;  // REF 时使用
    private final List<MirType> elements; // TUPLE 时使用

    private MirType(Kind kind, String className, Mutability mutability, List<MirType> elements) {
        this.kind = kind;
        this.className = className;
        this.mutability = mutability;
        this.elements = elements;
    }

    public static MirType ofVoid()  { return VOID; }
    public static MirType ofBool()  { return BOOL; }
    public static MirType ofI8()    { return I8; }
    public static MirType ofI16()   { return I16; }
    public static MirType ofI32()   { return I32; }
    public static MirType ofI64()   { return I64; }
    public static MirType ofF32()   { return F32; }
    public static MirType ofF64()   { return F64; }
    public static MirType ofPtr()   { return PTR; }
    public static MirType ofLabel() { return LABEL; }

    public static MirType ofRef(String className, Mutability mutability) {
        return new MirType(Kind.REF, className, mutability, null);
    }

    public static MirType ofRef(String className) {
        return ofRef(className, Mutability.MAYBE_FROZEN);
    }

    public static MirType ofTuple(List<MirType> elements) {
        return new MirType(Kind.TUPLE, null, null,
                Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    /**
     * 能容纳 [0, maxValue] 全部取值的最小无符号整数类型。
     */
    public static MirType smallestUnsignedFor(long maxValue) {
        if (maxValue <= 0xFFL) return I8;
        if (maxValue <= 0xFFFFL) return I16;
        if (maxValue <= 0xFFFFFFFFL) return I32;
        return I64;
    }

    public Kind getKind() { return kind; }
    public String getClassName() { return className; }
    public Mutability getMutability() { return mutability; }
    public List<MirType> getElements() { return elements; }

    public boolean isRef() { return kind == Kind.REF; }
    public boolean isTuple() { return kind == Kind.TUPLE; }

    public boolean isInteger() {
        switch (kind) {
            case BOOL: case I8: case I16: case I32: case I64: return true;
            default: return false;
        }
    }

    public boolean isFloat() {
        return kind == Kind.F32 || kind == Kind.F64;
    }

    /**
     * 是否有具体的标量表示（可以用一个零值替代）。
     */
    public boolean isScalar() {
        return kind != Kind.VOID && kind != Kind.TUPLE;
    }

    /**
     * 在内存中占用的位数。bool 占 1 位，允许被布局打包为位域。
     */
    public int getBitSize() {
        switch (kind) {
            case BOOL:  return 1;
            case I8:    return 8;
            case I16:   return 16;
            case I32:   case F32: return 32;
            case I64:   case F64: case PTR: case LABEL: case REF: return 64;
            case TUPLE: {
                int total = 0;
                for (MirType e : elements) total += e.getBitSize();
                return total;
            }
            default: return 0;
        }
    }

    /**
     * 该类型的零值常量；无标量表示时返回 null。
     */
    public ConstValue zeroValue() {
        switch (kind) {
            case BOOL: case I8: case I16: case I32: case I64: case F32: case F64:
                return ConstValue.scalar(this, 0L);
            case PTR: case LABEL: case REF:
                return ConstValue.nullValue();
            default:
                return null;
        }
    }

    /**
     * 解析 {@link #toString()} 的输出，例如 {@code i64}、{@code ref<Point,frozen>}、{@code (i64, bool)}。
     */
    public static MirType parse(String text) {
        String s = text.trim();
        if (s.startsWith("(") && s.endsWith(")")) {
            String body = s.substring(1, s.length() - 1).trim();
            List<MirType> elems = new ArrayList<>();
            if (!body.isEmpty()) {
                for (String part : splitTopLevel(body)) elems.add(parse(part));
            }
            return ofTuple(elems);
        }
        if (s.startsWith("ref<") && s.endsWith(">")) {
            String body = s.substring(4, s.length() - 1);
            int comma = body.indexOf(',');
            if (comma < 0) return ofRef(body.trim());
            String mut = body.substring(comma + 1).trim();
            Mutability m;
            switch (mut) {
                case "frozen":       m = Mutability.FROZEN; break;
                case "mutable":      m = Mutability.MUTABLE; break;
                case "maybe_frozen": m = Mutability.MAYBE_FROZEN; break;
                default: throw new IllegalArgumentException("Unknown mutability '" + mut + "' in type " + text);
            }
            return ofRef(body.substring(0, comma).trim(), m);
        }
        switch (s) {
            case "void":  return VOID;
            case "bool":  return BOOL;
            case "i8":    return I8;
            case "i16":   return I16;
            case "i32":   return I32;
            case "i64":   return I64;
            case "f32":   return F32;
            case "f64":   return F64;
            case "ptr":   return PTR;
            case "label": return LABEL;
            default: throw new IllegalArgumentException("Unknown MIR type: " + text);
        }
    }

    private static List<String> splitTopLevel(String body) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(' || c == '<') depth++;
            else if (c == ')' || c == '>') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(body.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(body.substring(start));
        return parts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MirType)) return false;
        MirType t = (MirType) o;
        return kind == t.kind && Objects.equals(className, t.className)
                && mutability == t.mutability && Objects.equals(elements, t.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, className, mutability, elements);
    }

    @Override
    public String toString() {
        switch (kind) {
            case REF:
                if (mutability == Mutability.FROZEN) return "ref<" + className + ",frozen>";
                if (mutability == Mutability.MUTABLE) return "ref<" + className + ",mutable>";
                return "ref<" + className + ">";
            case TUPLE: {
                StringBuilder sb = new StringBuilder("(");
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(elements.get(i));
                }
                return sb.append(')').toString();
            }
            default:
                return kind.name().toLowerCase();
        }
    }
}
