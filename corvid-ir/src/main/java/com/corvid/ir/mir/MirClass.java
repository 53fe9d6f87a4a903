package com.corvid.ir.mir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MIR 类。
 *
 * <p>fields 是完整的字段列表（继承字段已由上游展平）。数组类额外携带元组元素类型。</p>
 */
public class MirClass {

    /** 引用类（堆上、有 vtable）或值类（拆箱为标量/聚合，不经过本降级） */
    public enum Kind {
        REFERENCE, VALUE
    }

    private final String name;
    private final Kind kind;
    private final String superClass;
    private final boolean isAbstract;
    private final List<MirField> fields;
    private final Map<String, String> methods;
    private final List<MirType> arrayElementTypes;

    public MirClass(String name, Kind kind, String superClass, boolean isAbstract,
                    List<MirField> fields, Map<String, String> methods) {
        this(name, kind, superClass, isAbstract, fields, methods, null);
    }

    public MirClass(String name, Kind kind, String superClass, boolean isAbstract,
                    List<MirField> fields, Map<String, String> methods,
                    List<MirType> arrayElementTypes) {
        this.name = name;
        this.kind = kind;
        this.superClass = superClass;
        this.isAbstract = isAbstract;
        this.fields = fields != null ? fields : Collections.<MirField>emptyList();
        this.methods = methods != null ? new LinkedHashMap<>(methods) : new LinkedHashMap<String, String>();
        this.arrayElementTypes = arrayElementTypes;
    }

    public String getName() { return name; }
    public Kind getKind() { return kind; }
    public String getSuperClass() { return superClass; }
    public boolean isAbstract() { return isAbstract; }
    public List<MirField> getFields() { return fields; }

    /** 方法名 → 实现函数名（仅本类声明/覆盖的方法） */
    public Map<String, String> getMethods() { return methods; }

    public List<MirType> getArrayElementTypes() { return arrayElementTypes; }

    public boolean isArray() {
        return arrayElementTypes != null;
    }

    public boolean isReference() {
        return kind == Kind.REFERENCE;
    }

    public MirField findField(String fieldName) {
        for (MirField f : fields) {
            if (f.getName().equals(fieldName)) return f;
        }
        return null;
    }

    @Override
    public String toString() {
        return (isAbstract ? "abstract " : "") + kind.name().toLowerCase() + " class " + name;
    }
}
