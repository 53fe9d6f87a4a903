package com.corvid.ir.mir;

import com.corvid.ir.vtable.VTableLayout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MIR 模块（整个程序）。
 */
public class MirModule {

    private final String name;
    private final List<MirClass> classes;
    private final List<MirFunction> functions;
    /** 需要序列化进数据段的常量：全局名 → 常量 */
    private final Map<String, ConstValue> constants;
    /** 降级完成后由 vtable 填充阶段写入 */
    private VTableLayout vtableLayout;

    public MirModule(String name) {
        this(name, new ArrayList<MirClass>(), new ArrayList<MirFunction>());
    }

    public MirModule(String name, List<MirClass> classes, List<MirFunction> functions) {
        this.name = name;
        this.classes = classes;
        this.functions = functions;
        this.constants = new LinkedHashMap<>();
    }

    public String getName() { return name; }
    public List<MirClass> getClasses() { return classes; }
    public List<MirFunction> getFunctions() { return functions; }
    public Map<String, ConstValue> getConstants() { return constants; }

    public void addClass(MirClass cls) {
        classes.add(cls);
    }

    public void addFunction(MirFunction function) {
        functions.add(function);
    }

    public void addConstant(String globalName, ConstValue value) {
        constants.put(globalName, value);
    }

    public MirFunction findFunction(String functionName) {
        for (MirFunction f : functions) {
            if (f.getName().equals(functionName)) return f;
        }
        return null;
    }

    public VTableLayout getVTableLayout() { return vtableLayout; }
    public void setVTableLayout(VTableLayout vtableLayout) { this.vtableLayout = vtableLayout; }
}
