package com.corvid.ir.mir;

import com.corvid.ir.vtable.VTableLayout;

import java.util.Map;

/**
 * 将 MIR 模块渲染为文本（调试 dump 与 CLI 输出）。
 */
public final class MirPrinter {

    private MirPrinter() {
    }

    public static String print(MirModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(module.getName()).append('\n');
        for (MirClass cls : module.getClasses()) {
            sb.append(cls);
            if (cls.getSuperClass() != null) sb.append(" : ").append(cls.getSuperClass());
            sb.append(" {\n");
            for (MirField field : cls.getFields()) {
                sb.append("  ").append(field).append('\n');
            }
            if (cls.isArray()) {
                sb.append("  [").append(MirType.ofTuple(cls.getArrayElementTypes())).append("]\n");
            }
            for (Map.Entry<String, String> m : cls.getMethods().entrySet()) {
                sb.append("  method ").append(m.getKey()).append(" = @").append(m.getValue()).append('\n');
            }
            sb.append("}\n");
        }
        for (Map.Entry<String, ConstValue> c : module.getConstants().entrySet()) {
            sb.append("const @").append(c.getKey()).append(" = ").append(c.getValue()).append('\n');
        }
        for (MirFunction function : module.getFunctions()) {
            sb.append(print(function));
        }
        VTableLayout layout = module.getVTableLayout();
        if (layout != null) {
            sb.append(layout);
        }
        return sb.toString();
    }

    public static String print(MirFunction function) {
        StringBuilder sb = new StringBuilder(function.toString());
        // 局部变量表，降级产生的临时变量只计数
        sb.append("  locals:\n");
        int temporaries = 0;
        for (MirLocal local : function.getLocals()) {
            if (local.isTemporary()) {
                temporaries++;
            } else {
                sb.append("    ").append(local).append('\n');
            }
        }
        if (temporaries > 0) {
            sb.append("    (").append(temporaries).append(" temporaries)\n");
        }
        return sb.toString();
    }
}
