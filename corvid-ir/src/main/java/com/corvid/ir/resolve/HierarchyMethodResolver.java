package com.corvid.ir.resolve;

import com.corvid.ir.LoweringException;
import com.corvid.ir.SourceLocation;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.mir.TypeCase;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于类继承关系的方法解析：具体子类沿继承链向上查找实现。
 */
public class HierarchyMethodResolver implements MethodResolver {

    private final ClassHierarchy hierarchy;

    public HierarchyMethodResolver(ClassHierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    @Override
    public List<Implementation> allImplementations(MirType receiver, String methodName) {
        List<Implementation> result = new ArrayList<>();
        if (!receiver.isRef()) return result;
        for (String cls : hierarchy.concreteSubclasses(receiver.getClassName())) {
            String impl = hierarchy.lookupMethod(cls, methodName);
            if (impl == null) {
                throw new LoweringException("Concrete class " + cls + " has no implementation of "
                        + methodName, SourceLocation.UNKNOWN);
            }
            result.add(new Implementation(cls, impl));
        }
        return result;
    }

    /**
     * 第一个类名等于 className 或为其祖先的 case。
     */
    @Override
    public int findTypeSwitchSuccessor(String className, List<TypeCase> cases) {
        for (int i = 0; i < cases.size(); i++) {
            if (hierarchy.isSubclassOf(className, cases.get(i).getClassName())) {
                return i;
            }
        }
        throw new LoweringException("Type switch does not cover class " + className, SourceLocation.UNKNOWN);
    }

    @Override
    public List<String> concreteSubclasses(String className) {
        return hierarchy.concreteSubclasses(className);
    }
}
