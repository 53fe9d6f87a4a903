package com.corvid.ir.resolve;

import com.corvid.ir.mir.MirType;
import com.corvid.ir.mir.TypeCase;

import java.util.List;

/**
 * 方法解析查询（整个程序分析的结果）。
 */
public interface MethodResolver {

    /**
     * 调用点可达的每个具体类及其选中的实现。空列表表示调用静态不可达。
     */
    List<Implementation> allImplementations(MirType receiver, String methodName);

    /**
     * 具体类 className 在类型分派中命中的 case 下标。
     */
    int findTypeSwitchSuccessor(String className, List<TypeCase> cases);

    /**
     * 静态类型 className 在整个程序中的全部具体子类（含自身）。
     */
    List<String> concreteSubclasses(String className);
}
