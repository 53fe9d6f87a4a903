package com.corvid.ir.resolve;

import com.corvid.ir.LoweringException;
import com.corvid.ir.SourceLocation;
import com.corvid.ir.mir.MirClass;
import com.corvid.ir.mir.MirModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块的类继承关系（整个程序可见）。
 */
public class ClassHierarchy {

    private final Map<String, MirClass> classes = new LinkedHashMap<>();
    private final Map<String, List<String>> directSubclasses = new HashMap<>();

    public ClassHierarchy(List<MirClass> classList) {
        for (MirClass cls : classList) {
            classes.put(cls.getName(), cls);
        }
        for (MirClass cls : classList) {
            String sup = cls.getSuperClass();
            if (sup != null) {
                directSubclasses.computeIfAbsent(sup, k -> new ArrayList<>()).add(cls.getName());
            }
        }
    }

    public static ClassHierarchy of(MirModule module) {
        return new ClassHierarchy(module.getClasses());
    }

    public MirClass find(String className) {
        return classes.get(className);
    }

    public MirClass require(String className, SourceLocation location) {
        MirClass cls = classes.get(className);
        if (cls == null) {
            throw new LoweringException("Unknown class " + className, location);
        }
        return cls;
    }

    public boolean isSubclassOf(String className, String ancestor) {
        String current = className;
        while (current != null) {
            if (current.equals(ancestor)) return true;
            MirClass cls = classes.get(current);
            current = cls != null ? cls.getSuperClass() : null;
        }
        return false;
    }

    /**
     * className 自身（若非抽象）及其全部非抽象后代，按先序遍历排列。
     */
    public List<String> concreteSubclasses(String className) {
        if (!classes.containsKey(className)) return Collections.emptyList();
        List<String> result = new ArrayList<>();
        List<String> work = new ArrayList<>();
        work.add(className);
        while (!work.isEmpty()) {
            String name = work.remove(work.size() - 1);
            MirClass cls = classes.get(name);
            if (cls == null) continue;
            if (!cls.isAbstract()) result.add(name);
            List<String> subs = directSubclasses.get(name);
            if (subs != null) {
                for (int i = subs.size() - 1; i >= 0; i--) work.add(subs.get(i));
            }
        }
        return result;
    }

    /**
     * 沿继承链查找方法实现，找不到返回 null。
     */
    public String lookupMethod(String className, String methodName) {
        String current = className;
        while (current != null) {
            MirClass cls = classes.get(current);
            if (cls == null) return null;
            String impl = cls.getMethods().get(methodName);
            if (impl != null) return impl;
            current = cls.getSuperClass();
        }
        return null;
    }
}
