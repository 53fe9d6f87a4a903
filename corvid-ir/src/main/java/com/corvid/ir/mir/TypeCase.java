package com.corvid.ir.mir;

/**
 * 类型分派的一个分支：case 类 → 后继。
 */
public final class TypeCase {

    private final String className;
    private final Successor successor;

    public TypeCase(String className, Successor successor) {
        this.className = className;
        this.successor = successor;
    }

    public String getClassName() { return className; }
    public Successor getSuccessor() { return successor; }

    @Override
    public String toString() {
        return className + " -> " + successor;
    }
}
