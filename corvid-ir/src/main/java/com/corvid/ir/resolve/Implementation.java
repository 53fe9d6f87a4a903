package com.corvid.ir.resolve;

/**
 * 某个具体类对一个方法选中的实现入口。
 */
public final class Implementation {

    private final String className;
    private final String functionName;

    public Implementation(String className, String functionName) {
        this.className = className;
        this.functionName = functionName;
    }

    public String getClassName() { return className; }
    public String getFunctionName() { return functionName; }

    @Override
    public String toString() {
        return className + " -> @" + functionName;
    }
}
