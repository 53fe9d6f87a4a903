package com.corvid.ir.mir;

import java.util.Arrays;

/**
 * 控制流边：目标块 + 块参数。两条边目标与实参完全相同时视为同一后继。
 */
public final class Successor {

    private final int targetBlockId;
    private final int[] args;

    public Successor(int targetBlockId, int... args) {
        this.targetBlockId = targetBlockId;
        this.args = args != null ? args : new int[0];
    }

    public int getTargetBlockId() { return targetBlockId; }
    public int[] getArgs() { return args; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Successor)) return false;
        Successor s = (Successor) o;
        return targetBlockId == s.targetBlockId && Arrays.equals(args, s.args);
    }

    @Override
    public int hashCode() {
        return targetBlockId * 31 + Arrays.hashCode(args);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("B").append(targetBlockId);
        if (args.length > 0) {
            sb.append('(');
            for (int i = 0; i < args.length; i++) {
                if (i > 0) sb.append(", ");
                sb.append('%').append(args[i]);
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
