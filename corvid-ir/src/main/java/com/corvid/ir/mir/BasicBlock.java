package com.corvid.ir.mir;

import java.util.ArrayList;
import java.util.List;

/**
 * MIR 基本块。块参数（params）在进入块时由前驱边的实参赋值。
 */
public class BasicBlock {

    private final int id;
    private final List<Integer> params;
    private final List<MirInst> instructions;
    private MirTerminator terminator;

    public BasicBlock(int id) {
        this.id = id;
        this.params = new ArrayList<>();
        this.instructions = new ArrayList<>();
    }

    public int getId() { return id; }

    public List<Integer> getParams() { return params; }

    public void addParam(int local) {
        params.add(local);
    }

    public List<MirInst> getInstructions() { return instructions; }

    public void addInstruction(MirInst inst) {
        instructions.add(inst);
    }

    public MirTerminator getTerminator() { return terminator; }

    public void setTerminator(MirTerminator terminator) {
        this.terminator = terminator;
    }

    public boolean hasTerminator() {
        return terminator != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("B").append(id);
        if (!params.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append('%').append(params.get(i));
            }
            sb.append(')');
        }
        sb.append(":\n");
        for (MirInst inst : instructions) {
            sb.append("  ").append(inst).append('\n');
        }
        if (terminator != null) {
            sb.append("  ").append(terminator).append('\n');
        }
        return sb.toString();
    }
}
