package com.corvid.ir.mir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MIR 函数（包含 CFG）。没有基本块的函数是外部声明，没有实现。
 */
public class MirFunction {

    private final String name;
    private final MirType returnType;
    private final List<Integer> params;
    private final List<BasicBlock> blocks;
    private final List<MirLocal> locals;
    /** blockId → BasicBlock（块只增不删，id 即创建序号） */
    private final Map<Integer, BasicBlock> blockIndex = new HashMap<>();

    public MirFunction(String name, MirType returnType) {
        this.name = name;
        this.returnType = returnType;
        this.params = new ArrayList<>();
        this.blocks = new ArrayList<>();
        this.locals = new ArrayList<>();
    }

    public String getName() { return name; }
    public MirType getReturnType() { return returnType; }
    public List<Integer> getParams() { return params; }
    public List<BasicBlock> getBlocks() { return blocks; }
    public List<MirLocal> getLocals() { return locals; }

    public boolean hasBody() {
        return !blocks.isEmpty();
    }

    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public BasicBlock newBlock() {
        BasicBlock block = new BasicBlock(blocks.size());
        blocks.add(block);
        blockIndex.put(block.getId(), block);
        return block;
    }

    public BasicBlock getBlock(int id) {
        BasicBlock block = blockIndex.get(id);
        if (block == null) {
            throw new IllegalArgumentException("No block B" + id + " in function " + name);
        }
        return block;
    }

    public int newLocal(String name, MirType type) {
        int index = locals.size();
        locals.add(new MirLocal(index, name, type));
        return index;
    }

    public int newParam(String name, MirType type) {
        int index = newLocal(name, type);
        params.add(index);
        return index;
    }

    public MirType getLocalType(int local) {
        return locals.get(local).getType();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fun ").append(name).append("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(locals.get(params.get(i)));
        }
        sb.append("): ").append(returnType).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block);
        }
        sb.append("}\n");
        return sb.toString();
    }
}
