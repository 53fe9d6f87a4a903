package com.corvid.ir.lowering;

import com.corvid.ir.SourceLocation;
import com.corvid.ir.layout.MemoryLayout;
import com.corvid.ir.mir.BasicBlock;
import com.corvid.ir.mir.BinaryOp;
import com.corvid.ir.mir.MemoryAccess;
import com.corvid.ir.mir.MirBuilder;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirTerminator;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.mir.Successor;

/**
 * 冻结：在 vtable 指针字上置冻结标志位。
 *
 * <p>可能已冻结的值可能位于只读存储中，再写一次会触发写保护错误，所以先测试标志位；
 * 静态已知可变的值直接写。</p>
 */
public class FreezeLowering {

    private final MirBuilder b;

    FreezeLowering(FunctionLowering fl) {
        this.b = fl.getBuilder();
    }

    void lowerFreeze(MirInst inst) {
        SourceLocation loc = inst.getLocation();
        int value = inst.operand(0);
        MirType type = b.typeOf(value);
        if (!type.isRef() || type.getMutability() == MirType.Mutability.FROZEN) {
            b.emitMoveTo(value, inst.getDest(), loc);
            return;
        }
        MemoryAccess vtableWord = new MemoryAccess(MemoryLayout.VTABLE_BIT_OFFSET, MirType.ofI64(), false);
        int word = b.emitLoad(value, vtableWord, loc);
        int flag = b.emitConstLong(MemoryLayout.FROZEN_FLAG, loc);

        if (type.getMutability() == MirType.Mutability.MAYBE_FROZEN) {
            int bits = b.emitBinary(BinaryOp.BAND, word, flag, MirType.ofI64(), loc);
            int zero = b.emitConstLong(0, loc);
            int isFrozen = b.emitBinary(BinaryOp.NE, bits, zero, MirType.ofBool(), loc);
            BasicBlock setFlag = b.newBlock();
            BasicBlock cont = b.newBlock();
            b.terminate(new MirTerminator.Branch(loc, isFrozen, new Successor(cont.getId()),
                    new Successor(setFlag.getId())));
            b.switchToBlock(setFlag);
            storeFlag(value, word, flag, vtableWord, loc);
            b.terminate(new MirTerminator.Goto(loc, new Successor(cont.getId())));
            b.switchToBlock(cont);
        } else {
            storeFlag(value, word, flag, vtableWord, loc);
        }
        b.emitMoveTo(value, inst.getDest(), loc);
    }

    private void storeFlag(int value, int word, int flag, MemoryAccess vtableWord, SourceLocation loc) {
        int frozenWord = b.emitBinary(BinaryOp.BOR, word, flag, MirType.ofI64(), loc);
        b.emitStore(value, frozenWord, vtableWord, loc);
    }
}
