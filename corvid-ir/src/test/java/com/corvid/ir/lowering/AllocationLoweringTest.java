package com.corvid.ir.lowering;

import com.corvid.ir.LoweringException;
import com.corvid.ir.exec.MirInterpreter;
import com.corvid.ir.layout.ArraySlotInfo;
import com.corvid.ir.layout.DefaultLayoutOracle;
import com.corvid.ir.layout.LayoutOracle;
import com.corvid.ir.layout.LayoutSlot;
import com.corvid.ir.mir.BinaryOp;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.ConvertOp;
import com.corvid.ir.mir.MemoryAccess;
import com.corvid.ir.mir.MirBuilder;
import com.corvid.ir.mir.MirFunction;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.mir.MirOp;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.resolve.ClassHierarchy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.corvid.ir.MirFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("分配降级测试")
class AllocationLoweringTest {

    private MirModule module;

    @BeforeEach
    void setUp() {
        module = shapes();
    }

    private static ByteBuffer littleEndian(byte[] bytes) {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    private int i8(MirBuilder b, long value) {
        return b.emitConst(ConstValue.scalar(MirType.ofI8(), value), MirType.ofI8(), LOC);
    }

    private int i32(MirBuilder b, long value) {
        return b.emitConst(ConstValue.scalar(MirType.ofI32(), value), MirType.ofI32(), LOC);
    }

    private int bool(MirBuilder b, boolean value) {
        return b.emitConst(ConstValue.ofBool(value), MirType.ofBool(), LOC);
    }

    /** 用替换了 Point 布局的 oracle 降级 */
    private void lowerWithPointLayout(List<LayoutSlot> pointSlots) {
        DefaultLayoutOracle inner = new DefaultLayoutOracle(ClassHierarchy.of(module));
        ObjectModelLowering pass = new ObjectModelLowering();
        pass.setLayoutOracle(new LayoutOracle() {
            @Override
            public List<LayoutSlot> getLayout(String className) {
                return className.equals("Point") ? pointSlots : inner.getLayout(className);
            }

            @Override
            public ArraySlotInfo getArraySlotInfo(String className) {
                return inner.getArraySlotInfo(className);
            }

            @Override
            public int getFieldIndex(String className, String fieldName) {
                return inner.getFieldIndex(className, fieldName);
            }
        });
        pass.run(module);
    }

    @Nested
    @DisplayName("对象")
    class ObjectAllocation {

        @Test
        @DisplayName("构造后读回每个字段")
        void testFieldRoundTrip() {
            MirFunction f = function(module, "roundTrip", I64);
            MirBuilder b = new MirBuilder(f);
            int x = b.emitConstLong(11, LOC);
            int y = b.emitConstLong(-5, LOC);
            int p = b.emitNewObject("Point", new int[]{x, y}, LOC);
            int gx = b.emitGetField(p, "x", I64, LOC);
            int gy = b.emitGetField(p, "y", I64, LOC);
            b.emitReturn(b.emitBinary(BinaryOp.SUB, gx, gy, I64, LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);
            assertThat(interp.call("roundTrip")).containsExactly(16L);
        }

        @Test
        @DisplayName("位域布局的对象中未写入的位全部为零")
        void testZeroFillWithBitfields() {
            MirFunction f = function(module, "makeFlags", MirType.ofRef("Flags"));
            MirBuilder b = new MirBuilder(f);
            int a = bool(b, true);
            int x = b.emitConstLong(0x1122334455667788L, LOC);
            int bb = bool(b, false);
            int c = i8(b, 0x7F);
            b.emitReturn(b.emitNewObject("Flags", new int[]{a, x, bb, c}, LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);
            long p = interp.call("makeFlags")[0];
            ByteBuffer raw = littleEndian(interp.getHeap().readBytes(p - 8, 24));
            assertThat(raw.getLong(0)).isEqualTo(interp.vtableAddress("Flags"));
            assertThat(raw.getLong(8)).isEqualTo(0x1122334455667788L);
            assertThat(raw.get(16)).isEqualTo((byte) 0x7F);
            assertThat(raw.get(17)).isEqualTo((byte) 0x01);
            for (int i = 18; i < 24; i++) {
                assertThat(raw.get(i)).as("byte %d", i).isZero();
            }
        }

        @Test
        @DisplayName("分配本身不清零，空隙字在字段写入之前清零")
        void testGapStoresPrecedeFieldStores() {
            MirFunction f = function(module, "makeFlags", MirType.ofRef("Flags"));
            MirBuilder b = new MirBuilder(f);
            int a = bool(b, true);
            int x = b.emitConstLong(1, LOC);
            int c = i8(b, 2);
            b.emitReturn(b.emitNewObject("Flags", new int[]{a, x, a, c}, LOC), LOC);
            lower(module);

            assertThat(instructions(f, MirOp.ALLOC)).extracting(MirInst::getExtra).containsExactly(false);
            List<MemoryAccess> stores = stores(f);
            // vtable, 空隙字 1, 然后 x, c, a, b
            assertThat(stores).extracting(MemoryAccess::getBitOffset).containsExactly(0L, 64L, 0L, 64L, 72L, 73L);
            assertThat(stores.get(1).getType()).isEqualTo(MirType.ofI64());
        }

        @Test
        @DisplayName("稀疏布局中间的字被清零")
        void testSparseLayout() {
            MirFunction f = function(module, "makePoint", MirType.ofRef("Point"));
            MirBuilder b = new MirBuilder(f);
            int x = b.emitConstLong(3, LOC);
            int y = b.emitConstLong(4, LOC);
            b.emitReturn(b.emitNewObject("Point", new int[]{x, y}, LOC), LOC);
            MirFunction g = function(module, "readY", I64);
            MirBuilder gb = new MirBuilder(g);
            int p = gb.newParam("p", MirType.ofRef("Point"));
            gb.emitReturn(gb.emitGetField(p, "y", I64, LOC), LOC);

            lowerWithPointLayout(Arrays.asList(
                    new LayoutSlot("x", 0, I64),
                    new LayoutSlot("y", 192, I64)));
            MirInterpreter interp = new MirInterpreter(module);
            long ptr = interp.call("makePoint")[0];
            ByteBuffer raw = littleEndian(interp.getHeap().readBytes(ptr, 32));
            assertThat(raw.getLong(0)).isEqualTo(3);
            assertThat(raw.getLong(8)).isZero();
            assertThat(raw.getLong(16)).isZero();
            assertThat(raw.getLong(24)).isEqualTo(4);
            assertThat(interp.call("readY", ptr)).containsExactly(4L);
        }

        @Test
        @DisplayName("布局槽位数与字段数不符是致命错误")
        void testStaleLayout() {
            MirFunction f = function(module, "makePoint", MirType.ofRef("Point"));
            MirBuilder b = new MirBuilder(f);
            int x = b.emitConstLong(3, LOC);
            b.emitReturn(b.emitNewObject("Point", new int[]{x, x}, LOC), LOC);

            assertThatThrownBy(() -> lowerWithPointLayout(Collections.singletonList(new LayoutSlot("x", 0, I64))))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("1 slots")
                    .hasMessageContaining("2 fields")
                    .hasMessageContaining("test.cv:1:1");
        }

        @Test
        @DisplayName("值类与抽象类不能在堆上构造")
        void testValueAndAbstractClasses() {
            MirFunction f = function(module, "makeNum", MirType.ofVoid());
            MirBuilder b = new MirBuilder(f);
            int v = b.emitConstLong(1, LOC);
            b.emitNewObject("Num", new int[]{v}, LOC);
            b.emitReturn(-1, LOC);
            assertThatThrownBy(() -> lower(module))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("Value class Num");

            MirModule other = shapes();
            MirFunction g = function(other, "makeShape", MirType.ofVoid());
            MirBuilder gb = new MirBuilder(g);
            gb.emitNewObject("Shape", new int[0], LOC);
            gb.emitReturn(-1, LOC);
            assertThatThrownBy(() -> lower(other))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("abstract");
        }

        @Test
        @DisplayName("with 复制整个对象再覆盖字段，源对象不变")
        void testWith() {
            MirFunction f = function(module, "withY", I64);
            MirBuilder b = new MirBuilder(f);
            int one = b.emitConstLong(1, LOC);
            int two = b.emitConstLong(2, LOC);
            int nine = b.emitConstLong(9, LOC);
            int p = b.emitNewObject("Point", new int[]{one, two}, LOC);
            int q = b.emitWith(p, Collections.singletonList("y"), new int[]{nine}, LOC);
            int qx = b.emitGetField(q, "x", I64, LOC);
            int qy = b.emitGetField(q, "y", I64, LOC);
            int py = b.emitGetField(p, "y", I64, LOC);
            int hundred = b.emitConstLong(100, LOC);
            int ten = b.emitConstLong(10, LOC);
            int sum = b.emitBinary(BinaryOp.ADD,
                    b.emitBinary(BinaryOp.MUL, qx, hundred, I64, LOC),
                    b.emitBinary(BinaryOp.MUL, qy, ten, I64, LOC), I64, LOC);
            b.emitReturn(b.emitBinary(BinaryOp.ADD, sum, py, I64, LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);
            assertThat(interp.call("withY")).containsExactly(192L);
            assertThat(count(f, MirOp.MEMCPY)).isEqualTo(1);
        }

        @Test
        @DisplayName("with 作用于非确切类是致命错误")
        void testWithOnAbstractType() {
            MirFunction f = function(module, "withShape", MirType.ofVoid());
            MirBuilder b = new MirBuilder(f);
            int s = b.newParam("s", MirType.ofRef("Shape"));
            b.emitWith(s, Collections.<String>emptyList(), new int[0], LOC);
            b.emitReturn(-1, LOC);
            assertThatThrownBy(() -> lower(module))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("exact concrete class");
        }

        @Test
        @DisplayName("只有冻结引用上的字段读取可缓存")
        void testFieldLoadCacheability() {
            MirFunction f = function(module, "frozenX", I64);
            MirBuilder b = new MirBuilder(f);
            int p = b.newParam("p", MirType.ofRef("Point", MirType.Mutability.FROZEN));
            b.emitReturn(b.emitGetField(p, "x", I64, LOC), LOC);
            MirFunction g = function(module, "plainX", I64);
            MirBuilder gb = new MirBuilder(g);
            int q = gb.newParam("q", MirType.ofRef("Point"));
            gb.emitReturn(gb.emitGetField(q, "x", I64, LOC), LOC);
            lower(module);

            assertThat(instructions(f, MirOp.LOAD).get(0).<MemoryAccess>extraAs().isCacheable()).isTrue();
            assertThat(instructions(g, MirOp.LOAD).get(0).<MemoryAccess>extraAs().isCacheable()).isFalse();
        }
    }

    @Nested
    @DisplayName("数组")
    class ArrayAllocation {

        @ParameterizedTest(name = "count = {0}")
        @ValueSource(ints = {0, 1, 5, 8, 13})
        @DisplayName("构造后立即读取长度")
        void testLength(int n) {
            MirFunction dyn = function(module, "dynamicLength", I64);
            MirBuilder b = new MirBuilder(dyn);
            int count = b.newParam("n", I64);
            b.emitReturn(b.emitArraySize(b.emitNewArrayZeroed("Words", count, LOC), LOC), LOC);

            MirFunction lit = function(module, "literalLength", I64);
            MirBuilder lb = new MirBuilder(lit);
            int[] elements = new int[n];
            for (int i = 0; i < n; i++) elements[i] = i8(lb, i + 1);
            lb.emitReturn(lb.emitArraySize(lb.emitNewArray("Bytes", elements, LOC), LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);
            assertThat(interp.call("dynamicLength", n)).containsExactly((long) n);
            assertThat(interp.call("literalLength")).containsExactly((long) n);
        }

        @Test
        @DisplayName("长度读取是可缓存的 32 位负偏移读取")
        void testSizeLoad() {
            MirFunction f = function(module, "size", I64);
            MirBuilder b = new MirBuilder(f);
            int a = b.newParam("a", MirType.ofRef("Words"));
            b.emitReturn(b.emitArraySize(a, LOC), LOC);
            lower(module);

            MemoryAccess access = instructions(f, MirOp.LOAD).get(0).extraAs();
            assertThat(access.getBitOffset()).isEqualTo(-128);
            assertThat(access.getType()).isEqualTo(MirType.ofI32());
            assertThat(access.isCacheable()).isTrue();
            assertThat(count(f, MirOp.CONVERT)).isEqualTo(1);
        }

        @Test
        @DisplayName("字面量中静态为零的元素不写入")
        void testZeroElementsSkipped() {
            MirFunction f = function(module, "literal", I64);
            MirBuilder b = new MirBuilder(f);
            int zero = b.emitConstLong(0, LOC);
            int five = b.emitConstLong(5, LOC);
            int arr = b.emitNewArray("Words", new int[]{zero, five, zero}, LOC);
            int one = b.emitConstLong(1, LOC);
            b.emitReturn(b.emitArrayGet(arr, one, 0, I64, LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);
            // 长度、vtable、唯一的非零元素
            assertThat(count(f, MirOp.STORE)).isEqualTo(3);
            assertThat(instructions(f, MirOp.ALLOC)).extracting(MirInst::getExtra).containsExactly(true);
            assertThat(interp.call("literal")).containsExactly(5L);
        }

        @Test
        @DisplayName("元组元素按分量读写")
        void testTupleElements() {
            MirFunction f = function(module, "pairs", MirType.ofI32());
            MirBuilder b = new MirBuilder(f);
            int arr = b.emitNewArray("Pairs", new int[]{i32(b, 7), bool(b, true), i32(b, 0), bool(b, false)}, LOC);
            int zero = b.emitConstLong(0, LOC);
            int one = b.emitConstLong(1, LOC);
            b.emitArraySet(arr, one, 1, bool(b, true), LOC);
            int flag = b.emitArrayGet(arr, one, 1, MirType.ofBool(), LOC);
            int first = b.emitArrayGet(arr, zero, 0, MirType.ofI32(), LOC);
            int second = b.emitArrayGet(arr, one, 0, MirType.ofI32(), LOC);
            int flag32 = b.emitConvert(ConvertOp.ZEXT, flag, MirType.ofI32(), LOC);
            int hundred = i32(b, 100);
            int r = b.emitBinary(BinaryOp.ADD, b.emitBinary(BinaryOp.MUL, first, hundred, MirType.ofI32(), LOC),
                    b.emitBinary(BinaryOp.ADD, second, flag32, MirType.ofI32(), LOC), MirType.ofI32(), LOC);
            b.emitReturn(r, LOC);

            MirInterpreter interp = lowerAndLoad(module);
            assertThat(interp.call("pairs")).containsExactly(701L);
        }

        @Test
        @DisplayName("克隆后修改副本不影响源数组")
        void testCloneDoesNotAlias() {
            MirFunction f = function(module, "cloneAndMutate", I64);
            MirBuilder b = new MirBuilder(f);
            int src = b.emitNewArray("Words",
                    new int[]{b.emitConstLong(1, LOC), b.emitConstLong(2, LOC), b.emitConstLong(3, LOC)}, LOC);
            int copy = b.emitArrayClone(src, LOC);
            int one = b.emitConstLong(1, LOC);
            b.emitArraySet(copy, one, 0, b.emitConstLong(99, LOC), LOC);
            int s = b.emitArrayGet(src, one, 0, I64, LOC);
            int c = b.emitArrayGet(copy, one, 0, I64, LOC);
            int k = b.emitConstLong(1000, LOC);
            b.emitReturn(b.emitBinary(BinaryOp.ADD, b.emitBinary(BinaryOp.MUL, s, k, I64, LOC), c, I64, LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);
            assertThat(interp.call("cloneAndMutate")).containsExactly(2099L);
            assertThat(instructions(f, MirOp.ALLOC)).extracting(MirInst::getExtra).containsExactly(true, false);
        }

        @Test
        @DisplayName("动态长度克隆：不清零分配，尾部与哈希被显式清零")
        void testDynamicClone() {
            MirFunction make = function(module, "make", MirType.ofRef("Bytes"));
            MirBuilder mb = new MirBuilder(make);
            int[] elements = new int[5];
            for (int i = 0; i < 5; i++) elements[i] = i8(mb, i + 1);
            mb.emitReturn(mb.emitNewArray("Bytes", elements, LOC), LOC);
            MirFunction dup = function(module, "dup", MirType.ofRef("Bytes"));
            MirBuilder db = new MirBuilder(dup);
            int a = db.newParam("a", MirType.ofRef("Bytes"));
            db.emitReturn(db.emitArrayClone(a, LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);
            long src = interp.call("make")[0];
            long copy = interp.call("dup", src)[0];
            ByteBuffer raw = littleEndian(interp.getHeap().readBytes(copy - 16, 24));
            assertThat(raw.getInt(0)).isEqualTo(5);
            assertThat(raw.getInt(4)).isZero();
            assertThat(raw.getLong(8)).isEqualTo(interp.vtableAddress("Bytes"));
            for (int i = 0; i < 5; i++) {
                assertThat(raw.get(16 + i)).isEqualTo((byte) (i + 1));
            }
            for (int i = 21; i < 24; i++) {
                assertThat(raw.get(i)).as("tail byte %d", i).isZero();
            }
        }

        @Test
        @DisplayName("动态长度为 0 的克隆：尾部清零落在 vtable 字上并被随后覆盖")
        void testEmptyDynamicClone() {
            MirFunction make = function(module, "makeEmpty", MirType.ofRef("Bytes"));
            MirBuilder mb = new MirBuilder(make);
            mb.emitReturn(mb.emitNewArray("Bytes", new int[0], LOC), LOC);
            MirFunction dup = function(module, "dup", MirType.ofRef("Bytes"));
            MirBuilder db = new MirBuilder(dup);
            int a = db.newParam("a", MirType.ofRef("Bytes"));
            int copy = db.emitArrayClone(a, LOC);
            db.emitReturn(db.emitArrayHash(copy, LOC), LOC);
            MirFunction dupPtr = function(module, "dupPtr", MirType.ofRef("Bytes"));
            MirBuilder pb = new MirBuilder(dupPtr);
            int a2 = pb.newParam("a", MirType.ofRef("Bytes"));
            pb.emitReturn(pb.emitArrayClone(a2, LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);
            long src = interp.call("makeEmpty")[0];
            assertThat(interp.call("dup", src)).containsExactly(0L);
            long copyPtr = interp.call("dupPtr", src)[0];
            ByteBuffer raw = littleEndian(interp.getHeap().readBytes(copyPtr - 16, 16));
            assertThat(raw.getInt(0)).isZero();
            assertThat(raw.getLong(8)).isEqualTo(interp.vtableAddress("Bytes"));
        }

        @Test
        @DisplayName("常量长度克隆按尾部宽度选择对齐写")
        void testConstantTailStores() {
            MirFunction shorts = function(module, "cloneShorts", MirType.ofRef("Shorts"));
            MirBuilder sb = new MirBuilder(shorts);
            int s1 = sb.emitConst(ConstValue.scalar(MirType.ofI16(), 1), MirType.ofI16(), LOC);
            int src = sb.emitNewArray("Shorts", new int[]{s1, s1, s1}, LOC);
            sb.emitReturn(sb.emitArrayClone(src, LOC), LOC);

            MirFunction bytes = function(module, "cloneBytes", MirType.ofRef("Bytes"));
            MirBuilder bb = new MirBuilder(bytes);
            int b1 = i8(bb, 1);
            int bsrc = bb.emitNewArray("Bytes", new int[]{b1, b1, b1, b1, b1}, LOC);
            bb.emitReturn(bb.emitArrayClone(bsrc, LOC), LOC);

            MirFunction words = function(module, "cloneWords", MirType.ofRef("Words"));
            MirBuilder wb = new MirBuilder(words);
            int w = wb.emitConstLong(1, LOC);
            wb.emitReturn(wb.emitArrayClone(wb.emitNewArray("Words", new int[]{w}, LOC), LOC), LOC);

            MirInterpreter interp = lowerAndLoad(module);

            // 6 字节内容：16 位写覆盖第 6、7 字节
            assertThat(stores(shorts)).anySatisfy(a -> {
                assertThat(a.getType()).isEqualTo(MirType.ofI16());
                assertThat(a.getBitOffset()).isEqualTo(48);
            });
            // 5 字节内容：整字写覆盖最后一个字
            assertThat(stores(bytes)).anySatisfy(a -> {
                assertThat(a.getType()).isEqualTo(MirType.ofI64());
                assertThat(a.getBitOffset()).isEqualTo(0);
            });
            // 8 字节内容：无尾部写，只有长度、哈希、vtable 与字面量元素
            assertThat(stores(words)).hasSize(3 + 3);

            long copy = interp.call("cloneShorts")[0];
            ByteBuffer raw = littleEndian(interp.getHeap().readBytes(copy, 8));
            assertThat(raw.getShort(0)).isEqualTo((short) 1);
            assertThat(raw.getShort(4)).isEqualTo((short) 1);
            assertThat(raw.getShort(6)).isZero();
            long copyBytes = interp.call("cloneBytes")[0];
            byte[] content = interp.getHeap().readBytes(copyBytes, 8);
            assertThat(content).containsExactly(1, 1, 1, 1, 1, 0, 0, 0);
        }

        @Test
        @DisplayName("非数组类用作数组是致命错误")
        void testNotAnArrayClass() {
            MirFunction f = function(module, "bad", MirType.ofVoid());
            MirBuilder b = new MirBuilder(f);
            b.emitNewArray("Point", new int[0], LOC);
            b.emitReturn(-1, LOC);
            assertThatThrownBy(() -> lower(module))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("not a reference array class");
        }
    }

    @Nested
    @DisplayName("继承字段")
    class InheritedFields {

        private MirModule hierarchy;

        @BeforeEach
        void setUp() {
            hierarchy = inheritance();
        }

        /** new Derived(tag, big)，以 ref&lt;Base&gt; 返回 */
        private int newDerivedAsBase(MirBuilder b, long tag, long big) {
            int derived = b.emitNewObject("Derived", new int[]{i8(b, tag), b.emitConstLong(big, LOC)}, LOC);
            return b.emitMove(derived, MirType.ofRef("Base"), LOC);
        }

        @Test
        @DisplayName("子类对象上调用继承方法读取超类槽位")
        void testInheritedMethodOnSubclass() {
            MirFunction f = function(hierarchy, "tagOfDerived", MirType.ofI8());
            MirBuilder b = new MirBuilder(f);
            int base = newDerivedAsBase(b, 7, 0x1234);
            b.emitReturn(b.emitCallVirtual("tagOf", new int[]{base}, MirType.ofI8(), LOC), LOC);

            MirInterpreter interp = lowerAndLoad(hierarchy);
            assertThat(interp.call("tagOfDerived")).containsExactly(7L);
        }

        @Test
        @DisplayName("经超类引用写入字段，子类引用读回，不影响子类自己的字段")
        void testSetFieldThroughBaseReference() {
            MirFunction f = function(hierarchy, "retag", MirType.ofI8());
            MirBuilder b = new MirBuilder(f);
            int base = newDerivedAsBase(b, 1, 0x1234);
            b.emitSetField(base, "tag", i8(b, 9), LOC);
            int derived = b.emitMove(base, MirType.ofRef("Derived"), LOC);
            b.emitReturn(b.emitGetField(derived, "tag", MirType.ofI8(), LOC), LOC);

            MirFunction g = function(hierarchy, "retagThenBig", I64);
            MirBuilder gb = new MirBuilder(g);
            int base2 = newDerivedAsBase(gb, 1, 0x1234);
            gb.emitSetField(base2, "tag", i8(gb, 9), LOC);
            gb.emitReturn(gb.emitCallVirtual("bigOf", new int[]{gb.emitMove(base2, MirType.ofRef("Derived"), LOC)},
                    I64, LOC), LOC);

            MirInterpreter interp = lowerAndLoad(hierarchy);
            assertThat(interp.call("retag")).containsExactly(9L);
            assertThat(interp.call("retagThenBig")).containsExactly(0x1234L);
        }

        @Test
        @DisplayName("子类缺少继承字段时报告构造位置")
        void testMissingInheritedField() {
            hierarchy.addClass(refClass("Broken", "Base", false, fields("big", I64), methods()));
            MirFunction f = function(hierarchy, "makeBroken", MirType.ofRef("Broken"));
            MirBuilder b = new MirBuilder(f);
            b.emitReturn(b.emitNewObject("Broken", new int[]{b.emitConstLong(1, LOC)}, LOC), LOC);

            assertThatThrownBy(() -> lower(hierarchy))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("inherited field tag")
                    .hasMessageContaining("test.cv:1:1");
        }
    }

    @Nested
    @DisplayName("布局查询失败")
    class LayoutFailures {

        @Test
        @DisplayName("空元素元组的数组类")
        void testEmptyElementTuple() {
            module.addClass(arrayClass("Units"));
            MirFunction f = function(module, "units", MirType.ofRef("Units"));
            MirBuilder b = new MirBuilder(f);
            b.emitReturn(b.emitNewArrayZeroed("Units", b.emitConstLong(3, LOC), LOC), LOC);

            assertThatThrownBy(() -> lower(module))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("empty element tuple")
                    .hasMessageContaining("test.cv:1:1");
        }

        @Test
        @DisplayName("元组类型的字段无法布局")
        void testTupleField() {
            MirType pair = MirType.ofTuple(Arrays.asList(I64, I64));
            module.addClass(refClass("Holder", null, false, fields("pair", pair), methods()));
            MirFunction f = function(module, "holder", MirType.ofRef("Holder"));
            MirBuilder b = new MirBuilder(f);
            int value = b.emitTuple(new int[]{b.emitConstLong(1, LOC), b.emitConstLong(2, LOC)}, pair, LOC);
            b.emitReturn(b.emitNewObject("Holder", new int[]{value}, LOC), LOC);

            LoweringException e = catchThrowableOfType(() -> lower(module), LoweringException.class);
            assertThat(e).hasMessageContaining("Layout query failed")
                    .hasMessageContaining("test.cv:1:1")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }
}
