package com.corvid.ir.lowering;

import com.corvid.ir.LoweringException;
import com.corvid.ir.TargetConfig;
import com.corvid.ir.mir.BasicBlock;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.MirBuilder;
import com.corvid.ir.mir.MirFunction;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.mir.MirOp;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.pass.PassPipeline;
import com.corvid.ir.vtable.GreedyVTablePopulator;
import com.corvid.ir.vtable.VTableLayout;
import com.corvid.ir.vtable.VTablePopulator;
import com.corvid.ir.vtable.VTableRequest;
import com.corvid.ir.vtable.VTableRequestRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static com.corvid.ir.MirFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("对象模型降级 pass 测试")
class ObjectModelLoweringTest {

    private MirModule module;

    @BeforeEach
    void setUp() {
        module = shapes();
    }

    static Stream<MirOp> lowLevelOps() {
        return Arrays.stream(MirOp.values()).filter(op -> !op.isObjectModel());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("lowLevelOps")
    @DisplayName("底层操作原样保留")
    void testLowLevelOpPassesThrough(MirOp op) {
        MirFunction f = function(module, "passThrough", MirType.ofVoid());
        MirBuilder b = new MirBuilder(f);
        int a = b.newParam("a", I64);
        Object extra = op == MirOp.CONST ? ConstValue.ofI64(5) : null;
        MirInst inst = new MirInst(op, b.newTemp(I64), new int[]{a}, extra, LOC);
        b.emit(inst);
        b.emitReturn(-1, LOC);

        lower(module);
        assertThat(f.getEntryBlock().getInstructions()).containsExactly(inst);
    }

    @Test
    @DisplayName("没有函数体的函数被跳过")
    void testDeclarationsSkipped() {
        MirFunction declaration = new MirFunction("external", I64);
        declaration.newParam("x", I64);
        module.addFunction(declaration);

        lower(module);
        assertThat(declaration.getBlocks()).isEmpty();
    }

    @Test
    @DisplayName("缺少终止指令的块是致命错误")
    void testMissingTerminator() {
        MirFunction f = function(module, "open", I64);
        MirBuilder b = new MirBuilder(f);
        b.emitConstLong(1, LOC);

        assertThatThrownBy(() -> lower(module))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("no terminator");
    }

    @Test
    @DisplayName("降级校验拒绝残留的对象模型操作")
    void testVerifyLowered() {
        MirFunction f = function(module, "unlowered", I64);
        MirBuilder b = new MirBuilder(f);
        int p = b.newParam("p", MirType.ofRef("Point"));
        b.emitReturn(b.emitGetField(p, "x", I64, LOC), LOC);

        assertThatThrownBy(() -> FunctionLowering.verifyLowered(f))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("GET_FIELD");

        lower(module);
        assertThatCode(() -> FunctionLowering.verifyLowered(f)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("vtable 填充在所有函数降级后只调用一次")
    void testPopulatorCalledOnce() {
        for (String name : Arrays.asList("a", "b", "c")) {
            MirFunction f = function(module, name, I64);
            MirBuilder b = new MirBuilder(f);
            int s = b.newParam("s", MirType.ofRef("Shape"));
            b.emitReturn(b.emitCallVirtual(name.equals("a") ? "area" : "describe", new int[]{s}, I64, LOC), LOC);
        }
        AtomicInteger calls = new AtomicInteger();
        VTablePopulator greedy = new GreedyVTablePopulator();
        ObjectModelLowering pass = new ObjectModelLowering();
        pass.setPopulator(new VTablePopulator() {
            @Override
            public VTableLayout populate(Collection<VTableRequest> requests, Set<String> classes) {
                calls.incrementAndGet();
                assertThat(requests).hasSize(2);
                return greedy.populate(requests, classes);
            }
        });
        pass.run(module);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(module.getVTableLayout()).isNotNull();
        assertThat(module.getVTableLayout().getRequestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("常量图中的类（含环）都得到 vtable")
    void testConstantScavenging() {
        ConstValue.Aggregate origin = new ConstValue.Aggregate("Point",
                Arrays.<ConstValue>asList(ConstValue.ofI64(0), ConstValue.ofI64(0)));
        ConstValue.Aggregate ring = new ConstValue.Aggregate("Circle",
                Collections.<ConstValue>singletonList(origin));
        origin.setComponent(1, ring);
        module.addConstant("origin", origin);
        module.addConstant("alias", origin);

        MirFunction f = function(module, "vtableOfSquare", MirType.ofPtr());
        MirBuilder b = new MirBuilder(f);
        b.emitReturn(b.emitConst(new ConstValue.VTableRef("Square"), MirType.ofPtr(), LOC), LOC);

        VTableRequestRegistry registry = new VTableRequestRegistry();
        assertThat(ConstantScavenger.scavenge(module, registry)).isEqualTo(2);
        assertThat(registry.getClassesNeedingVTables()).containsExactly("Circle", "Point", "Square");

        ObjectModelLowering pass = lower(module);
        assertThat(module.getVTableLayout().getVTables()).containsKeys("Circle", "Point", "Square");
        assertThat(pass.getLastRegistry().size()).isZero();
    }

    @Test
    @DisplayName("默认管线执行降级并挂上 vtable 布局")
    void testDefaultPipeline() {
        MirFunction f = function(module, "makePoint", MirType.ofRef("Point"));
        MirBuilder b = new MirBuilder(f);
        int one = b.emitConstLong(1, LOC);
        b.emitReturn(b.emitNewObject("Point", new int[]{one, one}, LOC), LOC);

        PassPipeline pipeline = PassPipeline.createDefault(new TargetConfig());
        assertThat(pipeline.getMirPasses()).hasSize(1);
        MirModule result = pipeline.execute(module);

        assertThat(result).isSameAs(module);
        assertThat(count(f, MirOp.NEW_OBJECT)).isZero();
        assertThat(count(f, MirOp.ALLOC)).isEqualTo(1);
        assertThat(result.getVTableLayout().getVTable("Point")).isNotNull();
    }

    @Test
    @DisplayName("替换序列中沿用原 dest 的指令恰好一条")
    void testDestinationKeptOnce() {
        MirFunction f = function(module, "sum", I64);
        MirBuilder b = new MirBuilder(f);
        int p = b.emitNewObject("Point", new int[]{b.emitConstLong(2, LOC), b.emitConstLong(3, LOC)}, LOC);
        int x = b.emitGetField(p, "x", I64, LOC);
        b.emitReturn(x, LOC);
        lower(module);

        int pDefs = 0;
        int xDefs = 0;
        for (BasicBlock block : f.getBlocks()) {
            for (MirInst inst : block.getInstructions()) {
                if (inst.getDest() == p) pDefs++;
                if (inst.getDest() == x) xDefs++;
            }
        }
        assertThat(pDefs).isEqualTo(1);
        assertThat(xDefs).isEqualTo(1);
    }
}
