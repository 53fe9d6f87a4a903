package com.corvid.cli;

import com.corvid.ir.SourceLocation;
import com.corvid.ir.exec.MirInterpreter;
import com.corvid.ir.lowering.ObjectModelLowering;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.MirClass;
import com.corvid.ir.mir.MirFunction;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.mir.MirOp;
import com.corvid.ir.mir.MirTerminator;
import com.corvid.ir.mir.MirType;
import com.google.gson.JsonParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MIR JSON 读取测试")
class MirJsonReaderTest {

    private MirModule module;

    @BeforeEach
    void setUp() throws Exception {
        try (Reader reader = new InputStreamReader(
                MirJsonReaderTest.class.getResourceAsStream("/shapes.json"), StandardCharsets.UTF_8)) {
            module = new MirJsonReader().read(reader);
        }
    }

    @Nested
    @DisplayName("示例模块")
    class Sample {

        @Test
        @DisplayName("类、字段、方法表与数组元素类型")
        void testClasses() {
            assertThat(module.getName()).isEqualTo("shapes");
            assertThat(module.getClasses()).extracting(MirClass::getName)
                    .containsExactly("Shape", "Circle", "Square", "Point", "Bytes");
            MirClass shape = module.getClasses().get(0);
            assertThat(shape.isAbstract()).isTrue();
            assertThat(shape.getMethods()).containsEntry("describe", "Shape.describe");
            MirClass circle = module.getClasses().get(1);
            assertThat(circle.getSuperClass()).isEqualTo("Shape");
            assertThat(circle.findField("r").getType()).isEqualTo(MirType.ofI64());
            assertThat(module.getClasses().get(4).getArrayElementTypes()).containsExactly(MirType.ofI8());
            assertThat(module.getClasses().get(3).isArray()).isFalse();
        }

        @Test
        @DisplayName("局部变量按名字解析，位置取自 source 与 line")
        void testFunctionBody() {
            MirFunction f = module.findFunction("sumAreas");
            assertThat(f.getBlocks()).hasSize(1);
            MirInst alloc = f.getEntryBlock().getInstructions().get(2);
            assertThat(alloc.getOp()).isEqualTo(MirOp.NEW_OBJECT);
            assertThat(alloc.<String>extraAs()).isEqualTo("Circle");
            assertThat(f.getLocalType(alloc.getDest())).isEqualTo(MirType.ofRef("Circle", MirType.Mutability.MUTABLE));
            assertThat(alloc.getLocation()).isEqualTo(new SourceLocation("shapes.cv", 10, 1));
            assertThat(f.getEntryBlock().getInstructions().get(0).getLocation()).isEqualTo(SourceLocation.UNKNOWN);
        }

        @Test
        @DisplayName("类型分派终止指令与聚合常量")
        void testTypeSwitchAndConstants() {
            MirTerminator t = module.findFunction("classify").getEntryBlock().getTerminator();
            assertThat(t).isInstanceOf(MirTerminator.TypeSwitch.class);
            assertThat(((MirTerminator.TypeSwitch) t).getCases()).hasSize(2);
            assertThat(module.getConstants().get("origin")).isInstanceOf(ConstValue.Aggregate.class);
        }

        @Test
        @DisplayName("读入的模块可以降级并执行")
        void testLowerAndRun() {
            ObjectModelLowering pass = new ObjectModelLowering();
            pass.run(module);
            MirInterpreter interp = new MirInterpreter(module);

            assertThat(interp.call("sumAreas")).containsExactly(21L);
            assertThat(interp.call("classifySquare")).containsExactly(2L);
            assertThat(interp.call("byteCount", 5)).containsExactly(5L);
            assertThat(pass.getLastRegistry().getClassesNeedingVTables()).contains("Point");
        }
    }

    @Nested
    @DisplayName("格式错误")
    class Malformed {

        @Test
        @DisplayName("未声明的局部变量")
        void testUndeclaredLocal() {
            String json = "{\"name\":\"m\",\"functions\":[{\"name\":\"f\",\"blocks\":["
                    + "{\"term\":{\"kind\":\"return\",\"value\":\"ghost\"}}]}]}";
            assertThatThrownBy(() -> new MirJsonReader().read(json))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("Undeclared local 'ghost'");
        }

        @Test
        @DisplayName("未知操作码与未知类型")
        void testUnknownOpAndType() {
            String badOp = "{\"name\":\"m\",\"functions\":[{\"name\":\"f\",\"blocks\":["
                    + "{\"insts\":[{\"op\":\"TELEPORT\"}],\"term\":{\"kind\":\"unreachable\"}}]}]}";
            assertThatThrownBy(() -> new MirJsonReader().read(badOp))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("TELEPORT");

            String badType = "{\"name\":\"m\",\"functions\":[{\"name\":\"f\",\"params\":[{\"name\":\"x\",\"type\":\"u7\"}]}]}";
            assertThatThrownBy(() -> new MirJsonReader().read(badType))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("u7");
        }

        @Test
        @DisplayName("降级产物不能作为输入")
        void testLoweringOutputRejected() {
            String json = "{\"name\":\"m\",\"functions\":[{\"name\":\"f\",\"blocks\":["
                    + "{\"insts\":[{\"op\":\"LOAD_VTABLE_SLOT\"}],\"term\":{\"kind\":\"unreachable\"}}]}]}";
            assertThatThrownBy(() -> new MirJsonReader().read(json))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("LOAD_VTABLE_SLOT");
        }

        @Test
        @DisplayName("后继指向不存在的块")
        void testMissingSuccessor() {
            String json = "{\"name\":\"m\",\"functions\":[{\"name\":\"f\",\"blocks\":["
                    + "{\"term\":{\"kind\":\"goto\",\"target\":{\"block\":3}}}]}]}";
            assertThatThrownBy(() -> new MirJsonReader().read(json))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("B3");
        }
    }
}
