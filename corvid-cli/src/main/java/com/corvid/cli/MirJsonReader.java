package com.corvid.cli;

import com.corvid.ir.SourceLocation;
import com.corvid.ir.mir.BasicBlock;
import com.corvid.ir.mir.BinaryOp;
import com.corvid.ir.mir.ConstValue;
import com.corvid.ir.mir.ConvertOp;
import com.corvid.ir.mir.MemoryAccess;
import com.corvid.ir.mir.MirClass;
import com.corvid.ir.mir.MirField;
import com.corvid.ir.mir.MirFunction;
import com.corvid.ir.mir.MirInst;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.mir.MirOp;
import com.corvid.ir.mir.MirTerminator;
import com.corvid.ir.mir.MirType;
import com.corvid.ir.mir.Successor;
import com.corvid.ir.mir.TypeCase;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从 JSON 读取 MIR 模块。
 *
 * <p>局部变量在 JSON 中按名字引用：函数参数、{@code locals} 声明的变量，名字在函数内唯一。
 * 块按出现顺序编号。格式错误抛出 {@link JsonParseException}。</p>
 */
public class MirJsonReader {

    private final Gson gson = new Gson();

    private String sourceFile;

    public MirModule read(Reader reader) {
        JsonObject root = gson.fromJson(reader, JsonObject.class);
        if (root == null) {
            throw new JsonParseException("Empty MIR document");
        }
        return readModule(root);
    }

    public MirModule read(String json) {
        JsonObject root = gson.fromJson(json, JsonObject.class);
        if (root == null) {
            throw new JsonParseException("Empty MIR document");
        }
        return readModule(root);
    }

    private MirModule readModule(JsonObject root) {
        String name = requireString(root, "name");
        sourceFile = root.has("source") ? root.get("source").getAsString() : name;
        MirModule module = new MirModule(name);
        for (JsonElement e : array(root, "classes")) {
            module.addClass(readClass(e.getAsJsonObject()));
        }
        if (root.has("constants")) {
            for (Map.Entry<String, JsonElement> e : root.getAsJsonObject("constants").entrySet()) {
                module.addConstant(e.getKey(), readConst(e.getValue().getAsJsonObject()));
            }
        }
        for (JsonElement e : array(root, "functions")) {
            module.addFunction(readFunction(e.getAsJsonObject()));
        }
        return module;
    }

    // ========== 类 ==========

    private MirClass readClass(JsonObject obj) {
        String name = requireString(obj, "name");
        String kindText = obj.has("kind") ? obj.get("kind").getAsString() : "reference";
        MirClass.Kind kind;
        switch (kindText) {
            case "reference": kind = MirClass.Kind.REFERENCE; break;
            case "value":     kind = MirClass.Kind.VALUE; break;
            default: throw new JsonParseException("Unknown class kind '" + kindText + "' for " + name);
        }
        String superClass = obj.has("super") && !obj.get("super").isJsonNull() ? obj.get("super").getAsString() : null;
        boolean isAbstract = obj.has("abstract") && obj.get("abstract").getAsBoolean();
        List<MirField> fields = new ArrayList<>();
        for (JsonElement e : array(obj, "fields")) {
            JsonObject f = e.getAsJsonObject();
            fields.add(new MirField(requireString(f, "name"), type(requireString(f, "type"))));
        }
        Map<String, String> methods = new LinkedHashMap<>();
        if (obj.has("methods")) {
            for (Map.Entry<String, JsonElement> m : obj.getAsJsonObject("methods").entrySet()) {
                methods.put(m.getKey(), m.getValue().getAsString());
            }
        }
        List<MirType> elements = null;
        if (obj.has("elements")) {
            elements = new ArrayList<>();
            for (JsonElement e : obj.getAsJsonArray("elements")) {
                elements.add(type(e.getAsString()));
            }
        }
        return new MirClass(name, kind, superClass, isAbstract, fields, methods, elements);
    }

    // ========== 常量 ==========

    private ConstValue readConst(JsonObject obj) {
        String kind = requireString(obj, "kind");
        switch (kind) {
            case "scalar": {
                MirType type = type(requireString(obj, "type"));
                JsonElement value = obj.get("value");
                if (value == null) throw new JsonParseException("Scalar constant without value");
                if (type.getKind() == MirType.Kind.BOOL && value.getAsJsonPrimitive().isBoolean()) {
                    return ConstValue.ofBool(value.getAsBoolean());
                }
                if (type.getKind() == MirType.Kind.F64) {
                    return ConstValue.ofF64(value.getAsDouble());
                }
                if (type.getKind() == MirType.Kind.F32) {
                    return ConstValue.scalar(type, Float.floatToRawIntBits(value.getAsFloat()) & 0xFFFFFFFFL);
                }
                return ConstValue.scalar(type, value.getAsLong());
            }
            case "null":
                return ConstValue.nullValue();
            case "string":
                return new ConstValue.Str(requireString(obj, "value"));
            case "function":
                return new ConstValue.FunctionRef(requireString(obj, "name"));
            case "label":
                return new ConstValue.Label(requireString(obj, "function"), obj.get("block").getAsInt());
            case "vtable":
                return new ConstValue.VTableRef(requireString(obj, "class"));
            case "aggregate": {
                List<ConstValue> components = new ArrayList<>();
                for (JsonElement e : array(obj, "components")) {
                    components.add(readConst(e.getAsJsonObject()));
                }
                return new ConstValue.Aggregate(requireString(obj, "class"), components);
            }
            default:
                throw new JsonParseException("Unknown constant kind '" + kind + "'");
        }
    }

    // ========== 函数 ==========

    private MirFunction readFunction(JsonObject obj) {
        String name = requireString(obj, "name");
        MirType returnType = obj.has("returns") ? type(obj.get("returns").getAsString()) : MirType.ofVoid();
        MirFunction function = new MirFunction(name, returnType);
        Map<String, Integer> locals = new HashMap<>();
        for (JsonElement e : array(obj, "params")) {
            JsonObject p = e.getAsJsonObject();
            declare(locals, requireString(p, "name"), function.newParam(requireString(p, "name"),
                    type(requireString(p, "type"))), name);
        }
        for (JsonElement e : array(obj, "locals")) {
            JsonObject l = e.getAsJsonObject();
            declare(locals, requireString(l, "name"), function.newLocal(requireString(l, "name"),
                    type(requireString(l, "type"))), name);
        }

        JsonArray blocks = array(obj, "blocks");
        for (int i = 0; i < blocks.size(); i++) {
            function.newBlock();
        }
        FunctionScope scope = new FunctionScope(function, locals);
        for (int i = 0; i < blocks.size(); i++) {
            JsonObject b = blocks.get(i).getAsJsonObject();
            if (b.has("id") && b.get("id").getAsInt() != i) {
                throw new JsonParseException("Block " + b.get("id") + " of " + name + " is listed at position " + i);
            }
            BasicBlock block = function.getBlock(i);
            for (JsonElement p : array(b, "params")) {
                block.addParam(scope.local(p.getAsString()));
            }
            for (JsonElement e : array(b, "insts")) {
                block.addInstruction(readInst(scope, e.getAsJsonObject()));
            }
            if (b.has("term")) {
                block.setTerminator(readTerminator(scope, b.getAsJsonObject("term")));
            }
        }
        return function;
    }

    private static void declare(Map<String, Integer> locals, String localName, int index, String functionName) {
        if (locals.put(localName, index) != null) {
            throw new JsonParseException("Local '" + localName + "' declared twice in " + functionName);
        }
    }

    private MirInst readInst(FunctionScope scope, JsonObject obj) {
        String opName = requireString(obj, "op");
        MirOp op;
        try {
            op = MirOp.valueOf(opName);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Unknown MIR op '" + opName + "'", e);
        }
        int dest = obj.has("dest") ? scope.local(obj.get("dest").getAsString()) : -1;
        int[] args = scope.locals(array(obj, "args"));
        Object extra;
        switch (op) {
            case NEW_OBJECT:
            case NEW_ARRAY:
            case NEW_ARRAY_ZEROED:
                extra = requireString(obj, "class");
                break;
            case GET_FIELD:
            case SET_FIELD:
                extra = requireString(obj, "field");
                break;
            case WITH: {
                List<String> names = new ArrayList<>();
                for (JsonElement e : array(obj, "fields")) names.add(e.getAsString());
                extra = names;
                break;
            }
            case ARRAY_GET:
            case ARRAY_SET:
            case EXTRACT:
                extra = obj.has("index") ? obj.get("index").getAsInt() : 0;
                break;
            case CALL_VIRTUAL:
                extra = requireString(obj, "method");
                break;
            case CALL_STATIC:
            case CALL_RUNTIME:
                extra = requireString(obj, "function");
                break;
            case CONST:
                extra = readConst(obj.getAsJsonObject("value"));
                break;
            case BINARY:
                extra = BinaryOp.valueOf(requireString(obj, "binop"));
                break;
            case CONVERT:
                extra = ConvertOp.valueOf(requireString(obj, "conv"));
                break;
            case ALLOC:
                extra = obj.has("zero") && obj.get("zero").getAsBoolean();
                break;
            case PTR_ADD:
                extra = obj.has("disp") ? obj.get("disp").getAsLong() : 0L;
                break;
            case LOAD:
            case STORE:
                extra = new MemoryAccess(obj.get("offset").getAsLong(), type(requireString(obj, "type")),
                        obj.has("cacheable") && obj.get("cacheable").getAsBoolean());
                break;
            case LOAD_VTABLE_SLOT:
                throw new JsonParseException("LOAD_VTABLE_SLOT is produced by lowering and cannot be read");
            default:
                extra = null;
                break;
        }
        return new MirInst(op, dest, args, extra, location(obj));
    }

    private MirTerminator readTerminator(FunctionScope scope, JsonObject obj) {
        String kind = requireString(obj, "kind");
        SourceLocation loc = location(obj);
        switch (kind) {
            case "goto":
                return new MirTerminator.Goto(loc, successor(scope, obj.getAsJsonObject("target")));
            case "branch":
                return new MirTerminator.Branch(loc, scope.local(requireString(obj, "cond")),
                        successor(scope, obj.getAsJsonObject("then")), successor(scope, obj.getAsJsonObject("else")));
            case "switch": {
                Map<Long, Successor> cases = new LinkedHashMap<>();
                for (JsonElement e : array(obj, "cases")) {
                    JsonObject c = e.getAsJsonObject();
                    cases.put(c.get("value").getAsLong(), successor(scope, c.getAsJsonObject("target")));
                }
                Successor defaultTarget = obj.has("default") && !obj.get("default").isJsonNull()
                        ? successor(scope, obj.getAsJsonObject("default")) : null;
                return new MirTerminator.Switch(loc, scope.local(requireString(obj, "key")), cases, defaultTarget);
            }
            case "return":
                return new MirTerminator.Return(loc, obj.has("value") ? scope.local(obj.get("value").getAsString()) : -1);
            case "unreachable":
                return new MirTerminator.Unreachable(loc);
            case "type_switch": {
                List<TypeCase> cases = new ArrayList<>();
                for (JsonElement e : array(obj, "cases")) {
                    JsonObject c = e.getAsJsonObject();
                    cases.add(new TypeCase(requireString(c, "class"), successor(scope, c.getAsJsonObject("target"))));
                }
                return new MirTerminator.TypeSwitch(loc, scope.local(requireString(obj, "value")), cases);
            }
            case "invoke_virtual":
                return new MirTerminator.InvokeVirtual(loc,
                        obj.has("dest") ? scope.local(obj.get("dest").getAsString()) : -1,
                        requireString(obj, "method"), scope.locals(array(obj, "args")),
                        successor(scope, obj.getAsJsonObject("normal")),
                        successor(scope, obj.getAsJsonObject("unwind")));
            default:
                throw new JsonParseException("Unknown terminator kind '" + kind + "'");
        }
    }

    private Successor successor(FunctionScope scope, JsonObject obj) {
        if (obj == null) {
            throw new JsonParseException("Missing successor in " + scope.function.getName());
        }
        int target = obj.get("block").getAsInt();
        if (target < 0 || target >= scope.function.getBlocks().size()) {
            throw new JsonParseException("Successor B" + target + " does not exist in " + scope.function.getName());
        }
        return new Successor(target, scope.locals(array(obj, "args")));
    }

    // ========== 公共 ==========

    private SourceLocation location(JsonObject obj) {
        if (!obj.has("line")) return SourceLocation.UNKNOWN;
        int column = obj.has("column") ? obj.get("column").getAsInt() : 1;
        return new SourceLocation(sourceFile, obj.get("line").getAsInt(), column);
    }

    private static MirType type(String text) {
        try {
            return MirType.parse(text);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

    private static String requireString(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) {
            throw new JsonParseException("Missing \"" + key + "\" in " + obj);
        }
        return e.getAsString();
    }

    private static JsonArray array(JsonObject obj, String key) {
        return obj.has(key) ? obj.getAsJsonArray(key) : new JsonArray();
    }

    /** 函数内的名字 → 局部变量下标 */
    private static final class FunctionScope {
        final MirFunction function;
        final Map<String, Integer> locals;

        FunctionScope(MirFunction function, Map<String, Integer> locals) {
            this.function = function;
            this.locals = locals;
        }

        int local(String name) {
            Integer index = locals.get(name);
            if (index == null) {
                throw new JsonParseException("Undeclared local '" + name + "' in " + function.getName());
            }
            return index;
        }

        int[] locals(JsonArray names) {
            int[] result = new int[names.size()];
            for (int i = 0; i < names.size(); i++) {
                result[i] = local(names.get(i).getAsString());
            }
            return result;
        }
    }
}
