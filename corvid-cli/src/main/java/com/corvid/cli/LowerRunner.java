package com.corvid.cli;

import com.corvid.ir.LoweringException;
import com.corvid.ir.TargetConfig;
import com.corvid.ir.exec.MirInterpreter;
import com.corvid.ir.exec.TrapException;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.mir.MirPrinter;
import com.corvid.ir.pass.PassPipeline;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.logging.Logger;

/**
 * 读取、降级、输出或执行 MIR 模块。返回进程退出码。
 */
public class LowerRunner {

    private static final Logger LOG = Logger.getLogger(LowerRunner.class.getName());

    private final TargetConfig config;
    private final PrintWriter out;
    private final PrintWriter err;

    public LowerRunner(TargetConfig config, PrintWriter out, PrintWriter err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * 降级文件中的模块并打印结果。
     *
     * @param printVTables 额外打印 vtable 布局
     */
    public int lowerFile(String filePath, boolean printVTables) {
        MirModule module = lowerOrReport(filePath);
        if (module == null) return 1;
        out.print(MirPrinter.print(module));
        if (printVTables) {
            out.println(module.getVTableLayout());
        }
        out.flush();
        return 0;
    }

    /**
     * 降级后在解释器中执行指定函数，逐行打印返回值。
     */
    public int runFile(String filePath, String functionName, long[] args) {
        MirModule module = lowerOrReport(filePath);
        if (module == null) return 1;
        if (module.findFunction(functionName) == null) {
            err.println("错误: 模块中没有函数 " + functionName);
            err.flush();
            return 1;
        }
        try {
            long[] results = new MirInterpreter(module, config).call(functionName, args);
            LOG.fine(() -> functionName + Arrays.toString(args) + " -> " + Arrays.toString(results));
            for (long r : results) {
                out.println(r);
            }
            out.flush();
            return 0;
        } catch (TrapException e) {
            err.println("运行时陷阱: " + e.getMessage() + " (subject " + e.getSubject() + ")");
        } catch (IllegalStateException | ArithmeticException e) {
            err.println("执行错误: " + e.getMessage());
        }
        err.flush();
        return 1;
    }

    private MirModule lowerOrReport(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            err.flush();
            return null;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            MirModule module = new MirJsonReader().read(reader);
            return PassPipeline.createDefault(config).execute(module);
        } catch (JsonParseException e) {
            err.println("MIR 格式错误: " + e.getMessage());
        } catch (LoweringException e) {
            err.println("降级错误: " + e.getMessage());
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
        }
        err.flush();
        return null;
    }
}
