package com.corvid.cli;

import com.corvid.ir.TargetConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * Corvid CLI 入口点（picocli）
 */
@Command(name = "corvid", version = "Corvid v0.1.0",
         mixinStandardHelpOptions = true,
         description = "对 JSON 形式的 MIR 模块执行对象模型降级")
public class Main implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "MIR 模块（JSON）")
    String file;

    @Parameters(index = "1..*", description = "--run 时传给函数的整数参数")
    long[] args = new long[0];

    @Option(names = "--no-computed-jumps", description = "目标不支持计算跳转：类型分派使用稠密 switch")
    boolean noComputedJumps;

    @Option(names = "--layout-cache", defaultValue = "1024", description = "布局缓存容量（默认 1024）")
    int layoutCacheSize;

    @Option(names = "--trap-function", defaultValue = TargetConfig.DEFAULT_TRAP_FUNCTION,
            description = "运行时陷阱函数名")
    String trapFunction;

    @Option(names = "--vtables", description = "打印 vtable 布局")
    boolean printVTables;

    @Option(names = {"-r", "--run"}, description = "降级后执行指定函数")
    String runFunction;

    @Option(names = {"-v", "--verbose"}, description = "输出 FINE 级别日志")
    boolean verbose;

    @Override
    public Integer call() {
        configureLogging(verbose ? Level.FINE : Level.WARNING);
        TargetConfig config = new TargetConfig();
        config.setComputedJumpsSupported(!noComputedJumps);
        config.setLayoutCacheSize(layoutCacheSize);
        config.setTrapFunction(trapFunction);

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        LowerRunner runner = new LowerRunner(config, out, err);
        if (runFunction != null) {
            return runner.runFile(file, runFunction, args);
        }
        return runner.lowerFile(file, printVTables);
    }

    /**
     * 日志输出到 stderr，不与降级结果混在一起。
     */
    static void configureLogging(Level level) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，按操作系统原生编码输出中文
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
