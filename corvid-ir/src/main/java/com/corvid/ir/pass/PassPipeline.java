package com.corvid.ir.pass;

import com.corvid.ir.TargetConfig;
import com.corvid.ir.lowering.ObjectModelLowering;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.mir.MirPrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 中端 Pass 管线。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<MirPass> mirPasses = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线。
     */
    public static PassPipeline createDefault(TargetConfig config) {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addMirPass(new ObjectModelLowering(config));
        return pipeline;
    }

    public void addMirPass(MirPass pass) {
        mirPasses.add(pass);
    }

    public List<MirPass> getMirPasses() { return mirPasses; }

    public MirModule execute(MirModule module) {
        MirModule mir = module;
        for (MirPass pass : mirPasses) {
            LOG.fine(() -> "running " + pass.getName());
            mir = pass.run(mir);
        }

        // MIR dump（设置 CORVID_DUMP_MIR=1 环境变量启用）
        if ("1".equals(System.getenv("CORVID_DUMP_MIR"))) {
            System.err.println("===== MIR DUMP =====");
            System.err.print(MirPrinter.print(mir));
            System.err.println("===== END MIR DUMP =====");
        }
        return mir;
    }
}
