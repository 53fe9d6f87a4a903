package com.corvid.ir.lowering;

import com.corvid.ir.TargetConfig;
import com.corvid.ir.layout.CachingLayoutOracle;
import com.corvid.ir.layout.DefaultLayoutOracle;
import com.corvid.ir.layout.LayoutOracle;
import com.corvid.ir.mir.MirFunction;
import com.corvid.ir.mir.MirModule;
import com.corvid.ir.pass.MirPass;
import com.corvid.ir.resolve.ClassHierarchy;
import com.corvid.ir.resolve.HierarchyMethodResolver;
import com.corvid.ir.resolve.MethodResolver;
import com.corvid.ir.vtable.GreedyVTablePopulator;
import com.corvid.ir.vtable.VTableLayout;
import com.corvid.ir.vtable.VTablePopulator;
import com.corvid.ir.vtable.VTableRequestRegistry;

import java.util.logging.Logger;

/**
 * 对象模型降级 pass：此后的任何 pass 都不再知道类，只知道字节。
 *
 * <p>顺序：逐个降级有实现的函数（共享一个 vtable 请求登记表）→ 扫描常量图 →
 * 全部请求收齐后只做一次 vtable 填充，结果挂到模块上。</p>
 */
public class ObjectModelLowering implements MirPass {

    private static final Logger LOG = Logger.getLogger(ObjectModelLowering.class.getName());

    private final TargetConfig config;
    private LayoutOracle layoutOracle;
    private MethodResolver methodResolver;
    private VTablePopulator populator = new GreedyVTablePopulator();
    private VTableRequestRegistry lastRegistry;

    public ObjectModelLowering(TargetConfig config) {
        this.config = config;
    }

    public ObjectModelLowering() {
        this(new TargetConfig());
    }

    @Override
    public String getName() {
        return "ObjectModelLowering";
    }

    /** 替换布局查询（默认按模块类定义计算并缓存） */
    public void setLayoutOracle(LayoutOracle layoutOracle) {
        this.layoutOracle = layoutOracle;
    }

    /** 替换方法解析（默认按类继承关系） */
    public void setMethodResolver(MethodResolver methodResolver) {
        this.methodResolver = methodResolver;
    }

    public void setPopulator(VTablePopulator populator) {
        this.populator = populator;
    }

    /** 最近一次运行使用的登记表 */
    public VTableRequestRegistry getLastRegistry() {
        return lastRegistry;
    }

    @Override
    public MirModule run(MirModule module) {
        ClassHierarchy hierarchy = ClassHierarchy.of(module);
        LayoutOracle oracle = layoutOracle != null ? layoutOracle
                : new CachingLayoutOracle(new DefaultLayoutOracle(hierarchy), config.getLayoutCacheSize());
        MethodResolver resolver = methodResolver != null ? methodResolver : new HierarchyMethodResolver(hierarchy);
        VTableRequestRegistry registry = new VTableRequestRegistry();
        LoweringContext ctx = new LoweringContext(config, hierarchy, oracle, resolver, registry);

        int lowered = 0;
        for (MirFunction function : module.getFunctions()) {
            if (!function.hasBody()) continue;
            new FunctionLowering(ctx, function).lower();
            lowered++;
        }
        int aggregates = ConstantScavenger.scavenge(module, registry);

        VTableLayout layout = populator.populate(registry.getRequests(), registry.getClassesNeedingVTables());
        module.setVTableLayout(layout);
        lastRegistry = registry;

        if (oracle instanceof CachingLayoutOracle) {
            ((CachingLayoutOracle) oracle).logStats();
        }
        LOG.info("object-model lowering of " + module.getName() + ": " + lowered + " functions, "
                + registry.size() + " vtable requests, " + registry.getClassesNeedingVTables().size()
                + " vtables, " + aggregates + " constant aggregates");
        return module;
    }
}
