package com.corvid.ir.lowering;

import com.corvid.ir.TargetConfig;
import com.corvid.ir.layout.LayoutOracle;
import com.corvid.ir.resolve.ClassHierarchy;
import com.corvid.ir.resolve.MethodResolver;
import com.corvid.ir.vtable.VTableRequestRegistry;

/**
 * 一次降级运行的共享状态。显式传给每个函数的降级，而不是全局单例。
 */
public class LoweringContext {

    private final TargetConfig config;
    private final ClassHierarchy hierarchy;
    private final LayoutOracle layoutOracle;
    private final MethodResolver methodResolver;
    private final VTableRequestRegistry registry;

    public LoweringContext(TargetConfig config, ClassHierarchy hierarchy, LayoutOracle layoutOracle,
                           MethodResolver methodResolver, VTableRequestRegistry registry) {
        this.config = config;
        this.hierarchy = hierarchy;
        this.layoutOracle = layoutOracle;
        this.methodResolver = methodResolver;
        this.registry = registry;
    }

    public TargetConfig getConfig() { return config; }
    public ClassHierarchy getHierarchy() { return hierarchy; }
    public LayoutOracle getLayoutOracle() { return layoutOracle; }
    public MethodResolver getMethodResolver() { return methodResolver; }
    public VTableRequestRegistry getRegistry() { return registry; }
}
