package com.corvid.ir;

/**
 * 目标环境配置。
 *
 * <p>影响降级正确性的能力（例如是否支持计算跳转）在这里查询，而不是写死为常量。</p>
 */
public class TargetConfig {
    /** 运行时诊断陷阱函数的默认名称 */
    public static final String DEFAULT_TRAP_FUNCTION = "corvid_trap";

    private boolean computedJumpsSupported = true;
    private int layoutCacheSize = 1024;
    private String trapFunction = DEFAULT_TRAP_FUNCTION;

    public TargetConfig() {
    }

    /**
     * 目标是否支持多路计算跳转（indirect jump to label）。
     * 不支持时类型分派的第三种策略退化为稠密整数 switch。
     */
    public boolean isComputedJumpsSupported() {
        return computedJumpsSupported;
    }

    public void setComputedJumpsSupported(boolean computedJumpsSupported) {
        this.computedJumpsSupported = computedJumpsSupported;
    }

    public int getLayoutCacheSize() {
        return layoutCacheSize;
    }

    public void setLayoutCacheSize(int layoutCacheSize) {
        if (layoutCacheSize <= 0) {
            throw new IllegalArgumentException("layoutCacheSize must be positive");
        }
        this.layoutCacheSize = layoutCacheSize;
    }

    public String getTrapFunction() {
        return trapFunction;
    }

    public void setTrapFunction(String trapFunction) {
        this.trapFunction = trapFunction;
    }

    @Override
    public String toString() {
        return "TargetConfig{computedJumps=" + computedJumpsSupported
                + ", layoutCacheSize=" + layoutCacheSize
                + ", trap=" + trapFunction + "}";
    }
}
