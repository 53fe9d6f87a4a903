package com.corvid.ir.layout;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 带缓存的布局查询，包装任意 {@link LayoutOracle}。
 *
 * <p>同一个类的布局在一次编译中会被每个构造点、字段访问点反复查询。
 * 使用 Caffeine（Window TinyLfu），线程安全，可供并行降级共享。</p>
 */
public final class CachingLayoutOracle implements LayoutOracle {

    private static final Logger LOG = Logger.getLogger(CachingLayoutOracle.class.getName());

    private final LayoutOracle delegate;
    private final Cache<String, List<LayoutSlot>> layouts;
    private final Cache<String, ArraySlotInfo> arrayInfos;

    /**
     * @param maximumSize 每种查询缓存的最大条目数
     */
    public CachingLayoutOracle(LayoutOracle delegate, long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.delegate = delegate;
        this.layouts = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
        this.arrayInfos = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    public List<LayoutSlot> getLayout(String className) {
        return layouts.get(className, delegate::getLayout);
    }

    @Override
    public ArraySlotInfo getArraySlotInfo(String className) {
        return arrayInfos.get(className, delegate::getArraySlotInfo);
    }

    @Override
    public int getFieldIndex(String className, String fieldName) {
        return delegate.getFieldIndex(className, fieldName);
    }

    public CacheStats layoutStats() {
        return layouts.stats();
    }

    public CacheStats arrayStats() {
        return arrayInfos.stats();
    }

    public void logStats() {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("layout cache: " + layouts.stats() + ", array cache: " + arrayInfos.stats());
        }
    }
}
