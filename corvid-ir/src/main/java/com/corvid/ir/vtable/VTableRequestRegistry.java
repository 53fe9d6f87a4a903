package com.corvid.ir.vtable;

import com.corvid.ir.LoweringException;
import com.corvid.ir.SourceLocation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * 全程序共享的 vtable 请求登记表，以及需要 vtable 的类集合。
 *
 * <p>结构相同的请求（排序后的 (类, 值) 集合相同）共享同一个 id。
 * 线程安全：按规范化内容做键的并发 map，可供并行降级多个函数。</p>
 */
public class VTableRequestRegistry {

    private static final Logger LOG = Logger.getLogger(VTableRequestRegistry.class.getName());

    private final ConcurrentHashMap<List<VTableEntry>, VTableRequest> requests = new ConcurrentHashMap<>();
    private final Set<String> classesNeedingVTables = ConcurrentHashMap.newKeySet();
    private final AtomicInteger nextId = new AtomicInteger();

    /**
     * 登记一个请求，返回规范化后的请求（可能是之前登记过的同一个）。
     *
     * @throws LoweringException entries 为空，或同一个类对应了不同的值
     */
    public VTableRequest submit(Collection<VTableEntry> entries, String name, SourceLocation location) {
        if (entries.isEmpty()) {
            throw new LoweringException("Empty vtable request '" + name + "'", location);
        }
        Map<String, VTableEntry> byClass = new TreeMap<>();
        for (VTableEntry entry : entries) {
            VTableEntry previous = byClass.putIfAbsent(entry.getClassName(), entry);
            if (previous != null && !previous.getValue().equals(entry.getValue())) {
                throw new LoweringException("contradictory vtable entries for class " + entry.getClassName()
                        + " in '" + name + "': " + previous.getValue() + " vs " + entry.getValue(), location);
            }
        }
        List<VTableEntry> canonical = Collections.unmodifiableList(new ArrayList<>(byClass.values()));
        classesNeedingVTables.addAll(byClass.keySet());
        return requests.computeIfAbsent(canonical, key -> {
            VTableRequest request = new VTableRequest(key, name, nextId.getAndIncrement());
            LOG.finer(() -> "new " + request + " over " + key.size() + " classes");
            return request;
        });
    }

    /**
     * 类被直接构造（或作为常量序列化）时登记。
     */
    public void requireVTable(String className) {
        classesNeedingVTables.add(className);
    }

    /** 按 id 排序的全部请求 */
    public List<VTableRequest> getRequests() {
        List<VTableRequest> list = new ArrayList<>(requests.values());
        list.sort(Comparator.comparingInt(VTableRequest::getId));
        return list;
    }

    public Set<String> getClassesNeedingVTables() {
        return Collections.unmodifiableSet(new TreeSet<>(classesNeedingVTables));
    }

    public int size() {
        return requests.size();
    }
}
