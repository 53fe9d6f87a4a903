package com.corvid.ir.vtable;

import java.util.Collection;
import java.util.Set;

/**
 * 为全部请求分配具体的 vtable 字节偏移，并给每个类合成 vtable 内容。
 * 在所有函数降级完成后只调用一次。
 */
public interface VTablePopulator {

    VTableLayout populate(Collection<VTableRequest> requests, Set<String> classes);
}
