package com.corvid.ir.vtable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 贪心 vtable 填充：覆盖类最多的请求先放；每个请求取其所有类中都空闲的最低槽位。
 * 不同类的 vtable 可以在同一偏移放不同请求，只要没有类同时需要两者。
 */
public class GreedyVTablePopulator implements VTablePopulator {

    private static final Logger LOG = Logger.getLogger(GreedyVTablePopulator.class.getName());

    @Override
    public VTableLayout populate(Collection<VTableRequest> requests, Set<String> classes) {
        VTableLayout layout = new VTableLayout();
        for (String cls : classes) {
            layout.vtableOf(cls);
        }
        List<VTableRequest> ordered = new ArrayList<>(requests);
        ordered.sort(Comparator.comparingInt((VTableRequest r) -> -r.getEntries().size())
                .thenComparingInt(VTableRequest::getId));
        for (VTableRequest request : ordered) {
            long offset = 0;
            while (!isFree(layout, request, offset)) {
                offset += VTableLayout.SLOT_BYTES;
            }
            layout.assign(request, offset);
        }
        LOG.fine(() -> "populated " + requests.size() + " vtable requests over "
                + layout.getVTables().size() + " classes");
        return layout;
    }

    private static boolean isFree(VTableLayout layout, VTableRequest request, long offset) {
        for (VTableEntry entry : request.getEntries()) {
            if (layout.vtableOf(entry.getClassName()).isOccupied(offset)) return false;
        }
        return true;
    }
}
