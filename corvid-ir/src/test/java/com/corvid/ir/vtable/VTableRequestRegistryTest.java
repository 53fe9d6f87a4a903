package com.corvid.ir.vtable;

import com.corvid.ir.LoweringException;
import com.corvid.ir.MirFixtures;
import com.corvid.ir.mir.ConstValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

@DisplayName("VTableRequestRegistry 测试")
class VTableRequestRegistryTest {

    private VTableRequestRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new VTableRequestRegistry();
    }

    private static VTableEntry fn(String cls, String function) {
        return new VTableEntry(cls, new ConstValue.FunctionRef(function));
    }

    @Nested
    @DisplayName("规范化")
    class Canonicalization {

        @Test
        @DisplayName("顺序不同的相同集合得到同一个 id")
        void testPermutedEntries() {
            VTableRequest a = registry.submit(Arrays.asList(fn("Square", "S.area"), fn("Circle", "C.area")),
                    "area", MirFixtures.LOC);
            VTableRequest b = registry.submit(Arrays.asList(fn("Circle", "C.area"), fn("Square", "S.area")),
                    "area2", MirFixtures.LOC);
            assertThat(b.getId()).isEqualTo(a.getId());
            assertThat(b).isSameAs(a);
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("条目按类名排序")
        void testSortedEntries() {
            VTableRequest r = registry.submit(Arrays.asList(fn("Triangle", "t"), fn("Circle", "c"), fn("Square", "s")),
                    "area", MirFixtures.LOC);
            assertThat(r.getEntries()).extracting(VTableEntry::getClassName)
                    .containsExactly("Circle", "Square", "Triangle");
        }

        @Test
        @DisplayName("同一个类重复出现且值相同时合并")
        void testDuplicateIdenticalEntry() {
            VTableRequest r = registry.submit(Arrays.asList(fn("Circle", "c"), fn("Circle", "c")),
                    "area", MirFixtures.LOC);
            assertThat(r.getEntries()).hasSize(1);
        }

        @Test
        @DisplayName("不同的值得到不同的 id，id 连续分配")
        void testDistinctRequests() {
            VTableRequest a = registry.submit(Collections.singletonList(fn("Circle", "c1")), "m1", MirFixtures.LOC);
            VTableRequest b = registry.submit(Collections.singletonList(fn("Circle", "c2")), "m2", MirFixtures.LOC);
            VTableRequest c = registry.submit(Collections.singletonList(
                    new VTableEntry("Circle", ConstValue.ofBool(true))), "t", MirFixtures.LOC);
            assertThat(Arrays.asList(a.getId(), b.getId(), c.getId())).containsExactly(0, 1, 2);
            assertThat(registry.getRequests()).containsExactly(a, b, c);
        }
    }

    @Nested
    @DisplayName("致命错误")
    class Fatal {

        @Test
        @DisplayName("同一个类对应两个不同的值")
        void testContradictoryEntries() {
            assertThatThrownBy(() -> registry.submit(Arrays.asList(fn("Circle", "a"), fn("Circle", "b")),
                    "area", MirFixtures.LOC))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("contradictory vtable entries")
                    .hasMessageContaining("test.cv:1:1");
        }

        @Test
        @DisplayName("空请求")
        void testEmptyRequest() {
            assertThatThrownBy(() -> registry.submit(Collections.<VTableEntry>emptyList(), "none", MirFixtures.LOC))
                    .isInstanceOf(LoweringException.class)
                    .hasMessageContaining("Empty vtable request");
        }
    }

    @Test
    @DisplayName("请求引用的类与直接登记的类都需要 vtable")
    void testClassesNeedingVTables() {
        registry.submit(Arrays.asList(fn("Circle", "c"), fn("Square", "s")), "area", MirFixtures.LOC);
        registry.requireVTable("Bytes");
        assertThat(registry.getClassesNeedingVTables()).containsExactly("Bytes", "Circle", "Square");
    }

    @Test
    @DisplayName("并发提交相同内容只登记一次")
    void testConcurrentSubmit() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<VTableRequest>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                final boolean flip = i % 2 == 0;
                tasks.add(() -> registry.submit(flip
                                ? Arrays.asList(fn("Circle", "c"), fn("Square", "s"))
                                : Arrays.asList(fn("Square", "s"), fn("Circle", "c")),
                        "area", MirFixtures.LOC));
            }
            List<Integer> ids = new ArrayList<>();
            for (Future<VTableRequest> f : pool.invokeAll(tasks)) {
                ids.add(f.get().getId());
            }
            assertThat(ids).containsOnly(0);
            assertThat(registry.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
