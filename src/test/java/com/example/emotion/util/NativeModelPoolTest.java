package com.example.emotion.util;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class NativeModelPoolTest {

    private static class FakeModel implements AutoCloseable {
        volatile boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    public void testFirstInstanceIsCreatedEagerly() {
        AtomicInteger created = new AtomicInteger();
        NativeModelPool<FakeModel> pool = new NativeModelPool<>("fake", 3, () -> {
            created.incrementAndGet();
            return new FakeModel();
        });

        assertEquals(1, created.get());
        assertEquals(1, pool.size());
        assertEquals(3, pool.getCapacity());
    }

    @Test(expected = IllegalStateException.class)
    public void testInvalidModelFailsOnConstruction() {
        new NativeModelPool<FakeModel>("broken", 2, () -> {
            throw new IllegalStateException("无法加载模型");
        });
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveCapacity() {
        new NativeModelPool<FakeModel>("fake", 0, FakeModel::new);
    }

    @Test
    public void testConcurrentCallersGetDistinctInstances() throws Exception {
        NativeModelPool<FakeModel> pool = new NativeModelPool<>("fake", 2, FakeModel::new);
        Set<FakeModel> seen = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));
        CountDownLatch bothInside = new CountDownLatch(2);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(executor.submit(() -> pool.execute(model -> {
                    seen.add(model);
                    bothInside.countDown();
                    try {
                        return bothInside.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                })));
            }
            for (Future<Boolean> future : futures) {
                assertTrue("两个调用应同时持有实例", future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(2, seen.size());
        assertEquals(2, pool.size());
    }

    @Test
    public void testCapacityBoundsParallelism() throws Exception {
        NativeModelPool<FakeModel> pool = new NativeModelPool<>("fake", 1, FakeModel::new);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> pool.execute(model -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    try {
                        Thread.sleep(2);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return inside.decrementAndGet();
                }));
            }
            for (Future<Integer> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(1, pool.size());
    }

    @Test
    public void testInstanceReturnedAfterTaskFailure() {
        NativeModelPool<FakeModel> pool = new NativeModelPool<>("fake", 1, FakeModel::new);
        try {
            pool.execute(model -> {
                throw new IllegalStateException("推理失败");
            });
            fail("应抛出推理异常");
        } catch (IllegalStateException expected) {
            assertEquals("推理失败", expected.getMessage());
        }

        assertTrue(pool.execute(model -> !model.closed));
    }

    @Test
    public void testCloseReleasesInstances() {
        FakeModel model = new FakeModel();
        NativeModelPool<FakeModel> pool = new NativeModelPool<>("fake", 1, () -> model);

        pool.close();

        assertTrue(model.closed);
        try {
            pool.execute(m -> true);
            fail("关闭后不应再借出实例");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().contains("fake"));
        }
    }
}
