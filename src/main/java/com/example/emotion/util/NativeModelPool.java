package com.example.emotion.util;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 原生模型实例池
 * <p>
 * OpenCV检测器与网络对象不能被多个线程同时使用。池内每个实例同一时刻只借给一个调用方，
 * 不同会话的推理最多并行 capacity 路。实例按需创建，第一个实例在构造时创建，模型无效时立即失败。
 */
@Slf4j
public class NativeModelPool<T extends AutoCloseable> implements AutoCloseable {

    private final String name;
    private final Supplier<T> factory;
    private final int capacity;
    private final BlockingQueue<T> idle = new LinkedBlockingQueue<>();
    private final List<T> created = new CopyOnWriteArrayList<>();
    private final AtomicInteger size = new AtomicInteger();
    private volatile boolean closed;

    public NativeModelPool(String name, int capacity, Supplier<T> factory) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("模型池容量必须大于0: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.factory = factory;

        size.incrementAndGet();
        T first = factory.get();
        created.add(first);
        idle.add(first);
        log.info("✓ 模型池 {} 已就绪，容量 {}", name, capacity);
    }

    /**
     * 借出一个实例执行任务，结束后归还。池满且全部被占用时等待
     */
    public <R> R execute(Function<T, R> task) {
        T model = acquire();
        try {
            return task.apply(model);
        } finally {
            idle.add(model);
        }
    }

    private T acquire() {
        if (closed) {
            throw new IllegalStateException("模型池 " + name + " 已关闭");
        }
        T model = idle.poll();
        if (model != null) {
            return model;
        }
        if (size.incrementAndGet() <= capacity) {
            try {
                T fresh = factory.get();
                created.add(fresh);
                log.debug("模型池 {} 新建实例，当前 {} 个", name, created.size());
                return fresh;
            } catch (RuntimeException | Error e) {
                size.decrementAndGet();
                throw e;
            }
        }
        size.decrementAndGet();
        try {
            return idle.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("等待模型池 " + name + " 实例时被中断", e);
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /** 已创建的实例数 */
    public int size() {
        return created.size();
    }

    @Override
    public void close() {
        closed = true;
        for (T model : created) {
            try {
                model.close();
            } catch (Exception e) {
                log.warn("⚠ 模型池 {} 释放实例失败: {}", name, e.getMessage());
            }
        }
        created.clear();
        idle.clear();
    }
}
