package com.asiainfo.deepdive.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 查询执行器配置
 * 两个周期的聚合查询相互独立，在这里并行执行
 */
@ApplicationScoped
public class FetchExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(FetchExecutorConfig.class);

    @Inject
    DeepDiveConfig config;

    private ExecutorService fetchExecutor;

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "deepdive-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.fetchExecutor = Executors.newFixedThreadPool(config.getFetchPoolSize(), factory);
        log.info("Fetch executor initialized with {} threads", config.getFetchPoolSize());
    }

    @PreDestroy
    void shutdown() {
        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Fetch executor shut down");
    }

    /**
     * 获取查询执行器
     * 用于 I/O 密集型任务：数据仓库查询
     */
    public ExecutorService getFetchExecutor() {
        return fetchExecutor;
    }
}
