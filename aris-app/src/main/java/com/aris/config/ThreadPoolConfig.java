package com.aris.config;

import com.aris.trigger.config.ExecutionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <ul>
 *   <li>planExecutionWorker：每条入站消息一个回合任务，回合内顺序执行计划</li>
 *   <li>toolCallWorker：承载单次工具调用，调用方以 Future#get 施加超时</li>
 * </ul>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ExecutionProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "planExecutionWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "planExecutionWorker")
    public ThreadPoolExecutor planExecutionWorker(
            @Value("${executor.plan.core-size:8}") int coreSize,
            @Value("${executor.plan.max-size:32}") int maxSize,
            @Value("${executor.plan.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.plan.queue-capacity:200}") int queueCapacity,
            @Value("${executor.plan.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.plan.thread-name-prefix:plan-exec-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    /**
     * 默认 queue-capacity=0，工具调用直接占用线程开始执行，超时计时不含排队时间。
     */
    @Bean(name = "toolCallWorker", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "toolCallWorker")
    public ThreadPoolExecutor toolCallWorker(
            @Value("${executor.tool.core-size:16}") int coreSize,
            @Value("${executor.tool.max-size:64}") int maxSize,
            @Value("${executor.tool.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.tool.queue-capacity:0}") int queueCapacity,
            @Value("${executor.tool.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.tool.thread-name-prefix:tool-call-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    private ThreadPoolExecutor buildExecutor(int coreSize,
                                             int maxSize,
                                             long keepAliveSeconds,
                                             int queueCapacity,
                                             String rejectionPolicy,
                                             String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        return new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        switch (policy == null ? "" : policy) {
            case "CallerRunsPolicy":
                return new ThreadPoolExecutor.CallerRunsPolicy();
            case "DiscardPolicy":
                return new ThreadPoolExecutor.DiscardPolicy();
            case "DiscardOldestPolicy":
                return new ThreadPoolExecutor.DiscardOldestPolicy();
            case "AbortPolicy":
                return new ThreadPoolExecutor.AbortPolicy();
            default:
                // 回合被拒绝时由 SessionManager 向客户端推送 error 事件
                log.warn("THREAD_POOL_CONFIG unknown rejection policy={}, fallback=AbortPolicy", policy);
                return new ThreadPoolExecutor.AbortPolicy();
        }
    }

}
