package junie.email.intel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for scoring backfills, queued AI analysis and individual model calls.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "aiBatchExecutor")
    public Executor aiBatchExecutor() {
        // Small on purpose: bounds concurrent model calls from the batch worker
        return executor(3, 5, 100, "ai-batch-");
    }

    @Bean(name = "scoringExecutor")
    public Executor scoringExecutor() {
        return executor(5, 10, 500, "scoring-");
    }

    /**
     * Runs each model call so that a timed-out call can be interrupted through its future.
     */
    @Bean(name = "aiCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService aiCallExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        return new ThreadPoolExecutor(5, 10, 60L, TimeUnit.SECONDS, new ArrayBlockingQueue<>(100), r -> {
            Thread thread = new Thread(r, "ai-call-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static ThreadPoolTaskExecutor executor(int core, int max, int queue, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
