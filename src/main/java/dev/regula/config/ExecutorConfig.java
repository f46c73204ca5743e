package dev.regula.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the bounded {@code retrievalExecutor} shared by tier calls and generator calls. A full
 * queue rejects new work instead of blocking the request thread; callers record the rejection as a
 * failed tier or an unavailable generator.
 */
@Configuration
public class ExecutorConfig {

  @Bean(name = "retrievalExecutor", destroyMethod = "shutdownNow")
  public ExecutorService retrievalExecutor(ExecutorProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threads =
        runnable -> {
          Thread thread = new Thread(runnable, "regula-retrieval-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return new ThreadPoolExecutor(
        properties.getCoreSize(),
        properties.getMaxSize(),
        60L,
        TimeUnit.SECONDS,
        new ArrayBlockingQueue<>(properties.getQueueCapacity()),
        threads,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
