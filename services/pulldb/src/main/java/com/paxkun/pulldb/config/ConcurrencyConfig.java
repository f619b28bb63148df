package com.paxkun.pulldb.config;

import com.paxkun.pulldb.concurrent.AutoCloseableExecutor;
import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.concurrent.KeyedLocks;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ConcurrencyConfig {

    @Bean(destroyMethod = "close")
    public AutoCloseableExecutor readExecutor(@Value("${pulldb.fanout.threads:16}") int threads,
                                              @Value("${pulldb.fanout.shutdown-seconds:30}") long shutdownSeconds) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "pulldb-read-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new AutoCloseableExecutor(Executors.newFixedThreadPool(threads, factory), shutdownSeconds);
    }

    @Bean
    public FanOut fanOut(AutoCloseableExecutor readExecutor) {
        return new FanOut(readExecutor);
    }

    @Bean
    public KeyedLocks keyedLocks(@Value("${pulldb.locks.stripes:256}") int stripes) {
        return new KeyedLocks(stripes);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
