package com.imagesearch.API;

import com.imagesearch.scan.ImageScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class ScanConfiguration {

    @Bean
    public ImageScanner imageScanner() {
        return new ImageScanner();
    }

    /**
     * Runs streamed scans. Each scan is sequential; the pool only lets several scans run side by side.
     */
    @Bean(name = "scanExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scanExecutor(ImageSearchProperties properties) {
        int threads = Math.max(1, properties.getConcurrency().getScanThreads());
        log.info("Creating scan executor with {} threads", threads);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "scan-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}
