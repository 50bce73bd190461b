package com.zookies.zkbackend.config;

import com.zookies.zkbackend.service.proof.backend.ProvingBackend;
import com.zookies.zkbackend.service.proof.backend.SnarkjsProvingBackend;
import com.zookies.zkbackend.util.CircuitInputExportUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ProofBackendConfig {

    private final ProofCircuitProperties properties;

    @Bean
    public ProvingBackend provingBackend(CircuitInputExportUtils exportUtils) {
        String command = properties.getSnarkjs().getCommand();
        log.info("Use snarkjs proving backend: {}", command);
        return new SnarkjsProvingBackend(command, exportUtils);
    }

    // Work never runs on the caller thread; the proof deadline only covers pool threads
    @Bean(name = "proofExecutor", destroyMethod = "shutdownNow")
    public ExecutorService proofExecutor() {
        int threads = properties.getWorker().getThreads();
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(properties.getWorker().getQueueCapacity()),
                new ThreadFactory() {
                    private final AtomicInteger seq = new AtomicInteger(0);
                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "proof-worker-" + seq.getAndIncrement());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

}
