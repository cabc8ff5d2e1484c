package com.showdownlab.optimizer.infrastructure;

import com.showdownlab.optimizer.repository.AnalysisJobRepository;
import com.showdownlab.optimizer.service.AnalysisJobExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Starts the analysis workers on startup and stops them on shutdown.
 */
@Component
@Slf4j
public class WorkerManager {

    private final ExecutorService workerExecutorService;
    private final QueueService queueService;
    private final AnalysisJobRepository analysisJobRepository;
    private final AnalysisJobExecutor analysisJobExecutor;

    @Value("${showdown.worker.thread-count:3}")
    private int workerThreadCount;

    @Value("${showdown.worker.enabled:true}")
    private boolean workersEnabled;

    private final List<AnalysisWorker> workers = new ArrayList<>();

    public WorkerManager(@Qualifier("workerExecutorService") ExecutorService workerExecutorService,
            QueueService queueService,
            AnalysisJobRepository analysisJobRepository,
            AnalysisJobExecutor analysisJobExecutor) {
        this.workerExecutorService = workerExecutorService;
        this.queueService = queueService;
        this.analysisJobRepository = analysisJobRepository;
        this.analysisJobExecutor = analysisJobExecutor;
    }

    @PostConstruct
    public void startWorkers() {
        if (!workersEnabled) {
            log.info("Background workers are disabled");
            return;
        }

        for (int i = 0; i < workerThreadCount; i++) {
            String workerName = "AnalysisWorker-" + (i + 1);
            AnalysisWorker worker = new AnalysisWorker(queueService, analysisJobRepository, analysisJobExecutor,
                    workerName);
            workers.add(worker);
            workerExecutorService.submit(worker);
        }

        log.info("Started {} analysis workers", workerThreadCount);
    }

    @PreDestroy
    public void stopWorkers() {
        log.info("Stopping all workers...");
        workers.forEach(AnalysisWorker::stop);
        workerExecutorService.shutdown();

        try {
            if (!workerExecutorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Workers did not terminate gracefully, forcing shutdown");
                workerExecutorService.shutdownNow();
            } else {
                log.info("All workers stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for workers to stop", e);
            workerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    List<AnalysisWorker> getWorkers() {
        return workers;
    }
}
