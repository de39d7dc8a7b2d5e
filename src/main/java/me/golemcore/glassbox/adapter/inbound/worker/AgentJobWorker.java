package me.golemcore.glassbox.adapter.inbound.worker;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.service.AgentJobHandler;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.port.outbound.JobQueuePort;
import me.golemcore.glassbox.port.outbound.JobQueuePort.ReceivedJob;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue consumer. Polls the job transport on a fixed delay and runs each job
 * on a bounded pool, one execution per thread. Receives only as many jobs as
 * there are free slots so that un-started jobs stay on the queue.
 */
@Component
@Slf4j
public class AgentJobWorker {

    private final JobQueuePort jobQueuePort;
    private final AgentJobHandler jobHandler;
    private final AgentProperties.WorkerProperties settings;

    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final AtomicInteger busy = new AtomicInteger();

    private ScheduledExecutorService poller;
    private ExecutorService runners;
    private ScheduledFuture<?> pollTask;

    public AgentJobWorker(JobQueuePort jobQueuePort, AgentJobHandler jobHandler, AgentProperties properties) {
        this.jobQueuePort = jobQueuePort;
        this.jobHandler = jobHandler;
        this.settings = properties.getWorker();
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("[Worker] Queue consumer disabled");
            return;
        }

        AtomicInteger threadIndex = new AtomicInteger();
        runners = Executors.newFixedThreadPool(settings.getConcurrency(), r -> {
            Thread t = new Thread(r, "agent-job-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agent-job-poller");
            t.setDaemon(true);
            return t;
        });
        pollTask = poller.scheduleWithFixedDelay(this::poll, settings.getPollIntervalMs(),
                settings.getPollIntervalMs(), TimeUnit.MILLISECONDS);

        log.info("[Worker] Started: concurrency={}, batchSize={}, pollInterval={}ms", settings.getConcurrency(),
                settings.getBatchSize(), settings.getPollIntervalMs());
    }

    @PreDestroy
    public void shutdown() {
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        stop(poller);
        stop(runners);
        log.info("[Worker] Shut down");
    }

    void poll() {
        if (!polling.compareAndSet(false, true)) {
            return;
        }
        try {
            int free = settings.getConcurrency() - busy.get();
            if (free <= 0) {
                return;
            }
            List<ReceivedJob> jobs = jobQueuePort.receive(Math.min(free, settings.getBatchSize()));
            if (!jobs.isEmpty()) {
                log.debug("[Worker] Received {} jobs", jobs.size());
            }
            for (ReceivedJob received : jobs) {
                busy.incrementAndGet();
                runners.execute(() -> {
                    try {
                        process(received);
                    } finally {
                        busy.decrementAndGet();
                    }
                });
            }
        } catch (Exception e) { // NOSONAR
            log.error("[Worker] Poll failed: {}", e.getMessage(), e);
        } finally {
            polling.set(false);
        }
    }

    void process(ReceivedJob received) {
        if (received.job() == null) {
            log.warn("[Worker] Acknowledging undecodable job: {}", received.rawBody());
            jobQueuePort.ack(received.receiptHandle());
            return;
        }
        if (jobHandler.handle(received.job()) == AgentJobHandler.Disposition.ACK) {
            jobQueuePort.ack(received.receiptHandle());
        }
    }

    int busySlots() {
        return busy.get();
    }

    private static void stop(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
