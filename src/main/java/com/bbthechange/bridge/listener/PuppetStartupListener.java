package com.bbthechange.bridge.listener;

import com.bbthechange.bridge.model.Puppet;
import com.bbthechange.bridge.service.DoublePuppetService;
import com.bbthechange.bridge.service.PuppetService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Restarts double puppeting for every linked puppet once the bridge has started.
 *
 * Each puppet is started by its own task; a failing or cancelled task is logged and does not
 * affect the others.
 */
@Component
public class PuppetStartupListener {

    private static final Logger logger = LoggerFactory.getLogger(PuppetStartupListener.class);

    private final PuppetService puppetService;
    private final DoublePuppetService doublePuppetService;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public PuppetStartupListener(PuppetService puppetService,
                                 DoublePuppetService doublePuppetService,
                                 @Qualifier("puppetStartExecutor") Executor executor,
                                 MeterRegistry meterRegistry) {
        this.puppetService = puppetService;
        this.doublePuppetService = doublePuppetService;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        startCustomPuppets();
    }

    /**
     * @return future of the number of sessions that started
     */
    public CompletableFuture<Integer> startCustomPuppets() {
        return CompletableFuture.supplyAsync(() -> puppetService.getAllWithCustomMxid()
                        .map(this::startAsync)
                        .collect(Collectors.toList()), executor)
                .thenCompose(this::countStarted)
                .whenComplete((started, error) -> {
                    if (error != null) {
                        logger.error("Failed to enumerate double puppeted puppets", error);
                    } else {
                        logger.info("Started double puppeting for {} puppets", started);
                    }
                });
    }

    private CompletableFuture<Boolean> startAsync(Puppet puppet) {
        return CompletableFuture.supplyAsync(() -> doublePuppetService.tryStart(puppet), executor)
                .exceptionally(error -> {
                    logger.error("Double puppeting start task for {} failed", puppet.getRemoteUserKey(), error);
                    return false;
                })
                .whenComplete((started, error) -> meterRegistry
                        .counter("puppet_custom_start_total", "status", Boolean.TRUE.equals(started) ? "started" : "failed")
                        .increment());
    }

    private CompletableFuture<Integer> countStarted(List<CompletableFuture<Boolean>> tasks) {
        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> (int) tasks.stream()
                        .filter(task -> Boolean.TRUE.equals(task.join()))
                        .count());
    }
}
