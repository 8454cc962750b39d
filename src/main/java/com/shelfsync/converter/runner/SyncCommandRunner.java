package com.shelfsync.converter.runner;

import com.shelfsync.converter.config.ConverterProperties;
import com.shelfsync.converter.dto.SyncDtos;
import com.shelfsync.converter.service.sync.SyncEngine;
import com.shelfsync.converter.service.sync.SyncJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One-shot sync: {@code --sync.run=true} runs a single sync with the {@code converter.*}
 * settings (override them as {@code --converter.receiver-location=...} etc.). A failed run
 * propagates out of the runner so the process exits non-zero.
 */
@Component
public class SyncCommandRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCommandRunner.class);

    static final String OPTION = "sync.run";

    private final ApplicationArguments arguments;
    private final SyncEngine engine;
    private final ConverterProperties properties;

    public SyncCommandRunner(ApplicationArguments arguments, SyncEngine engine, ConverterProperties properties) {
        this.arguments = arguments;
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        if (!isEnabled()) {
            return;
        }
        SyncJob job = new SyncJob(properties.getReceiverLocation(), properties.getCatalogLocation(),
                properties.getParserName(), properties.getBatchSize(), properties.getMaxBatches(), null, "cli");
        SyncDtos.SyncReport report = engine.run(job, event -> log.info("Batch {}: processed={} total={} cursor=({}, {})",
                event.batchNumber(), event.batchSize(), event.totalSeen(), event.cursorIngestedAt(), event.cursorProductId()));
        log.info("Sync finished: batches={} processed={} skipped={} failed={}",
                report.getBatches(), report.getProcessed(), report.getSkipped(), report.getFailed());
    }

    boolean isEnabled() {
        if (!arguments.containsOption(OPTION)) return false;
        List<String> values = arguments.getOptionValues(OPTION);
        return values == null || values.isEmpty() || Boolean.parseBoolean(values.get(0));
    }
}
