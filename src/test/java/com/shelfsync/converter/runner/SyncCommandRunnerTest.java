package com.shelfsync.converter.runner;

import com.shelfsync.converter.config.ConverterProperties;
import com.shelfsync.converter.dto.SyncDtos;
import com.shelfsync.converter.repository.StoreUnavailableException;
import com.shelfsync.converter.service.sync.BatchListener;
import com.shelfsync.converter.service.sync.SyncEngine;
import com.shelfsync.converter.service.sync.SyncJob;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SyncCommandRunnerTest {

    static class StubEngine extends SyncEngine {
        final List<SyncJob> jobs = new ArrayList<>();
        RuntimeException failure;

        StubEngine() {
            super(null, null, null, null, null, null, true);
        }

        @Override
        public SyncDtos.SyncReport run(SyncJob job, BatchListener listener) {
            jobs.add(job);
            if (failure != null) throw failure;
            return new SyncDtos.SyncReport();
        }
    }

    private static ConverterProperties properties() {
        ConverterProperties p = new ConverterProperties();
        p.setReceiverLocation("receiver.db");
        p.setCatalogLocation("catalog.db");
        p.setParserName("chizhik");
        p.setBatchSize(25);
        return p;
    }

    @Test
    public void doesNothingWithoutTheOption() {
        StubEngine engine = new StubEngine();
        new SyncCommandRunner(new DefaultApplicationArguments(), engine, properties()).run();
        assertTrue(engine.jobs.isEmpty());
    }

    @Test
    public void runsOneSyncWithConfiguredSettings() {
        StubEngine engine = new StubEngine();
        new SyncCommandRunner(new DefaultApplicationArguments("--sync.run=true"), engine, properties()).run();
        assertEquals(1, engine.jobs.size());
        assertEquals("chizhik", engine.jobs.get(0).parserName());
        assertEquals(25, engine.jobs.get(0).batchSize());
        assertEquals("cli", engine.jobs.get(0).source());
    }

    @Test
    public void explicitFalseDisablesTheRun() {
        StubEngine engine = new StubEngine();
        new SyncCommandRunner(new DefaultApplicationArguments("--sync.run=false"), engine, properties()).run();
        assertTrue(engine.jobs.isEmpty());
    }

    @Test
    public void failurePropagates() {
        StubEngine engine = new StubEngine();
        engine.failure = new StoreUnavailableException("SQLite database not found: receiver.db");
        SyncCommandRunner runner = new SyncCommandRunner(new DefaultApplicationArguments("--sync.run"), engine, properties());
        assertThrows(StoreUnavailableException.class, runner::run);
    }
}
