package com.shelfsync.converter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfsync.converter.repository.JdbcStoreFactory;
import com.shelfsync.converter.repository.StoreFactory;
import com.shelfsync.converter.service.image.HttpImageStorageGateway;
import com.shelfsync.converter.service.image.ImageFingerprinter;
import com.shelfsync.converter.service.image.ImageStorageGateway;
import com.shelfsync.converter.service.image.UrlImageFingerprinter;
import com.shelfsync.converter.service.parser.ChizhikHandler;
import com.shelfsync.converter.service.parser.FixPriceHandler;
import com.shelfsync.converter.service.parser.ParserHandlerRegistry;
import com.shelfsync.converter.service.parser.PerekrestokHandler;
import com.shelfsync.converter.service.parser.TextNormalizer;
import com.shelfsync.converter.service.queue.SyncTaskQueue;
import com.shelfsync.converter.service.queue.SyncTaskRegistry;
import com.shelfsync.converter.service.queue.SyncWorker;
import com.shelfsync.converter.service.sync.SyncEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class ConverterConfig {
    private static final Logger log = LoggerFactory.getLogger(ConverterConfig.class);

    @Bean
    public TextNormalizer textNormalizer() {
        return new TextNormalizer();
    }

    @Bean
    public ParserHandlerRegistry parserHandlerRegistry(TextNormalizer text) {
        ParserHandlerRegistry registry = new ParserHandlerRegistry()
                .register(new FixPriceHandler(text))
                .register(new ChizhikHandler(text))
                .register(new PerekrestokHandler(text));
        log.info("Parser handlers: {}", registry.registeredParsers());
        return registry;
    }

    @Bean
    public ImageFingerprinter imageFingerprinter() {
        return new UrlImageFingerprinter();
    }

    @Bean
    public ImageStorageGateway imageStorageGateway(StorageProperties storage, @Qualifier("storageClient") WebClient storageClient) {
        if (!storage.isConfigured()) {
            log.info("Image storage not configured, duplicate images will not be deleted upstream");
            return ImageStorageGateway.DISABLED;
        }
        Duration timeout = Duration.ofMillis(Math.max(100L, Math.round(storage.getDeleteTimeout() * 1000)));
        return new HttpImageStorageGateway(storageClient, storage.getBaseUrl(), timeout);
    }

    @Bean
    public StoreFactory storeFactory(ObjectMapper objectMapper) {
        return new JdbcStoreFactory(objectMapper);
    }

    @Bean
    public SyncEngine syncEngine(StoreFactory stores, ParserHandlerRegistry registry, TextNormalizer text,
                                 ObjectMapper objectMapper, ImageFingerprinter fingerprinter,
                                 ImageStorageGateway storageGateway, StorageProperties storage) {
        return new SyncEngine(stores, registry, text, objectMapper, fingerprinter, storageGateway, storage.isStrict());
    }

    @Bean
    public SyncTaskQueue syncTaskQueue(ConverterProperties properties) {
        return new SyncTaskQueue(properties.getMaxQueueSize());
    }

    @Bean
    public SyncTaskRegistry syncTaskRegistry() {
        return new SyncTaskRegistry();
    }

    /** Not started for one-shot {@code --sync.run} invocations. */
    @Bean(destroyMethod = "stop")
    public SyncWorker syncWorker(SyncTaskQueue queue, SyncEngine engine, ConverterProperties properties,
                                 ApplicationArguments arguments) {
        SyncWorker worker = new SyncWorker(queue, engine);
        if (properties.isWorkerEnabled() && !arguments.containsOption("sync.run")) {
            worker.start();
        }
        return worker;
    }
}
