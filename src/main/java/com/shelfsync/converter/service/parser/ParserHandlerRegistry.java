package com.shelfsync.converter.service.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a parser name to its handler. Populated once at startup and then only read,
 * one lookup per raw record.
 */
public class ParserHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParserHandlerRegistry.class);

    private final Map<String, ParserHandler> handlers = new ConcurrentHashMap<>();

    public ParserHandlerRegistry register(ParserHandler handler) {
        return register(handler.parserName(), handler);
    }

    public ParserHandlerRegistry register(String parserName, ParserHandler handler) {
        String key = key(parserName);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Parser name must be non-empty");
        }
        if (handlers.putIfAbsent(key, handler) != null) {
            throw new DuplicateHandlerException(key);
        }
        log.debug("Registered parser handler {} -> {}", key, handler.getClass().getSimpleName());
        return this;
    }

    public ParserHandler resolve(String parserName) {
        ParserHandler handler = handlers.get(key(parserName));
        if (handler == null) {
            throw new UnknownParserException(parserName, registeredParsers());
        }
        return handler;
    }

    public List<String> registeredParsers() {
        List<String> names = new ArrayList<>(handlers.keySet());
        Collections.sort(names);
        return names;
    }

    private static String key(String parserName) {
        return parserName == null ? "" : parserName.trim().toLowerCase(Locale.ROOT);
    }
}
