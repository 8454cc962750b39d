package com.shelfsync.converter.repository;

import com.fasterxml.jackson.databind.ObjectMapper;

public class JdbcStoreFactory implements StoreFactory {
    private final ObjectMapper mapper;

    public JdbcStoreFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ReceiverRepository openReceiver(String location) {
        return new JdbcReceiverRepository(JdbcStore.open(location, true), mapper);
    }

    @Override
    public CatalogRepository openCatalog(String location) {
        JdbcStore store = JdbcStore.open(location, false);
        return store.kind() == JdbcStore.Kind.MYSQL
                ? new MysqlCatalogRepository(store, mapper)
                : new SqliteCatalogRepository(store, mapper);
    }
}
