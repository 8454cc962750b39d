package com.shelfsync.converter.repository;

import com.fasterxml.jackson.databind.ObjectMapper;

public class SqliteCatalogRepository extends AbstractJdbcCatalogRepository {

    public SqliteCatalogRepository(JdbcStore store, ObjectMapper mapper) {
        super(store, mapper);
    }

    @Override
    protected String idColumn() {
        return "INTEGER PRIMARY KEY AUTOINCREMENT";
    }

    @Override
    protected String longText() {
        return "TEXT";
    }

    @Override
    protected String insertIgnore() {
        return "INSERT OR IGNORE";
    }

    @Override
    protected String lastInsertIdSql() {
        return "SELECT last_insert_rowid()";
    }
}
