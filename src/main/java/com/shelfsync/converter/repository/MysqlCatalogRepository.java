package com.shelfsync.converter.repository;

import com.fasterxml.jackson.databind.ObjectMapper;

public class MysqlCatalogRepository extends AbstractJdbcCatalogRepository {

    public MysqlCatalogRepository(JdbcStore store, ObjectMapper mapper) {
        super(store, mapper);
    }

    @Override
    protected String idColumn() {
        return "BIGINT PRIMARY KEY AUTO_INCREMENT";
    }

    @Override
    protected String longText() {
        return "LONGTEXT";
    }

    @Override
    protected String insertIgnore() {
        return "INSERT IGNORE";
    }

    @Override
    protected String lastInsertIdSql() {
        return "SELECT LAST_INSERT_ID()";
    }

    @Override
    protected String tableOptions() {
        return " ENGINE=InnoDB DEFAULT CHARSET=utf8mb4";
    }
}
