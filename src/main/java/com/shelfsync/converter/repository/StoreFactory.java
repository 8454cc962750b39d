package com.shelfsync.converter.repository;

/** Opens receiver and catalog stores from a location string (file path or {@code mysql://} DSN). */
public interface StoreFactory {
    ReceiverRepository openReceiver(String location);

    CatalogRepository openCatalog(String location);
}
