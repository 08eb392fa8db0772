package com.tapas.superstore.etl.repository;

import com.tapas.superstore.etl.domain.WarehouseTable;
import com.tapas.superstore.etl.exception.SinkWriteException;

/**
 * Append-only destination for finished tables. Existing rows are never
 * replaced or removed.
 */
public interface WarehouseSink {

    /**
     * @throws SinkWriteException when the rows could not be written
     */
    void append(WarehouseTable table);
}
