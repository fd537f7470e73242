package com.example.mlops.collab;

import com.example.mlops.dto.DataWindow;
import com.example.mlops.dto.Dataset;
import com.example.mlops.exception.NotAvailableException;

/**
 * Source of fresh, cleaned training data. Download and cleaning are owned by the implementation.
 */
public interface DataIngestionClient {

    /**
     * @throws NotAvailableException if the window has no data yet or the fetch failed
     */
    Dataset fetchWindow(DataWindow window);
}
