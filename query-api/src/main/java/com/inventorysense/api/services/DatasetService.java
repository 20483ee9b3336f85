package com.inventorysense.api.services;

import com.inventorysense.api.model.UploadRequest;
import com.inventorysense.api.model.UploadResponse;
import com.inventorysense.engine.context.DatasetContext;
import com.inventorysense.engine.context.DatasetSnapshot;
import com.inventorysense.engine.model.RawDataset;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accepts dataset uploads and publishes them as new snapshots.
 */
@ApplicationScoped
public class DatasetService {

    private static final Logger LOG = Logger.getLogger(DatasetService.class);

    @Inject
    DatasetContext datasetContext;

    /**
     * Replace the current dataset. A rejected upload leaves the previous dataset in place.
     */
    public UploadResponse upload(UploadRequest request) {
        List<Map<String, Object>> rows = request != null && request.rows() != null ? request.rows() : List.of();
        LOG.infof("Received dataset upload with %d rows", rows.size());

        DatasetSnapshot snapshot = datasetContext.replace(RawDataset.of(rows));

        return new UploadResponse(
            "Dataset uploaded successfully",
            snapshot.dataset().size(),
            snapshot.dataset().columns(),
            snapshot.distributorQuarters().size(),
            snapshot.version()
        );
    }

    public Optional<DatasetSnapshot> loaded() {
        return datasetContext.peek();
    }
}
