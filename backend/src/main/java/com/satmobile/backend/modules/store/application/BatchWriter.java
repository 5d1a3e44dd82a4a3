package com.satmobile.backend.modules.store.application;

import java.util.List;

import com.satmobile.backend.global.config.SyncProperties;
import com.satmobile.backend.modules.store.domain.WriteOperation;
import com.satmobile.backend.modules.store.infrastructure.DocumentStore;
import com.satmobile.backend.modules.store.infrastructure.DocumentStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits write operations into chunks of at most {@code satmobile.sync.batch-limit} and
 * commits them one after another. Stops at the first failed chunk and does not retry;
 * a crash or failure leaves the committed prefix in place.
 */
@Component
public class BatchWriter {

    private static final Logger log = LoggerFactory.getLogger(BatchWriter.class);

    private final DocumentStore documentStore;
    private final int limit;

    public BatchWriter(DocumentStore documentStore, SyncProperties syncProperties) {
        int configured = syncProperties.batchLimit();
        if (configured < 1 || configured > DocumentStore.MAX_BATCH_OPERATIONS) {
            throw new IllegalArgumentException("satmobile.sync.batch-limit must be between 1 and "
                    + DocumentStore.MAX_BATCH_OPERATIONS + " but was " + configured);
        }
        this.documentStore = documentStore;
        this.limit = configured;
    }

    public int limit() {
        return limit;
    }

    public BatchWriteResult write(List<WriteOperation> operations) {
        if (operations.isEmpty()) {
            return BatchWriteResult.empty();
        }
        int total = operations.size();
        int chunks = (total + limit - 1) / limit;
        int committed = 0;
        for (int index = 0; index < chunks; index++) {
            List<WriteOperation> chunk = operations.subList(index * limit, Math.min(total, (index + 1) * limit));
            try {
                documentStore.commit(chunk);
            } catch (DocumentStoreException ex) {
                log.warn("[ALERT][Batch] chunk={}/{} committed={}/{} detail={}",
                        index + 1,
                        chunks,
                        committed,
                        total,
                        ex.getMessage(),
                        ex);
                return new BatchWriteResult(total, committed, chunks, index, ex);
            }
            committed += chunk.size();
        }
        if (chunks > 1) {
            log.debug("Committed {} operations in {} chunks", total, chunks);
        }
        return new BatchWriteResult(total, committed, chunks, chunks, null);
    }
}
