package com.satmobile.backend.modules.store.infrastructure;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.satmobile.backend.modules.store.domain.DocumentPath;
import com.satmobile.backend.modules.store.domain.WriteOperation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Loads a JSON object of {@code "document/path": {fields}} entries into a store. Used to
 * start the in-memory store with tenants, administrators and members for local runs.
 */
public class DocumentTreeSeeder {

    private static final Logger log = LoggerFactory.getLogger(DocumentTreeSeeder.class);
    private static final TypeReference<LinkedHashMap<String, Map<String, Object>>> TREE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public DocumentTreeSeeder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public int seed(DocumentStore store, Resource resource) {
        Map<String, Map<String, Object>> tree;
        try (InputStream input = resource.getInputStream()) {
            tree = objectMapper.readValue(input, TREE_TYPE);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read seed documents from " + resource, ex);
        }

        List<WriteOperation> chunk = new ArrayList<>();
        int written = 0;
        for (Map.Entry<String, Map<String, Object>> entry : tree.entrySet()) {
            chunk.add(WriteOperation.replace(new DocumentPath(entry.getKey()), entry.getValue()));
            if (chunk.size() == DocumentStore.MAX_BATCH_OPERATIONS) {
                store.commit(chunk);
                written += chunk.size();
                chunk = new ArrayList<>();
            }
        }
        if (!chunk.isEmpty()) {
            store.commit(chunk);
            written += chunk.size();
        }
        log.info("Seeded {} documents from {}", written, resource.getDescription());
        return written;
    }
}
