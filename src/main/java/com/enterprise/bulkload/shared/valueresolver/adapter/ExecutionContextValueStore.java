package com.enterprise.bulkload.shared.valueresolver.adapter;

import com.enterprise.bulkload.shared.valueresolver.port.ValueStore;

import org.springframework.batch.item.ExecutionContext;

import java.util.Map;
import java.util.Objects;

/**
 * {@link ValueStore} over a Spring Batch {@link ExecutionContext}. The first path
 * segment is the context key; the rest walks into the (map) value stored there.
 *
 * <p>Backed by the job execution context, this is the flow scope: values written
 * by one step are visible to the following steps of the same job.
 */
public class ExecutionContextValueStore implements ValueStore {

    private final ExecutionContext executionContext;

    public ExecutionContextValueStore(ExecutionContext executionContext) {
        this.executionContext = Objects.requireNonNull(executionContext, "executionContext");
    }

    @Override
    public Object get(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        int dot = path.indexOf('.');
        Object root = executionContext.get(dot < 0 ? path : path.substring(0, dot));
        return dot < 0 ? root : DottedPath.get(root, path.substring(dot + 1));
    }

    @Override
    public void put(String path, Object value) {
        int dot = path.indexOf('.');
        if (dot < 0) {
            executionContext.put(path, value);
            return;
        }
        String head = path.substring(0, dot);
        Map<String, Object> root = DottedPath.mutableCopy(executionContext.get(head));
        DottedPath.put(root, path.substring(dot + 1), value);
        executionContext.put(head, root);
    }
}
