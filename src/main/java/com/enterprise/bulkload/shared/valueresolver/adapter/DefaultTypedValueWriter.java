package com.enterprise.bulkload.shared.valueresolver.adapter;

import com.enterprise.bulkload.shared.valueresolver.port.InvocationContext;
import com.enterprise.bulkload.shared.valueresolver.port.TypedValueWriter;
import com.enterprise.bulkload.shared.valueresolver.port.ValueScope;

/**
 * Writes into the message (creating intermediate maps), the flow store or
 * the global store.
 */
public class DefaultTypedValueWriter implements TypedValueWriter {

    @Override
    public void write(ValueScope scope, String path, Object value, InvocationContext context) {
        if (path == null || path.isBlank()) {
            return;
        }
        switch (scope) {
            case FLOW -> context.flow().put(path, value);
            case GLOBAL -> context.global().put(path, value);
            case MESSAGE -> DottedPath.put(context.message(), path, value);
        }
    }
}
