package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.ColumnMapping;
import com.enterprise.bulkload.shared.valueresolver.port.InvocationContext;

import java.util.List;

/**
 * Turns an input row into the ordered parameter tuple of the run's statement:
 * resolve each mapped column, then apply its transform.
 */
public class RowParameterMapper {

    private final List<ColumnMapping> mappings;
    private final List<String> columns;
    private final RowResolver resolver;
    private final InvocationContext context;

    public RowParameterMapper(List<ColumnMapping> mappings, RowResolver resolver, InvocationContext context) {
        this.mappings = List.copyOf(mappings);
        this.columns = this.mappings.stream().map(ColumnMapping::column).toList();
        this.resolver = resolver;
        this.context = context;
    }

    public List<String> columns() {
        return columns;
    }

    public Object[] toParameters(Object row) {
        Object[] params = new Object[mappings.size()];
        for (int i = 0; i < params.length; i++) {
            ColumnMapping m = mappings.get(i);
            params[i] = ValueTransforms.apply(resolver.resolve(row, m, context), m.transform());
        }
        return params;
    }
}
