package com.enterprise.bulkload.sql.param;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.SqlTypeValue;
import org.springframework.jdbc.core.StatementCreatorUtils;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Map;

/**
 * Binds one row of positional values onto a reused {@link PreparedStatement}.
 *
 * <p>Values are normalized for SQLite storage classes: booleans become 1/0,
 * nested maps and collections become their JSON text, temporals and enums their
 * string form. Everything else is handed to Spring's {@link StatementCreatorUtils}.
 */
public class ParameterBinder {

    private final ObjectMapper objectMapper;

    public ParameterBinder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void bind(PreparedStatement ps, Object[] values) throws SQLException {
        ps.clearParameters();
        for (int i = 0; i < values.length; i++) {
            StatementCreatorUtils.setParameterValue(ps, i + 1, SqlTypeValue.TYPE_UNKNOWN, normalize(values[i]));
        }
    }

    public Object normalize(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        if (value instanceof TemporalAccessor || value instanceof Enum<?> || value instanceof Character) {
            return value.toString();
        }
        return value;
    }
}
