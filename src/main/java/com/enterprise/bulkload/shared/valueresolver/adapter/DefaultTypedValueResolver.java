package com.enterprise.bulkload.shared.valueresolver.adapter;

import com.enterprise.bulkload.shared.valueresolver.port.InvocationContext;
import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;
import com.enterprise.bulkload.shared.valueresolver.port.TypedValueResolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

import java.util.Objects;

/**
 * Default {@link TypedValueResolver}: literals are parsed, {@code ENV} reads the
 * Spring {@link Environment} (system environment included), the three stores
 * are addressed by dotted path and expressions go through SpEL.
 */
public class DefaultTypedValueResolver implements TypedValueResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultTypedValueResolver.class);

    private final Environment environment;
    private final ObjectMapper objectMapper;
    private final SpelExpressionEvaluator expressions;

    public DefaultTypedValueResolver(Environment environment,
                                     ObjectMapper objectMapper,
                                     SpelExpressionEvaluator expressions) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.expressions = Objects.requireNonNull(expressions, "expressions");
    }

    @Override
    public Object resolve(SourceKind kind, String spec, InvocationContext context, Object row) {
        return switch (kind) {
            case PATH -> DottedPath.get(row, spec);
            case EXPRESSION -> expressions.evaluate(spec, context, row);
            case STRING -> spec;
            case NUMBER -> NumberCoercion.parse(spec);
            case BOOLEAN -> spec != null && Boolean.parseBoolean(spec.trim());
            case JSON -> parseJson(spec);
            case ENV -> spec == null ? "" : environment.getProperty(spec, "");
            case MESSAGE -> DottedPath.get(context.message(), spec);
            case FLOW -> context.flow().get(spec);
            case GLOBAL -> context.global().get(spec);
        };
    }

    private Object parseJson(String spec) {
        if (spec == null || spec.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(spec, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("JSON literal rejected: {}", e.getOriginalMessage());
            return null;
        }
    }
}
