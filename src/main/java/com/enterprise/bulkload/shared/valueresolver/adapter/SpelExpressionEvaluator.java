package com.enterprise.bulkload.shared.valueresolver.adapter;

import com.enterprise.bulkload.shared.valueresolver.port.InvocationContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates SpEL expressions against the invocation message merged with the
 * current row.
 *
 * <p>The root object is a copy of the message with the row under {@code row},
 * so both {@code row.price * 2} and {@code payload.meta.source} work. The row and
 * message are also bound as {@code #row} and {@code #msg}, the flow and global
 * stores as {@code #flow} and {@code #global}.
 *
 * <p>Evaluation runs in a read-only {@link SimpleEvaluationContext}: no type
 * references, constructors or bean lookups. Any parse or evaluation failure
 * yields {@code null}.
 */
public class SpelExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SpelExpressionEvaluator.class);

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();

    public Object evaluate(String expressionText, InvocationContext context, Object row) {
        if (expressionText == null || expressionText.isBlank()) {
            return null;
        }
        try {
            Expression expression = cache.computeIfAbsent(expressionText, parser::parseExpression);

            Map<String, Object> root = new LinkedHashMap<>(context.message());
            root.put("row", row);

            SimpleEvaluationContext ctx = SimpleEvaluationContext
                    .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                    .withInstanceMethods()
                    .withRootObject(root)
                    .build();
            ctx.setVariable("row", row);
            ctx.setVariable("msg", context.message());
            ctx.setVariable("flow", context.flow());
            ctx.setVariable("global", context.global());

            return expression.getValue(ctx);
        } catch (RuntimeException e) {
            log.debug("Expression '{}' did not evaluate: {}", expressionText, e.getMessage());
            return null;
        }
    }
}
