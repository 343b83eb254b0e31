package com.enterprise.bulkload.shared.valueresolver.adapter;

import com.enterprise.bulkload.shared.valueresolver.port.InvocationContext;
import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;
import com.enterprise.bulkload.shared.valueresolver.port.ValueScope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DefaultTypedValueResolverTest {

    private final MockEnvironment environment = new MockEnvironment().withProperty("DB_PATH", "/data/app.db");
    private final DefaultTypedValueResolver resolver =
            new DefaultTypedValueResolver(environment, new ObjectMapper(), new SpelExpressionEvaluator());
    private final DefaultTypedValueWriter writer = new DefaultTypedValueWriter();

    private InvocationContext context;

    @BeforeEach
    void setUp() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("payload", List.of(Map.of("qty", 3)));
        message.put("meta", Map.of("source", "crm"));
        context = InvocationContext.of(message);
    }

    @Test
    void literals() {
        assertThat(resolver.resolve(SourceKind.STRING, "abc", context)).isEqualTo("abc");
        assertThat(resolver.resolve(SourceKind.NUMBER, "42", context)).isEqualTo(42L);
        assertThat(resolver.resolve(SourceKind.NUMBER, "2.5", context)).isEqualTo(2.5d);
        assertThat(resolver.resolve(SourceKind.NUMBER, "n/a", context)).isNull();
        assertThat(resolver.resolve(SourceKind.BOOLEAN, "TRUE", context)).isEqualTo(true);
        assertThat(resolver.resolve(SourceKind.BOOLEAN, "", context)).isEqualTo(false);
    }

    @Test
    void jsonLiteral() {
        assertThat(resolver.resolve(SourceKind.JSON, "[{\"a\":1}]", context))
                .isEqualTo(List.of(Map.of("a", 1)));
        assertThat(resolver.resolve(SourceKind.JSON, "{broken", context)).isNull();
    }

    @Test
    void environmentPropertyOrEmpty() {
        assertThat(resolver.resolve(SourceKind.ENV, "DB_PATH", context)).isEqualTo("/data/app.db");
        assertThat(resolver.resolve(SourceKind.ENV, "NOT_SET", context)).isEqualTo("");
    }

    @Test
    void storesByDottedPath() {
        context.flow().put("last.run", "ok");
        context.global().put("limit", 10);
        assertThat(resolver.resolve(SourceKind.MESSAGE, "meta.source", context)).isEqualTo("crm");
        assertThat(resolver.resolve(SourceKind.MESSAGE, "meta.missing", context)).isNull();
        assertThat(resolver.resolve(SourceKind.FLOW, "last.run", context)).isEqualTo("ok");
        assertThat(resolver.resolve(SourceKind.GLOBAL, "limit", context)).isEqualTo(10);
    }

    @Test
    void pathReadsTheRow() {
        Map<String, Object> row = Map.of("contact", Map.of("email", "x@y.z"));
        assertThat(resolver.resolve(SourceKind.PATH, "contact.email", context, row)).isEqualTo("x@y.z");
    }

    @Test
    void expressionSeesRowAndMessage() {
        Map<String, Object> row = Map.of("qty", 3, "sku", "ab-1");
        assertThat(resolver.resolve(SourceKind.EXPRESSION, "row.qty * 2", context, row)).isEqualTo(6);
        assertThat(resolver.resolve(SourceKind.EXPRESSION, "#row['sku'].toUpperCase()", context, row))
                .isEqualTo("AB-1");
        assertThat(resolver.resolve(SourceKind.EXPRESSION, "meta.source + ':' + row.sku", context, row))
                .isEqualTo("crm:ab-1");
    }

    @Test
    void badExpressionIsNull() {
        Map<String, Object> row = Map.of("qty", 3);
        assertThat(resolver.resolve(SourceKind.EXPRESSION, "row.qty *", context, row)).isNull();
        assertThat(resolver.resolve(SourceKind.EXPRESSION, "row.nothing.deeper", context, row)).isNull();
        assertThat(resolver.resolve(SourceKind.EXPRESSION, "T(java.lang.Runtime).getRuntime()", context, row))
                .isNull();
    }

    @Test
    void writerStoresInEachScope() {
        writer.write(ValueScope.MESSAGE, "result.summary", "s", context);
        writer.write(ValueScope.FLOW, "f", 1, context);
        writer.write(ValueScope.GLOBAL, "g.h", 2, context);
        writer.write(ValueScope.MESSAGE, " ", "ignored", context);

        assertThat(DottedPath.get(context.message(), "result.summary")).isEqualTo("s");
        assertThat(context.flow().get("f")).isEqualTo(1);
        assertThat(context.global().get("g.h")).isEqualTo(2);
        assertThat(context.message()).doesNotContainKey(" ");
    }
}
