package com.enterprise.bulkload.load.infrastructure;

import com.enterprise.bulkload.load.application.BulkExecutor;
import com.enterprise.bulkload.load.application.BulkLoadService;
import com.enterprise.bulkload.load.application.CapabilityDetector;
import com.enterprise.bulkload.load.application.ConnectionSessionFactory;
import com.enterprise.bulkload.shared.valueresolver.adapter.DefaultTypedValueResolver;
import com.enterprise.bulkload.shared.valueresolver.adapter.DefaultTypedValueWriter;
import com.enterprise.bulkload.shared.valueresolver.adapter.MapValueStore;
import com.enterprise.bulkload.shared.valueresolver.adapter.SpelExpressionEvaluator;
import com.enterprise.bulkload.shared.valueresolver.port.TypedValueResolver;
import com.enterprise.bulkload.shared.valueresolver.port.TypedValueWriter;
import com.enterprise.bulkload.shared.valueresolver.port.ValueStore;
import com.enterprise.bulkload.sql.core.Dialects;
import com.enterprise.bulkload.sql.core.EngineVersion;
import com.enterprise.bulkload.sql.core.SqlDialect;
import com.enterprise.bulkload.sql.param.ParameterBinder;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Wiring for the bulk-load engine.
 */
@Configuration
@EnableConfigurationProperties(BulkLoadProperties.class)
public class BulkLoadConfig {

    @Bean
    public SqlDialect bulkLoadDialect(BulkLoadProperties properties) {
        return Dialects.sqlite(EngineVersion.parse(properties.getReturningMinimumVersion()));
    }

    @Bean
    public CapabilityDetector capabilityDetector(SqlDialect bulkLoadDialect) {
        return new CapabilityDetector(bulkLoadDialect);
    }

    @Bean
    public ConnectionSessionFactory connectionSessionFactory(CapabilityDetector detector) {
        return new SqliteSessionFactory(detector);
    }

    @Bean
    public ParameterBinder parameterBinder(ObjectProvider<ObjectMapper> objectMapper) {
        return new ParameterBinder(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public SpelExpressionEvaluator spelExpressionEvaluator() {
        return new SpelExpressionEvaluator();
    }

    @Bean
    public TypedValueResolver typedValueResolver(Environment environment,
                                                 ObjectProvider<ObjectMapper> objectMapper,
                                                 SpelExpressionEvaluator evaluator) {
        return new DefaultTypedValueResolver(environment, objectMapper.getIfAvailable(ObjectMapper::new), evaluator);
    }

    @Bean
    public TypedValueWriter typedValueWriter() {
        return new DefaultTypedValueWriter();
    }

    /** Process-wide store behind the GLOBAL scope. */
    @Bean
    public ValueStore globalValueStore() {
        return new MapValueStore();
    }

    @Bean
    public BulkExecutor bulkExecutor(SqlDialect bulkLoadDialect, ParameterBinder binder) {
        return new BulkExecutor(bulkLoadDialect, binder);
    }

    @Bean
    public BulkLoadService bulkLoadService(ConnectionSessionFactory sessionFactory,
                                           BulkExecutor executor,
                                           TypedValueResolver resolver,
                                           TypedValueWriter writer) {
        return new BulkLoadService(sessionFactory, executor, resolver, writer);
    }
}
