package com.enterprise.bulkload.shared.valueresolver.port;

/**
 * Where a configured value comes from.
 */
public enum SourceKind {
    /** Dot-separated path into the current row. */
    PATH,
    /** SpEL expression over the message merged with the current row. */
    EXPRESSION,
    /** The source text itself. */
    STRING,
    /** The source text parsed as a number. */
    NUMBER,
    /** The source text parsed as a boolean. */
    BOOLEAN,
    /** The source text parsed as JSON. */
    JSON,
    /** Environment property named by the spec. */
    ENV,
    /** Dotted path into the invocation message. */
    MESSAGE,
    /** Dotted path into the flow-scoped store. */
    FLOW,
    /** Dotted path into the global store. */
    GLOBAL
}
