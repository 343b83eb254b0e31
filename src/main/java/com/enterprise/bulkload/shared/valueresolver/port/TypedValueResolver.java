package com.enterprise.bulkload.shared.valueresolver.port;

/**
 * Resolves a configured (kind, spec) pair to a value.
 *
 * <p>Absent data is a normal outcome and comes back as {@code null}; a missing key
 * never raises. Malformed expressions and JSON also resolve to {@code null}.
 */
public interface TypedValueResolver {

    /**
     * @param row current input row for {@link SourceKind#PATH} and
     *            {@link SourceKind#EXPRESSION}, or {@code null} outside row scope
     */
    Object resolve(SourceKind kind, String spec, InvocationContext context, Object row);

    default Object resolve(SourceKind kind, String spec, InvocationContext context) {
        return resolve(kind, spec, context, null);
    }
}
