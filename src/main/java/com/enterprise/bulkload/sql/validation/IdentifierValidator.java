package com.enterprise.bulkload.sql.validation;

import com.enterprise.bulkload.load.domain.exception.InvalidIdentifierException;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * SQL injection guard for table and column names. Names are the only text
 * concatenated into statements; values are always bound as parameters.
 */
public final class IdentifierValidator {

    private IdentifierValidator() {}

    // Letter/underscore start, then alphanumeric/underscore. No dots, no quoting.
    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static boolean isIdentifier(String identifier) {
        return identifier != null && IDENTIFIER_PATTERN.matcher(identifier).matches();
    }

    /**
     * @throws InvalidIdentifierException if the name is null or malformed
     */
    public static String requireIdentifier(String identifier) {
        if (!isIdentifier(identifier)) {
            throw new InvalidIdentifierException(identifier);
        }
        return identifier;
    }

    public static void requireIdentifiers(Collection<String> identifiers) {
        identifiers.forEach(IdentifierValidator::requireIdentifier);
    }

    /** Validates and double-quotes a name for SQL text. */
    public static String quote(String identifier) {
        return "\"" + requireIdentifier(identifier) + "\"";
    }
}
