package io.lighting.quill.sql;

import java.util.Objects;

/**
 * A query that cannot be built. These are programmer errors and are never retried.
 */
public final class QueryException extends RuntimeException {
    public enum Kind {
        MISSING_CLAUSE,
        UNSUPPORTED_FEATURE,
        INVALID_SYNTAX
    }

    private final Kind kind;
    private final DatabaseBackend backend;
    private final String detail;

    private QueryException(Kind kind, DatabaseBackend backend, String detail, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.backend = backend;
        this.detail = detail;
    }

    public static QueryException missingClause(String clause) {
        return new QueryException(Kind.MISSING_CLAUSE, null, clause, "Missing required clause: " + clause);
    }

    public static QueryException unsupportedFeature(DatabaseBackend backend, String feature) {
        return new QueryException(
            Kind.UNSUPPORTED_FEATURE,
            backend,
            feature,
            "Feature " + feature + " is not supported by " + backend
        );
    }

    public static QueryException invalidSyntax(DatabaseBackend backend, String message) {
        return new QueryException(Kind.INVALID_SYNTAX, backend, message, "Invalid SQL for " + backend + ": " + message);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The backend the query targeted; null for a missing clause.
     */
    public DatabaseBackend backend() {
        return backend;
    }

    /**
     * The clause name, feature name or syntax message.
     */
    public String detail() {
        return detail;
    }
}
