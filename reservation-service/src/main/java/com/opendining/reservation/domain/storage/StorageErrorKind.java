package com.opendining.reservation.domain.storage;

import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;

/**
 * Closed set of storage failure kinds. Retry decisions are made on the kind only,
 * never on exception message text.
 */
public enum StorageErrorKind {
    /** Connection refused, dropped or pool exhausted. */
    CONNECTION(true),
    /** Statement or transaction exceeded its time budget. */
    TIMEOUT(true),
    /** Row lock, deadlock or serialization failure. */
    CONTENTION(true),
    /** Missing table or column, or any other SQLState class 42 mismatch between code and schema. */
    SCHEMA_MISMATCH(false),
    /** Malformed query or misuse of the data access API. */
    QUERY_DEFECT(false),
    /** Unique, foreign key or not-null constraint rejected the write. */
    INTEGRITY_VIOLATION(false);

    private static final String SQL_STATE_SYNTAX_OR_ACCESS_RULE = "42";

    private final boolean retryable;

    StorageErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Maps Spring's data access hierarchy onto a kind. Order matters: the more specific
     * types are tested first.
     */
    public static StorageErrorKind classify(DataAccessException ex) {
        if (ex instanceof QueryTimeoutException) {
            return TIMEOUT;
        }
        if (ex instanceof CannotAcquireLockException || ex instanceof ConcurrencyFailureException) {
            return CONTENTION;
        }
        if (ex instanceof DataIntegrityViolationException) {
            return INTEGRITY_VIOLATION;
        }
        if (ex instanceof InvalidDataAccessResourceUsageException) {
            return hasSqlStateClass(ex, SQL_STATE_SYNTAX_OR_ACCESS_RULE) ? SCHEMA_MISMATCH : QUERY_DEFECT;
        }
        if (ex instanceof DataAccessResourceFailureException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof TransientDataAccessException) {
            return CONNECTION;
        }
        if (hasSqlStateClass(ex, SQL_STATE_SYNTAX_OR_ACCESS_RULE)) {
            return SCHEMA_MISMATCH;
        }
        return QUERY_DEFECT;
    }

    /**
     * Failures raised by the transaction infrastructure rather than by a statement.
     */
    public static StorageErrorKind classify(TransactionException ex) {
        if (ex instanceof TransactionTimedOutException) {
            return TIMEOUT;
        }
        if (ex instanceof CannotCreateTransactionException) {
            return CONNECTION;
        }
        return QUERY_DEFECT;
    }

    private static boolean hasSqlStateClass(Throwable ex, String sqlStateClass) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException sqlException) {
                String state = sqlException.getSQLState();
                if (state != null && state.startsWith(sqlStateClass)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
