package io.markwise.core.store;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import javax.net.ssl.SSLException;

public final class TransientStorageErrors {
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private TransientStorageErrors() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof SocketException
                || current instanceof SocketTimeoutException
                || current instanceof SSLException
                || current instanceof SQLTransientException) {
                return true;
            }
            if (current instanceof SQLException sql) {
                // extended result codes keep the primary code in the low byte
                int primary = sql.getErrorCode() & 0xff;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
