package com.svarx.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One cleanup tier. Implementations run inside the cleanup transaction, must be idempotent, and
 * return the number of rows they removed.
 */
public interface RetentionPolicy {
    String name();

    int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException;
}
