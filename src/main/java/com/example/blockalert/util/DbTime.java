package com.example.blockalert.util;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Timestamps are stored WITH TIME ZONE and handled as UTC {@link ZonedDateTime} in code.
 */
public final class DbTime {

    private DbTime() {}

    public static ZonedDateTime now() {
        return ZonedDateTime.now(ZoneOffset.UTC);
    }

    public static OffsetDateTime param(ZonedDateTime value) {
        return value != null ? value.toOffsetDateTime() : null;
    }

    public static ZonedDateTime read(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.atZoneSameInstant(ZoneOffset.UTC) : null;
    }
}
