package io.caretaker.core.database;

import io.caretaker.core.config.ConfigException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Connection descriptor for the database being backed up or queried. Server engines carry
 * host/port/credentials; file engines carry only {@link #file()}.
 */
public record DatabaseTarget(
    DbKind kind,
    String host,
    int port,
    String user,
    String password,
    String database,
    Path file
) {
    public static final int DEFAULT_POSTGRES_PORT = 5432;

    /**
     * Accepts {@code postgres://}, {@code postgresql://} and {@code sqlite:} URLs, optionally
     * prefixed with {@code jdbc:}. SQLite follows the usual convention: {@code sqlite:///app.db}
     * is relative, {@code sqlite:////var/db/app.db} is absolute.
     *
     * @throws ConfigException for a missing, malformed or unsupported URL
     */
    public static DatabaseTarget parse(String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigException("database URL is not configured");
        }
        String raw = url.trim();
        if (raw.regionMatches(true, 0, "jdbc:", 0, 5)) {
            raw = raw.substring(5);
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.startsWith("postgres://") || lower.startsWith("postgresql://")) {
            return parsePostgres(raw);
        }
        if (lower.startsWith("sqlite:")) {
            return parseSqlite(raw.substring("sqlite:".length()));
        }
        int colon = raw.indexOf(':');
        String scheme = colon > 0 ? raw.substring(0, colon) : raw;
        throw new ConfigException("unsupported database scheme: " + scheme);
    }

    public String jdbcUrl() {
        return switch (kind) {
            case POSTGRES -> "jdbc:postgresql://" + host + ":" + port + "/" + database;
            case SQLITE -> "jdbc:sqlite:" + file.toAbsolutePath();
        };
    }

    public String describe() {
        return switch (kind) {
            case POSTGRES -> "postgres " + database + "@" + host + ":" + port;
            case SQLITE -> "sqlite " + file;
        };
    }

    @Override
    public String toString() {
        return "DatabaseTarget[" + describe() + ", user=" + user + ", password=" + (password == null ? "null" : "***") + "]";
    }

    private static DatabaseTarget parsePostgres(String raw) {
        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            throw new ConfigException("malformed database URL: " + e.getMessage(), e);
        }
        // read the raw authority: URI leaves host and user info unset for names such as db_primary
        String authority = uri.getRawAuthority() == null ? "" : uri.getRawAuthority();
        String user = null;
        String password = null;
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            String userInfo = authority.substring(0, at);
            int separator = userInfo.indexOf(':');
            if (separator >= 0) {
                user = decode(userInfo.substring(0, separator));
                password = decode(userInfo.substring(separator + 1));
            } else {
                user = decode(userInfo);
            }
        }
        String hostPort = authority.substring(at + 1);
        String host = hostPort;
        int port = DEFAULT_POSTGRES_PORT;
        int portSeparator = hostPort.lastIndexOf(':');
        if (portSeparator >= 0 && portSeparator > hostPort.lastIndexOf(']')) {
            host = hostPort.substring(0, portSeparator);
            String portText = hostPort.substring(portSeparator + 1);
            if (!portText.isEmpty()) {
                try {
                    port = Integer.parseInt(portText);
                } catch (NumberFormatException e) {
                    throw new ConfigException("malformed database URL port: " + portText, e);
                }
            }
        }
        if (host.isBlank()) {
            host = "localhost";
        }
        String path = uri.getPath() == null ? "" : uri.getPath();
        String database = path.startsWith("/") ? path.substring(1) : path;
        if (database.isBlank()) {
            throw new ConfigException("database URL has no database name");
        }
        if (user == null || user.isBlank()) {
            throw new ConfigException("database URL has no user");
        }
        return new DatabaseTarget(DbKind.POSTGRES, host, port, user, password, database, null);
    }

    private static DatabaseTarget parseSqlite(String rest) {
        String path = rest;
        if (path.startsWith("//")) {
            path = path.substring(2);
            if (path.startsWith("/")) {
                path = path.substring(1);
            }
        }
        if (path.isBlank()) {
            throw new ConfigException("sqlite URL has no file path");
        }
        return new DatabaseTarget(DbKind.SQLITE, null, 0, null, null, null, Path.of(path));
    }

    /** Percent-decoding only; a literal {@code +} in user info stays a plus. */
    private static String decode(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}
