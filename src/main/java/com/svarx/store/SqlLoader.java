package com.svarx.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads statements from {@code /sql/<name>.sql} on the classpath and caches them.
 */
final class SqlLoader {
    private static final String ROOT = "/sql/";

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    String load(String name) {
        return cache.computeIfAbsent(name, SqlLoader::read);
    }

    List<String> statements(String name) {
        List<String> statements = new ArrayList<>();
        for (String part : load(name).split(";")) {
            if (!part.isBlank()) {
                statements.add(part.strip());
            }
        }
        return statements;
    }

    private static String read(String name) {
        try (InputStream in = SqlLoader.class.getResourceAsStream(ROOT + name + ".sql")) {
            if (in == null) {
                throw new PersistenceException("Missing SQL resource " + ROOT + name + ".sql");
            }
            String sql = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
            return sql.endsWith(";") ? sql.substring(0, sql.length() - 1) : sql;
        } catch (IOException e) {
            throw new PersistenceException("Unable to read SQL resource " + name, e);
        }
    }
}
