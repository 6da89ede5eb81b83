package com.daniel.eprec.eprecapi.dataset;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

/**
 * Statement text for the two snapshot reads, kept in {@code sql/<name>.sql}
 * on the classpath and read once per JVM.
 *
 * <p>
 * A statement that filters on a variable number of ids writes its list as
 * {@value #IDS_PLACEHOLDER}; {@link #loadWithInList(String, int)} swaps it for
 * one {@code ?} per id, so every id still travels as a bind parameter.
 */
public final class SqlLoader {

    public static final String IDS_PLACEHOLDER = "{ids}";

    private static final String RESOURCE_DIR = "sql/";
    private static final Map<String, String> STATEMENTS = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * @throws IllegalStateException if {@code sql/<name>.sql} is missing or unreadable
     */
    public static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, SqlLoader::read);
    }

    /**
     * Statement {@code name} with {@value #IDS_PLACEHOLDER} replaced by
     * {@code count} comma-separated bind markers.
     *
     * @throws IllegalArgumentException if {@code count} is below 1
     * @throws IllegalStateException if the statement has no id list to expand
     */
    public static String loadWithInList(String name, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("IN list needs at least one id, got " + count);
        }
        String sql = load(name);
        if (!sql.contains(IDS_PLACEHOLDER)) {
            throw new IllegalStateException(RESOURCE_DIR + name + ".sql has no " + IDS_PLACEHOLDER + " list");
        }
        return sql.replace(IDS_PLACEHOLDER, String.join(",", Collections.nCopies(count, "?")));
    }

    private static String read(String name) {
        ClassPathResource resource = new ClassPathResource(RESOURCE_DIR + name + ".sql", SqlLoader.class.getClassLoader());
        if (!resource.exists()) {
            throw new IllegalStateException("SQL resource not found: " + resource.getPath());
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).trim();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read SQL resource: " + resource.getPath(), ex);
        }
    }
}
