package com.warehouse.util;

import java.util.regex.Pattern;

/**
 * Identifier checks and quoting for SQL that has to interpolate schema, table or column names.
 *
 * <p>Identifiers cannot be bound as statement parameters, so every name reaching SQL text must
 * pass {@link #isSafe(String)} and is then emitted through {@link #quote(String)}.
 */
public final class SqlIdentifiers {

    // PostgreSQL truncates identifiers at 63 bytes (NAMEDATALEN - 1).
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_$]{0,62}$");

    private SqlIdentifiers() {
    }

    public static boolean isSafe(String identifier) {
        return identifier != null && SAFE_IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * Double-quote an identifier, doubling any embedded quote.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    public static String quote(String identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("Identifier must not be null");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String qualify(String schema, String table) {
        return quote(schema) + "." + quote(table);
    }
}
