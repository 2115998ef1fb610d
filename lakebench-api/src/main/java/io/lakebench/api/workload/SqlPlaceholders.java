package io.lakebench.api.workload;

/**
 * Handling of the {@code %s} positional placeholders benchmark queries are written with.
 */
public final class SqlPlaceholders {

    public static final String PLACEHOLDER = "%s";

    private SqlPlaceholders() {}

    /**
     * @return number of {@code %s} placeholders in the SQL text
     */
    public static int count(String sql) {
        int count = 0;
        int from = 0;
        while ((from = sql.indexOf(PLACEHOLDER, from)) >= 0) {
            count++;
            from += PLACEHOLDER.length();
        }
        return count;
    }

    /**
     * Rewrite every {@code %s} into the JDBC bound-parameter marker {@code ?}.
     */
    public static String toJdbc(String sql) {
        StringBuilder converted = new StringBuilder(sql.length());
        int i = 0;
        while (i < sql.length()) {
            if (i + 1 < sql.length() && sql.charAt(i) == '%' && sql.charAt(i + 1) == 's') {
                converted.append('?');
                i += 2;
            } else {
                converted.append(sql.charAt(i));
                i++;
            }
        }
        return converted.toString();
    }
}
