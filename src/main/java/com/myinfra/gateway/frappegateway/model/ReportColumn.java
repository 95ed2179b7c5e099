package com.myinfra.gateway.frappegateway.model;

import java.util.Locale;

/**
 * A report column, decoded either from a column object or from a Frappe column string
 * such as {@code "Customer:Link/Customer:200"}.
 */
public record ReportColumn(
        String fieldname,
        String label,
        String fieldtype,
        String options,
        Integer width) {

    public static ReportColumn parse(String spec) {
        String[] parts = spec.split(":", -1);
        String label = parts[0];
        String fieldtype = "Data";
        String options = null;
        Integer width = null;

        if (parts.length > 1 && !parts[1].isEmpty()) {
            String type = parts[1];
            int slash = type.indexOf('/');
            if (slash >= 0) {
                fieldtype = type.substring(0, slash);
                options = type.substring(slash + 1);
            } else {
                fieldtype = type;
            }
        }
        if (parts.length > 2 && !parts[2].isBlank()) {
            try {
                width = Integer.valueOf(parts[2].trim());
            } catch (NumberFormatException e) {
                width = null;
            }
        }

        return new ReportColumn(toFieldname(label), label, fieldtype, options, width);
    }

    private static String toFieldname(String label) {
        return label.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    }
}
