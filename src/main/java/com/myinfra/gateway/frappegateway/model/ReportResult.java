package com.myinfra.gateway.frappegateway.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @param columns Column definitions in display order
 * @param rows    Result rows; each row is either a list of values or a field map
 */
public record ReportResult(List<ReportColumn> columns, List<Object> rows) {

    public ReportResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
    }
}
