package com.myinfra.gateway.frappegateway.model;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ReportColumnTest {

    @Test
    void parsesLabelTypeOptionsAndWidth() {
        ReportColumn column = ReportColumn.parse("Sales Order:Link/Sales Order:150");

        assertThat(column.fieldname()).isEqualTo("sales_order");
        assertThat(column.label()).isEqualTo("Sales Order");
        assertThat(column.fieldtype()).isEqualTo("Link");
        assertThat(column.options()).isEqualTo("Sales Order");
        assertThat(column.width()).isEqualTo(150);
    }

    @Test
    void labelOnlyDefaultsToData() {
        ReportColumn column = ReportColumn.parse("Status");

        assertThat(column.fieldname()).isEqualTo("status");
        assertThat(column.fieldtype()).isEqualTo("Data");
        assertThat(column.options()).isNull();
        assertThat(column.width()).isNull();
    }

    @Test
    void unreadableWidthIsIgnored() {
        ReportColumn column = ReportColumn.parse("Grand Total (USD):Currency:wide");

        assertThat(column.fieldname()).isEqualTo("grand_total_usd_");
        assertThat(column.fieldtype()).isEqualTo("Currency");
        assertThat(column.width()).isNull();
    }

    @Test
    void fieldnameDoesNotDependOnDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(ReportColumn.parse("ITEM ID").fieldname()).isEqualTo("item_id");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
