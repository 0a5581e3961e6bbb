package com.olap.bench.domain;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One cell of a grouped benchmark: the labeled business keys of a group plus
 * the aggregate the engine returned for it.
 *
 * Key fields that a query family does not group by are left null. Because the
 * engine answers point aggregates for an exact combination of dimension
 * values, {@link #result} already is the fully aggregated group value.
 *
 * Serialized from fields so the customer and supplier keys keep the star
 * schema's column names ({@code c_nation}, {@code s_city}).
 */
@Value
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class GroupedRow {

    @JsonProperty("family")
    String family;

    @JsonProperty("year")
    Integer year;
    @JsonProperty("year_id")
    Integer yearId;
    @JsonProperty("year_month_id")
    Integer yearMonthId;

    @JsonProperty("c_nation_id")
    Integer cNationId;
    @JsonProperty("c_nation")
    String cNation;
    @JsonProperty("s_nation_id")
    Integer sNationId;
    @JsonProperty("s_nation")
    String sNation;

    @JsonProperty("c_city_id")
    Integer cCityId;
    @JsonProperty("c_city")
    String cCity;
    @JsonProperty("s_city_id")
    Integer sCityId;
    @JsonProperty("s_city")
    String sCity;

    @JsonProperty("category_id")
    Integer categoryId;
    @JsonProperty("category")
    String category;

    @JsonProperty("brand_id")
    Integer brandId;
    @JsonProperty("brand_number")
    Integer brandNumber;
    @JsonProperty("brand")
    String brand;

    /** Aggregate value, null until the row has been queried or if it failed. */
    @JsonProperty("result")
    Long result;

    @JsonProperty("failure_reason")
    String failureReason;

    public boolean isFailed() {
        return failureReason != null;
    }

    /** Result for ordering purposes, failed rows sort as zero. */
    public long resultOrZero() {
        return result != null ? result : 0L;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<").append(family);
        append(sb, "year", year);
        append(sb, "yearmonth", yearMonthId);
        append(sb, "c_nation", cNation);
        append(sb, "s_nation", sNation);
        append(sb, "c_city", cCity);
        append(sb, "s_city", sCity);
        append(sb, "category", category);
        append(sb, "brand", brand);
        if (isFailed()) {
            sb.append(" failed=").append(failureReason);
        } else {
            append(sb, "sum", result);
        }
        return sb.append('>').toString();
    }

    private static void append(StringBuilder sb, String label, Object value) {
        if (value != null) {
            sb.append(' ').append(label).append('=').append(value);
        }
    }
}
