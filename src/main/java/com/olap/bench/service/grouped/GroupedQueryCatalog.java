package com.olap.bench.service.grouped;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.olap.bench.domain.Dimension;
import com.olap.bench.domain.DimensionEncoder;
import com.olap.bench.domain.GroupedRow;
import com.olap.bench.domain.QueryArgument;
import com.olap.bench.domain.QueryTemplate;
import com.olap.bench.domain.UnknownQuerySetException;

import lombok.extern.slf4j.Slf4j;

/**
 * Grouped query families of flights 2 to 4.
 *
 * The engine only answers point aggregates, so a GROUP BY is expanded into
 * one query per combination of group keys and the ORDER BY is applied by
 * the caller once all rows are back.
 *
 * <pre>
 * 2.x  group by (year, brand)              order by (year, brand)
 * 3.x  group by (year, c_*, s_*)           order by (year asc, revenue desc)
 * 4.1  group by (year, c_nation)           order by (year, c_nation)
 * 4.2  group by (year, s_nation, category) order by (year, s_nation, category)
 * 4.3  group by (year, s_city, brand)      order by (year, s_city, brand)
 * </pre>
 */
@Slf4j
@Component
public class GroupedQueryCatalog {

    private static final String Q2 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="p_brand1", rowID=%d),
        		Bitmap(frame="s_region", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q31 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="c_nation", rowID=%d),
        		Bitmap(frame="s_nation", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q32 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="c_city", rowID=%d),
        		Bitmap(frame="s_city", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q34 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="lo_month", rowID=%d),
        		Bitmap(frame="c_city", rowID=%d),
        		Bitmap(frame="s_city", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q41 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="c_nation", rowID=%d),
        		Bitmap(frame="s_region", rowID=%d),
        		Union(
        			Bitmap(frame="p_mfgr", rowID=1),
        			Bitmap(frame="p_mfgr", rowID=2)
        		)
        	),
        frame="lo_profit", field="lo_profit")""";

    private static final String Q42 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="s_nation", rowID=%d),
        		Bitmap(frame="c_region", rowID=%d),
        		Bitmap(frame="p_category", rowID=%d)
        	),
        frame="lo_profit", field="lo_profit")""";

    private static final String Q43 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="s_city", rowID=%d),
        		Bitmap(frame="c_region", rowID=%d),
        		Bitmap(frame="p_brand1", rowID=%d)
        	),
        frame="lo_profit", field="lo_profit")""";

    private static final int MONTHS_PER_YEAR = 12;

    private final DimensionEncoder encoder;
    private final Map<String, GroupedFamily> families;

    public GroupedQueryCatalog(DimensionEncoder encoder) {
        this.encoder = encoder;
        this.families = Collections.unmodifiableMap(build());
        log.info("Grouped query families loaded: {}", families.keySet());
    }

    public List<String> names() {
        return List.copyOf(families.keySet());
    }

    /**
     * @throws UnknownQuerySetException if no family has this name
     */
    public GroupedFamily get(String name) {
        GroupedFamily family = families.get(name);
        if (family == null) {
            throw new UnknownQuerySetException(name);
        }
        return family;
    }

    private Map<String, GroupedFamily> build() {
        List<Integer> allYears = encoder.yearIds(DimensionEncoder.FIRST_YEAR, DimensionEncoder.LAST_YEAR + 1);
        List<Integer> years92to97 = encoder.yearIds(1992, 1998);
        List<Integer> years97to98 = encoder.yearIds(1997, 1999);
        List<Integer> ukCities = List.of(
            encoder.idOf(Dimension.CITY, "UNITED KI1"),
            encoder.idOf(Dimension.CITY, "UNITED KI5"));
        List<Integer> usCities = encoder.cityIdsOf("UNITED STATES");

        List<Integer> mfgr22Brands = new ArrayList<>();
        for (int number = 21; number <= 28; number++) {
            mfgr22Brands.add(encoder.brandId("MFGR#22", number));
        }

        Map<String, GroupedFamily> map = new LinkedHashMap<>();
        put(map, brandFamily("2.1", allYears, encoder.brandIdsOf("MFGR#12"), "AMERICA"));
        put(map, brandFamily("2.2", allYears, mfgr22Brands, "ASIA"));
        put(map, brandFamily("2.3", allYears, List.of(encoder.brandId("MFGR#22", 21)), "EUROPE"));
        put(map, nationPairFamily("3.1", years92to97, encoder.nationIdsOf("ASIA")));
        put(map, cityPairFamily("3.2", years92to97, usCities));
        put(map, cityPairFamily("3.3", years92to97, ukCities));
        put(map, cityPairMonthFamily("3.4", List.of(encoder.yearMonthId(1997, 12)), ukCities));
        put(map, customerNationFamily("4.1", allYears, encoder.nationIdsOf("AMERICA")));
        put(map, supplierNationCategoryFamily("4.2", years97to98, encoder.nationIdsOf("AMERICA"),
            categoriesOf("MFGR#1", "MFGR#2")));
        put(map, supplierCityBrandFamily("4.3", years97to98, usCities, encoder.brandIdsOf("MFGR#14")));
        return map;
    }

    private GroupedFamily brandFamily(String name, List<Integer> yearIds, List<Integer> brandIds, String region) {
        int regionId = encoder.idOf(Dimension.REGION, region);
        List<GroupedRow> keys = new ArrayList<>();
        for (int yearId : yearIds) {
            for (int brandId : brandIds) {
                keys.add(yearKey(name, yearId)
                    .brandId(brandId)
                    .brandNumber(DimensionEncoder.brandNumberOf(brandId))
                    .brand(encoder.valueOf(Dimension.BRAND, brandId))
                    .build());
            }
        }
        return new GroupedFamily(name, "year, brand (s_region " + region + ")", QueryTemplate.parse(Q2), keys,
            row -> QueryArgument.ints(row.getYearId(), row.getBrandId(), regionId),
            GroupedRowComparators.BY_YEAR_BRAND_NUMBER);
    }

    private GroupedFamily nationPairFamily(String name, List<Integer> yearIds, List<Integer> nationIds) {
        List<GroupedRow> keys = new ArrayList<>();
        for (int yearId : yearIds) {
            for (int cNationId : nationIds) {
                for (int sNationId : nationIds) {
                    keys.add(yearKey(name, yearId)
                        .cNationId(cNationId)
                        .cNation(encoder.valueOf(Dimension.NATION, cNationId))
                        .sNationId(sNationId)
                        .sNation(encoder.valueOf(Dimension.NATION, sNationId))
                        .build());
                }
            }
        }
        return new GroupedFamily(name, "year, c_nation, s_nation", QueryTemplate.parse(Q31), keys,
            row -> QueryArgument.ints(row.getYearId(), row.getCNationId(), row.getSNationId()),
            GroupedRowComparators.BY_YEAR_RESULT_DESC);
    }

    private GroupedFamily cityPairFamily(String name, List<Integer> yearIds, List<Integer> cityIds) {
        List<GroupedRow> keys = new ArrayList<>();
        for (int yearId : yearIds) {
            for (int cCityId : cityIds) {
                for (int sCityId : cityIds) {
                    keys.add(cityPair(yearKey(name, yearId), cCityId, sCityId).build());
                }
            }
        }
        return new GroupedFamily(name, "year, c_city, s_city", QueryTemplate.parse(Q32), keys,
            row -> QueryArgument.ints(row.getYearId(), row.getCCityId(), row.getSCityId()),
            GroupedRowComparators.BY_YEAR_RESULT_DESC);
    }

    private GroupedFamily cityPairMonthFamily(String name, List<Integer> yearMonthIds, List<Integer> cityIds) {
        List<GroupedRow> keys = new ArrayList<>();
        for (int yearMonthId : yearMonthIds) {
            for (int cCityId : cityIds) {
                for (int sCityId : cityIds) {
                    keys.add(cityPair(yearKey(name, yearMonthId / MONTHS_PER_YEAR), cCityId, sCityId)
                        .yearMonthId(yearMonthId)
                        .build());
                }
            }
        }
        return new GroupedFamily(name, "year-month, c_city, s_city", QueryTemplate.parse(Q34), keys,
            row -> QueryArgument.ints(row.getYearId(), row.getYearMonthId() % MONTHS_PER_YEAR,
                row.getCCityId(), row.getSCityId()),
            GroupedRowComparators.BY_YEAR_RESULT_DESC);
    }

    private GroupedFamily customerNationFamily(String name, List<Integer> yearIds, List<Integer> nationIds) {
        int america = encoder.idOf(Dimension.REGION, "AMERICA");
        List<GroupedRow> keys = new ArrayList<>();
        for (int yearId : yearIds) {
            for (int cNationId : nationIds) {
                keys.add(yearKey(name, yearId)
                    .cNationId(cNationId)
                    .cNation(encoder.valueOf(Dimension.NATION, cNationId))
                    .build());
            }
        }
        return new GroupedFamily(name, "year, c_nation", QueryTemplate.parse(Q41), keys,
            row -> QueryArgument.ints(row.getYearId(), row.getCNationId(), america),
            GroupedRowComparators.BY_YEAR_C_NATION);
    }

    private GroupedFamily supplierNationCategoryFamily(
            String name, List<Integer> yearIds, List<Integer> nationIds, List<Integer> categoryIds) {
        int america = encoder.idOf(Dimension.REGION, "AMERICA");
        List<GroupedRow> keys = new ArrayList<>();
        for (int yearId : yearIds) {
            for (int sNationId : nationIds) {
                for (int categoryId : categoryIds) {
                    keys.add(yearKey(name, yearId)
                        .sNationId(sNationId)
                        .sNation(encoder.valueOf(Dimension.NATION, sNationId))
                        .categoryId(categoryId)
                        .category(encoder.valueOf(Dimension.CATEGORY, categoryId))
                        .build());
                }
            }
        }
        return new GroupedFamily(name, "year, s_nation, category", QueryTemplate.parse(Q42), keys,
            row -> QueryArgument.ints(row.getYearId(), row.getSNationId(), america, row.getCategoryId()),
            GroupedRowComparators.BY_YEAR_S_NATION_CATEGORY);
    }

    private GroupedFamily supplierCityBrandFamily(
            String name, List<Integer> yearIds, List<Integer> cityIds, List<Integer> brandIds) {
        int america = encoder.idOf(Dimension.REGION, "AMERICA");
        List<GroupedRow> keys = new ArrayList<>();
        for (int yearId : yearIds) {
            for (int sCityId : cityIds) {
                for (int brandId : brandIds) {
                    keys.add(yearKey(name, yearId)
                        .sCityId(sCityId)
                        .sCity(encoder.valueOf(Dimension.CITY, sCityId))
                        .brandId(brandId)
                        .brandNumber(DimensionEncoder.brandNumberOf(brandId))
                        .brand(encoder.valueOf(Dimension.BRAND, brandId))
                        .build());
                }
            }
        }
        return new GroupedFamily(name, "year, s_city, brand", QueryTemplate.parse(Q43), keys,
            row -> QueryArgument.ints(row.getYearId(), row.getSCityId(), america, row.getBrandId()),
            GroupedRowComparators.BY_YEAR_S_CITY_BRAND);
    }

    private GroupedRow.GroupedRowBuilder yearKey(String family, int yearId) {
        return GroupedRow.builder()
            .family(family)
            .yearId(yearId)
            .year(DimensionEncoder.FIRST_YEAR + yearId);
    }

    private GroupedRow.GroupedRowBuilder cityPair(GroupedRow.GroupedRowBuilder key, int cCityId, int sCityId) {
        return key
            .cCityId(cCityId)
            .cCity(encoder.valueOf(Dimension.CITY, cCityId))
            .sCityId(sCityId)
            .sCity(encoder.valueOf(Dimension.CITY, sCityId));
    }

    private List<Integer> categoriesOf(String... mfgrs) {
        List<Integer> ids = new ArrayList<>();
        for (String mfgr : mfgrs) {
            int first = encoder.idOf(Dimension.MFGR, mfgr) * DimensionEncoder.CATEGORIES_PER_MFGR;
            for (int i = 0; i < DimensionEncoder.CATEGORIES_PER_MFGR; i++) {
                ids.add(first + i);
            }
        }
        return ids;
    }

    private static void put(Map<String, GroupedFamily> map, GroupedFamily family) {
        map.put(family.name(), family);
    }
}
