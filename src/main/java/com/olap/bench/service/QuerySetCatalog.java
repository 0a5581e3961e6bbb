package com.olap.bench.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.springframework.stereotype.Component;

import com.olap.bench.domain.Dimension;
import com.olap.bench.domain.DimensionEncoder;
import com.olap.bench.domain.QuerySet;
import com.olap.bench.domain.UnknownQuerySetException;

import lombok.extern.slf4j.Slf4j;

/**
 * The monolithic query sets of the Star Schema Benchmark flights, keyed by
 * name (1.1, 2.1, ...).
 *
 * Variants:
 * <ul>
 *   <li>{@code b}: range predicates rewritten as unions of bucket bitmaps</li>
 *   <li>{@code c}: range predicates rewritten as BETWEEN ({@code ><}), which
 *       older engines reject</li>
 *   <li>{@code r}: nested {@code IntersectReg} instead of a flat Intersect</li>
 * </ul>
 *
 * Year, nation, city, category and brand arguments are row ids from the
 * {@link DimensionEncoder}.
 */
@Slf4j
@Component
public class QuerySetCatalog {

    private static final String Q11 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Range(frame="lo_discount", lo_discount >= 1),
        		Range(frame="lo_discount", lo_discount <= 3),
        		Range(frame="lo_quantity", lo_quantity < 25)
        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q12 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_month", rowID=0),
        		Bitmap(frame="lo_year", rowID=%d),
        		Range(frame="lo_discount", lo_discount >= 4),
        		Range(frame="lo_discount", lo_discount <= 6),
        		Range(frame="lo_quantity", lo_quantity >= 26),
        		Range(frame="lo_quantity", lo_quantity <= 35)
        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q13 = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_weeknum", rowID=6),
        		Bitmap(frame="lo_year", rowID=%d),
        		Range(frame="lo_discount", lo_discount >= 5),
        		Range(frame="lo_discount", lo_discount <= 7),
        		Range(frame="lo_quantity", lo_quantity >= 26),
        		Range(frame="lo_quantity", lo_quantity <= 35)
        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q11B = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        """ + union("lo_discount_b", 1, 3) + ",\n" + union("lo_quantity_b", 1, 24) + """

        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q12B = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_month", rowID=0),
        		Bitmap(frame="lo_year", rowID=%d),
        """ + union("lo_discount_b", 4, 6) + ",\n" + union("lo_quantity_b", 26, 36) + """

        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q13B = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_weeknum", rowID=6),
        		Bitmap(frame="lo_year", rowID=%d),
        """ + union("lo_discount_b", 5, 7) + ",\n" + union("lo_quantity_b", 26, 36) + """

        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q11C = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Range(frame="lo_discount", lo_discount >< [1,3]),
        		Range(frame="lo_quantity", lo_quantity < 25)
        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q12C = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_month", rowID=0),
        		Bitmap(frame="lo_year", rowID=%d),
        		Range(frame="lo_discount", lo_discount >< [4,6]),
        		Range(frame="lo_quantity", lo_quantity >< [26,35])
        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q13C = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_weeknum", rowID=6),
        		Bitmap(frame="lo_year", rowID=%d),
        		Range(frame="lo_discount", lo_discount >< [5,7]),
        		Range(frame="lo_quantity", lo_quantity >< [26,35])
        	),
        frame="lo_revenue_computed", field="lo_revenue_computed")""";

    private static final String Q2 = """
        Sum(
        	Intersect(
        		Bitmap(frame="p_brand1", rowID=%d),
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="s_region", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q31 = """
        Sum(
        	Intersect(
        		Bitmap(frame="c_nation", rowID=%d),
        		Bitmap(frame="s_nation", rowID=%d),
        		Bitmap(frame="lo_year", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q31R = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		IntersectReg(
        			Bitmap(frame="c_nation", rowID=%d),
        			Bitmap(frame="s_nation", rowID=%d)
        		)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q3_CITY = """
        Sum(
        	Intersect(
        		Bitmap(frame="c_city", rowID=%d),
        		Bitmap(frame="s_city", rowID=%d),
        		Bitmap(frame="lo_year", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q32R = """
        Sum(
        	Intersect(
        		Bitmap(frame="c_city", rowID=%d),
        		IntersectReg(
        			Bitmap(frame="s_city", rowID=%d),
        			Bitmap(frame="lo_year", rowID=%d)
        		)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q34 = """
        Sum(
        	Intersect(
        		Bitmap(frame="c_city", rowID=%d),
        		Bitmap(frame="s_city", rowID=%d),
        		Bitmap(frame="lo_month", rowID=%d),
        		Bitmap(frame="lo_year", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private static final String Q41 = """
        Sum(
        	Intersect(
        		Bitmap(frame="c_nation", rowID=%d),
        		Bitmap(frame="lo_year", rowID=%d),
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
        		Bitmap(frame="p_category", rowID=%d),
        		Bitmap(frame="s_nation", rowID=%d),
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="c_region", rowID=%d)
        	),
        frame="lo_profit", field="lo_profit")""";

    private static final String Q43 = """
        Sum(
        	Intersect(
        		Bitmap(frame="p_brand1", rowID=%d),
        		Bitmap(frame="s_city", rowID=%d),
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="c_region", rowID=%d)
        	),
        frame="lo_profit", field="lo_profit")""";

    private static final String Q43R = """
        Sum(
        	Intersect(
        		Bitmap(frame="p_brand1", rowID=%d),
        		IntersectReg(
        			Bitmap(frame="lo_year", rowID=%d),
        			Bitmap(frame="s_city", rowID=%d),
        			Bitmap(frame="c_region", rowID=%d)
        		)
        	),
        frame="lo_profit", field="lo_profit")""";

    private static final String TEST = """
        Sum(
        	Intersect(
        		Bitmap(frame="lo_year", rowID=%d),
        		Bitmap(frame="p_brand1", rowID=%d),
        		Bitmap(frame="s_region", rowID=%d)
        	),
        	frame="lo_revenue", field="lo_revenue")""";

    private final Map<String, QuerySet> querySets;

    public QuerySetCatalog(DimensionEncoder encoder) {
        this.querySets = Collections.unmodifiableMap(build(encoder));
        log.info("Query set catalog loaded: {}", querySets.keySet());
    }

    /**
     * @return query set names in catalog order
     */
    public List<String> names() {
        return List.copyOf(querySets.keySet());
    }

    public List<QuerySet> all() {
        return List.copyOf(querySets.values());
    }

    /**
     * @throws UnknownQuerySetException if no query set has this name
     */
    public QuerySet get(String name) {
        QuerySet querySet = querySets.get(name);
        if (querySet == null) {
            throw new UnknownQuerySetException(name);
        }
        return querySet;
    }

    private static Map<String, QuerySet> build(DimensionEncoder encoder) {
        List<Integer> year1993 = List.of(encoder.yearId(1993));
        List<Integer> year1994 = List.of(encoder.yearId(1994));
        List<Integer> allYears = encoder.yearIds(DimensionEncoder.FIRST_YEAR, DimensionEncoder.LAST_YEAR + 1);
        List<Integer> years92to97 = encoder.yearIds(1992, 1998);
        List<Integer> years97to98 = encoder.yearIds(1997, 1999);

        int america = encoder.idOf(Dimension.REGION, "AMERICA");
        int asia = encoder.idOf(Dimension.REGION, "ASIA");
        int europe = encoder.idOf(Dimension.REGION, "EUROPE");

        List<Integer> asiaNations = encoder.nationIdsOf("ASIA");
        List<Integer> americaNations = encoder.nationIdsOf("AMERICA");
        List<Integer> usCities = encoder.cityIdsOf("UNITED STATES");
        List<Integer> ukCities = ukCities(encoder);

        List<Integer> mfgr12Brands = encoder.brandIdsOf("MFGR#12");
        List<Integer> mfgr22Brands = IntStream.rangeClosed(21, 28)
            .mapToObj(number -> encoder.brandId("MFGR#22", number))
            .collect(Collectors.toList());
        List<Integer> mfgr14Brands = encoder.brandIdsOf("MFGR#14");
        List<Integer> mfgr1And2Categories = IntStream.range(0, 2 * DimensionEncoder.CATEGORIES_PER_MFGR)
            .boxed()
            .collect(Collectors.toList());

        Map<String, QuerySet> sets = new LinkedHashMap<>();
        add(sets, QuerySet.ofInts("1.1", Q11, List.of(year1993)));
        add(sets, QuerySet.ofInts("1.2", Q12, List.of(year1994)));
        add(sets, QuerySet.ofInts("1.3", Q13, List.of(year1994)));
        add(sets, QuerySet.ofInts("1.1b", Q11B, List.of(year1993)));
        add(sets, QuerySet.ofInts("1.2b", Q12B, List.of(year1994)));
        add(sets, QuerySet.ofInts("1.3b", Q13B, List.of(year1994)));
        add(sets, QuerySet.ofInts("1.1c", Q11C, List.of(year1993)));
        add(sets, QuerySet.ofInts("1.2c", Q12C, List.of(year1994)));
        add(sets, QuerySet.ofInts("1.3c", Q13C, List.of(year1994)));

        add(sets, QuerySet.ofInts("2.1", Q2, List.of(mfgr12Brands, allYears, List.of(america))));
        add(sets, QuerySet.ofInts("2.2", Q2, List.of(mfgr22Brands, allYears, List.of(asia))));
        add(sets, QuerySet.ofInts("2.3", Q2,
            List.of(List.of(encoder.brandId("MFGR#22", 21)), allYears, List.of(europe))));

        add(sets, QuerySet.ofInts("3.1", Q31, List.of(asiaNations, asiaNations, years92to97)));
        add(sets, QuerySet.ofInts("3.1r", Q31R, List.of(years92to97, asiaNations, asiaNations)));
        add(sets, QuerySet.ofInts("3.2", Q3_CITY, List.of(usCities, usCities, years92to97)));
        add(sets, QuerySet.ofInts("3.2r", Q32R, List.of(usCities, usCities, years92to97)));
        add(sets, QuerySet.ofInts("3.3", Q3_CITY, List.of(ukCities, ukCities, years92to97)));

        // December 1997
        int yearMonth = encoder.yearMonthId(1997, 12);
        add(sets, QuerySet.ofInts("3.4", Q34, List.of(ukCities, ukCities,
            List.of(yearMonth % 12), List.of(yearMonth / 12))));

        add(sets, QuerySet.ofInts("4.1", Q41, List.of(americaNations, allYears, List.of(america))));
        add(sets, QuerySet.ofInts("4.2", Q42,
            List.of(mfgr1And2Categories, americaNations, years97to98, List.of(america))));
        add(sets, QuerySet.ofInts("4.3", Q43, List.of(mfgr14Brands, usCities, years97to98, List.of(america))));
        add(sets, QuerySet.ofInts("4.3r", Q43R, List.of(mfgr14Brands, years97to98, usCities, List.of(america))));

        add(sets, QuerySet.ofInts("test", TEST, List.of(
            years92to97,
            List.of(0, 1, 2, 3),
            List.of(0, 1, 2))));

        return sets;
    }

    /** UNITED KI1 and UNITED KI5. */
    static List<Integer> ukCities(DimensionEncoder encoder) {
        return List.of(
            encoder.idOf(Dimension.CITY, "UNITED KI1"),
            encoder.idOf(Dimension.CITY, "UNITED KI5"));
    }

    private static void add(Map<String, QuerySet> sets, QuerySet querySet) {
        sets.put(querySet.name(), querySet);
    }

    /**
     * Union of the bucket bitmaps {@code from..toInclusive} of a frame, at
     * the indentation of an Intersect operand.
     */
    static String union(String frame, int from, int toInclusive) {
        List<String> bitmaps = new ArrayList<>();
        for (int row = from; row <= toInclusive; row++) {
            bitmaps.add("\t\t\tBitmap(frame=" + frame + ", rowID=" + row + ")");
        }
        return "\t\tUnion(\n" + String.join(",\n", bitmaps) + ")";
    }
}
