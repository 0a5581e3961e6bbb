package com.olap.bench.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Read-only mapping between star-schema domain values and the dense row ids
 * the engine's bitmap frames are keyed by.
 *
 * Ids are composable so ranges can be computed instead of enumerated:
 * <pre>
 * nation   = region * 5 + offset           (5 nations per region)
 * city     = nation * 10 + j               (10 cities per nation)
 * category = (mfgr - 1) * 5 + (cat - 1)    (MFGR#11 .. MFGR#55)
 * brand    = category * 40 + (brand - 1)   (40 brands per category)
 * month    = (year - 1992) * 12 + month - 1
 * </pre>
 *
 * Instances are immutable and shared across worker threads.
 */
public final class DimensionEncoder {

    public static final int FIRST_YEAR = 1992;
    public static final int LAST_YEAR = 1998;
    public static final int NATIONS_PER_REGION = 5;
    public static final int CITIES_PER_NATION = 10;
    public static final int CATEGORIES_PER_MFGR = 5;
    public static final int BRANDS_PER_CATEGORY = 40;

    private static final int CITY_PREFIX_LENGTH = 9;
    private static final int MFGR_COUNT = 5;

    private static final List<String> REGIONS = List.of(
        "AMERICA", "AFRICA", "ASIA", "EUROPE", "MIDDLE EAST");

    // Same order as REGIONS, five per region
    private static final List<String> NATIONS = List.of(
        "CANADA", "ARGENTINA", "BRAZIL", "UNITED STATES", "PERU",
        "ETHIOPIA", "ALGERIA", "KENYA", "MOZAMBIQUE", "MOROCCO",
        "INDIA", "INDONESIA", "CHINA", "VIETNAM", "JAPAN",
        "ROMANIA", "RUSSIA", "FRANCE", "UNITED KINGDOM", "GERMANY",
        "SAUDI ARABIA", "JORDAN", "IRAN", "IRAQ", "EGYPT");

    private final Map<Dimension, List<String>> valuesById;
    private final Map<Dimension, Map<String, Integer>> idsByValue;

    private DimensionEncoder(Map<Dimension, List<String>> valuesById) {
        Map<Dimension, List<String>> values = new EnumMap<>(Dimension.class);
        Map<Dimension, Map<String, Integer>> ids = new EnumMap<>(Dimension.class);
        valuesById.forEach((dimension, list) -> {
            values.put(dimension, List.copyOf(list));
            Map<String, Integer> index = new HashMap<>();
            for (int id = 0; id < list.size(); id++) {
                index.put(list.get(id), id);
            }
            ids.put(dimension, Collections.unmodifiableMap(index));
        });
        this.valuesById = Collections.unmodifiableMap(values);
        this.idsByValue = Collections.unmodifiableMap(ids);
    }

    /**
     * Builds the Star Schema Benchmark tables.
     *
     * @return the standard encoder
     */
    public static DimensionEncoder standard() {
        Map<Dimension, List<String>> tables = new EnumMap<>(Dimension.class);

        tables.put(Dimension.YEAR, IntStream.rangeClosed(FIRST_YEAR, LAST_YEAR)
            .mapToObj(String::valueOf)
            .collect(Collectors.toList()));

        List<String> yearMonths = new ArrayList<>();
        for (int year = FIRST_YEAR; year <= LAST_YEAR; year++) {
            for (int month = 1; month <= 12; month++) {
                yearMonths.add(String.format("%d%02d", year, month));
            }
        }
        tables.put(Dimension.YEAR_MONTH, yearMonths);

        tables.put(Dimension.REGION, REGIONS);
        tables.put(Dimension.NATION, NATIONS);

        List<String> cities = new ArrayList<>();
        for (String nation : NATIONS) {
            for (int j = 0; j < CITIES_PER_NATION; j++) {
                cities.add(cityName(nation, j));
            }
        }
        tables.put(Dimension.CITY, cities);

        List<String> mfgrs = new ArrayList<>();
        List<String> categories = new ArrayList<>();
        List<String> brands = new ArrayList<>();
        for (int mfgr = 1; mfgr <= MFGR_COUNT; mfgr++) {
            mfgrs.add("MFGR#" + mfgr);
            for (int cat = 1; cat <= CATEGORIES_PER_MFGR; cat++) {
                categories.add("MFGR#" + mfgr + cat);
                for (int brand = 1; brand <= BRANDS_PER_CATEGORY; brand++) {
                    brands.add("MFGR#" + mfgr + cat + brand);
                }
            }
        }
        tables.put(Dimension.MFGR, mfgrs);
        tables.put(Dimension.CATEGORY, categories);
        tables.put(Dimension.BRAND, brands);

        return new DimensionEncoder(tables);
    }

    /**
     * City names are the nation padded or truncated to nine characters,
     * followed by the city digit, e.g. {@code UNITED KI1}.
     */
    static String cityName(String nation, int digit) {
        StringBuilder prefix = new StringBuilder(nation);
        while (prefix.length() < CITY_PREFIX_LENGTH) {
            prefix.append(' ');
        }
        return prefix.substring(0, CITY_PREFIX_LENGTH) + digit;
    }

    /**
     * Looks up the id of a domain value.
     *
     * @param dimension the dimension
     * @param value the human-readable value
     * @return the dense id
     * @throws DimensionValueNotFoundException if the value is unmapped
     */
    public int idOf(Dimension dimension, String value) {
        Integer id = idsByValue.get(dimension).get(value);
        if (id == null) {
            throw new DimensionValueNotFoundException(dimension, value);
        }
        return id;
    }

    /**
     * Inverse of {@link #idOf}, used for reporting.
     *
     * @throws DimensionValueNotFoundException if the id is out of range
     */
    public String valueOf(Dimension dimension, int id) {
        List<String> values = valuesById.get(dimension);
        if (id < 0 || id >= values.size()) {
            throw new DimensionValueNotFoundException(dimension, String.valueOf(id));
        }
        return values.get(id);
    }

    public List<String> values(Dimension dimension) {
        return valuesById.get(dimension);
    }

    public int cardinality(Dimension dimension) {
        return valuesById.get(dimension).size();
    }

    public int yearId(int year) {
        return idOf(Dimension.YEAR, String.valueOf(year));
    }

    /**
     * Ids of the years {@code [fromYear, toYearExclusive)}.
     */
    public List<Integer> yearIds(int fromYear, int toYearExclusive) {
        return range(yearId(fromYear), yearId(toYearExclusive - 1) + 1);
    }

    public int yearMonthId(int year, int month) {
        return idOf(Dimension.YEAR_MONTH, String.format("%d%02d", year, month));
    }

    public List<Integer> nationIdsOf(String region) {
        int first = idOf(Dimension.REGION, region) * NATIONS_PER_REGION;
        return range(first, first + NATIONS_PER_REGION);
    }

    public List<Integer> cityIdsOf(String nation) {
        int first = idOf(Dimension.NATION, nation) * CITIES_PER_NATION;
        return range(first, first + CITIES_PER_NATION);
    }

    public List<Integer> brandIdsOf(String category) {
        int first = idOf(Dimension.CATEGORY, category) * BRANDS_PER_CATEGORY;
        return range(first, first + BRANDS_PER_CATEGORY);
    }

    public int brandId(String category, int brandNumber) {
        if (brandNumber < 1 || brandNumber > BRANDS_PER_CATEGORY) {
            throw new DimensionValueNotFoundException(Dimension.BRAND, category + brandNumber);
        }
        return idOf(Dimension.CATEGORY, category) * BRANDS_PER_CATEGORY + brandNumber - 1;
    }

    /** One-based brand number within its category, e.g. 21 for MFGR#2221. */
    public static int brandNumberOf(int brandId) {
        return brandId % BRANDS_PER_CATEGORY + 1;
    }

    public static int nationOfCity(int cityId) {
        return cityId / CITIES_PER_NATION;
    }

    public static int regionOfNation(int nationId) {
        return nationId / NATIONS_PER_REGION;
    }

    private static List<Integer> range(int startInclusive, int endExclusive) {
        return IntStream.range(startInclusive, endExclusive).boxed().collect(Collectors.toUnmodifiableList());
    }
}
