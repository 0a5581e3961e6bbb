package com.olap.bench.repository;

import java.util.List;
import java.util.Optional;

import com.olap.bench.domain.EngineResult;

/**
 * Synchronous client of the external bitmap-index aggregation engine.
 *
 * Implementations must tolerate concurrent use from all dispatch workers.
 */
public interface BitmapEngineClient {

    /**
     * Frame whose rows partition the fact table, used to count records.
     */
    String RECORD_COUNT_FRAME = "p_mfgr";

    /**
     * Executes one or more newline-joined query statements.
     *
     * @param queries the statements, in the engine's query language
     * @return one result per statement, in statement order
     * @throws EngineCallException if the engine rejects the request or cannot be reached
     */
    List<EngineResult> query(String queries);

    /**
     * @return the engine's version string, empty if it cannot be determined
     */
    Optional<String> version();

    /**
     * Counts the fact table records by summing the counts of every
     * manufacturer row.
     *
     * @return the record count
     * @throws EngineCallException if the count query fails
     */
    default long countRecords() {
        StringBuilder pql = new StringBuilder();
        for (int mfgr = 0; mfgr < 5; mfgr++) {
            if (mfgr > 0) {
                pql.append('\n');
            }
            pql.append("Count(Bitmap(frame=\"").append(RECORD_COUNT_FRAME)
                .append("\", rowID=").append(mfgr).append("))");
        }
        return query(pql.toString()).stream().mapToLong(EngineResult::count).sum();
    }
}
