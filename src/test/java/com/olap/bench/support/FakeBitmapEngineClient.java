package com.olap.bench.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import com.olap.bench.domain.EngineResult;
import com.olap.bench.repository.BitmapEngineClient;
import com.olap.bench.repository.EngineCallException;

/**
 * In-memory engine for tests.
 *
 * Every statement starting a line with {@code Sum(} or {@code Count(} is
 * answered with {@link #valueOf(String)}, a deterministic function of the
 * statement text. A payload containing a statement matched by the failure
 * predicate is rejected as a whole, like the real engine does.
 */
public class FakeBitmapEngineClient implements BitmapEngineClient {

    public static final long RECORDS_PER_MFGR = 1_000;

    private static final Pattern STATEMENT_START = Pattern.compile("(?m)^(?=Sum\\(|Count\\()");

    private final AtomicInteger calls = new AtomicInteger();
    private final ConcurrentLinkedQueue<Integer> payloadSizes = new ConcurrentLinkedQueue<>();
    private volatile Predicate<String> failing = statement -> false;
    private volatile String failureMessage = "engine error";
    private volatile Predicate<String> crashing = statement -> false;
    private volatile String version = "v0.0.0-fake";

    /**
     * Rejects every payload containing a statement that matches.
     */
    public FakeBitmapEngineClient failWhen(Predicate<String> statementPredicate, String message) {
        this.failing = statementPredicate;
        this.failureMessage = message;
        return this;
    }

    /**
     * Throws an {@link IllegalStateException}, not an engine error, for every
     * payload containing a statement that matches.
     */
    public FakeBitmapEngineClient crashWhen(Predicate<String> statementPredicate) {
        this.crashing = statementPredicate;
        return this;
    }

    public FakeBitmapEngineClient withVersion(String version) {
        this.version = version;
        return this;
    }

    public void reset() {
        calls.set(0);
        payloadSizes.clear();
        failing = statement -> false;
        crashing = statement -> false;
        version = "v0.0.0-fake";
    }

    public int calls() {
        return calls.get();
    }

    public List<Integer> payloadSizes() {
        return new ArrayList<>(payloadSizes);
    }

    public static long valueOf(String statement) {
        return Math.abs((long) statement.trim().hashCode()) % 100_000;
    }

    public static List<String> split(String queries) {
        List<String> statements = new ArrayList<>();
        for (String part : STATEMENT_START.split(queries)) {
            if (!part.isBlank()) {
                statements.add(part.trim());
            }
        }
        return statements;
    }

    @Override
    public List<EngineResult> query(String queries) {
        calls.incrementAndGet();
        List<String> statements = split(queries);
        payloadSizes.add(statements.size());

        for (String statement : statements) {
            if (crashing.test(statement)) {
                throw new IllegalStateException("client crashed");
            }
            if (failing.test(statement)) {
                throw new EngineCallException(failureMessage);
            }
        }

        List<EngineResult> results = new ArrayList<>(statements.size());
        for (String statement : statements) {
            if (statement.startsWith("Count(")) {
                results.add(new EngineResult(RECORDS_PER_MFGR, RECORDS_PER_MFGR));
            } else {
                results.add(new EngineResult(valueOf(statement), 1));
            }
        }
        return results;
    }

    @Override
    public Optional<String> version() {
        return Optional.ofNullable(version);
    }
}
