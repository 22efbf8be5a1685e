package com.sqlstage.service;

import com.sqlstage.cache.ResultCache;
import com.sqlstage.model.QueryResult;
import com.sqlstage.model.StagedResultSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Writes large results to the result cache under {@code query:{id}} and reads them back.
 *
 * <p>Entries are write-once: every staging call gets a fresh id and nothing rewrites an entry
 * after it is stored. Entries live for one hour.
 */
@Slf4j
@Service
public class StagedResultStore {

    static final String KEY_PREFIX = "query:";
    static final Duration TTL = Duration.ofSeconds(3600);
    static final int MAX_KEY_ATTEMPTS = 16;

    private final ResultCache cache;
    private final StagedResultCodec codec;
    private final QueryIdGenerator idGenerator;

    public StagedResultStore(ResultCache cache, StagedResultCodec codec, QueryIdGenerator idGenerator) {
        this.cache = cache;
        this.codec = codec;
        this.idGenerator = idGenerator;
    }

    /**
     * Stage rows and fields of a result together.
     *
     * <p>The write only succeeds on an unused key. Another instance sharing the cache may have drawn
     * the same id; in that case the next id is drawn and the write retried.
     *
     * @param result result to stage
     * @return identifier for later page requests
     * @throws IllegalStateException if no free key was found
     */
    public String stage(QueryResult result) {
        String payload = codec.encode(StagedResultSet.of(result));
        for (int attempt = 1; attempt <= MAX_KEY_ATTEMPTS; attempt++) {
            String queryId = idGenerator.next();
            if (cache.setIfAbsent(key(queryId), payload, TTL)) {
                log.info("Staged large result: query_id={}, rows={}, bytes={}", queryId, result.rowCount(), payload.length());
                return queryId;
            }
            log.warn("Staged result id already taken, drawing another: query_id={}", queryId);
        }
        throw new IllegalStateException("No free staged result id after " + MAX_KEY_ATTEMPTS + " attempts");
    }

    /**
     * @throws ResultNotFoundException if the id is unknown or expired
     * @throws StagedResultCorruptException if the cache entry is malformed
     */
    public StagedResultSet load(String queryId) {
        if (queryId == null || queryId.isBlank()) {
            throw new ResultNotFoundException(queryId);
        }
        String payload = cache.get(key(queryId)).orElseThrow(() -> {
            log.info("Staged result not found or expired: query_id={}", queryId);
            return new ResultNotFoundException(queryId);
        });
        return codec.decode(payload);
    }

    public boolean evict(String queryId) {
        if (queryId == null || queryId.isBlank()) {
            return false;
        }
        boolean removed = cache.delete(key(queryId));
        log.info("Evict staged result: query_id={}, removed={}", queryId, removed);
        return removed;
    }

    static String key(String queryId) {
        return KEY_PREFIX + queryId;
    }
}
