package com.markettracker.ingestion.store;

import com.markettracker.domain.StockPrice;
import com.markettracker.ingestion.client.DailyAggregateRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Upserts daily aggregates keyed by (tickerSymbol, timestampEnd). Re-fetching a day replaces its rows.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StockPriceStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public int upsertBatch(List<DailyAggregateRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, StockPrice.class);
        for (DailyAggregateRecord r : records) {
            Query key = Query.query(Criteria.where("tickerSymbol").is(r.ticker()).and("timestampEnd").is(r.timestampEnd()));
            Update update = new Update()
                    .set("open", r.open())
                    .set("high", r.high())
                    .set("low", r.low())
                    .set("close", r.close())
                    .set("volume", r.volume())
                    .set("insertTimestamp", now);
            ops.upsert(key, update);
        }
        ops.execute();
        log.debug("Upserted {} stock price(s)", records.size());
        return records.size();
    }
}
