package com.markettracker.ingestion.store;

import com.markettracker.domain.ScreenerSnapshot;
import com.markettracker.ingestion.client.ScreenerRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Upserts screener rows keyed by (tickerSymbol, snapshotTime).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScreenerSnapshotStore {

    private final MongoTemplate mongoTemplate;

    public int upsertBatch(List<ScreenerRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, ScreenerSnapshot.class);
        for (ScreenerRecord r : records) {
            Query key = Query.query(Criteria.where("tickerSymbol").is(r.ticker()).and("snapshotTime").is(r.fetchedAt()));
            Update update = new Update()
                    .set("companyName", r.companyName())
                    .set("price", r.price())
                    .set("change", r.change())
                    .set("industry", r.industry())
                    .set("volume", r.volume())
                    .set("peRatio", r.peRatio())
                    .set("marketCap", r.marketCap())
                    .set("revenue", r.revenue());
            ops.upsert(key, update);
        }
        ops.execute();
        log.debug("Upserted {} screener row(s)", records.size());
        return records.size();
    }
}
