package com.markettracker.ingestion.store;

import com.markettracker.domain.TickerProfile;
import com.markettracker.ingestion.client.TickerProfileRecord;
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
 * Upserts the latest profile per ticker (ticker is the document id).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TickerProfileStore {

    private final MongoTemplate mongoTemplate;

    public int upsertBatch(List<TickerProfileRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, TickerProfile.class);
        for (TickerProfileRecord r : records) {
            Update update = new Update()
                    .set("enterpriseValue", r.enterpriseValue())
                    .set("marketCapGroup", r.marketCapGroup())
                    .set("sector", r.sector())
                    .set("exchange", r.exchange())
                    .set("peForward", r.peForward())
                    .set("dividendYield", r.dividendYield())
                    .set("analystRating", r.analystRating())
                    .set("priceTarget", r.priceTarget())
                    .set("updatedAt", r.fetchedAt());
            ops.upsert(Query.query(Criteria.where("_id").is(r.ticker())), update);
        }
        ops.execute();
        log.debug("Upserted {} ticker profile(s)", records.size());
        return records.size();
    }
}
