package com.myorg.msgstore.mongo;

import com.myorg.msgstore.contracts.core.delivery.DeliveryHandler;
import com.myorg.msgstore.contracts.core.delivery.DeliveryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.Binary;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.Date;

/**
 * Stores every delivered payload as one document: {@code payload}, {@code size}, {@code receivedAt}.
 * A failed insert fails the delivery, so the message is redelivered.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoMessageSink implements DeliveryHandler {

    private final MongoTemplate mongoTemplate;
    private final String collection;
    private final Clock clock;

    public MongoMessageSink(MongoTemplate mongoTemplate, String collection) {
        this(mongoTemplate, collection, Clock.systemUTC());
    }

    @Override
    public DeliveryResult handle(byte[] payload) {
        Document doc = new Document()
                .append("payload", new Binary(payload))
                .append("size", payload.length)
                .append("receivedAt", Date.from(clock.instant()));
        try {
            mongoTemplate.insert(doc, collection);
        } catch (RuntimeException e) {
            log.warn("mongo insert failed collection={} size={} err={}", collection, payload.length, e.toString());
            return DeliveryResult.failure(e);
        }
        log.debug("message stored collection={} size={}", collection, payload.length);
        return DeliveryResult.success();
    }
}
