package com.myorg.msgstore.mongo;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.exception.StoreConnectivityException;
import com.myorg.msgstore.contracts.core.lifecycle.Component;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

// The MongoClient itself belongs to Spring Boot; this only verifies it at startup.
@Slf4j
@RequiredArgsConstructor
public class MongoStoreComponent implements Component {

    private final MongoTemplate mongoTemplate;

    @Override
    public String name() {
        return "mongodb";
    }

    @Override
    public void start(CancellationSignal signal) {
        String database = mongoTemplate.getDb().getName();
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
        } catch (RuntimeException e) {
            throw new StoreConnectivityException("mongodb: ping primary failed database=" + database, e);
        }
        log.info("Connected to MongoDB database={}", database);
    }

    @Override
    public void stop(Duration timeout) {
        log.info("Disconnected from MongoDB database={}", mongoTemplate.getDb().getName());
    }
}
