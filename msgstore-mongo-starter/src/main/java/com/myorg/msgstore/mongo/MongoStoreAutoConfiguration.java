package com.myorg.msgstore.mongo;

import com.mongodb.client.MongoClient;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.concurrent.TimeUnit;

@AutoConfiguration(after = MongoDataAutoConfiguration.class)
@ConditionalOnClass({MongoClient.class, MongoTemplate.class})
@ConditionalOnProperty(prefix = "msgstore.mongo", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MongoStoreProperties.class)
public class MongoStoreAutoConfiguration {

    @Bean
    public MongoClientSettingsBuilderCustomizer msgstoreMongoTimeouts(MongoStoreProperties props) {
        long ms = props.getPingTimeout().toMillis();
        return builder -> builder.applyToClusterSettings(c -> c.serverSelectionTimeout(ms, TimeUnit.MILLISECONDS));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    public MongoMessageSink mongoMessageSink(MongoTemplate mongoTemplate, MongoStoreProperties props) {
        return new MongoMessageSink(mongoTemplate, props.getCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    public MongoStoreComponent mongoStoreComponent(MongoTemplate mongoTemplate) {
        return new MongoStoreComponent(mongoTemplate);
    }
}
