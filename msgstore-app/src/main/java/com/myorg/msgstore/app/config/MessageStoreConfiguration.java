package com.myorg.msgstore.app.config;

import com.myorg.msgstore.app.lifecycle.ComponentContainer;
import com.myorg.msgstore.app.lifecycle.MessageStoreLifecycle;
import com.myorg.msgstore.contracts.core.lifecycle.Component;
import com.myorg.msgstore.kafka.KafkaMessageBus;
import com.myorg.msgstore.mongo.MongoStoreComponent;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(AppProperties.class)
public class MessageStoreConfiguration {

    // Store first: nothing is consumed before there is somewhere to put it.
    @Bean
    public ComponentContainer componentContainer(ObjectProvider<MongoStoreComponent> mongo,
                                                 KafkaMessageBus kafka,
                                                 AppProperties props) {
        List<Component> components = new ArrayList<>();
        mongo.ifAvailable(components::add);
        components.add(kafka);
        return new ComponentContainer(components, props.getShutdownTimeout());
    }

    @Bean
    public MessageStoreLifecycle messageStoreLifecycle(ComponentContainer container) {
        return new MessageStoreLifecycle(container);
    }
}
