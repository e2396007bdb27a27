package com.booking.lifecycle.core;

import com.booking.lifecycle.domain.GatewayOperationRecord;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for the gateway idempotency ledger cache.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, GatewayOperationRecord> gatewayOperationRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, GatewayOperationRecord> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new GatewayOperationRecordRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
