package com.booking.lifecycle.core;

import com.booking.lifecycle.domain.GatewayOperationRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * JSON codec for ledger entries cached in Redis. Plain JSON with ISO timestamps and no type
 * hints, so entries stay readable by any client.
 */
public class GatewayOperationRecordRedisSerializer implements RedisSerializer<GatewayOperationRecord> {

    private final ObjectMapper mapper;

    public GatewayOperationRecordRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(GatewayOperationRecord value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize GatewayOperationRecord", e);
        }
    }

    @Override
    public GatewayOperationRecord deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), GatewayOperationRecord.class);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize GatewayOperationRecord", e);
        }
    }
}
