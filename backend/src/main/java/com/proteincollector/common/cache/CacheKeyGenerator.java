package com.proteincollector.common.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic cache key: {@code api:endpoint:<first 16 hex chars of SHA-256 over sorted-key JSON>}.
 * Hash collisions are possible and tolerated; a colliding entry is simply refetched data for another request.
 */
public class CacheKeyGenerator {

    private static final int HASH_LENGTH = 16;

    private final ObjectMapper mapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String generate(String apiName, String endpoint, Map<String, ?> params) {
        Map<String, Object> keyData = new LinkedHashMap<>();
        keyData.put("api", apiName);
        keyData.put("endpoint", endpoint);
        keyData.put("params", params != null ? params : Map.of());
        try {
            byte[] json = mapper.writeValueAsBytes(keyData);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return apiName + ":" + endpoint + ":" + HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key parameters are not serializable for " + apiName + ":" + endpoint, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
