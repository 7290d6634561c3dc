package com.govcontracts.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.govcontracts.domain.model.ContractSearchRequest;
import com.govcontracts.domain.model.Pagination;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueryCacheServiceTest {

    private InMemoryRedis redis;
    private QueryCacheService cacheService;

    @BeforeEach
    void setUp() {
        redis = new InMemoryRedis();
        ObjectMapper objectMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
        cacheService = new QueryCacheService(redis.template(), objectMapper);
    }

    @Test
    void testGenerateCacheKey_EqualRequestsShareKey() {
        // Given
        ContractSearchRequest first = ContractSearchRequest.builder()
                .contractors(List.of("acme"))
                .page(2)
                .sortBy("contract_amount")
                .build();
        ContractSearchRequest second = ContractSearchRequest.builder()
                .sortBy("contract_amount")
                .page(2)
                .contractors(List.of("acme"))
                .build();

        // When
        String firstKey = cacheService.generateCacheKey("contracts:search", first);
        String secondKey = cacheService.generateCacheKey("contracts:search", second);

        // Then
        assertEquals(firstKey, secondKey);
        assertTrue(firstKey.matches("contracts:search:[0-9a-f]{32}"));
    }

    @Test
    void testGenerateCacheKey_MapOrderDoesNotMatter() {
        // Given
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", 2);
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", 2);
        ba.put("a", 1);

        // When / Then
        assertEquals(cacheService.generateCacheKey("k", ab), cacheService.generateCacheKey("k", ba));
    }

    @Test
    void testGenerateCacheKey_DifferentRequestsDiffer() {
        // Given
        ContractSearchRequest first = ContractSearchRequest.builder().page(1).build();
        ContractSearchRequest second = ContractSearchRequest.builder().page(2).build();

        // When / Then
        assertNotEquals(cacheService.generateCacheKey("k", first), cacheService.generateCacheKey("k", second));
    }

    @Test
    void testSetThenGet_RoundTripsValue() {
        // Given
        Pagination pagination = Pagination.of(1, 20, 45);

        // When
        cacheService.set("key", pagination, 60);
        Optional<Pagination> cached = cacheService.get("key", Pagination.class);

        // Then
        assertEquals(Optional.of(pagination), cached);
    }

    @Test
    void testGet_UnreadableEntryIsMiss() {
        // Given
        redis.values().put("key", "{not json");

        // When / Then
        assertTrue(cacheService.get("key", Pagination.class).isEmpty());
    }

    @Test
    void testInvalidate_RemovesEntry() {
        // Given
        cacheService.set("key", Pagination.empty(1, 20), 60);

        // When
        cacheService.invalidate("key");

        // Then
        assertTrue(cacheService.get("key", Pagination.class).isEmpty());
    }
}
