package com.customer.identity.cdi;

import com.customer.identity.api.CustomerIdentityEngine;
import com.customer.identity.cache.NoOpSearchResultCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustomerIdentityProducer Tests")
class CustomerIdentityProducerTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Instance<MeterRegistry> meterRegistry;

    @Mock
    private Instance<OpenTelemetry> openTelemetry;

    private CustomerIdentityProducer producer;

    @BeforeEach
    void setUp() {
        producer = new CustomerIdentityProducer();
        producer.dataSource = dataSource;
        producer.meterRegistry = meterRegistry;
        producer.openTelemetry = openTelemetry;
        producer.createSchema = false;
        producer.addressLinkingEnabled = true;
        producer.candidateLimit = 150;
        producer.trigramThreshold = 0.3;
        producer.minScore = 1.0;
        producer.defaultSearchLimit = 10;
        producer.maxSearchLimit = 25;
        producer.cacheEnabled = false;
        producer.cacheMaxSize = 100;
        producer.cacheTtlSeconds = 5;
        producer.syncPageSize = 50;
        producer.syncMaxPages = 10;
    }

    @Test
    @DisplayName("Configuration properties flow into the engine options")
    void configuredOptions() {
        when(meterRegistry.isResolvable()).thenReturn(false);
        when(openTelemetry.isResolvable()).thenReturn(false);

        CustomerIdentityEngine engine = producer.customerIdentityEngine();

        assertEquals(150, engine.getOptions().getCandidateLimit());
        assertEquals(0.3, engine.getOptions().getTrigramThreshold());
        assertEquals(1.0, engine.getOptions().getMinScore());
        assertEquals(10, engine.getOptions().getDefaultSearchLimit());
        assertEquals(25, engine.getOptions().getMaxSearchLimit());
        assertEquals(50, engine.getOptions().getSyncPageSize());
        assertEquals(10, engine.getOptions().getSyncMaxPages());
        assertInstanceOf(NoOpSearchResultCache.class, engine.getCache());
        assertEquals(2, engine.getHealthCheckRegistry().size());
        verifyNoInteractions(dataSource);
        verify(meterRegistry, never()).get();
    }

    @Test
    @DisplayName("A resolvable meter registry is used for metrics")
    void meterRegistryUsed() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        when(meterRegistry.isResolvable()).thenReturn(true);
        when(meterRegistry.get()).thenReturn(registry);
        when(openTelemetry.isResolvable()).thenReturn(false);

        CustomerIdentityEngine engine = producer.customerIdentityEngine();

        verify(meterRegistry).get();
        assertSame(engine.getResolver(), producer.identityResolver(engine));
        assertSame(engine.getSearchService(), producer.customerSearchService(engine));
        assertSame(engine.getMergeEngine(), producer.mergeEngine(engine));
        assertSame(engine.getCursorStore(), producer.syncCursorStore(engine));
    }

    @Test
    @DisplayName("Invalid limits fail at production time")
    void invalidLimits() {
        producer.defaultSearchLimit = 100;

        assertThrows(IllegalArgumentException.class, () -> producer.customerIdentityEngine());
    }
}
