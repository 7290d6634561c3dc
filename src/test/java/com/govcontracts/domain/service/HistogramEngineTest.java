package com.govcontracts.domain.service;

import com.govcontracts.domain.exception.ValidationException;
import com.govcontracts.domain.filter.FilterCompiler;
import com.govcontracts.domain.filter.MatchAll;
import com.govcontracts.domain.model.FilterRequest;
import com.govcontracts.domain.model.HistogramBin;
import com.govcontracts.domain.model.ValueDistributionResponse;
import com.govcontracts.domain.model.ValueRange;
import com.govcontracts.infrastructure.dataset.DatasetFixtures;
import com.govcontracts.infrastructure.dataset.DuckDbEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HistogramEngineTest {

    @TempDir
    Path dataDir;

    private DuckDbEngine engine;

    @BeforeEach
    void setUp() {
        engine = DatasetFixtures.engine();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void testDistribution_BinCountsSumToTotal() {
        // Given
        DatasetFixtures.writeFacts(engine, dataDir.resolve(DatasetFixtures.PRIMARY_FILE), 1000);
        HistogramEngine histogram = new HistogramEngine(engine, DatasetFixtures.catalog(engine, dataDir));

        // When
        ValueDistributionResponse response = histogram.distribution(MatchAll.INSTANCE, false, 10);

        // Then
        assertTrue(response.isSuccess());
        assertEquals(1000, response.getTotalContracts());
        assertEquals(1000, response.getBins().stream().mapToLong(HistogramBin::getCount).sum());
        assertEquals(0.5, response.getMinValue(), 0.001);
        assertEquals(999.5, response.getMaxValue(), 0.001);
        assertEquals(99.9, response.getBinWidth(), 0.001);
    }

    @Test
    void testDistribution_BinsClampedToRange() {
        // Given
        DatasetFixtures.writeFacts(engine, dataDir.resolve(DatasetFixtures.PRIMARY_FILE), 500);
        HistogramEngine histogram = new HistogramEngine(engine, DatasetFixtures.catalog(engine, dataDir));

        // When
        ValueDistributionResponse response = histogram.distribution(MatchAll.INSTANCE, false, 7);

        // Then
        for (HistogramBin bin : response.getBins()) {
            assertTrue(bin.getBinNumber() >= 1 && bin.getBinNumber() <= 7, "bin " + bin.getBinNumber());
            assertTrue(bin.getBinStart() <= bin.getBinEnd());
        }
        HistogramBin last = response.getBins().get(response.getBins().size() - 1);
        assertEquals(7, last.getBinNumber());
        assertEquals(response.getMaxValue(), last.getBinEnd(), 0.0);
    }

    @Test
    void testDistribution_SingleValueGoesToFirstBin() {
        // Given
        DatasetFixtures.writeConstantAmounts(engine, dataDir.resolve(DatasetFixtures.PRIMARY_FILE), 12, 250.0);
        HistogramEngine histogram = new HistogramEngine(engine, DatasetFixtures.catalog(engine, dataDir));

        // When
        ValueDistributionResponse response = histogram.distribution(MatchAll.INSTANCE, false, 50);

        // Then
        assertEquals(1, response.getBins().size());
        assertEquals(1, response.getBins().get(0).getBinNumber());
        assertEquals(12, response.getBins().get(0).getCount());
        assertEquals(0.0, response.getBinWidth(), 0.0);
    }

    @Test
    void testDistribution_KeepsAmountsWiderThanEighteenDigits() {
        // Given
        DatasetFixtures.writeConstantAmounts(engine, dataDir.resolve(DatasetFixtures.PRIMARY_FILE), 3, 1.0E20);
        HistogramEngine histogram = new HistogramEngine(engine, DatasetFixtures.catalog(engine, dataDir));

        // When
        ValueDistributionResponse response = histogram.distribution(MatchAll.INSTANCE, false, 5);

        // Then
        assertEquals(3, response.getTotalContracts());
        assertEquals(1.0E20, response.getMaxValue(), 1.0E6);
    }

    @Test
    void testDistribution_NoMatchesIsEmptySuccess() {
        // Given
        DatasetFixtures.writeFacts(engine, dataDir.resolve(DatasetFixtures.PRIMARY_FILE), 20);
        HistogramEngine histogram = new HistogramEngine(engine, DatasetFixtures.catalog(engine, dataDir));
        FilterRequest request = FilterRequest.builder().valueRange(ValueRange.builder().min(1_000_000.0).build()).build();

        // When
        ValueDistributionResponse response = histogram.distribution(new FilterCompiler().compile(request), false, 10);

        // Then
        assertTrue(response.isSuccess());
        assertEquals(0, response.getTotalContracts());
        assertTrue(response.getBins().isEmpty());
    }

    @Test
    void testDistribution_RejectsBinCountOutOfRange() {
        HistogramEngine histogram = new HistogramEngine(engine, DatasetFixtures.catalog(engine, dataDir));

        assertThrows(ValidationException.class, () -> histogram.distribution(MatchAll.INSTANCE, false, 0));
        assertThrows(ValidationException.class, () -> histogram.distribution(MatchAll.INSTANCE, false, 10_001));
    }
}
