package com.koni.energy.application.query;

import com.koni.energy.domain.model.EnergySummary;
import com.koni.energy.domain.repository.EnergyRecordRepository;
import com.koni.energy.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GetSummaryQueryHandler.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class GetSummaryQueryHandlerTest {

    @Mock
    private EnergyRecordRepository repository;

    private GetSummaryQueryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GetSummaryQueryHandler(repository);
    }

    @Test
    void shouldReturnZeroesWhenNothingStored() {
        when(repository.summarize()).thenReturn(new EnergySummary(0, 0, List.of(), Map.of()));

        SummaryResponse response = handler.handle(new GetSummaryQuery());

        assertThat(response.getTotalRecords()).isZero();
        assertThat(response.getAnomalyCount()).isZero();
        assertThat(response.getSiteIds()).isEmpty();
        assertThat(response.getTotalSites()).isZero();
        assertThat(response.getSiteAnomalyDistribution()).isEmpty();
    }

    @Test
    void shouldExposeTotalsAndDistribution() {
        when(repository.summarize()).thenReturn(new EnergySummary(5, 3, List.of("alpha", "beta", "gamma"),
                Map.of("alpha", 2L, "gamma", 1L)));

        SummaryResponse response = handler.handle(new GetSummaryQuery());

        assertThat(response.getTotalRecords()).isEqualTo(5);
        assertThat(response.getAnomalyCount()).isEqualTo(3);
        assertThat(response.getSiteIds()).containsExactly("alpha", "beta", "gamma");
        assertThat(response.getTotalSites()).isEqualTo(3);
        assertThat(response.getSiteAnomalyDistribution())
                .containsExactly(Map.entry("alpha", 2L), Map.entry("gamma", 1L));
    }
}
