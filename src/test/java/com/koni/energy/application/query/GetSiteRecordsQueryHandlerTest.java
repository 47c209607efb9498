package com.koni.energy.application.query;

import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.model.EnergyRecord;
import com.koni.energy.domain.repository.EnergyRecordRepository;
import com.koni.energy.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@UnitTest
@ExtendWith(MockitoExtension.class)
class GetSiteRecordsQueryHandlerTest {

    @Mock
    private EnergyRecordRepository repository;

    private GetSiteRecordsQueryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GetSiteRecordsQueryHandler(repository);
    }

    @Test
    void shouldMapStoredRecords() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-02T00:00:00Z");
        EnergyRecord record = EnergyRecord.restore("alpha", start, new BigDecimal("10"),
                new BigDecimal("15"), new BigDecimal("-5"), true);
        when(repository.findBySite("alpha", start, end)).thenReturn(List.of(record));

        List<EnergyRecordResponse> responses = handler.handle(new GetSiteRecordsQuery("alpha", start, end));

        assertThat(responses).hasSize(1);
        EnergyRecordResponse response = responses.get(0);
        assertThat(response.getSiteId()).isEqualTo("alpha");
        assertThat(response.getTimestamp()).isEqualTo(start);
        assertThat(response.getNetEnergyKwh()).isEqualByComparingTo("-5");
        assertThat(response.isAnomaly()).isTrue();
    }

    @Test
    void shouldReturnEmptyListForUnknownSite() {
        when(repository.findBySite("ghost", null, null)).thenReturn(List.of());

        assertThat(handler.handle(new GetSiteRecordsQuery("ghost", null, null))).isEmpty();
    }

    @Test
    void shouldRejectStartAfterEnd() {
        Instant start = Instant.parse("2024-01-02T00:00:00Z");
        Instant end = Instant.parse("2024-01-01T00:00:00Z");

        assertThatThrownBy(() -> handler.handle(new GetSiteRecordsQuery("alpha", start, end)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("start must not be after end");
        verifyNoInteractions(repository);
    }

    @Test
    void shouldAcceptEqualBounds() {
        Instant instant = Instant.parse("2024-01-01T00:00:00Z");
        when(repository.findBySite("alpha", instant, instant)).thenReturn(List.of());

        assertThat(handler.handle(new GetSiteRecordsQuery("alpha", instant, instant))).isEmpty();
    }
}
