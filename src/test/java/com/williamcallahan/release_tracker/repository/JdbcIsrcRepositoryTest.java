package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.IsrcEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcIsrcRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcIsrcRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcIsrcRepository(jdbcTemplate);
    }

    @Test
    void upsertIfEarlier_onlyOverwritesWithStrictlyEarlierDate() {
        assertThat(JdbcIsrcRepository.UPSERT_SQL)
            .contains("ON CONFLICT (isrc) DO UPDATE")
            .endsWith("WHERE EXCLUDED.earliest_date < isrc_lookup_cache.earliest_date");
    }

    @Test
    void upsertIfEarlier_reportsWhetherRowWasWritten() {
        IsrcEntry entry = new IsrcEntry("USX000000001", LocalDate.of(2019, 3, 8), "Debut",
            Instant.parse("2024-06-15T12:00:00Z"));
        when(jdbcTemplate.update(eq(JdbcIsrcRepository.UPSERT_SQL), any(), any(), any(), any())).thenReturn(1);

        assertThat(repository.upsertIfEarlier(entry)).isTrue();

        ArgumentCaptor<Object> params = ArgumentCaptor.forClass(Object.class);
        verify(jdbcTemplate).update(eq(JdbcIsrcRepository.UPSERT_SQL),
            params.capture(), params.capture(), params.capture(), params.capture());
        assertThat(params.getAllValues()).containsExactly(
            "USX000000001",
            Date.valueOf(LocalDate.of(2019, 3, 8)),
            "Debut",
            Timestamp.from(Instant.parse("2024-06-15T12:00:00Z")));
    }

    @Test
    void upsertIfEarlier_returnsFalseWhenConditionRejectsRow() {
        IsrcEntry entry = new IsrcEntry("USX000000001", LocalDate.of(2024, 1, 1), "Reissue", Instant.EPOCH);

        assertThat(repository.upsertIfEarlier(entry)).isFalse();
    }

    @Test
    void find_returnsEmptyForUnknownIsrc() {
        when(jdbcTemplate.queryForObject(anyString(), any(RowMapper.class), eq("UNKNOWN")))
            .thenThrow(new EmptyResultDataAccessException(1));

        assertThat(repository.find("UNKNOWN")).isEmpty();
    }
}
