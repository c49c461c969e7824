package com.flagship.recurring_ledger.observability;

import com.flagship.recurring_ledger.outbox.OutboxEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OutboxHealthIndicatorTest {

    private final OutboxEventRepository repository = mock(OutboxEventRepository.class);
    private final OutboxHealthIndicator indicator = new OutboxHealthIndicator(repository);

    @ParameterizedTest(name = "backlog {0} -> {1}")
    @CsvSource({
        "0, UP",
        "999, UP",
        "1000, WARNING",
        "9999, WARNING",
        "10000, DOWN"
    })
    @DisplayName("Status follows the unpublished backlog")
    void statusFollowsBacklog(long backlog, String expected) {
        when(repository.countUnpublished()).thenReturn(backlog);

        Health health = indicator.health();

        assertEquals(new Status(expected), health.getStatus());
        assertEquals(backlog, health.getDetails().get("backlogSize"));
    }

    @Test
    @DisplayName("An unreachable database reports DOWN")
    void databaseDown() {
        when(repository.countUnpublished()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }
}
