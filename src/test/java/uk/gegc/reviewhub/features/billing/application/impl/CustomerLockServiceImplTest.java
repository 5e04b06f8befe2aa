package uk.gegc.reviewhub.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscriptionLock;
import uk.gegc.reviewhub.features.billing.infra.repository.CustomerSubscriptionLockRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CustomerLockService")
class CustomerLockServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private CustomerSubscriptionLockRepository lockRepository;

    private CustomerLockServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new CustomerLockServiceImpl(lockRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("creates the lock row when the customer has none")
    void createsMissingRow() {
        when(lockRepository.existsById("cus_1")).thenReturn(false);

        service.ensureLockRow("cus_1");

        ArgumentCaptor<CustomerSubscriptionLock> saved = ArgumentCaptor.forClass(CustomerSubscriptionLock.class);
        verify(lockRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getStripeCustomerId()).isEqualTo("cus_1");
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("leaves an existing lock row alone")
    void keepsExistingRow() {
        when(lockRepository.existsById("cus_1")).thenReturn(true);

        service.ensureLockRow("cus_1");

        verify(lockRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("tolerates a lock row inserted concurrently")
    void concurrentInsert() {
        when(lockRepository.existsById("cus_1")).thenReturn(false);
        when(lockRepository.saveAndFlush(any(CustomerSubscriptionLock.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatCode(() -> service.ensureLockRow("cus_1")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("lock fails loudly when the row was never created")
    void lockWithoutRow() {
        when(lockRepository.findByIdForUpdate("cus_1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.lock("cus_1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cus_1");
    }
}
