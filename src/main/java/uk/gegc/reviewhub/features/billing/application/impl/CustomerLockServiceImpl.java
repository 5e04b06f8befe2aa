package uk.gegc.reviewhub.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewhub.features.billing.application.CustomerLockService;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscriptionLock;
import uk.gegc.reviewhub.features.billing.infra.repository.CustomerSubscriptionLockRepository;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerLockServiceImpl implements CustomerLockService {

    private final CustomerSubscriptionLockRepository lockRepository;
    private final Clock clock;

    /**
     * Each repository call commits on its own, so a delivery never holds a second connection while
     * it waits for the lock.
     */
    @Override
    @Transactional(propagation = Propagation.NEVER)
    public void ensureLockRow(String customerId) {
        if (lockRepository.existsById(customerId)) {
            return;
        }
        try {
            lockRepository.saveAndFlush(new CustomerSubscriptionLock(customerId, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            log.debug("Lock row for customer {} created concurrently", customerId);
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void lock(String customerId) {
        lockRepository.findByIdForUpdate(customerId)
                .orElseThrow(() -> new IllegalStateException("Lock row missing for customer " + customerId));
    }
}
