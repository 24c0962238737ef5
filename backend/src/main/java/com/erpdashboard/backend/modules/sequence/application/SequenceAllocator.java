package com.erpdashboard.backend.modules.sequence.application;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

import com.erpdashboard.backend.global.error.ProblemException;
import com.erpdashboard.backend.modules.sequence.domain.CounterKeys;
import com.erpdashboard.backend.modules.sequence.domain.SequenceCounter;
import com.erpdashboard.backend.modules.sequence.infrastructure.persistence.SequenceCounterStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * 영속 카운터의 다음 값을 발급한다.
 *
 * <p>모든 호출이 DB로 가며 메모리에 캐시하지 않으므로 여러 인스턴스가 같은 카운터를 공유할 수 있다.
 * 같은 키의 동시 호출자는 서로 다른, 빈틈 없는 값을 받는다.
 * 바깥 트랜잭션 안에서 호출되면 증가도 그 트랜잭션에 합류해 롤백 시 함께 취소된다.
 */
@Service
public class SequenceAllocator {

    private static final Logger log = LoggerFactory.getLogger(SequenceAllocator.class);

    private static final Pattern BRANCH_CODE_PATTERN = Pattern.compile("[A-Z][A-Z0-9]{0,15}");
    private static final Pattern COUNTER_KEY_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final SequenceCounterStore counterStore;
    private final long initialValue;
    private final Duration defaultTimeout;

    public SequenceAllocator(
            SequenceCounterStore counterStore,
            @Value("${erp.sequence.initial-value:0}") long initialValue,
            @Value("${erp.sequence.statement-timeout:5s}") Duration defaultTimeout
    ) {
        if (initialValue < 0) {
            throw new IllegalArgumentException("erp.sequence.initial-value must be >= 0");
        }
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("erp.sequence.statement-timeout must be positive");
        }
        this.counterStore = counterStore;
        this.initialValue = initialValue;
        this.defaultTimeout = defaultTimeout;
    }

    public long allocateNext(String branchCode) {
        return allocateNext(branchCode, defaultTimeout);
    }

    public long allocateNext(String branchCode, Duration timeout) {
        return increment(CounterKeys.forBranch(requireBranchCode(branchCode)), timeout);
    }

    public long allocateNextForKey(String counterKey) {
        return allocateNextForKey(counterKey, defaultTimeout);
    }

    public long allocateNextForKey(String counterKey, Duration timeout) {
        return increment(requireCounterKey(counterKey), timeout);
    }

    /**
     * 카운터가 없으면 설정된 초기값으로 만든다.
     */
    public boolean initializeCounter(String counterKey) {
        String key = requireCounterKey(counterKey);
        try {
            return counterStore.initialize(key, initialValue);
        } catch (TransientDataAccessException | DataAccessResourceFailureException | RecoverableDataAccessException ex) {
            log.warn("Counter initialization failed for key={}: {}", key, ex.getMessage());
            throw new StorageUnavailableException(key, ex);
        }
    }

    public Optional<Long> currentValue(String counterKey) {
        String key = requireCounterKey(counterKey);
        try {
            return counterStore.find(key).map(SequenceCounter::sequence);
        } catch (TransientDataAccessException | DataAccessResourceFailureException | RecoverableDataAccessException ex) {
            throw new StorageUnavailableException(key, ex);
        }
    }

    public long getInitialValue() {
        return initialValue;
    }

    /**
     * {@code null} 타임아웃은 설정 기본값을 뜻한다. 0 이하의 값은 이미 지난 기한이므로 저장소를 호출하지 않고
     * 사용 불가로 실패한다.
     */
    private long increment(String counterKey, Duration timeout) {
        Duration effectiveTimeout = timeout != null ? timeout : defaultTimeout;
        if (effectiveTimeout.isZero() || effectiveTimeout.isNegative()) {
            log.warn("Sequence allocation skipped for key={}: deadline already exhausted ({})", counterKey, effectiveTimeout);
            throw new StorageUnavailableException(counterKey, "Deadline exhausted before the sequence store was called");
        }
        try {
            long value = counterStore.incrementAndGet(counterKey, initialValue, effectiveTimeout);
            log.debug("Allocated sequence {} for key={}", value, counterKey);
            return value;
        } catch (TransientDataAccessException | DataAccessResourceFailureException | RecoverableDataAccessException ex) {
            log.warn("Sequence allocation failed for key={}: {}", counterKey, ex.getMessage());
            throw new StorageUnavailableException(counterKey, ex);
        }
    }

    static String requireBranchCode(String branchCode) {
        if (branchCode == null || !BRANCH_CODE_PATTERN.matcher(branchCode).matches()) {
            throw new InvalidBranchCodeException(branchCode);
        }
        return branchCode;
    }

    static String requireCounterKey(String counterKey) {
        if (counterKey == null || !COUNTER_KEY_PATTERN.matcher(counterKey).matches()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_COUNTER_KEY",
                    "Counter key is empty or malformed: '" + counterKey + "'");
        }
        return counterKey;
    }
}
