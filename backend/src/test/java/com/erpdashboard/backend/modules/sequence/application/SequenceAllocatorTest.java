package com.erpdashboard.backend.modules.sequence.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import com.erpdashboard.backend.global.error.ProblemException;
import com.erpdashboard.backend.modules.sequence.domain.SequenceCounter;
import com.erpdashboard.backend.modules.sequence.infrastructure.persistence.SequenceCounterStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

@ExtendWith(MockitoExtension.class)
class SequenceAllocatorTest {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private SequenceCounterStore counterStore;

    private SequenceAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new SequenceAllocator(counterStore, 0, DEFAULT_TIMEOUT);
    }

    @Test
    @DisplayName("기본 타임아웃으로 지점 카운터를 증가시킨다")
    void allocateNextUsesBranchKey() {
        when(counterStore.incrementAndGet("DH", 0, DEFAULT_TIMEOUT)).thenReturn(7L);

        assertThat(allocator.allocateNext("DH")).isEqualTo(7L);
        verify(counterStore).incrementAndGet("DH", 0, DEFAULT_TIMEOUT);
    }

    @Test
    @DisplayName("호출자 기한을 저장소에 그대로 넘긴다")
    void allocateNextPassesCallerTimeout() {
        Duration deadline = Duration.ofMillis(250);
        when(counterStore.incrementAndGet("BOG", 0, deadline)).thenReturn(1L);

        assertThat(allocator.allocateNext("BOG", deadline)).isEqualTo(1L);
    }

    @Test
    @DisplayName("설정된 초기값을 넘겨 새 카운터가 초기값 + 1에서 시작한다")
    void configuredInitialValue() {
        SequenceAllocator based = new SequenceAllocator(counterStore, 1000, DEFAULT_TIMEOUT);
        when(counterStore.incrementAndGet("CTG", 1000, DEFAULT_TIMEOUT)).thenReturn(1001L);

        assertThat(based.allocateNext("CTG")).isEqualTo(1001L);
    }

    @Test
    @DisplayName("비었거나 형식이 틀린 지점 코드는 저장소 호출 전에 거부한다")
    void invalidBranchCodes() {
        for (String code : new String[]{null, "", "  ", "dh", "D H", "DH-1", "1DH", "ABCDEFGHIJKLMNOPQ"}) {
            assertThatThrownBy(() -> allocator.allocateNext(code))
                    .as("branch code '%s'", code)
                    .isInstanceOf(InvalidBranchCodeException.class)
                    .satisfies(ex -> assertThat(((InvalidBranchCodeException) ex).getCode()).isEqualTo("INVALID_BRANCH_CODE"));
        }
        verifyNoInteractions(counterStore);
    }

    @Test
    @DisplayName("저장소 연결 실패는 StorageUnavailableException으로 드러난다")
    void unreachableStore() {
        when(counterStore.incrementAndGet(anyString(), anyLong(), any()))
                .thenThrow(new CannotGetJdbcConnectionException("connection refused"));

        assertThatThrownBy(() -> allocator.allocateNext("DH"))
                .isInstanceOf(StorageUnavailableException.class)
                .satisfies(ex -> {
                    StorageUnavailableException unavailable = (StorageUnavailableException) ex;
                    assertThat(unavailable.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(unavailable.getCounterKey()).isEqualTo("DH");
                    assertThat(unavailable.getRetryAfterSeconds()).isPositive();
                    assertThat(unavailable.getCause()).isInstanceOf(CannotGetJdbcConnectionException.class);
                });
    }

    @Test
    @DisplayName("문장 타임아웃은 StorageUnavailableException으로 드러난다")
    void timedOutStore() {
        when(counterStore.incrementAndGet(eq("DH"), anyLong(), any()))
                .thenThrow(new QueryTimeoutException("canceling statement due to user request"));

        assertThatThrownBy(() -> allocator.allocateNext("DH", Duration.ofSeconds(1)))
                .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    @DisplayName("일시적이지 않은 데이터 오류는 장애로 바꾸지 않는다")
    void nonTransientErrorsPropagate() {
        when(counterStore.incrementAndGet(eq("DH"), anyLong(), any()))
                .thenThrow(new DataIntegrityViolationException("check constraint"));

        assertThatThrownBy(() -> allocator.allocateNext("DH"))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("일반 카운터 키를 검증한다")
    void counterKeyValidation() {
        when(counterStore.incrementAndGet("transaction_DH_290825", 0, DEFAULT_TIMEOUT)).thenReturn(3L);

        assertThat(allocator.allocateNextForKey("transaction_DH_290825")).isEqualTo(3L);
        assertThatThrownBy(() -> allocator.allocateNextForKey("bad key!"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("INVALID_COUNTER_KEY"));
    }

    @Test
    @DisplayName("현재 값 조회는 증가시키지 않는다")
    void currentValue() {
        when(counterStore.find("DH")).thenReturn(Optional.of(new SequenceCounter("DH", 12, null)));
        when(counterStore.find("BOG")).thenReturn(Optional.empty());

        assertThat(allocator.currentValue("DH")).contains(12L);
        assertThat(allocator.currentValue("BOG")).isEmpty();
    }

    @Test
    @DisplayName("음수 초기값 설정은 거부한다")
    void negativeInitialValue() {
        assertThatThrownBy(() -> new SequenceAllocator(counterStore, -1, DEFAULT_TIMEOUT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("기한이 없으면 설정된 타임아웃을 쓴다")
    void nullDeadlineUsesDefault() {
        when(counterStore.incrementAndGet("DH", 0, DEFAULT_TIMEOUT)).thenReturn(2L);

        assertThat(allocator.allocateNext("DH", null)).isEqualTo(2L);
    }

    @Test
    @DisplayName("지난 기한은 저장소를 호출하지 않고 사용 불가로 실패한다")
    void exhaustedDeadline() {
        for (Duration deadline : new Duration[]{Duration.ZERO, Duration.ofMillis(-1)}) {
            assertThatThrownBy(() -> allocator.allocateNext("DH", deadline))
                    .as("deadline %s", deadline)
                    .isInstanceOf(StorageUnavailableException.class)
                    .satisfies(ex -> {
                        StorageUnavailableException unavailable = (StorageUnavailableException) ex;
                        assertThat(unavailable.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                        assertThat(unavailable.getCode()).isEqualTo("STORAGE_UNAVAILABLE");
                        assertThat(unavailable.getCounterKey()).isEqualTo("DH");
                    });
        }
        assertThatThrownBy(() -> allocator.allocateNextForKey("transaction_DH_290825", Duration.ZERO))
                .isInstanceOf(StorageUnavailableException.class);
        verifyNoInteractions(counterStore);
    }

    @Test
    @DisplayName("0 이하의 기본 타임아웃은 거부한다")
    void nonPositiveDefaultTimeout() {
        assertThatThrownBy(() -> new SequenceAllocator(counterStore, 0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SequenceAllocator(counterStore, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
