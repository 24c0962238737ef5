package com.erpdashboard.backend.modules.sequence.domain;

import java.time.OffsetDateTime;

/**
 * 영속 카운터 행의 스냅숏. 행은 {@code SequenceCounterStore}의 원자적 upsert로만 바뀐다.
 */
public record SequenceCounter(String counterKey, long sequence, OffsetDateTime updatedAt) {
}
