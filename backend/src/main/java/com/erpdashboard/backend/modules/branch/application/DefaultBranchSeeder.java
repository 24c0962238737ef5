package com.erpdashboard.backend.modules.branch.application;

import com.erpdashboard.backend.modules.branch.domain.DefaultBranches;
import com.erpdashboard.backend.modules.branch.domain.DefaultBranches.BranchSeed;
import com.erpdashboard.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.erpdashboard.backend.modules.sequence.application.SequenceAllocator;
import com.erpdashboard.backend.modules.sequence.domain.CounterKeys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 기본 지점과 카운터를 기동 시 삽입한다. 기존 행은 건드리지 않아 재시작이나 동시 기동에도 안전하다.
 * 코드가 이미 다른 이름의 지점에 쓰인 기본값은 건너뛴다.
 */
@Service
public class DefaultBranchSeeder {

    private static final Logger log = LoggerFactory.getLogger(DefaultBranchSeeder.class);

    private final BranchRepository branchRepository;
    private final SequenceAllocator sequenceAllocator;
    private final boolean enabled;

    public DefaultBranchSeeder(
            BranchRepository branchRepository,
            SequenceAllocator sequenceAllocator,
            @Value("${erp.seed.default-branches:true}") boolean enabled
    ) {
        this.branchRepository = branchRepository;
        this.sequenceAllocator = sequenceAllocator;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seedOnStartup() {
        if (!enabled) {
            log.info("Default branch seeding disabled");
            return;
        }
        seedDefaultBranches();
    }

    @Transactional
    public int seedDefaultBranches() {
        int insertedBranches = 0;
        int initializedCounters = 0;
        for (BranchSeed seed : DefaultBranches.ALL) {
            int rows = branchRepository.insertIfAbsent(
                    seed.branchId(),
                    seed.branchName(),
                    seed.branchLocation(),
                    seed.branchCode()
            );
            if (rows == 0 && !branchRepository.existsByBranchId(seed.branchId())) {
                log.warn("Default branch '{}' skipped: code {} is already used by another branch",
                        seed.branchId(), seed.branchCode());
            }
            insertedBranches += rows;
            if (sequenceAllocator.initializeCounter(CounterKeys.forBranch(seed.branchCode()))) {
                initializedCounters++;
            }
        }
        log.info("Default branches seeded: {} new branches, {} new counters", insertedBranches, initializedCounters);
        return insertedBranches;
    }
}
