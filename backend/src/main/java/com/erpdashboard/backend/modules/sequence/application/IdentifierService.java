package com.erpdashboard.backend.modules.sequence.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

import com.erpdashboard.backend.modules.customertype.application.CustomerTypeService;
import com.erpdashboard.backend.modules.customertype.domain.CustomerType;
import com.erpdashboard.backend.modules.sequence.domain.CounterKeys;
import com.erpdashboard.backend.modules.sequence.domain.UniqueIdFormatter;

import org.springframework.stereotype.Service;

/**
 * ERP 식별자 발급: 지점별 사용자 고유 ID와 일자별 고객/거래 ID.
 * 호출 한 번에 카운터 값을 정확히 하나 소비한다.
 */
@Service
public class IdentifierService {

    private final SequenceAllocator sequenceAllocator;
    private final CustomerTypeService customerTypeService;
    private final Clock clock;
    private final ZoneId businessZone;

    public IdentifierService(
            SequenceAllocator sequenceAllocator,
            CustomerTypeService customerTypeService,
            Clock clock,
            ZoneId businessZone
    ) {
        this.sequenceAllocator = sequenceAllocator;
        this.customerTypeService = customerTypeService;
        this.clock = clock;
        this.businessZone = businessZone;
    }

    public String nextUserUniqueId(String branchCode) {
        long sequence = sequenceAllocator.allocateNext(branchCode);
        return UniqueIdFormatter.formatUniqueId(branchCode, sequence);
    }

    /**
     * 접두사는 호출자가 아니라 등록된 고객 유형에서 가져온다.
     */
    public String nextCustomerId(String customerType) {
        CustomerType type = customerTypeService.requireActiveCustomerType(customerType);
        LocalDate today = businessDate();
        long sequence = sequenceAllocator.allocateNextForKey(CounterKeys.forCustomerDay(type.getTypeValue(), today));
        return UniqueIdFormatter.formatCustomerId(type.getPrefix(), today, sequence);
    }

    public String nextTransactionId(String branchCode) {
        SequenceAllocator.requireBranchCode(branchCode);
        LocalDate today = businessDate();
        long sequence = sequenceAllocator.allocateNextForKey(CounterKeys.forTransactionDay(branchCode, today));
        return UniqueIdFormatter.formatTransactionId(branchCode, today, sequence);
    }

    LocalDate businessDate() {
        return LocalDate.now(clock.withZone(businessZone));
    }
}
