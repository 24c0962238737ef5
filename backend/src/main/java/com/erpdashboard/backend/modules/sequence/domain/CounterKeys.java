package com.erpdashboard.backend.modules.sequence.domain;

import java.time.LocalDate;
import java.util.Locale;

/**
 * 카운터 저장 키를 만든다. 지점 사용자 ID는 지점 코드 자체를 키로 쓰고,
 * 일자별 고객/거래 키에는 날짜가 들어가 날마다 새 카운터가 시작된다.
 */
public final class CounterKeys {

    private CounterKeys() {
    }

    public static String forBranch(String branchCode) {
        return branchCode;
    }

    public static String forCustomerDay(String customerType, LocalDate date) {
        return "customer_" + customerType.toLowerCase(Locale.ROOT) + "_" + UniqueIdFormatter.formatDateStamp(date);
    }

    public static String forTransactionDay(String branchCode, LocalDate date) {
        return "transaction_" + branchCode + "_" + UniqueIdFormatter.formatDateStamp(date);
    }
}
