package com.erpdashboard.backend.modules.sequence.domain;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class UniqueIdFormatter {

    private static final DateTimeFormatter DATE_STAMP = DateTimeFormatter.ofPattern("ddMMyy");
    private static final String TRANSACTION_PREFIX = "TXN";

    private UniqueIdFormatter() {
    }

    /**
     * {@code DH-0001} 형태의 사용자 고유 ID. 네 자리를 넘는 순번은 자르지 않는다.
     */
    public static String formatUniqueId(String branchCode, long sequence) {
        requireNonNegative(sequence);
        return branchCode + "-" + String.format(Locale.ROOT, "%04d", sequence);
    }

    /**
     * {@code HAJ05092500001} 형태의 고객 ID.
     */
    public static String formatCustomerId(String prefix, LocalDate date, long sequence) {
        requireNonNegative(sequence);
        return prefix + formatDateStamp(date) + String.format(Locale.ROOT, "%05d", sequence);
    }

    /**
     * {@code TXNDH2908250001} 형태의 거래 ID.
     */
    public static String formatTransactionId(String branchCode, LocalDate date, long sequence) {
        requireNonNegative(sequence);
        return TRANSACTION_PREFIX + branchCode + formatDateStamp(date) + String.format(Locale.ROOT, "%04d", sequence);
    }

    public static String formatDateStamp(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date must not be null");
        }
        return DATE_STAMP.format(date);
    }

    private static void requireNonNegative(long sequence) {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative");
        }
    }
}
