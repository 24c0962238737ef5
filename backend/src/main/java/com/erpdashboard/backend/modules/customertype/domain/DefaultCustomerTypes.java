package com.erpdashboard.backend.modules.customertype.domain;

import java.util.List;

public final class DefaultCustomerTypes {

    public static final List<CustomerTypeSeed> ALL = List.of(
            new CustomerTypeSeed("haj", "হাজ্জ", "Home", "HAJ"),
            new CustomerTypeSeed("umrah", "ওমরাহ", "Plane", "UMR")
    );

    private DefaultCustomerTypes() {
    }

    public record CustomerTypeSeed(String typeValue, String label, String icon, String prefix) {
    }
}
