package com.erpdashboard.backend.modules.customertype.application;

import java.util.Locale;

import com.erpdashboard.backend.global.error.ProblemException;
import com.erpdashboard.backend.modules.customertype.domain.CustomerType;
import com.erpdashboard.backend.modules.customertype.domain.CustomerTypeStatus;
import com.erpdashboard.backend.modules.customertype.infrastructure.persistence.CustomerTypeRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class CustomerTypeService {

    public static final String INVALID_CUSTOMER_TYPE = "INVALID_CUSTOMER_TYPE";

    private final CustomerTypeRepository customerTypeRepository;

    public CustomerTypeService(CustomerTypeRepository customerTypeRepository) {
        this.customerTypeRepository = customerTypeRepository;
    }

    /**
     * 활성 고객 유형을 대소문자 구분 없이 찾는다. 없거나 비활성인 유형은 거부한다.
     */
    public CustomerType requireActiveCustomerType(String customerType) {
        if (customerType == null || customerType.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, INVALID_CUSTOMER_TYPE, "Customer type is required");
        }
        String typeValue = customerType.trim().toLowerCase(Locale.ROOT);
        return customerTypeRepository.findByTypeValueAndStatus(typeValue, CustomerTypeStatus.ACTIVE)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, INVALID_CUSTOMER_TYPE,
                        "Customer type not found: " + customerType));
    }
}
