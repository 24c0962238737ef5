package com.erpdashboard.backend.modules.customertype.application;

import com.erpdashboard.backend.modules.customertype.domain.DefaultCustomerTypes;
import com.erpdashboard.backend.modules.customertype.domain.DefaultCustomerTypes.CustomerTypeSeed;
import com.erpdashboard.backend.modules.customertype.infrastructure.persistence.CustomerTypeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 기본 고객 유형을 기동 시 삽입한다. 이미 있거나 접두사가 다른 유형에 쓰인 행은 건드리지 않는다.
 */
@Service
public class DefaultCustomerTypeSeeder {

    private static final Logger log = LoggerFactory.getLogger(DefaultCustomerTypeSeeder.class);

    private final CustomerTypeRepository customerTypeRepository;
    private final boolean enabled;

    public DefaultCustomerTypeSeeder(
            CustomerTypeRepository customerTypeRepository,
            @Value("${erp.seed.default-customer-types:true}") boolean enabled
    ) {
        this.customerTypeRepository = customerTypeRepository;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seedOnStartup() {
        if (!enabled) {
            log.info("Default customer type seeding disabled");
            return;
        }
        seedDefaultCustomerTypes();
    }

    @Transactional
    public int seedDefaultCustomerTypes() {
        int inserted = 0;
        for (CustomerTypeSeed seed : DefaultCustomerTypes.ALL) {
            int rows = customerTypeRepository.insertIfAbsent(seed.typeValue(), seed.label(), seed.icon(), seed.prefix());
            if (rows == 0 && !customerTypeRepository.existsByTypeValue(seed.typeValue())) {
                log.warn("Default customer type '{}' skipped: prefix {} is already used by another type",
                        seed.typeValue(), seed.prefix());
            }
            inserted += rows;
        }
        log.info("Default customer types seeded: {} new types", inserted);
        return inserted;
    }
}
