package com.erpdashboard.backend.modules.customertype.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.erpdashboard.backend.modules.customertype.domain.CustomerType;
import com.erpdashboard.backend.modules.customertype.domain.CustomerTypeStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomerTypeRepository extends JpaRepository<CustomerType, UUID> {

    Optional<CustomerType> findByTypeValueAndStatus(String typeValue, CustomerTypeStatus status);

    boolean existsByTypeValue(String typeValue);

    @Modifying
    @Query(value = """
            INSERT INTO customer_type (id, type_value, label, icon, prefix, status, created_at, updated_at)
            VALUES (gen_random_uuid(), :typeValue, :label, :icon, :prefix, 'ACTIVE',
                    CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("typeValue") String typeValue,
            @Param("label") String label,
            @Param("icon") String icon,
            @Param("prefix") String prefix
    );
}
