package com.erpdashboard.backend.modules.customertype.domain;

import com.erpdashboard.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

/**
 * 고객 유형. {@code typeValue}는 일자별 고객 카운터의 범위이고 {@code prefix}는 발급되는 ID의 머리글이다.
 */
@Entity
@Table(name = "customer_type")
public class CustomerType extends AbstractAuditedEntity {

    @Column(name = "type_value", nullable = false, unique = true, length = 32)
    private String typeValue;

    @Column(name = "label", nullable = false, length = 100)
    private String label;

    @Column(name = "icon", length = 32)
    private String icon;

    @Column(name = "prefix", nullable = false, unique = true, length = 8)
    private String prefix;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CustomerTypeStatus status;

    public String getTypeValue() {
        return typeValue;
    }

    public void setTypeValue(String typeValue) {
        this.typeValue = typeValue;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getIcon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public CustomerTypeStatus getStatus() {
        return status;
    }

    public void setStatus(CustomerTypeStatus status) {
        this.status = status;
    }
}
