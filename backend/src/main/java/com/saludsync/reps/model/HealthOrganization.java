package com.saludsync.reps.model;

import jakarta.persistence.*;

@Entity
@Table(name = "health_organization", uniqueConstraints = {
        @UniqueConstraint(name = "uk_health_org_nit", columnNames = {"nit"})
})
public class HealthOrganization {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 32)
    private String nit;

    @Column(name = "provider_code", length = 32)
    private String providerCode;

    public HealthOrganization() {}

    public HealthOrganization(String name, String nit, String providerCode) {
        this.name = name;
        this.nit = nit;
        this.providerCode = providerCode;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getNit() { return nit; }
    public void setNit(String nit) { this.nit = nit; }
    public String getProviderCode() { return providerCode; }
    public void setProviderCode(String providerCode) { this.providerCode = providerCode; }
}
