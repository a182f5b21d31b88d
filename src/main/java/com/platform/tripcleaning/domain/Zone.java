package com.platform.tripcleaning.domain;

import jakarta.persistence.*;

@Entity
@Table(name = "zones")
public class Zone {

    @Id
    @Column(name = "zone_id")
    private Integer id;

    @Column(nullable = false)
    private String borough;

    @Column(name = "zone_name", nullable = false)
    private String zoneName;

    @Column(name = "service_zone")
    private String serviceZone;

    public Zone() {}

    public Zone(Integer id, String borough, String zoneName, String serviceZone) {
        this.id = id;
        this.borough = borough;
        this.zoneName = zoneName;
        this.serviceZone = serviceZone;
    }

    // Getters and setters

    public Integer getId() { return id; }
    public void setId(Integer id) { this.id = id; }

    public String getBorough() { return borough; }
    public void setBorough(String borough) { this.borough = borough; }

    public String getZoneName() { return zoneName; }
    public void setZoneName(String zoneName) { this.zoneName = zoneName; }

    public String getServiceZone() { return serviceZone; }
    public void setServiceZone(String serviceZone) { this.serviceZone = serviceZone; }
}
