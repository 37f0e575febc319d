package io.tradedesk.opsengine.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** Physical location a job or quote is carried out at. Coordinates may be missing. */
@Entity
@Immutable
@Table(name = "sites")
public class Site {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "name")
  private String name;

  @Column(name = "address1")
  private String address1;

  @Column(name = "city")
  private String city;

  @Column(name = "latitude")
  private Double latitude;

  @Column(name = "longitude")
  private Double longitude;

  protected Site() {}

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getName() {
    return name;
  }

  public String getAddress1() {
    return address1;
  }

  public String getCity() {
    return city;
  }

  public Double getLatitude() {
    return latitude;
  }

  public Double getLongitude() {
    return longitude;
  }
}
