package com.example.pnl.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.example.pnl.domain.District;
import com.example.pnl.domain.Facility;

/**
 * In-memory view of the customer configuration: districts and facilities in document order.
 * Built once per report request and never modified afterwards.
 */
public final class CustomerDirectory {

  public static final String CUSTOMER_CONFIG_DOCUMENT = "customer_config.json";

  private final List<District> districts;
  private final Map<String, District> districtsById;
  private final Map<String, Integer> districtPositions;
  private final List<Facility> facilities;
  private final Map<Long, Facility> facilitiesByCustomerId;
  private final Set<String> tags;

  private CustomerDirectory(List<District> districts, List<Facility> facilities, Set<String> tags) {
    this.districts = List.copyOf(districts);
    this.facilities = List.copyOf(facilities);
    this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));

    Map<String, District> byId = new LinkedHashMap<>();
    Map<String, Integer> positions = new LinkedHashMap<>();
    for (District district : this.districts) {
      byId.put(district.id(), district);
      positions.putIfAbsent(district.id(), positions.size());
    }
    this.districtsById = Collections.unmodifiableMap(byId);
    this.districtPositions = Collections.unmodifiableMap(positions);

    Map<Long, Facility> byCustomer = new LinkedHashMap<>();
    for (Facility facility : this.facilities) {
      byCustomer.putIfAbsent(facility.customerId(), facility);
    }
    this.facilitiesByCustomerId = Collections.unmodifiableMap(byCustomer);
  }

  /**
   * @param districts district nodes in document order
   * @param facilities customer nodes in document order
   * @param tags every tag found in the document, in first-seen order
   */
  public static CustomerDirectory of(
      List<District> districts, List<Facility> facilities, Set<String> tags) {
    return new CustomerDirectory(districts, facilities, tags);
  }

  public List<District> districts() {
    return districts;
  }

  public District district(String id) {
    return id == null ? null : districtsById.get(id);
  }

  /** Document position of a district; unknown districts sort last. */
  public int districtPosition(String districtId) {
    Integer position = districtId == null ? null : districtPositions.get(districtId);
    return position == null ? Integer.MAX_VALUE : position;
  }

  public List<Facility> facilities() {
    return facilities;
  }

  /** The configured facility of a warehouse customer, or null when it is not configured. */
  public Facility facility(Long customerId) {
    return customerId == null ? null : facilitiesByCustomerId.get(customerId);
  }

  /** The district a facility hangs under, or null when its parent is not a district. */
  public District parentDistrictOf(Facility facility) {
    return facility == null ? null : district(facility.parentDistrictId());
  }

  public List<Facility> facilitiesOf(String districtId) {
    List<Facility> members = new ArrayList<>();
    for (Facility facility : facilities) {
      if (districtId.equals(facility.parentDistrictId())) {
        members.add(facility);
      }
    }
    return members;
  }

  public Set<String> tags() {
    return tags;
  }
}
