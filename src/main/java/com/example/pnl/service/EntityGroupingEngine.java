package com.example.pnl.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.pnl.domain.District;
import com.example.pnl.domain.Facility;
import com.example.pnl.domain.TagGroup;

/**
 * Groups facilities into reporting units.
 *
 * <p>A facility's tags are those of its parent district. Districts without tags fall back to their
 * own label, so every facility has a grouping key. Districts whose sorted tags are identical end
 * up in the same group even when their reporting exclusion differs.
 */
@Service
public class EntityGroupingEngine {

  private static final Logger log = LoggerFactory.getLogger(EntityGroupingEngine.class);

  static final String KEY_SEPARATOR = ",";
  static final String LABEL_SEPARATOR = " - ";
  static final String UNTAGGED_LABEL = "Other";

  /**
   * Maps each district label to the facilities whose parent is that district. Districts are kept
   * in the given order; a district without facilities maps to an empty list.
   */
  public Map<String, List<Facility>> buildDistrictMembership(
      Collection<Facility> facilities, Collection<District> districts) {
    Map<String, List<Facility>> membership = new LinkedHashMap<>();
    Map<String, String> labelsById = new LinkedHashMap<>();
    for (District district : districts) {
      labelsById.put(district.id(), district.label());
      membership.computeIfAbsent(district.label(), key -> new ArrayList<>());
    }
    for (Facility facility : facilities) {
      String label = labelsById.get(facility.parentDistrictId());
      if (label != null) {
        membership.get(label).add(facility);
      }
    }
    return membership;
  }

  /**
   * Sorted tags of a district, or its label alone when it has none. A missing district has no
   * tags at all.
   */
  public List<String> tagsFor(District district) {
    if (district == null) {
      return List.of();
    }
    if (district.tags().isEmpty()) {
      return List.of(district.label() == null ? district.id() : district.label());
    }
    List<String> sorted = new ArrayList<>(district.tags());
    sorted.sort(null);
    return List.copyOf(sorted);
  }

  /**
   * Partitions facilities by their sorted tag key. Groups come out in the order their first
   * member was seen; members keep their input order.
   */
  public List<TagGroup> groupByTags(
      Collection<Facility> facilities, Function<Facility, List<String>> tagsOf) {
    Map<String, List<String>> tagsByKey = new LinkedHashMap<>();
    Map<String, List<Facility>> membersByKey = new LinkedHashMap<>();
    for (Facility facility : facilities) {
      List<String> tags = new ArrayList<>(tagsOf.apply(facility));
      tags.sort(null);
      String key = String.join(KEY_SEPARATOR, tags);
      tagsByKey.putIfAbsent(key, tags);
      membersByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(facility);
    }

    List<TagGroup> groups = new ArrayList<>();
    membersByKey.forEach(
        (key, members) -> {
          List<String> tags = tagsByKey.get(key);
          groups.add(new TagGroup(key, labelFor(tags), tags, members));
        });
    log.debug("Grouped {} facilities into {} tag groups", facilities.size(), groups.size());
    return groups;
  }

  /**
   * Groups facilities by the tags of their parent district as configured in the directory. Groups
   * follow the document order of their first district.
   */
  public List<TagGroup> groupCustomersByDistrictTags(
      Collection<Facility> facilities, CustomerDirectory directory) {
    List<Facility> ordered = new ArrayList<>(facilities);
    ordered.sort(
        Comparator.comparingInt(facility -> directory.districtPosition(facility.parentDistrictId())));
    return groupByTags(ordered, facility -> tagsFor(directory.parentDistrictOf(facility)));
  }

  public String labelFor(List<String> tags) {
    if (tags.isEmpty()) {
      return UNTAGGED_LABEL;
    }
    if (tags.size() == 1) {
      return tags.get(0);
    }
    return String.join(LABEL_SEPARATOR, tags);
  }

  /**
   * Facilities directly below a district, regardless of its reporting exclusion. Each customer
   * appears once.
   */
  public List<Facility> membersOfDistrict(String districtId, CustomerDirectory directory) {
    List<Facility> members = new ArrayList<>();
    Set<Long> seen = new HashSet<>();
    for (Facility facility : directory.facilitiesOf(districtId)) {
      if (facility.customerId() != null && seen.add(facility.customerId())) {
        members.add(facility);
      }
    }
    return members;
  }

  /**
   * Facilities of every district carrying the tag. Reporting exclusion is ignored here; only
   * districts hidden from display are left out. Each customer appears once.
   */
  public List<Facility> membersOfTag(String tag, CustomerDirectory directory) {
    List<Facility> members = new ArrayList<>();
    Set<Long> seen = new HashSet<>();
    for (District district : directory.districts()) {
      if (district.displayExcluded() || !district.hasTag(tag)) {
        continue;
      }
      for (Facility facility : directory.facilitiesOf(district.id())) {
        if (facility.customerId() != null && seen.add(facility.customerId())) {
          members.add(facility);
        }
      }
    }
    return members;
  }
}
