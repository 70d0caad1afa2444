package com.example.pnl.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.pnl.domain.AccountNode;
import com.example.pnl.domain.District;
import com.example.pnl.domain.Facility;
import com.example.pnl.domain.HierarchyUnit;
import com.example.pnl.domain.SelectableItem;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Loads the account, customer, region and department documents into immutable domain objects and
 * answers the picker listings built from them.
 *
 * <p>Every document is an object keyed by node id. Unexpected field types are read leniently: a
 * non-array {@code tags} field means no tags, a textual internal id is parsed as a number.
 */
@Service
public class DimensionConfigService {

  private static final Logger log = LoggerFactory.getLogger(DimensionConfigService.class);

  public static final String REGION_CONFIG_DOCUMENT = "region_config.json";
  public static final String DEPARTMENT_CONFIG_DOCUMENT = "department_config.json";

  static final String DISTRICT_TYPE = "district";
  static final String REGION_TYPE = "region";
  static final String DEPARTMENT_TYPE = "department";

  private static final Pattern CENSUS_CODE_PATTERN = Pattern.compile("^([A-Z0-9]+)\\s*[-–]");

  private static final Comparator<SelectableItem> BY_LABEL =
      Comparator.comparing(
          SelectableItem::label, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));

  private final ConfigurationStore configurationStore;

  public DimensionConfigService(ConfigurationStore configurationStore) {
    this.configurationStore = configurationStore;
  }

  public AccountHierarchy loadAccountHierarchy() {
    return AccountHierarchy.of(
        parseAccounts(configurationStore.readDocument(AccountHierarchy.ACCOUNT_CONFIG_DOCUMENT)));
  }

  public CustomerDirectory loadCustomerDirectory() {
    return parseCustomers(
        configurationStore.readDocument(CustomerDirectory.CUSTOMER_CONFIG_DOCUMENT));
  }

  public List<HierarchyUnit> loadRegions() {
    return parseUnits(configurationStore.readDocument(REGION_CONFIG_DOCUMENT), "region_internal_id");
  }

  public List<HierarchyUnit> loadSubsidiaries() {
    return parseUnits(
        configurationStore.readDocument(DEPARTMENT_CONFIG_DOCUMENT), "subsidiary_internal_id");
  }

  /**
   * Districts that may be reported on their own plus one entry per tag found anywhere in the
   * customer document, sorted by label.
   */
  public List<SelectableItem> listDistricts() {
    CustomerDirectory directory = loadCustomerDirectory();
    List<SelectableItem> items = new ArrayList<>();
    for (District district : directory.districts()) {
      if (!district.reportingExcluded() && !district.displayExcluded()) {
        items.add(new SelectableItem(district.id(), district.label(), DISTRICT_TYPE));
      }
    }
    directory.tags().forEach(tag -> items.add(SelectableItem.tag(tag)));
    items.sort(BY_LABEL);
    return items;
  }

  public List<SelectableItem> listRegions() {
    return listUnits(loadRegions(), REGION_TYPE);
  }

  public List<SelectableItem> listSubsidiaries() {
    return listUnits(loadSubsidiaries(), DEPARTMENT_TYPE);
  }

  private static List<SelectableItem> listUnits(List<HierarchyUnit> units, String type) {
    List<SelectableItem> items = new ArrayList<>();
    Set<String> tags = new LinkedHashSet<>();
    for (HierarchyUnit unit : units) {
      if (unit.isSelectableLeaf()) {
        items.add(new SelectableItem(unit.configId(), unit.label(), type));
      }
      tags.addAll(unit.tags());
    }
    tags.forEach(tag -> items.add(SelectableItem.tag(tag)));
    items.sort(BY_LABEL);
    return items;
  }

  /**
   * Reads account nodes. Parents are referenced by node id and translated to labels; a parent id
   * that is not in the document makes the node a root.
   */
  static List<AccountNode> parseAccounts(JsonNode document) {
    List<AccountNode> nodes = new ArrayList<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = document.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode config = entry.getValue();
      String label = text(config, "label");
      if (label == null || label.isBlank()) {
        log.warn("Account node {} has no label, skipping", entry.getKey());
        continue;
      }

      String parentLabel = null;
      String parentId = text(config, "parent");
      if (parentId != null) {
        JsonNode parent = document.get(parentId);
        if (parent == null || text(parent, "label") == null) {
          log.warn("Account '{}' references missing parent {}, treating it as a root", label, parentId);
        } else {
          parentLabel = text(parent, "label");
        }
      }

      nodes.add(
          new AccountNode(
              label,
              parentLabel,
              number(config, "account_internal_id"),
              flag(config, "displayExcluded"),
              flag(config, "operationalExcluded"),
              flag(config, "doubleLines")));
    }
    return nodes;
  }

  /**
   * Reads the customer document. Nodes flagged {@code isDistrict} become districts, nodes with a
   * {@code customer_internal_id} become facilities.
   */
  static CustomerDirectory parseCustomers(JsonNode document) {
    List<District> districts = new ArrayList<>();
    List<Facility> facilities = new ArrayList<>();
    Set<String> allTags = new LinkedHashSet<>();

    for (Iterator<Map.Entry<String, JsonNode>> it = document.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      String id = entry.getKey();
      JsonNode config = entry.getValue();
      String label = text(config, "label");
      List<String> tags = tags(config);
      allTags.addAll(tags);

      if (flag(config, "isDistrict")) {
        String districtLabel = label;
        if (districtLabel == null || districtLabel.isBlank()) {
          log.warn("District node {} has no label, using its id", id);
          districtLabel = id;
        }
        districts.add(
            new District(
                id,
                districtLabel,
                tags,
                flag(config, "districtReportingExcluded"),
                flag(config, "displayExcluded")));
      }

      Long customerId = number(config, "customer_internal_id");
      if (customerId != null) {
        facilities.add(
            new Facility(
                customerId,
                label,
                id,
                text(config, "parent"),
                censusCode(config, label),
                text(config, "start_date_est")));
      }
    }
    log.debug(
        "Customer configuration has {} districts, {} facilities, {} tags",
        districts.size(),
        facilities.size(),
        allTags.size());
    return CustomerDirectory.of(districts, facilities, allTags);
  }

  static List<HierarchyUnit> parseUnits(JsonNode document, String internalIdField) {
    List<HierarchyUnit> units = new ArrayList<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = document.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode config = entry.getValue();
      units.add(
          new HierarchyUnit(
              entry.getKey(),
              text(config, "label"),
              text(config, "parent"),
              number(config, internalIdField),
              tags(config),
              flag(config, "displayExcluded"),
              flag(config, "operationalExcluded")));
    }
    return units;
  }

  /** The explicit customer code, else the leading code of labels like "AB12 - Facility". */
  static String censusCode(JsonNode config, String label) {
    String code = text(config, "customer_code");
    if (code != null && !code.isBlank()) {
      return code.trim();
    }
    if (label != null) {
      Matcher matcher = CENSUS_CODE_PATTERN.matcher(label);
      if (matcher.find()) {
        return matcher.group(1);
      }
    }
    return null;
  }

  private static List<String> tags(JsonNode config) {
    JsonNode tags = config.get("tags");
    if (tags == null || tags.isNull()) {
      tags = config.get("districtTags");
    }
    if (tags == null || !tags.isArray()) {
      return List.of();
    }
    List<String> values = new ArrayList<>();
    for (JsonNode tag : tags) {
      if (tag.isValueNode() && !tag.isNull() && !tag.asText().isBlank()) {
        values.add(tag.asText());
      }
    }
    return values;
  }

  private static String text(JsonNode config, String field) {
    JsonNode value = config.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    return value.asText();
  }

  private static boolean flag(JsonNode config, String field) {
    JsonNode value = config.get(field);
    return value != null && value.asBoolean(false);
  }

  private static Long number(JsonNode config, String field) {
    JsonNode value = config.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isIntegralNumber()) {
      return value.asLong();
    }
    String raw = value.asText().trim();
    if (raw.isEmpty()) {
      return null;
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException e) {
      log.warn("Ignoring non-numeric {} '{}'", field, raw);
      return null;
    }
  }
}
