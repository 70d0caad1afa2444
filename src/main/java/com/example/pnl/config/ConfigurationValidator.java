package com.example.pnl.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.example.pnl.domain.HierarchyUnit;
import com.example.pnl.service.AccountHierarchy;
import com.example.pnl.service.CustomerDirectory;
import com.example.pnl.service.DimensionConfigService;

/**
 * Loads every configuration document once on startup so that a broken document (for example an
 * account parent cycle) stops the application instead of failing the first report request.
 */
@Component
public class ConfigurationValidator implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(ConfigurationValidator.class);

  private final DimensionConfigService configService;
  private final boolean enabled;

  public ConfigurationValidator(
      DimensionConfigService configService,
      @Value("${pnl.config.validate-on-startup:true}") boolean enabled) {
    this.configService = configService;
    this.enabled = enabled;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!enabled) {
      log.info("Configuration validation on startup is disabled");
      return;
    }

    AccountHierarchy accounts = configService.loadAccountHierarchy();
    CustomerDirectory customers = configService.loadCustomerDirectory();
    List<HierarchyUnit> regions = configService.loadRegions();
    List<HierarchyUnit> subsidiaries = configService.loadSubsidiaries();

    log.info("Configuration documents loaded");
    log.info("  Accounts: {}", accounts.size());
    log.info(
        "  Districts: {}, facilities: {}, tags: {}",
        customers.districts().size(),
        customers.facilities().size(),
        customers.tags().size());
    log.info("  Regions: {}, departments: {}", regions.size(), subsidiaries.size());

    long unmappedFacilities =
        customers.facilities().stream()
            .filter(facility -> customers.parentDistrictOf(facility) == null)
            .count();
    if (unmappedFacilities > 0) {
      log.warn("{} facilities do not hang under a district and are left out of reports", unmappedFacilities);
    }
  }
}
