package com.example.pnl.domain;

/**
 * A customer (facility) from the customer configuration document.
 *
 * @param customerId warehouse customer internal id
 * @param label display label
 * @param configId id of the node in the customer configuration
 * @param parentDistrictId config id of the parent district node
 * @param censusCode customer code used for census lookups, may be null
 * @param startDate estimated start date as configured, may be null
 */
public record Facility(
    Long customerId,
    String label,
    String configId,
    String parentDistrictId,
    String censusCode,
    String startDate) {}
