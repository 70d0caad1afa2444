package com.example.pnl.domain;

/** Where the warehouse places a customer in the region/subsidiary hierarchy. */
public record CustomerPlacement(Long customerId, String label, Long regionId, Long subsidiaryId) {}
