package com.example.pnl.service;

import java.time.LocalDate;

import com.example.pnl.domain.CensusFigures;
import com.example.pnl.domain.Facility;

/** Display-only facility metadata. Never used in any aggregation. */
public interface FacilitySideDataProvider {

  CensusFigures sideDataFor(Facility facility, LocalDate period);
}
