package com.example.pnl.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Maps {@link Scenario} to the label stored in the warehouse tables. */
@Converter(autoApply = true)
public class ScenarioConverter implements AttributeConverter<Scenario, String> {

  @Override
  public String convertToDatabaseColumn(Scenario scenario) {
    return scenario != null ? scenario.getLabel() : null;
  }

  @Override
  public Scenario convertToEntityAttribute(String label) {
    return Scenario.fromLabel(label);
  }
}
