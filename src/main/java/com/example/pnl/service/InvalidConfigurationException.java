package com.example.pnl.service;

/**
 * Raised when a configuration document cannot be used, e.g. the account parent graph contains a
 * cycle or the document is not valid JSON.
 */
public class InvalidConfigurationException extends IllegalStateException {

  private final String documentName;

  public InvalidConfigurationException(String documentName, String message) {
    super(documentName + ": " + message);
    this.documentName = documentName;
  }

  public InvalidConfigurationException(String documentName, String message, Throwable cause) {
    super(documentName + ": " + message, cause);
    this.documentName = documentName;
  }

  public String getDocumentName() {
    return documentName;
  }
}
