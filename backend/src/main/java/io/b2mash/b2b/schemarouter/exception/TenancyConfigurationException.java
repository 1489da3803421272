package io.b2mash.b2b.schemarouter.exception;

/** Misconfigured classification or tenancy options. Fatal at startup. */
public class TenancyConfigurationException extends RuntimeException {

  public TenancyConfigurationException(String message) {
    super(message);
  }
}
