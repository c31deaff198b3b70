package io.github.fiserro.mep.config;

/** Thrown when engine defaults cannot be read. */
public class EngineConfigurationException extends RuntimeException {

  public EngineConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
