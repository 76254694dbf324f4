package com.gruelbox.migrator;

import lombok.Value;

/** Something wrong with a call to {@link MigrationRegistry.Builder#register}. */
@Value
public class RegistrationProblem {
  String version;
  String message;

  @Override
  public String toString() {
    return version + ": " + message;
  }
}
