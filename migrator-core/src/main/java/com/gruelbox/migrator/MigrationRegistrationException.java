package com.gruelbox.migrator;

import java.util.List;
import lombok.Getter;

/**
 * Thrown by {@link MigrationRegistry.Builder#build()} when the registrations are invalid. This is a
 * programming error in the migrations, not a runtime condition; the host should fail to start.
 */
@Getter
public class MigrationRegistrationException extends RuntimeException {

  private final List<RegistrationProblem> problems;

  MigrationRegistrationException(List<RegistrationProblem> problems) {
    super("Invalid migration registrations: " + problems);
    this.problems = List.copyOf(problems);
  }
}
