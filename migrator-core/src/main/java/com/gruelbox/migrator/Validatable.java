package com.gruelbox.migrator;

/** A component whose configuration can be checked by a {@link Validator}. */
public interface Validatable {

  void validate(Validator validator);
}
