package com.gruelbox.migrator.acceptance;

import com.gruelbox.migrator.Dialect;

@SuppressWarnings("WeakerAccess")
class TestH2 extends AbstractAcceptanceTest {

  @Override
  protected ConnectionDetails connectionDetails() {
    return ConnectionDetails.builder()
        .dialect(Dialect.H2)
        .driverClassName("org.h2.Driver")
        .url("jdbc:h2:mem:acceptance;DB_CLOSE_DELAY=-1;DEFAULT_LOCK_TIMEOUT=60000")
        .user("test")
        .password("test")
        .build();
  }
}
