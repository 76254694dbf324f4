package com.gruelbox.migrator;

import java.time.Instant;
import lombok.Value;

/** A row in the versions table: a migration whose up action is committed and not reverted. */
@Value
public class AppliedVersion {
  long id;
  String version;
  String name;
  Instant createdAt;
}
