package com.gruelbox.migrator;

import java.util.List;
import lombok.Value;

/**
 * The migrations selected for one run, in the order they are to be executed. Ascending for {@link
 * Direction#UP}, descending for {@link Direction#DOWN}.
 */
@Value
public class MigrationPlan {
  Direction direction;
  List<String> versions;
  String current;
  String target;

  public boolean isEmpty() {
    return versions.isEmpty();
  }
}
