package io.intellixity.dynattr.service;

import io.intellixity.dynattr.config.DynattrSettings;
import io.intellixity.dynattr.memory.InMemoryStorageEngine;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

final class Fixtures {
  static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);

  private Fixtures() {}

  static DynamicAttributes attributes(InMemoryStorageEngine engine) {
    return DynamicAttributes.builder()
        .engine(engine)
        .settings(DynattrSettings.defaults())
        .clock(CLOCK)
        .build();
  }

  static InMemoryStorageEngine engine() {
    return new InMemoryStorageEngine().carryCacheFor("customer", "product");
  }
}
