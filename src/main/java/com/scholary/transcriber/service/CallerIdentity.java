package com.scholary.transcriber.service;

import java.util.Objects;

/** Who submitted a job. Authentication happens upstream; this is only the resolved id. */
public record CallerIdentity(String userId) {

  public CallerIdentity {
    Objects.requireNonNull(userId, "userId");
    if (userId.isBlank()) {
      throw new IllegalArgumentException("User id cannot be blank");
    }
  }
}
