package com.svarx.store;

import java.time.Instant;

public record Sample(long id, Instant createdAt, String text) {
}
