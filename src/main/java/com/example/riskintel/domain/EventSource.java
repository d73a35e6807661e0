package com.example.riskintel.domain;

/** The connector an event came from and that connector's own identifier for it. */
public record EventSource(String system, String originalId) {
}
