package my.ledgerreconciler.app.domain;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

public record RunContext(String runId, String period, String policyName, Instant startedAt) {
	public static RunContext start(String period, String policyName, Clock clock) {
		return new RunContext(UUID.randomUUID().toString(), period, policyName, clock.instant());
	}
}
