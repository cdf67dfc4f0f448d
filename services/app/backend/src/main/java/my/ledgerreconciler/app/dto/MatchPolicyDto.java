package my.ledgerreconciler.app.dto;

import my.ledgerreconciler.app.domain.MatchPolicy;

import java.util.List;

public record MatchPolicyDto(String name, double threshold, List<String> collections) {
	public static MatchPolicyDto from(MatchPolicy policy) {
		return new MatchPolicyDto(policy.name(), policy.threshold(), policy.collections());
	}
}
