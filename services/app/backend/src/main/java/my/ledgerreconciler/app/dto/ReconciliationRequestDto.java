package my.ledgerreconciler.app.dto;

import jakarta.validation.constraints.NotBlank;
import my.ledgerreconciler.app.domain.RunMode;

/**
 * @param mode defaults to {@link RunMode#TEST} when omitted
 */
public record ReconciliationRequestDto(@NotBlank String period, @NotBlank String policy, RunMode mode) {
}
