package my.ledgerreconciler.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.ledgerreconciler.app.dto.MatchPolicyDto;
import my.ledgerreconciler.app.dto.ReconciliationRequestDto;
import my.ledgerreconciler.app.dto.RunSummaryDto;
import my.ledgerreconciler.app.service.ReconciliationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reconciliations")
@Tag(name = "Reconciliation")
public class ReconciliationController {
	private final ReconciliationService reconciliationService;

	public ReconciliationController(ReconciliationService reconciliationService) {
		this.reconciliationService = reconciliationService;
	}

	@PostMapping
	@Operation(summary = "Run a reconciliation for one period")
	public RunSummaryDto start(@Valid @RequestBody ReconciliationRequestDto request) {
		return RunSummaryDto.from(reconciliationService.startReconciliation(
				request.period(), request.policy(), request.mode()));
	}

	@GetMapping("/policies")
	@Operation(summary = "List configured match policies")
	public List<MatchPolicyDto> policies() {
		return reconciliationService.policies().stream().map(MatchPolicyDto::from).toList();
	}
}
