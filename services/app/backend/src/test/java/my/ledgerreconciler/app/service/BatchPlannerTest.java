package my.ledgerreconciler.app.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchPlannerTest {
	@Test
	void buildBatches_respectsBatchSize() {
		BatchPlanner planner = new BatchPlanner();
		List<String> items = List.of("a", "b", "c", "d", "e");

		List<List<String>> batches = planner.buildBatches(items, 2);

		assertThat(batches).containsExactly(List.of("a", "b"), List.of("c", "d"), List.of("e"));
	}

	@Test
	void buildBatches_handlesEmptyInputAndInvalidSize() {
		BatchPlanner planner = new BatchPlanner();

		assertThat(planner.buildBatches(List.of(), 10)).isEmpty();
		assertThat(planner.buildBatches(null, 10)).isEmpty();
		assertThat(planner.buildBatches(List.of("a", "b"), 0)).containsExactly(List.of("a"), List.of("b"));
	}
}
