package my.ledgerreconciler.app.service;

import java.util.ArrayList;
import java.util.List;

public class BatchPlanner {
	public <T> List<List<T>> buildBatches(List<T> items, int maxBatchSize) {
		if (items == null || items.isEmpty()) {
			return List.of();
		}
		int batchLimit = Math.max(1, maxBatchSize);
		List<List<T>> batches = new ArrayList<>();
		List<T> current = new ArrayList<>();
		for (T item : items) {
			current.add(item);
			if (current.size() >= batchLimit) {
				batches.add(List.copyOf(current));
				current.clear();
			}
		}
		if (!current.isEmpty()) {
			batches.add(List.copyOf(current));
		}
		return batches;
	}
}
