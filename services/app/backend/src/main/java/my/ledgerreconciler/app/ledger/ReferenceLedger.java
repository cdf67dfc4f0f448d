package my.ledgerreconciler.app.ledger;

import my.ledgerreconciler.app.service.ReconciliationValidationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The profit-and-loss worksheet: named client/expense blocks plus one column per period.
 */
public class ReferenceLedger {
	static final int HEADER_ROW = 1;

	private final Worksheet worksheet;
	private final Map<String, CollectionLayout> layouts;

	ReferenceLedger(Worksheet worksheet, List<CollectionLayout> layouts) {
		this.worksheet = worksheet;
		this.layouts = new LinkedHashMap<>();
		for (CollectionLayout layout : layouts) {
			if (this.layouts.putIfAbsent(layout.name(), layout) != null) {
				throw new ReconciliationValidationException("Duplicate reference collection " + layout.name());
			}
		}
	}

	public static ReferenceLedger load(Path path, List<CollectionLayout> layouts) {
		if (path == null || !Files.isRegularFile(path)) {
			throw new ReconciliationValidationException("Reference ledger not found: " + path);
		}
		return new ReferenceLedger(Worksheet.load(path), layouts == null ? List.of() : layouts);
	}

	public Worksheet worksheet() {
		return worksheet;
	}

	public List<NamedCollection> collections(List<String> names) {
		List<NamedCollection> collections = new ArrayList<>();
		for (String name : names) {
			CollectionLayout layout = layouts.get(name);
			if (layout == null) {
				throw new ReconciliationValidationException("Unknown reference collection " + name
						+ " (configured: " + layouts.keySet() + ")");
			}
			collections.add(new WorksheetCollection(worksheet, layout));
		}
		return collections;
	}

	public WorksheetAggregateStore aggregateStore(String period) {
		String column = worksheet.findColumn(HEADER_ROW, period)
				.orElseThrow(() -> new ReconciliationValidationException("Period column '" + period
						+ "' not found in " + worksheet.name()));
		return new WorksheetAggregateStore(worksheet, column);
	}

	public void save() {
		worksheet.save();
	}
}
