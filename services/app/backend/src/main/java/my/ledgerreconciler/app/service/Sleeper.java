package my.ledgerreconciler.app.service;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
	Sleeper SYSTEM = duration -> {
		if (duration != null && !duration.isNegative() && !duration.isZero()) {
			Thread.sleep(duration.toMillis());
		}
	};

	void sleep(Duration duration) throws InterruptedException;
}
