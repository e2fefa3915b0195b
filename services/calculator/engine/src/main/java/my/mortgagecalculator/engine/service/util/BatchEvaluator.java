package my.mortgagecalculator.engine.service.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Applies a function to every item of a batch, on a fixed thread pool when more than one
 * worker is allowed. Results are returned in input order.
 */
public final class BatchEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(BatchEvaluator.class);

	private BatchEvaluator() {
	}

	public static <T, R> List<R> evaluate(List<T> items, Function<? super T, ? extends R> function, int parallelism) {
		if (items.isEmpty()) {
			return List.of();
		}
		int workers = Math.min(Math.max(1, parallelism), items.size());
		if (workers == 1) {
			List<R> results = new ArrayList<>(items.size());
			for (T item : items) {
				results.add(function.apply(item));
			}
			return results;
		}

		ExecutorService executor = Executors.newFixedThreadPool(workers);
		List<Future<R>> futures = new ArrayList<>(items.size());
		try {
			for (T item : items) {
				futures.add(executor.submit(() -> function.apply(item)));
			}
			List<R> results = new ArrayList<>(items.size());
			for (Future<R> future : futures) {
				try {
					results.add(future.get());
				} catch (ExecutionException ex) {
					Throwable cause = ex.getCause();
					logger.warn("Batch evaluation of {} items failed: {}", items.size(), cause.getMessage());
					if (cause instanceof CancellationException cancel) {
						throw cancel;
					}
					if (cause instanceof RuntimeException runtime) {
						throw runtime;
					}
					if (cause instanceof Error error) {
						throw error;
					}
					throw new IllegalStateException(cause);
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					throw new CancellationException("Canceled");
				}
			}
			return results;
		} finally {
			executor.shutdownNow();
		}
	}
}
