// Copyright (c) 2026 Genome Research Ltd.
//
// This file is part of Nodule.
//
// Nodule is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.nodule.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A fixed number of worker threads which run per-well tasks. A batch of tasks
 * is run to completion before {@link #run(List)} returns. After
 * {@link #cancel()}, tasks which have not yet started are skipped.
 */

public class WellWorkerPool {
	private final ExecutorService executor;
	private final Logger logger;
	private final int threads;

	private volatile boolean cancelled = false;

	public WellWorkerPool(int threads, Logger logger) {
		this.threads = threads;
		this.logger = logger;

		final AtomicInteger counter = new AtomicInteger();

		executor = Executors.newFixedThreadPool(threads, new ThreadFactory() {
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(r, "well-worker-" + counter.incrementAndGet());
				thread.setDaemon(true);
				return thread;
			}
		});
	}

	public int getThreads() {
		return threads;
	}

	public <T> WellBatchResult<T> run(List<? extends WellTask<T>> tasks) {
		final WellBatchResult<T> batch = new WellBatchResult<T>();

		List<Future<?>> futures = new ArrayList<Future<?>>();

		for (final WellTask<T> task : tasks) {
			if (cancelled) {
				batch.addSkipped(task.getWell());
				continue;
			}

			futures.add(executor.submit(new Runnable() {
				public void run() {
					if (cancelled) {
						batch.addSkipped(task.getWell());
						return;
					}

					try {
						batch.addResult(task.getWell(), task.run());
					} catch (Exception e) {
						if (cancelled) {
							batch.addSkipped(task.getWell());
						} else {
							logger.log(Level.WARNING, "Task failed for well " + task.getWell(), e);
							batch.addFailure(task.getWell(), e);
						}
					} catch (Error e) {
						batch.addFailure(task.getWell(), new ExecutionException("Error in the task for well "
								+ task.getWell() + ": " + e, e));
						throw e;
					}
				}
			}));
		}

		for (Future<?> future : futures) {
			try {
				future.get();
			} catch (InterruptedException ie) {
				Thread.currentThread().interrupt();
				cancel();
			} catch (ExecutionException ee) {
				logger.log(Level.SEVERE, "Unexpected error in a well worker", ee.getCause());
			}
		}

		return batch;
	}

	public void cancel() {
		cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	public void shutdown() {
		executor.shutdownNow();
	}
}
