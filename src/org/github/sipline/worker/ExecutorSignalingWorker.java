package org.github.sipline.worker;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

public class ExecutorSignalingWorker implements SignalingWorker {

	private final Logger logger = LoggerFactory.getLogger(ExecutorSignalingWorker.class);
	private final ScheduledThreadPoolExecutor executor;

	public ExecutorSignalingWorker() {
		executor = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
			.setNameFormat("sipline-worker-%d").setDaemon(true).build());
		// Retransmission and timeout timers are mostly cancelled; drop them from the queue.
		executor.setRemoveOnCancelPolicy(true);
	}

	/**
	 * Number of tasks waiting to run, scheduled timers included.
	 */
	public int getPendingTaskCount() {
		return executor.getQueue().size();
	}

	@Override
	public void execute(Runnable task) {
		try {
			executor.execute(guarded(task));
		} catch (RejectedExecutionException rejected) {
			logger.warn("Worker is shut down, dropping task {}.", task);
		}
	}

	@Override
	public Cancellable schedule(Runnable task, long delayMillis) {
		try {
			final ScheduledFuture<?> future = executor.schedule(guarded(task),
					Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
			return new Cancellable() {

				@Override
				public void cancel() {
					future.cancel(false);
				}

			};
		} catch (RejectedExecutionException rejected) {
			logger.warn("Worker is shut down, not scheduling task {}.", task);
			return new Cancellable() {

				@Override
				public void cancel() {}

			};
		}
	}

	@Override
	public long currentTimeMillis() {
		return System.currentTimeMillis();
	}

	@Override
	public void shutdown() {
		executor.shutdownNow();
	}

	private Runnable guarded(final Runnable task) {
		return new Runnable() {

			@Override
			public void run() {
				try {
					task.run();
				} catch (RuntimeException unexpected) {
					logger.error("Unexpected failure in signaling task.", unexpected);
				}
			}

		};
	}

}
