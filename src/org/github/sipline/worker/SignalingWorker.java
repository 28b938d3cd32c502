package org.github.sipline.worker;

/**
 * Sequential executor every state transition runs on. Tasks run one at a time,
 * in submission order; timers fire on the same sequence.
 */
public interface SignalingWorker {

	void execute(Runnable task);

	Cancellable schedule(Runnable task, long delayMillis);

	long currentTimeMillis();

	void shutdown();

	interface Cancellable {

		void cancel();

	}

}
