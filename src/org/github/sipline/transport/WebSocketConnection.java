package org.github.sipline.transport;

public interface WebSocketConnection {

	/**
	 * Queues one text frame.
	 * @return false if the connection no longer accepts frames.
	 */
	boolean send(String text);

	void close(int code, String reason);

	/**
	 * Drops the connection at once, without a closing handshake.
	 */
	void cancel();

}
