package org.github.sipline.transport;

public interface TransportListener {

	void onTransportUp(boolean reconnected);

	/**
	 * Reported once per loss of connectivity, however many reconnection attempts follow.
	 */
	void onTransportDown(String reason);

	void onFrame(String text);

}
