package org.github.sipline.transport;

/**
 * Socket callbacks. They may arrive on any thread.
 */
public interface WebSocketHandler {

	void onOpen(WebSocketConnection connection);

	void onMessage(WebSocketConnection connection, String text);

	void onClosed(WebSocketConnection connection, int code, String reason);

	void onFailure(WebSocketConnection connection, Throwable failure);

}
