package org.github.sipline.transport;

/**
 * Opens WebSocket connections speaking the {@code sip} subprotocol.
 */
public interface WebSocketConnector {

	WebSocketConnection connect(String url, WebSocketHandler handler);

}
