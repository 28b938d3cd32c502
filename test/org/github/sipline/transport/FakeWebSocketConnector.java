package org.github.sipline.transport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Hands out in-memory connections the test opens, feeds and drops by hand.
 */
public class FakeWebSocketConnector implements WebSocketConnector {

	private final List<FakeConnection> connections = new ArrayList<>();

	@Override
	public WebSocketConnection connect(String url, WebSocketHandler handler) {
		FakeConnection connection = new FakeConnection(url, handler);
		connections.add(connection);
		return connection;
	}

	public List<FakeConnection> getConnections() {
		return connections;
	}

	public FakeConnection last() {
		return connections.isEmpty() ? null : connections.get(connections.size() - 1);
	}

	public static class FakeConnection implements WebSocketConnection {

		private final String url;
		private final WebSocketHandler handler;
		private final List<String> sent = new ArrayList<>();
		private boolean open;
		private boolean closed;
		private boolean cancelled;
		private int closeCode;

		FakeConnection(String url, WebSocketHandler handler) {
			this.url = url;
			this.handler = handler;
		}

		public void open() {
			open = true;
			handler.onOpen(this);
		}

		public void receive(String text) {
			handler.onMessage(this, text);
		}

		public void fail(String reason) {
			open = false;
			handler.onFailure(this, new IOException(reason));
		}

		public void closeFromServer(int code, String reason) {
			open = false;
			handler.onClosed(this, code, reason);
		}

		@Override
		public boolean send(String text) {
			if (!open || closed || cancelled) {
				return false;
			}
			sent.add(text);
			return true;
		}

		@Override
		public void close(int code, String reason) {
			closed = true;
			closeCode = code;
			open = false;
		}

		@Override
		public void cancel() {
			cancelled = true;
			open = false;
		}

		public String getUrl() {
			return url;
		}

		public List<String> getSent() {
			return sent;
		}

		public String lastSent() {
			return sent.isEmpty() ? null : sent.get(sent.size() - 1);
		}

		public boolean isClosed() {
			return closed;
		}

		public boolean isCancelled() {
			return cancelled;
		}

		public int getCloseCode() {
			return closeCode;
		}

	}

}
