package org.github.sipline.transport;

import java.util.concurrent.TimeUnit;

import org.github.sipline.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

public class OkHttpWebSocketConnector implements WebSocketConnector {

	private final Logger logger = LoggerFactory.getLogger(OkHttpWebSocketConnector.class);
	private final OkHttpClient client;

	/**
	 * @param pingIntervalMs
	 *            WebSocket ping period; a missing pong fails the socket. 0 disables pings.
	 */
	public OkHttpWebSocketConnector(long pingIntervalMs) {
		this(new OkHttpClient.Builder()
			.connectTimeout(10, TimeUnit.SECONDS)
			.readTimeout(0, TimeUnit.MILLISECONDS)
			.pingInterval(Math.max(0, pingIntervalMs), TimeUnit.MILLISECONDS)
			.build());
	}

	public OkHttpWebSocketConnector(OkHttpClient client) {
		this.client = client;
	}

	@Override
	public WebSocketConnection connect(String url, final WebSocketHandler handler) {
		Request request = new Request.Builder()
			.url(url)
			.header("Sec-WebSocket-Protocol", Constants.WEBSOCKET_SUBPROTOCOL)
			.build();
		final OkHttpConnection connection = new OkHttpConnection();
		logger.debug("Opening WebSocket to {}.", url);
		WebSocket socket = client.newWebSocket(request, new WebSocketListener() {

			@Override
			public void onOpen(WebSocket webSocket, Response response) {
				connection.attach(webSocket);
				handler.onOpen(connection);
			}

			@Override
			public void onMessage(WebSocket webSocket, String text) {
				handler.onMessage(connection, text);
			}

			@Override
			public void onMessage(WebSocket webSocket, ByteString bytes) {
				handler.onMessage(connection, bytes.utf8());
			}

			@Override
			public void onClosing(WebSocket webSocket, int code, String reason) {
				webSocket.close(TransportSession.NORMAL_CLOSURE, null);
			}

			@Override
			public void onClosed(WebSocket webSocket, int code, String reason) {
				handler.onClosed(connection, code, reason);
			}

			@Override
			public void onFailure(WebSocket webSocket, Throwable failure, Response response) {
				handler.onFailure(connection, failure);
			}

		});
		connection.attach(socket);
		return connection;
	}

	private static class OkHttpConnection implements WebSocketConnection {

		private volatile WebSocket socket;

		void attach(WebSocket webSocket) {
			if (socket == null) {
				socket = webSocket;
			}
		}

		@Override
		public boolean send(String text) {
			WebSocket current = socket;
			return current != null && current.send(text);
		}

		@Override
		public void close(int code, String reason) {
			WebSocket current = socket;
			if (current != null) {
				current.close(code, reason);
			}
		}

		@Override
		public void cancel() {
			WebSocket current = socket;
			if (current != null) {
				current.cancel();
			}
		}

	}

}
