package org.github.sipline.transport;

import org.github.sipline.SignalingConfig;
import org.github.sipline.worker.SignalingWorker;
import org.github.sipline.worker.SignalingWorker.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * The single WebSocket link to the SIP server. Liveness is left to the
 * connector's WebSocket pings; optional CRLF keepalives only hold the server to
 * an answer once it has shown it answers them. Reconnects with exponential
 * backoff until {@link #close()} is called.
 */
public class TransportSession {

	public static final int NORMAL_CLOSURE = 1000;
	public static final String KEEPALIVE = "\r\n\r\n";

	private final Logger logger = LoggerFactory.getLogger(TransportSession.class);

	private final SignalingWorker worker;
	private final WebSocketConnector connector;
	private final TransportListener listener;
	private final String url;
	private final long keepaliveIntervalMs;
	private final long keepaliveGraceMs;
	private final boolean crlfKeepalive;
	private final long reconnectInitialMs;
	private final long reconnectMaxMs;
	private final int reconnectMaxAttempts;

	private volatile TransportState state = TransportState.DISCONNECTED;
	private WebSocketConnection connection;
	private boolean everConnected;
	private boolean downReported;
	private int reconnectAttempts;
	private long lastTrafficAt;
	private boolean serverAnswersKeepalive;
	private Cancellable keepaliveTimer;
	private Cancellable pongTimer;
	private Cancellable reconnectTimer;

	public TransportSession(SignalingWorker worker, WebSocketConnector connector,
			SignalingConfig config, TransportListener listener) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(config.getTransportUrl()),
				"transport URL is required");
		this.worker = worker;
		this.connector = connector;
		this.listener = listener;
		this.url = config.getTransportUrl();
		this.keepaliveIntervalMs = config.getKeepaliveIntervalMs();
		this.keepaliveGraceMs = config.getKeepaliveGraceMs();
		this.crlfKeepalive = config.isCrlfKeepalive();
		this.reconnectInitialMs = config.getReconnectInitialMs();
		this.reconnectMaxMs = config.getReconnectMaxMs();
		this.reconnectMaxAttempts = config.getReconnectMaxAttempts();
	}

	/**
	 * Opens the connection. Must run on the worker.
	 */
	public void connect() {
		if (connection != null || reconnectTimer != null) {
			return;
		}
		state = reconnectAttempts > 0 ? TransportState.RECONNECTING : TransportState.CONNECTING;
		logger.debug("Connecting to {} (attempt {}).", url, reconnectAttempts + 1);
		connection = connector.connect(url, new Handler());
	}

	public boolean send(String text) {
		if (state != TransportState.CONNECTED || connection == null) {
			logger.warn("Cannot send frame while {}.", state);
			return false;
		}
		return connection.send(text);
	}

	/**
	 * Deliberate shutdown: closes the socket and never reconnects.
	 */
	public void close() {
		if (state == TransportState.CLOSED) {
			return;
		}
		state = TransportState.CLOSED;
		cancelTimers();
		if (reconnectTimer != null) {
			reconnectTimer.cancel();
			reconnectTimer = null;
		}
		if (connection != null) {
			connection.close(NORMAL_CLOSURE, "Shutting down");
			connection = null;
		}
		logger.info("Transport to {} closed.", url);
	}

	private void opened(WebSocketConnection opened) {
		if (opened != connection || state == TransportState.CLOSED) {
			opened.close(NORMAL_CLOSURE, "Stale connection");
			return;
		}
		boolean reconnected = everConnected;
		state = TransportState.CONNECTED;
		everConnected = true;
		downReported = false;
		reconnectAttempts = 0;
		serverAnswersKeepalive = false;
		logger.info("Transport to {} {}.", url, reconnected ? "reconnected" : "connected");
		trafficSeen();
		scheduleKeepalive();
		listener.onTransportUp(reconnected);
	}

	private void received(WebSocketConnection from, String text) {
		if (from != connection) {
			return;
		}
		trafficSeen();
		if (text.trim().isEmpty()) {
			if (!serverAnswersKeepalive) {
				logger.debug("{} answers CRLF keepalives, expecting a pong from now on.", url);
			}
			serverAnswersKeepalive = true;
			logger.trace("Keepalive pong received.");
			return;
		}
		listener.onFrame(text);
	}

	private void lost(WebSocketConnection from, String reason) {
		if (from != connection || state == TransportState.CLOSED) {
			return;
		}
		cancelTimers();
		connection = null;
		state = TransportState.DISCONNECTED;
		logger.warn("Transport to {} lost: {}", url, reason);
		if (!downReported) {
			downReported = true;
			listener.onTransportDown(reason);
		}
		scheduleReconnect();
	}

	private void scheduleReconnect() {
		if (state == TransportState.CLOSED) {
			return;
		}
		if (reconnectMaxAttempts > 0 && reconnectAttempts >= reconnectMaxAttempts) {
			logger.error("Giving up on {} after {} reconnection attempts.", url, reconnectAttempts);
			return;
		}
		reconnectAttempts++;
		long delay = getBackoffDelay(reconnectAttempts);
		state = TransportState.RECONNECTING;
		logger.info("Reconnecting to {} in {}ms (attempt {}).", url, delay, reconnectAttempts);
		reconnectTimer = worker.schedule(new Runnable() {

			@Override
			public void run() {
				reconnectTimer = null;
				if (state == TransportState.RECONNECTING) {
					connect();
				}
			}

		}, delay);
	}

	/**
	 * {@code initial * 2^(attempt-1)}, capped at the configured maximum.
	 */
	public long getBackoffDelay(int attempt) {
		long delay = reconnectInitialMs;
		for (int i = 1; i < attempt && delay < reconnectMaxMs; i++) {
			delay *= 2;
		}
		return Math.min(delay, reconnectMaxMs);
	}

	private void scheduleKeepalive() {
		if (!crlfKeepalive || keepaliveIntervalMs <= 0) {
			return;
		}
		keepaliveTimer = worker.schedule(new Runnable() {

			@Override
			public void run() {
				keepaliveTimer = null;
				if (state != TransportState.CONNECTED) {
					return;
				}
				logger.trace("Sending keepalive.");
				connection.send(KEEPALIVE);
				if (serverAnswersKeepalive) {
					awaitPong();
				}
				scheduleKeepalive();
			}

		}, keepaliveIntervalMs);
	}

	private void awaitPong() {
		if (pongTimer != null) {
			return;
		}
		pongTimer = worker.schedule(new Runnable() {

			@Override
			public void run() {
				pongTimer = null;
				if (state != TransportState.CONNECTED) {
					return;
				}
				WebSocketConnection dead = connection;
				logger.warn("No keepalive pong from {} within {}ms.", url, keepaliveGraceMs);
				dead.cancel();
				lost(dead, "Keepalive timeout");
			}

		}, keepaliveGraceMs);
	}

	private void trafficSeen() {
		lastTrafficAt = worker.currentTimeMillis();
		if (pongTimer != null) {
			pongTimer.cancel();
			pongTimer = null;
		}
	}

	private void cancelTimers() {
		if (keepaliveTimer != null) {
			keepaliveTimer.cancel();
			keepaliveTimer = null;
		}
		if (pongTimer != null) {
			pongTimer.cancel();
			pongTimer = null;
		}
	}

	public boolean isServerAnsweringKeepalive() {
		return serverAnswersKeepalive;
	}

	public TransportState getState() {
		return state;
	}

	public boolean isConnected() {
		return state == TransportState.CONNECTED;
	}

	public int getReconnectAttempts() {
		return reconnectAttempts;
	}

	public long getLastTrafficAt() {
		return lastTrafficAt;
	}

	/**
	 * Moves socket callbacks onto the worker.
	 */
	private class Handler implements WebSocketHandler {

		@Override
		public void onOpen(final WebSocketConnection opened) {
			worker.execute(new Runnable() {

				@Override
				public void run() {
					opened(opened);
				}

			});
		}

		@Override
		public void onMessage(final WebSocketConnection from, final String text) {
			worker.execute(new Runnable() {

				@Override
				public void run() {
					received(from, text);
				}

			});
		}

		@Override
		public void onClosed(final WebSocketConnection from, final int code, final String reason) {
			worker.execute(new Runnable() {

				@Override
				public void run() {
					lost(from, "Closed by server (" + code + (Strings.isNullOrEmpty(reason)
							? "" : ", " + reason) + ")");
				}

			});
		}

		@Override
		public void onFailure(final WebSocketConnection from, final Throwable failure) {
			worker.execute(new Runnable() {

				@Override
				public void run() {
					lost(from, failure.getMessage() == null ? failure.getClass().getSimpleName()
							: failure.getMessage());
				}

			});
		}

	}

}
