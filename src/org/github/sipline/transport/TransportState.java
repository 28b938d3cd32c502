package org.github.sipline.transport;

public enum TransportState {
	DISCONNECTED, CONNECTING, CONNECTED, RECONNECTING, CLOSED
}
