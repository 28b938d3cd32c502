package org.github.sipline.events;

import org.github.sipline.transport.TransportState;

public class TransportStateChanged {

	private final TransportState state;
	private final String reason;

	public TransportStateChanged(TransportState state, String reason) {
		this.state = state;
		this.reason = reason;
	}

	public TransportState getState() {
		return state;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public String toString() {
		return "TransportStateChanged[" + state + ", " + reason + "]";
	}

}
