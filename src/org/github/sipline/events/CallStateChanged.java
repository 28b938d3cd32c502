package org.github.sipline.events;

import org.github.sipline.state.CallState;

public class CallStateChanged {

	private final String callId;
	private final CallState oldState;
	private final CallState newState;
	private final String reason;
	private final int statusCode;
	private final String remoteSdp;

	public CallStateChanged(String callId, CallState oldState, CallState newState,
			String reason, int statusCode, String remoteSdp) {
		this.callId = callId;
		this.oldState = oldState;
		this.newState = newState;
		this.reason = reason;
		this.statusCode = statusCode;
		this.remoteSdp = remoteSdp;
	}

	public String getCallId() {
		return callId;
	}

	public CallState getOldState() {
		return oldState;
	}

	public CallState getNewState() {
		return newState;
	}

	public boolean isStateChange() {
		return oldState != newState;
	}

	public String getReason() {
		return reason;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getRemoteSdp() {
		return remoteSdp;
	}

	@Override
	public String toString() {
		return "CallStateChanged[" + callId + ": " + oldState + " -> " + newState
				+ ", " + reason + "]";
	}

}
