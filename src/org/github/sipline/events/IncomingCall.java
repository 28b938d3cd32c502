package org.github.sipline.events;

public class IncomingCall {

	private final String accountKey;
	private final String callId;
	private final String callerNumber;
	private final String remoteSdp;

	public IncomingCall(String accountKey, String callId, String callerNumber, String remoteSdp) {
		this.accountKey = accountKey;
		this.callId = callId;
		this.callerNumber = callerNumber;
		this.remoteSdp = remoteSdp;
	}

	public String getAccountKey() {
		return accountKey;
	}

	public String getCallId() {
		return callId;
	}

	public String getCallerNumber() {
		return callerNumber;
	}

	public String getRemoteSdp() {
		return remoteSdp;
	}

}
