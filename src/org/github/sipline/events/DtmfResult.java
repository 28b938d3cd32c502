package org.github.sipline.events;

public class DtmfResult {

	private final String callId;
	private final char digit;
	private final boolean success;

	public DtmfResult(String callId, char digit, boolean success) {
		this.callId = callId;
		this.digit = digit;
		this.success = success;
	}

	public String getCallId() {
		return callId;
	}

	public char getDigit() {
		return digit;
	}

	public boolean isSuccess() {
		return success;
	}

}
