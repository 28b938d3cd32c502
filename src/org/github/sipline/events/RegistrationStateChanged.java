package org.github.sipline.events;

import org.github.sipline.state.RegistrationState;

public class RegistrationStateChanged {

	private final String accountKey;
	private final RegistrationState oldState;
	private final RegistrationState newState;
	private final String reason;
	private final int statusCode;

	public RegistrationStateChanged(String accountKey, RegistrationState oldState,
			RegistrationState newState, String reason, int statusCode) {
		this.accountKey = accountKey;
		this.oldState = oldState;
		this.newState = newState;
		this.reason = reason;
		this.statusCode = statusCode;
	}

	public String getAccountKey() {
		return accountKey;
	}

	public RegistrationState getOldState() {
		return oldState;
	}

	public RegistrationState getNewState() {
		return newState;
	}

	public String getReason() {
		return reason;
	}

	/**
	 * SIP status code behind the change, or 0 when none applies.
	 */
	public int getStatusCode() {
		return statusCode;
	}

	@Override
	public String toString() {
		return "RegistrationStateChanged[" + accountKey + ": " + oldState + " -> " + newState
				+ ", " + reason + "]";
	}

}
