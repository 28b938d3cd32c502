package org.github.sipline.state;

public enum CallState {

	IDLE, CALLING, RINGING, CONNECTED, ON_HOLD, TERMINATING, ENDED, FAILED;

	public boolean isTerminal() {
		return this == ENDED || this == FAILED;
	}

}
