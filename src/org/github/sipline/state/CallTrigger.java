package org.github.sipline.state;

public enum CallTrigger {
	MAKE_CALL, INVITE_RECEIVED, PROVISIONAL, ANSWERED, CHALLENGED, REJECTED, CANCEL, CANCEL_RECEIVED,
	ACCEPT, DECLINE, HOLD_CONFIRMED, RESUME_CONFIRMED, SEND_DTMF, HANGUP, BYE_RECEIVED, TERMINATED, FAIL
}
