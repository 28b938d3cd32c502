package org.github.sipline.exceptions;

public class TransportDownException extends SiplineException {

	private static final long serialVersionUID = 1520957406131466268L;

	public TransportDownException(String message) {
		super(message);
	}

	public TransportDownException(String message, Throwable cause) {
		super(message, cause);
	}

}
