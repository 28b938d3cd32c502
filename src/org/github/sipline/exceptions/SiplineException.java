package org.github.sipline.exceptions;

public class SiplineException extends RuntimeException {

	private static final long serialVersionUID = -5852123403773924702L;

	public SiplineException(String message) {
		super(message);
	}

	public SiplineException(String message, Throwable cause) {
		super(message, cause);
	}

}
