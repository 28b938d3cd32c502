package org.github.sipline.exceptions;

public class AuthenticationFailedException extends SiplineException {

	private static final long serialVersionUID = 6694950208931250390L;
	private final int statusCode;

	public AuthenticationFailedException(String message, int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}

	public int getStatusCode() {
		return statusCode;
	}

}
