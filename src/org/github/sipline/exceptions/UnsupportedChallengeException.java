package org.github.sipline.exceptions;

public class UnsupportedChallengeException extends Exception {

	private static final long serialVersionUID = -1228745120986215417L;

	public UnsupportedChallengeException(String message) {
		super(message);
	}

	public UnsupportedChallengeException(String message, Throwable cause) {
		super(message, cause);
	}

}
