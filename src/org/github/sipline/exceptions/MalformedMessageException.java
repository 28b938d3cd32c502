package org.github.sipline.exceptions;

/**
 * Raised by the codec when raw transport text cannot be turned into a SIP message.
 */
public class MalformedMessageException extends Exception {

	private static final long serialVersionUID = 3174420961838016515L;

	public MalformedMessageException(String message) {
		super(message);
	}

	public MalformedMessageException(String message, Throwable cause) {
		super(message, cause);
	}

}
