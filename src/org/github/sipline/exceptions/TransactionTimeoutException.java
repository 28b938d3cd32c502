package org.github.sipline.exceptions;

public class TransactionTimeoutException extends SiplineException {

	private static final long serialVersionUID = -2951304386227316870L;

	public TransactionTimeoutException(String message) {
		super(message);
	}

}
