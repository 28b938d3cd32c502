package org.github.sipline.transaction;

import javax.sip.message.Response;

import org.github.sipline.exceptions.SiplineException;

public interface ResponseListener {

	/**
	 * Called for every provisional response and once for the final one.
	 */
	void onResponse(ClientTransaction transaction, Response response);

	/**
	 * Called once when no final response will arrive: a
	 * {@link org.github.sipline.exceptions.TransactionTimeoutException} or a
	 * {@link org.github.sipline.exceptions.TransportDownException}.
	 */
	void onFailure(ClientTransaction transaction, SiplineException failure);

}
