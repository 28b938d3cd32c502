package org.github.sipline.transaction;

import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.messages.SipMessages;
import org.github.sipline.worker.SignalingWorker.Cancellable;

public class ServerTransaction {

	private final String key;
	private final Request request;
	private Response lastResponse;
	Cancellable expiryTimer;

	ServerTransaction(String key, Request request) {
		this.key = key;
		this.request = request;
	}

	public String getKey() {
		return key;
	}

	public Request getRequest() {
		return request;
	}

	public Response getLastResponse() {
		return lastResponse;
	}

	void setLastResponse(Response lastResponse) {
		this.lastResponse = lastResponse;
	}

	public boolean isAnswered() {
		return lastResponse != null && SipMessages.isFinal(lastResponse);
	}

	@Override
	public String toString() {
		return key;
	}

}
