package org.github.sipline.transaction;

import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.messages.SipMessages;
import org.github.sipline.worker.SignalingWorker.Cancellable;

public class ClientTransaction {

	public enum Status {
		CALLING, PROCEEDING, COMPLETED, TERMINATED
	}

	private final String key;
	private final Request request;
	private final ResponseListener listener;
	private final boolean authenticatedRetry;
	private Status status = Status.CALLING;
	private boolean cancelled;
	private Response finalResponse;
	private Request ack;
	Cancellable timeoutTimer;
	Cancellable retransmissionTimer;
	long retransmissionInterval;

	ClientTransaction(String key, Request request, ResponseListener listener,
			boolean authenticatedRetry) {
		this.key = key;
		this.request = request;
		this.listener = listener;
		this.authenticatedRetry = authenticatedRetry;
	}

	public String getKey() {
		return key;
	}

	public Request getRequest() {
		return request;
	}

	public String getMethod() {
		return request.getMethod();
	}

	public String getBranch() {
		return SipMessages.branchOf(request);
	}

	ResponseListener getListener() {
		return listener;
	}

	public boolean isAuthenticatedRetry() {
		return authenticatedRetry;
	}

	public Status getStatus() {
		return status;
	}

	void setStatus(Status status) {
		this.status = status;
	}

	public boolean isTerminated() {
		return status == Status.COMPLETED || status == Status.TERMINATED;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	void setCancelled(boolean cancelled) {
		this.cancelled = cancelled;
	}

	public Response getFinalResponse() {
		return finalResponse;
	}

	void setFinalResponse(Response finalResponse) {
		this.finalResponse = finalResponse;
	}

	Request getAck() {
		return ack;
	}

	void setAck(Request ack) {
		this.ack = ack;
	}

	void cancelTimers() {
		if (timeoutTimer != null) {
			timeoutTimer.cancel();
			timeoutTimer = null;
		}
		if (retransmissionTimer != null) {
			retransmissionTimer.cancel();
			retransmissionTimer = null;
		}
	}

	@Override
	public String toString() {
		return key + " (" + status + ")";
	}

}
