package org.github.sipline.transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.Constants.RequestMethod;
import org.github.sipline.SignalingConfig;
import org.github.sipline.exceptions.TransactionTimeoutException;
import org.github.sipline.exceptions.TransportDownException;
import org.github.sipline.messages.SipMessageFactory;
import org.github.sipline.messages.SipMessages;
import org.github.sipline.transaction.ClientTransaction.Status;
import org.github.sipline.worker.SignalingWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches responses to the requests that caused them (topmost Via branch plus
 * CSeq method) and recognizes retransmitted inbound requests. Must only be
 * used from the {@link SignalingWorker}.
 */
public class TransactionManager {

	private final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

	private final SignalingWorker worker;
	private final MessageSender sender;
	private final SipMessageFactory messageFactory;
	private final long timeoutMs;
	private final boolean retransmissionEnabled;
	private final long t1Ms;
	private final long t2Ms;

	private final Map<String, ClientTransaction> clientTransactions = new HashMap<>();
	private final Map<String, ServerTransaction> serverTransactions = new HashMap<>();

	public TransactionManager(SignalingWorker worker, MessageSender sender,
			SipMessageFactory messageFactory, SignalingConfig config) {
		this.worker = worker;
		this.sender = sender;
		this.messageFactory = messageFactory;
		this.timeoutMs = config.getTransactionTimeoutMs();
		this.retransmissionEnabled = config.isRetransmissionEnabled();
		this.t1Ms = config.getT1Ms();
		this.t2Ms = config.getT2Ms();
	}

	public static String keyOf(String branch, String method) {
		return branch + "/" + method;
	}

	public ClientTransaction sendRequest(Request request, ResponseListener listener) {
		return sendRequest(request, listener, false);
	}

	public ClientTransaction sendRequest(Request request, ResponseListener listener,
			boolean authenticatedRetry) {
		String key = keyOf(SipMessages.branchOf(request), SipMessages.cseqMethodOf(request));
		final ClientTransaction transaction = new ClientTransaction(key, request, listener,
				authenticatedRetry);
		clientTransactions.put(key, transaction);
		if (!sender.send(request)) {
			clientTransactions.remove(key);
			transaction.setStatus(Status.TERMINATED);
			logger.error("Could not send {} request: transport is down.", request.getMethod());
			worker.execute(new Runnable() {

				@Override
				public void run() {
					transaction.getListener().onFailure(transaction, new TransportDownException(
							"Transport refused " + transaction.getMethod() + " request."));
				}

			});
			return transaction;
		}
		logger.debug("{} request sent in transaction {}.", request.getMethod(), key);
		transaction.timeoutTimer = worker.schedule(new Runnable() {

			@Override
			public void run() {
				handleTimeout(transaction);
			}

		}, timeoutMs);
		if (retransmissionEnabled) {
			transaction.retransmissionInterval = t1Ms;
			scheduleRetransmission(transaction);
		}
		return transaction;
	}

	/**
	 * Sends a request that opens no transaction (ACK for a 2xx).
	 */
	public boolean sendStateless(Message message) {
		return sender.send(message);
	}

	private void scheduleRetransmission(final ClientTransaction transaction) {
		transaction.retransmissionTimer = worker.schedule(new Runnable() {

			@Override
			public void run() {
				if (transaction.isTerminated()) {
					return;
				}
				if (transaction.getStatus() == Status.PROCEEDING
						&& transaction.getMethod().equals(RequestMethod.INVITE.name())) {
					return;
				}
				logger.debug("Retransmitting {} in {}.", transaction.getMethod(), transaction.getKey());
				sender.send(transaction.getRequest());
				transaction.retransmissionInterval = transaction.getStatus() == Status.PROCEEDING
						? t2Ms : Math.min(transaction.retransmissionInterval * 2, t2Ms);
				scheduleRetransmission(transaction);
			}

		}, transaction.retransmissionInterval);
	}

	private void handleTimeout(ClientTransaction transaction) {
		if (transaction.isTerminated()) {
			return;
		}
		transaction.cancelTimers();
		transaction.setStatus(Status.TERMINATED);
		clientTransactions.remove(transaction.getKey());
		logger.warn("{} transaction {} timed out after {}ms.", transaction.getMethod(),
				transaction.getKey(), timeoutMs);
		transaction.getListener().onFailure(transaction, new TransactionTimeoutException(
				"No final response to " + transaction.getMethod() + " within " + timeoutMs + "ms."));
	}

	/**
	 * @return false when the response matches no pending transaction.
	 */
	public boolean onResponseReceived(Response response) {
		String branch = SipMessages.branchOf(response);
		if (branch == null) {
			logger.warn("Dropping {} without a Via branch.", SipMessages.describe(response));
			return false;
		}
		String key = keyOf(branch, SipMessages.cseqMethodOf(response));
		ClientTransaction transaction = clientTransactions.get(key);
		if (transaction == null) {
			logger.debug("No transaction matches {} for {}.", SipMessages.describe(response), key);
			return false;
		}
		boolean invite = transaction.getMethod().equals(RequestMethod.INVITE.name());
		if (transaction.getStatus() == Status.COMPLETED) {
			if (invite && transaction.getAck() != null && SipMessages.isFinal(response)) {
				logger.debug("Absorbing retransmitted {} for {}.", response.getStatusCode(), key);
				sender.send(transaction.getAck());
			}
			return true;
		}
		if (!SipMessages.isFinal(response)) {
			transaction.setStatus(Status.PROCEEDING);
			// A ringing INVITE waits for the callee; the call decides when to give up.
			if (invite && transaction.timeoutTimer != null) {
				transaction.timeoutTimer.cancel();
				transaction.timeoutTimer = null;
			}
			transaction.getListener().onResponse(transaction, response);
			return true;
		}
		transaction.cancelTimers();
		transaction.setFinalResponse(response);
		if (invite && !SipMessages.isSuccess(response)) {
			Request ack = messageFactory.createNon2xxAck(transaction.getRequest(), response);
			sender.send(ack);
			transaction.setAck(ack);
			if (retransmissionEnabled) {
				keepCompleted(transaction);
			}
			else {
				terminate(transaction);
			}
		}
		else {
			terminate(transaction);
		}
		logger.debug("Transaction {} completed with {}.", key, response.getStatusCode());
		transaction.getListener().onResponse(transaction, response);
		return true;
	}

	private void keepCompleted(final ClientTransaction transaction) {
		transaction.setStatus(Status.COMPLETED);
		transaction.timeoutTimer = worker.schedule(new Runnable() {

			@Override
			public void run() {
				terminate(transaction);
			}

		}, timeoutMs);
	}

	private void terminate(ClientTransaction transaction) {
		transaction.setStatus(Status.TERMINATED);
		clientTransactions.remove(transaction.getKey());
	}

	/**
	 * Marks the transaction as cancelled. A final response that arrives anyway is
	 * still delivered to its listener.
	 */
	public void cancel(final ClientTransaction transaction) {
		transaction.setCancelled(true);
		// A ringing INVITE lost its timeout; the final response to the CANCEL must still come in time.
		if (!transaction.isTerminated() && transaction.timeoutTimer == null) {
			transaction.timeoutTimer = worker.schedule(new Runnable() {

				@Override
				public void run() {
					handleTimeout(transaction);
				}

			}, timeoutMs);
		}
	}

	public ClientTransaction getClientTransaction(String branch, String method) {
		return clientTransactions.get(keyOf(branch, method));
	}

	/**
	 * Records an inbound request. Returns null when it is a retransmission of a
	 * request already seen (the last response is sent again) or the ACK of a
	 * non-2xx final response.
	 */
	public ServerTransaction onRequestReceived(Request request) {
		String branch = SipMessages.branchOf(request);
		String method = SipMessages.cseqMethodOf(request);
		if (method.equals(RequestMethod.ACK.name())) {
			ServerTransaction invite = serverTransactions.get(keyOf(branch,
					RequestMethod.INVITE.name()));
			if (invite != null && invite.isAnswered() && !SipMessages.isSuccess(invite.getLastResponse())) {
				logger.debug("ACK for non-2xx final response absorbed in {}.", invite.getKey());
				return null;
			}
			return new ServerTransaction(keyOf(branch, method), request);
		}
		String key = keyOf(branch, method);
		ServerTransaction existing = serverTransactions.get(key);
		if (existing != null) {
			logger.debug("Retransmitted {} absorbed in {}.", method, key);
			if (existing.getLastResponse() != null) {
				sender.send(existing.getLastResponse());
			}
			return null;
		}
		ServerTransaction transaction = new ServerTransaction(key, request);
		serverTransactions.put(key, transaction);
		return transaction;
	}

	public ServerTransaction getServerTransaction(String branch, String method) {
		return serverTransactions.get(keyOf(branch, method));
	}

	/**
	 * Sends {@code response} and remembers it for retransmitted requests. Once the
	 * response is final the transaction expires after the transaction timeout.
	 */
	public boolean respond(final ServerTransaction transaction, Response response) {
		transaction.setLastResponse(response);
		boolean sent = sender.send(response);
		if (SipMessages.isFinal(response) && transaction.expiryTimer == null
				&& serverTransactions.get(transaction.getKey()) == transaction) {
			transaction.expiryTimer = worker.schedule(new Runnable() {

				@Override
				public void run() {
					serverTransactions.remove(transaction.getKey());
				}

			}, timeoutMs);
		}
		return sent;
	}

	/**
	 * Drops every transaction without notifying listeners.
	 */
	public void clear() {
		for (ClientTransaction transaction : new ArrayList<>(clientTransactions.values())) {
			transaction.cancelTimers();
			transaction.setStatus(Status.TERMINATED);
		}
		clientTransactions.clear();
		List<ServerTransaction> pending = new ArrayList<>(serverTransactions.values());
		for (ServerTransaction transaction : pending) {
			if (transaction.expiryTimer != null) {
				transaction.expiryTimer.cancel();
			}
		}
		serverTransactions.clear();
	}

	public int getPendingClientTransactions() {
		return clientTransactions.size();
	}

	public int getServerTransactionCount() {
		return serverTransactions.size();
	}

	public long getTimeoutMs() {
		return timeoutMs;
	}

}
