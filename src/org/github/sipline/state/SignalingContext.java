package org.github.sipline.state;

import org.github.sipline.SignalingConfig;
import org.github.sipline.auth.AuthenticationHandler;
import org.github.sipline.messages.SipMessageFactory;
import org.github.sipline.transaction.TransactionManager;
import org.github.sipline.worker.SignalingWorker;

/**
 * Collaborators shared by every registration and call of one engine.
 */
public class SignalingContext {

	private final SignalingConfig config;
	private final SignalingWorker worker;
	private final TransactionManager transactions;
	private final SipMessageFactory messageFactory;
	private final AuthenticationHandler authenticationHandler;

	public SignalingContext(SignalingConfig config, SignalingWorker worker,
			TransactionManager transactions, SipMessageFactory messageFactory,
			AuthenticationHandler authenticationHandler) {
		this.config = config;
		this.worker = worker;
		this.transactions = transactions;
		this.messageFactory = messageFactory;
		this.authenticationHandler = authenticationHandler;
	}

	public SignalingConfig getConfig() {
		return config;
	}

	public SignalingWorker getWorker() {
		return worker;
	}

	public TransactionManager getTransactions() {
		return transactions;
	}

	public SipMessageFactory getMessageFactory() {
		return messageFactory;
	}

	public AuthenticationHandler getAuthenticationHandler() {
		return authenticationHandler;
	}

}
