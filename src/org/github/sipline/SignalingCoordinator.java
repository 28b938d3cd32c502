package org.github.sipline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.Constants.RequestMethod;
import org.github.sipline.Constants.Transport;
import org.github.sipline.auth.AuthenticationHandler;
import org.github.sipline.events.CallStateChanged;
import org.github.sipline.events.DtmfResult;
import org.github.sipline.events.IncomingCall;
import org.github.sipline.events.RegistrationStateChanged;
import org.github.sipline.events.TransportStateChanged;
import org.github.sipline.exceptions.IllegalTransitionException;
import org.github.sipline.exceptions.MalformedMessageException;
import org.github.sipline.exceptions.SiplineException;
import org.github.sipline.messages.MessageCodec;
import org.github.sipline.messages.SipMessageFactory;
import org.github.sipline.messages.SipMessages;
import org.github.sipline.state.CallState;
import org.github.sipline.state.CallStateMachine;
import org.github.sipline.state.RegistrationState;
import org.github.sipline.state.RegistrationStateMachine;
import org.github.sipline.state.RegistrationTrigger;
import org.github.sipline.state.SignalingContext;
import org.github.sipline.transaction.MessageSender;
import org.github.sipline.transaction.ServerTransaction;
import org.github.sipline.transaction.TransactionManager;
import org.github.sipline.transport.OkHttpWebSocketConnector;
import org.github.sipline.transport.TransportListener;
import org.github.sipline.transport.TransportSession;
import org.github.sipline.transport.TransportState;
import org.github.sipline.transport.WebSocketConnector;
import org.github.sipline.worker.ExecutorSignalingWorker;
import org.github.sipline.worker.SignalingWorker;
import org.github.sipline.worker.SignalingWorker.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;

/**
 * Owns every registration and call of one engine, routes decoded frames to
 * them and reports what happens to a single listener.
 */
public class SignalingCoordinator implements SignalingApi, TransportListener, MessageSender,
		RegistrationStateMachine.Observer, CallStateMachine.Observer {

	private final Logger logger = LoggerFactory.getLogger(SignalingCoordinator.class);

	private final SignalingConfig config;
	private final SignalingWorker worker;
	private final WebSocketConnector connector;
	private final EventBus eventBus;
	private final MessageCodec codec = new MessageCodec();
	private final SipMessageFactory messageFactory;
	private final TransactionManager transactions;
	private final SignalingContext context;

	// Mutated on the worker only; the maps are safe for the getters' reads from other threads.
	private final Map<String, RegistrationStateMachine> registrations =
			Collections.synchronizedMap(new LinkedHashMap<String, RegistrationStateMachine>());
	private final Set<String> deferredRegistrations = new LinkedHashSet<>();
	private final Map<String, CallStateMachine> calls = new ConcurrentHashMap<>();
	private final Object listenerLock = new Object();
	private Object listener;
	private volatile TransportSession session;
	private Cancellable callGraceTimer;

	public SignalingCoordinator(SignalingConfig config) {
		this(config, new ExecutorSignalingWorker(),
				new OkHttpWebSocketConnector(config.getKeepaliveIntervalMs()));
	}

	public SignalingCoordinator(SignalingConfig config, SignalingWorker worker,
			WebSocketConnector connector) {
		this(config, worker, connector, new AuthenticationHandler());
	}

	public SignalingCoordinator(SignalingConfig config, SignalingWorker worker,
			WebSocketConnector connector, AuthenticationHandler authenticationHandler) {
		this.config = Preconditions.checkNotNull(config);
		this.worker = Preconditions.checkNotNull(worker);
		this.connector = Preconditions.checkNotNull(connector);
		this.eventBus = new EventBus("sipline");
		this.eventBus.register(this);
		Transport transport = Constants.getTransport(config.getTransportUrl());
		this.messageFactory = new SipMessageFactory(transport == Transport.UNKNOWN
				? Transport.WS.name() : transport.name(), config.getUserAgent(), config.getContactParams());
		this.transactions = new TransactionManager(worker, this, messageFactory, config);
		this.context = new SignalingContext(config, worker, transactions, messageFactory,
				authenticationHandler);
	}

	@Override
	public void setListener(Object newListener) {
		synchronized (listenerLock) {
			if (listener != null) {
				eventBus.unregister(listener);
			}
			listener = newListener;
			if (newListener != null) {
				eventBus.register(newListener);
			}
		}
	}

	@Subscribe
	public void onDeadEvent(DeadEvent deadEvent) {
		logger.debug("No listener for {}.", deadEvent.getEvent());
	}

	@Override
	public void start() {
		execute("start", new Runnable() {

			@Override
			public void run() {
				if (session == null) {
					session = new TransportSession(worker, connector, config, SignalingCoordinator.this);
				}
				logger.info("Starting signaling over {}.", config.getTransportUrl());
				session.connect();
				for (AccountCredentials account : config.getAccounts()) {
					doRegister(account);
				}
			}

		});
	}

	@Override
	public void shutdown() {
		execute("shutdown", new Runnable() {

			@Override
			public void run() {
				logger.info("Shutting down signaling.");
				for (CallStateMachine call : new ArrayList<>(calls.values())) {
					if (!call.getState().isTerminal()) {
						try {
							call.hangup();
						} catch (IllegalTransitionException illegalTransition) {
							logger.debug("Call {} not hung up: {}", call.getCallId(),
									illegalTransition.getMessage());
						}
					}
				}
				for (RegistrationStateMachine registration : registrationSnapshot()) {
					if (registration.canFire(RegistrationTrigger.UNREGISTER)) {
						registration.unregister();
					}
					registration.dispose();
				}
				cancelCallGraceTimer();
				registrations.clear();
				deferredRegistrations.clear();
				calls.clear();
				transactions.clear();
				if (session != null) {
					session.close();
					eventBus.post(new TransportStateChanged(TransportState.CLOSED, "Shut down"));
				}
				worker.shutdown();
			}

		});
	}

	@Override
	public void register(final AccountCredentials credentials) {
		Preconditions.checkNotNull(credentials, "credentials");
		execute("register " + credentials.getKey(), new Runnable() {

			@Override
			public void run() {
				doRegister(credentials);
			}

		});
	}

	private void doRegister(AccountCredentials credentials) {
		String key = credentials.getKey();
		RegistrationStateMachine registration = registrations.get(key);
		if (registration == null) {
			registration = new RegistrationStateMachine(context, credentials, this);
			registrations.put(key, registration);
		}
		if (session == null || !session.isConnected()) {
			deferredRegistrations.add(key);
			logger.info("Registration of {} deferred until the transport is up.", key);
			return;
		}
		if (!registration.canFire(RegistrationTrigger.REGISTER)) {
			logger.debug("{} is already {}.", key, registration.getState());
			return;
		}
		registration.register();
	}

	@Override
	public void unregister(final String accountKey) {
		Preconditions.checkNotNull(accountKey, "accountKey");
		execute("unregister " + accountKey, new Runnable() {

			@Override
			public void run() {
				deferredRegistrations.remove(accountKey);
				RegistrationStateMachine registration = registrations.get(accountKey);
				if (registration == null) {
					logger.warn("Cannot unregister unknown account {}.", accountKey);
					return;
				}
				if (registration.canFire(RegistrationTrigger.UNREGISTER)) {
					registration.unregister();
					return;
				}
				registrations.remove(accountKey);
				registration.dispose();
				logger.info("{} dropped while {}.", accountKey, registration.getState());
			}

		});
	}

	@Override
	public String makeCall(final String accountKey, final String target, final String sdp) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(accountKey), "account key is required");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(target), "call target is required");
		final String callId = messageFactory.newCallId();
		execute("makeCall " + callId, new Runnable() {

			@Override
			public void run() {
				RegistrationStateMachine registration = registrations.get(accountKey);
				if (registration == null) {
					logger.error("Cannot call {} from unknown account {}.", target, accountKey);
					eventBus.post(new CallStateChanged(callId, CallState.IDLE, CallState.FAILED,
							"Unknown account " + accountKey, 0, null));
					return;
				}
				AccountCredentials credentials = registration.getCredentials();
				CallStateMachine call = new CallStateMachine(context, credentials,
						registration.getNonceCounter(), callId, SignalingCoordinator.this);
				calls.put(callId, call);
				try {
					call.makeCall(normalizeTarget(target, credentials.getDomain()), sdp);
				} catch (SiplineException failure) {
					calls.remove(callId);
					logger.error("Cannot call {}: {}", target, failure.getMessage());
					eventBus.post(new CallStateChanged(callId, CallState.IDLE, CallState.FAILED,
							failure.getMessage(), 0, null));
				}
			}

		});
		return callId;
	}

	/**
	 * {@code sip:} and {@code sips:} URIs pass unchanged, {@code user@host}
	 * gets the scheme and anything else is a user in {@code domain}.
	 */
	public static String normalizeTarget(String target, String domain) {
		String trimmed = target.trim();
		String lower = trimmed.toLowerCase();
		if (lower.startsWith("sip:") || lower.startsWith("sips:")) {
			return trimmed;
		}
		if (trimmed.contains("@")) {
			return "sip:" + trimmed;
		}
		return "sip:" + trimmed + "@" + domain;
	}

	@Override
	public void acceptCall(final String callId, final String sdp) {
		onCall("acceptCall", callId, new CallCommand() {

			@Override
			public void run(CallStateMachine call) {
				call.accept(sdp);
			}

		});
	}

	@Override
	public void declineCall(final String callId, final boolean busy) {
		onCall("declineCall", callId, new CallCommand() {

			@Override
			public void run(CallStateMachine call) {
				call.decline(busy);
			}

		});
	}

	@Override
	public void hangup(String callId) {
		onCall("hangup", callId, new CallCommand() {

			@Override
			public void run(CallStateMachine call) {
				call.hangup();
			}

		});
	}

	@Override
	public void hold(String callId) {
		onCall("hold", callId, new CallCommand() {

			@Override
			public void run(CallStateMachine call) {
				call.hold();
			}

		});
	}

	@Override
	public void resume(String callId) {
		onCall("resume", callId, new CallCommand() {

			@Override
			public void run(CallStateMachine call) {
				call.resume();
			}

		});
	}

	@Override
	public void sendDtmf(String callId, final char digit, final int durationMs) {
		Preconditions.checkArgument(CallStateMachine.isDtmfDigit(digit), "Invalid DTMF digit '%s'", digit);
		Preconditions.checkArgument(durationMs > 0, "DTMF duration must be positive");
		onCall("sendDtmf", callId, new CallCommand() {

			@Override
			public void run(CallStateMachine call) {
				call.sendDtmf(digit, durationMs);
			}

		});
	}

	@Override
	public void sendDtmfSequence(String callId, final String digits, final int durationMs) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(digits), "DTMF digits are required");
		for (char digit : digits.toCharArray()) {
			Preconditions.checkArgument(CallStateMachine.isDtmfDigit(digit), "Invalid DTMF digit '%s'", digit);
		}
		Preconditions.checkArgument(durationMs > 0, "DTMF duration must be positive");
		onCall("sendDtmfSequence", callId, new CallCommand() {

			@Override
			public void run(CallStateMachine call) {
				call.sendDtmfSequence(digits, durationMs);
			}

		});
	}

	private interface CallCommand {

		void run(CallStateMachine call);

	}

	private void onCall(final String command, final String callId, final CallCommand callCommand) {
		Preconditions.checkNotNull(callId, "callId");
		execute(command + " " + callId, new Runnable() {

			@Override
			public void run() {
				CallStateMachine call = calls.get(callId);
				if (call == null) {
					logger.warn("{}: no active call {}.", command, callId);
					return;
				}
				callCommand.run(call);
			}

		});
	}

	/**
	 * Runs {@code task} on the worker; protocol failures end up in the log, never
	 * on the worker thread.
	 */
	private void execute(final String description, final Runnable task) {
		worker.execute(new Runnable() {

			@Override
			public void run() {
				try {
					task.run();
				} catch (IllegalTransitionException illegalTransition) {
					logger.warn("{} ignored: {}", description, illegalTransition.getMessage());
				} catch (SiplineException failure) {
					logger.error("{} failed: {}", description, failure.getMessage(), failure);
				}
			}

		});
	}

	@Override
	public boolean send(Message message) {
		TransportSession session = this.session;
		if (session == null) {
			logger.warn("Cannot send {} before start.", SipMessages.describe(message));
			return false;
		}
		if (logger.isTraceEnabled()) {
			logger.trace("Sending:\n{}", codec.buildText(message));
		}
		return session.send(codec.buildText(message));
	}

	@Override
	public void onTransportUp(boolean reconnected) {
		cancelCallGraceTimer();
		eventBus.post(new TransportStateChanged(TransportState.CONNECTED,
				reconnected ? "Reconnected" : "Connected"));
		for (RegistrationStateMachine registration : registrationSnapshot()) {
			boolean deferred = deferredRegistrations.remove(registration.getKey());
			if ((deferred || (reconnected && registration.wantsRegistration()))
					&& registration.canFire(RegistrationTrigger.REGISTER)) {
				try {
					registration.register();
				} catch (SiplineException failure) {
					logger.error("Could not register {}.", registration.getKey(), failure);
				}
			}
		}
	}

	@Override
	public void onTransportDown(final String reason) {
		eventBus.post(new TransportStateChanged(session.getState(), reason));
		for (RegistrationStateMachine registration : registrationSnapshot()) {
			registration.onTransportDown(reason);
		}
		if (calls.isEmpty() || callGraceTimer != null) {
			return;
		}
		logger.info("Keeping {} call(s) for {}ms while the transport is down.", calls.size(),
				config.getCallGraceMs());
		callGraceTimer = worker.schedule(new Runnable() {

			@Override
			public void run() {
				callGraceTimer = null;
				if (session != null && session.isConnected()) {
					return;
				}
				for (CallStateMachine call : new ArrayList<>(calls.values())) {
					call.failCall("Transport lost: " + reason, 0);
				}
			}

		}, config.getCallGraceMs());
	}

	private void cancelCallGraceTimer() {
		if (callGraceTimer != null) {
			callGraceTimer.cancel();
			callGraceTimer = null;
		}
	}

	@Override
	public void onFrame(String text) {
		Message message;
		try {
			message = codec.parse(text);
		} catch (MalformedMessageException malformed) {
			logger.warn("Dropping malformed frame: {}", malformed.getMessage());
			return;
		}
		logger.trace("Received:\n{}", text);
		try {
			if (message instanceof Response) {
				handleResponse((Response) message);
			}
			else {
				handleRequest((Request) message);
			}
		} catch (IllegalTransitionException illegalTransition) {
			logger.warn("{} dropped: {}", SipMessages.describe(message), illegalTransition.getMessage());
		} catch (SiplineException failure) {
			logger.error("Could not process {}.", SipMessages.describe(message), failure);
		}
	}

	private void handleResponse(Response response) {
		if (transactions.onResponseReceived(response)) {
			return;
		}
		String callId = SipMessages.callIdOf(response);
		if (SipMessages.isSuccess(response)
				&& SipMessages.cseqMethodOf(response).equals(RequestMethod.INVITE.name())) {
			CallStateMachine call = calls.get(callId);
			if (call != null) {
				call.onRetransmittedSuccess(response);
				return;
			}
		}
		logger.warn("Unmatched response {} for Call-ID {} dropped.", SipMessages.describe(response),
				callId);
	}

	private void handleRequest(Request request) {
		ServerTransaction transaction = transactions.onRequestReceived(request);
		if (transaction == null) {
			return;
		}
		String callId = SipMessages.callIdOf(request);
		CallStateMachine call = calls.get(callId);
		RequestMethod method = Constants.getRequestMethod(request.getMethod());
		if (method == RequestMethod.ACK) {
			if (call != null) {
				call.onAckReceived(request);
			}
			else {
				logger.debug("ACK for unknown call {} dropped.", callId);
			}
			return;
		}
		if (method == RequestMethod.CANCEL) {
			ServerTransaction invite = transactions.getServerTransaction(
					SipMessages.branchOf(request), RequestMethod.INVITE.name());
			if (invite != null && call != null) {
				call.onCancelReceived(transaction);
			}
			else {
				respond(transaction, Response.CALL_OR_TRANSACTION_DOES_NOT_EXIST);
			}
			return;
		}
		String toTag = SipMessages.toTagOf(request);
		if (toTag == null) {
			handleOutOfDialogRequest(transaction, call);
			return;
		}
		if (call != null && toTag.equals(call.getLocalTag())) {
			call.onRequestReceived(transaction);
			return;
		}
		logger.warn("{} for unknown dialog {} rejected.", request.getMethod(), callId);
		respond(transaction, Response.CALL_OR_TRANSACTION_DOES_NOT_EXIST);
	}

	private void handleOutOfDialogRequest(ServerTransaction transaction, CallStateMachine call) {
		Request request = transaction.getRequest();
		switch (Constants.getRequestMethod(request.getMethod())) {
			case INVITE:
				if (call != null) {
					logger.warn("Second initial INVITE for call {} rejected.",
							SipMessages.callIdOf(request));
					respond(transaction, Response.SERVER_INTERNAL_ERROR);
					return;
				}
				acceptIncomingCall(transaction);
				break;
			case OPTIONS:
				Response options = messageFactory.createResponse(request, Response.OK,
						messageFactory.newTag());
				messageFactory.addAllow(options);
				transactions.respond(transaction, options);
				break;
			case BYE:
			case INFO:
				respond(transaction, Response.CALL_OR_TRANSACTION_DOES_NOT_EXIST);
				break;
			default:
				Response notAllowed = messageFactory.createResponse(request,
						Response.METHOD_NOT_ALLOWED, messageFactory.newTag());
				messageFactory.addAllow(notAllowed);
				transactions.respond(transaction, notAllowed);
				break;
		}
	}

	private void acceptIncomingCall(ServerTransaction transaction) {
		Request invite = transaction.getRequest();
		String callId = SipMessages.callIdOf(invite);
		RegistrationStateMachine registration = findCalledAccount(invite);
		if (registration == null) {
			logger.warn("Incoming call {} for {} matches no account.", callId,
					invite.getRequestURI());
			respond(transaction, Response.NOT_FOUND);
			return;
		}
		CallStateMachine call = new CallStateMachine(context, registration.getCredentials(),
				registration.getNonceCounter(), callId, this);
		calls.put(callId, call);
		call.onInviteReceived(transaction);
		logger.info("Incoming call {} from {} for {}.", call.getCallId(), call.getRemoteNumber(),
				registration.getKey());
		eventBus.post(new IncomingCall(registration.getKey(), call.getCallId(),
				call.getRemoteNumber(), call.getRemoteSdp()));
	}

	/**
	 * The account whose username is the user part of the To header, else the
	 * first one known.
	 */
	private RegistrationStateMachine findCalledAccount(Request invite) {
		String calledUser = SipMessages.userOf(SipMessages.toOf(invite).getAddress());
		List<RegistrationStateMachine> known = registrationSnapshot();
		for (RegistrationStateMachine registration : known) {
			if (registration.getCredentials().getUsername().equals(calledUser)) {
				return registration;
			}
		}
		return known.isEmpty() ? null : known.get(0);
	}

	private List<RegistrationStateMachine> registrationSnapshot() {
		synchronized (registrations) {
			return new ArrayList<>(registrations.values());
		}
	}

	private void respond(ServerTransaction transaction, int statusCode) {
		transactions.respond(transaction, messageFactory.createResponse(transaction.getRequest(),
				statusCode, messageFactory.newTag()));
	}

	@Override
	public void onRegistrationStateChanged(RegistrationStateMachine registration,
			RegistrationState oldState, RegistrationState newState, String reason, int statusCode) {
		logger.info("Registration of {}: {} -> {} ({}).", registration.getKey(), oldState, newState, reason);
		if (newState == RegistrationState.UNREGISTERED && !registration.wantsRegistration()) {
			registrations.remove(registration.getKey());
			registration.dispose();
		}
		eventBus.post(new RegistrationStateChanged(registration.getKey(), oldState, newState,
				reason, statusCode));
	}

	@Override
	public void onCallStateChanged(CallStateMachine call, CallState oldState, CallState newState,
			String reason, int statusCode) {
		if (newState.isTerminal()) {
			calls.remove(call.getCallId());
			logger.info("Call {} {}: {}.", call.getCallId(), newState == CallState.ENDED
					? "ended" : "failed", reason);
		}
		eventBus.post(new CallStateChanged(call.getCallId(), oldState, newState, reason,
				statusCode, call.getRemoteSdp()));
	}

	@Override
	public void onDtmfResult(CallStateMachine call, char digit, boolean success) {
		eventBus.post(new DtmfResult(call.getCallId(), digit, success));
	}

	/**
	 * Snapshot for diagnostics, safe to read from any thread.
	 */
	public List<String> getActiveCallIds() {
		return Collections.unmodifiableList(new ArrayList<>(calls.keySet()));
	}

	public RegistrationState getRegistrationState(String accountKey) {
		RegistrationStateMachine registration = registrations.get(accountKey);
		return registration == null ? null : registration.getState();
	}

	public CallState getCallState(String callId) {
		CallStateMachine call = calls.get(callId);
		return call == null ? null : call.getState();
	}

	public TransportState getTransportState() {
		TransportSession current = session;
		return current == null ? TransportState.DISCONNECTED : current.getState();
	}

}
