package org.github.sipline.state;

import static org.github.sipline.state.RegistrationState.FAILED;
import static org.github.sipline.state.RegistrationState.NONE;
import static org.github.sipline.state.RegistrationState.REFRESHING;
import static org.github.sipline.state.RegistrationState.REGISTERED;
import static org.github.sipline.state.RegistrationState.REGISTERING;
import static org.github.sipline.state.RegistrationState.UNREGISTERED;
import static org.github.sipline.state.RegistrationState.UNREGISTERING;

import javax.sip.address.Address;
import javax.sip.header.ContactHeader;
import javax.sip.header.ExpiresHeader;
import javax.sip.header.Header;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.AccountCredentials;
import org.github.sipline.Constants;
import org.github.sipline.Constants.RequestMethod;
import org.github.sipline.auth.NonceCounter;
import org.github.sipline.exceptions.AuthenticationFailedException;
import org.github.sipline.exceptions.SiplineException;
import org.github.sipline.exceptions.TransactionTimeoutException;
import org.github.sipline.exceptions.UnsupportedChallengeException;
import org.github.sipline.messages.SipMessageFactory;
import org.github.sipline.messages.SipMessages;
import org.github.sipline.transaction.ClientTransaction;
import org.github.sipline.transaction.ResponseListener;
import org.github.sipline.worker.SignalingWorker.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REGISTER lifecycle of one account: initial registration, refresh before
 * expiry, a single authenticated retry per challenge and unregistration.
 */
public class RegistrationStateMachine extends AbstractStateMachine<RegistrationState, RegistrationTrigger> {

	public interface Observer {

		void onRegistrationStateChanged(RegistrationStateMachine registration,
				RegistrationState oldState, RegistrationState newState, String reason, int statusCode);

	}

	private static final StateMachineBehavior<RegistrationState, RegistrationTrigger> BEHAVIOR =
			new StateMachineBehavior<>(RegistrationState.class, RegistrationTrigger.class);
	static {
		BEHAVIOR.during(NONE).on(RegistrationTrigger.REGISTER).goTo(REGISTERING);

		BEHAVIOR.during(REGISTERING).on(RegistrationTrigger.SUCCEEDED).goTo(REGISTERED);
		BEHAVIOR.during(REGISTERING).on(RegistrationTrigger.CHALLENGED).stay();
		BEHAVIOR.during(REGISTERING).on(RegistrationTrigger.FAILED).goTo(FAILED);

		BEHAVIOR.during(REGISTERED).on(RegistrationTrigger.REFRESH_DUE).goTo(REFRESHING);
		BEHAVIOR.during(REGISTERED).on(RegistrationTrigger.UNREGISTER).goTo(UNREGISTERING);
		BEHAVIOR.during(REGISTERED).on(RegistrationTrigger.FAILED).goTo(FAILED);

		BEHAVIOR.during(REFRESHING).on(RegistrationTrigger.SUCCEEDED).goTo(REGISTERED);
		BEHAVIOR.during(REFRESHING).on(RegistrationTrigger.CHALLENGED).stay();
		BEHAVIOR.during(REFRESHING).on(RegistrationTrigger.FAILED).goTo(FAILED);
		BEHAVIOR.during(REFRESHING).on(RegistrationTrigger.UNREGISTER).goTo(UNREGISTERING);

		BEHAVIOR.during(UNREGISTERING).on(RegistrationTrigger.SUCCEEDED).goTo(UNREGISTERED);
		BEHAVIOR.during(UNREGISTERING).on(RegistrationTrigger.CHALLENGED).stay();
		BEHAVIOR.during(UNREGISTERING).on(RegistrationTrigger.FAILED).goTo(FAILED);

		BEHAVIOR.during(FAILED).on(RegistrationTrigger.REGISTER).goTo(REGISTERING);
		BEHAVIOR.during(UNREGISTERED).on(RegistrationTrigger.REGISTER).goTo(REGISTERING);
	}

	private final Logger logger = LoggerFactory.getLogger(RegistrationStateMachine.class);

	private final SignalingContext context;
	private final AccountCredentials credentials;
	private final Observer observer;
	private final NonceCounter nonceCounter = new NonceCounter();
	private final String callId;
	private final String fromTag;
	private final ContactHeader contact;
	private long sequenceNumber = 0;
	private int requestedExpires;
	private int grantedExpires;
	private boolean wantsRegistration;
	private ClientTransaction currentTransaction;
	private Cancellable refreshTimer;

	public RegistrationStateMachine(SignalingContext context, AccountCredentials credentials,
			Observer observer) {
		super(NONE);
		this.context = context;
		this.credentials = credentials;
		this.observer = observer;
		this.callId = context.getMessageFactory().newCallId();
		this.fromTag = context.getMessageFactory().newTag();
		this.contact = context.getMessageFactory().createContact(credentials.getUsername());
		this.requestedExpires = context.getConfig().getRegistrationExpires();
	}

	@Override
	protected StateMachineBehavior<RegistrationState, RegistrationTrigger> getBehavior() {
		return BEHAVIOR;
	}

	public void register() {
		fire(RegistrationTrigger.REGISTER);
		wantsRegistration = true;
		sendRegister(requestedExpires);
	}

	public void refresh() {
		fire(RegistrationTrigger.REFRESH_DUE);
		sendRegister(requestedExpires);
	}

	public void unregister() {
		fire(RegistrationTrigger.UNREGISTER);
		wantsRegistration = false;
		cancelRefresh();
		if (currentTransaction != null && !currentTransaction.isTerminated()) {
			context.getTransactions().cancel(currentTransaction);
		}
		sendRegister(0);
	}

	/**
	 * The transport went away: whatever the registrar knows about us is no longer
	 * reachable, so the registration is reported as failed.
	 */
	public void onTransportDown(String reason) {
		cancelRefresh();
		if (currentTransaction != null) {
			context.getTransactions().cancel(currentTransaction);
			currentTransaction = null;
		}
		if (canFire(RegistrationTrigger.FAILED)) {
			fire(RegistrationTrigger.FAILED, reason, 0);
		}
	}

	private void sendRegister(int expires) {
		sequenceNumber++;
		SipMessageFactory messageFactory = context.getMessageFactory();
		Address aor = messageFactory.createAddress(credentials.getDisplayName(),
				credentials.getAddressOfRecord());
		Request register = messageFactory.createRequest(RequestMethod.REGISTER.name(),
				messageFactory.createUri(credentials.getRegistrarUri()), aor, fromTag, aor, null,
				callId, sequenceNumber);
		register.addHeader((Header) contact.clone());
		register.addHeader(messageFactory.createExpires(expires));
		messageFactory.addAllow(register);
		logger.debug("Sending REGISTER for {} (expires {}).", credentials.getKey(), expires);
		send(register, false);
	}

	private void send(Request request, boolean authenticatedRetry) {
		currentTransaction = context.getTransactions().sendRequest(request, new ResponseListener() {

			@Override
			public void onResponse(ClientTransaction transaction, Response response) {
				handleResponse(transaction, response);
			}

			@Override
			public void onFailure(ClientTransaction transaction, SiplineException failure) {
				handleFailure(transaction, failure);
			}

		}, authenticatedRetry);
	}

	private void handleResponse(ClientTransaction transaction, Response response) {
		if (transaction != currentTransaction) {
			logger.warn("Ignoring {} for stale REGISTER transaction of {}.",
					response.getStatusCode(), credentials.getKey());
			return;
		}
		if (!SipMessages.isFinal(response)) {
			return;
		}
		currentTransaction = null;
		int statusCode = response.getStatusCode();
		if (SipMessages.isSuccess(response)) {
			if (getState() == UNREGISTERING) {
				fire(RegistrationTrigger.SUCCEEDED, "Unregistered", statusCode);
				logger.info("{} unregistered.", credentials.getKey());
				return;
			}
			int granted = grantedExpires(response);
			if (granted <= 0) {
				logger.error("Registrar granted {}s to {}, nothing to refresh.", granted,
						credentials.getKey());
				fire(RegistrationTrigger.FAILED, "Registrar granted no expiry (" + granted + ")",
						statusCode);
				return;
			}
			grantedExpires = granted;
			fire(RegistrationTrigger.SUCCEEDED, "Registered", statusCode);
			logger.info("{} registered for {}s.", credentials.getKey(), grantedExpires);
			scheduleRefresh();
			return;
		}
		if (Constants.isChallenge(statusCode)) {
			if (transaction.isAuthenticatedRetry()) {
				AuthenticationFailedException failure = new AuthenticationFailedException(
						"Credentials rejected for " + credentials.getKey(), statusCode);
				logger.error("Registration of {} failed.", credentials.getKey(), failure);
				fire(RegistrationTrigger.FAILED, failure.getMessage(), statusCode);
				return;
			}
			try {
				Request retry = context.getAuthenticationHandler().authorize(
						transaction.getRequest(), response, credentials, nonceCounter);
				fire(RegistrationTrigger.CHALLENGED);
				sequenceNumber = SipMessages.sequenceNumberOf(retry);
				send(retry, true);
			} catch (UnsupportedChallengeException unsupported) {
				logger.error("Cannot answer challenge for {}: {}", credentials.getKey(),
						unsupported.getMessage());
				fire(RegistrationTrigger.FAILED, unsupported.getMessage(), statusCode);
			}
			return;
		}
		logger.warn("REGISTER for {} rejected with {} {}.", credentials.getKey(), statusCode,
				response.getReasonPhrase());
		fire(RegistrationTrigger.FAILED, statusCode + " " + response.getReasonPhrase(), statusCode);
	}

	private void handleFailure(ClientTransaction transaction, SiplineException failure) {
		if (transaction != currentTransaction) {
			return;
		}
		currentTransaction = null;
		logger.error("REGISTER for {} failed: {}", credentials.getKey(), failure.getMessage());
		fire(RegistrationTrigger.FAILED, failure.getMessage(),
				failure instanceof TransactionTimeoutException ? Response.REQUEST_TIMEOUT : 0);
	}

	private int grantedExpires(Response response) {
		for (Header header : SipMessages.headersOf(response, ContactHeader.NAME)) {
			ContactHeader granted = (ContactHeader) header;
			if (granted.getAddress() != null
					&& granted.getAddress().getURI().equals(contact.getAddress().getURI())
					&& granted.getExpires() >= 0) {
				return granted.getExpires();
			}
		}
		ExpiresHeader expires = (ExpiresHeader) response.getHeader(ExpiresHeader.NAME);
		if (expires != null) {
			return expires.getExpires();
		}
		return requestedExpires;
	}

	private void scheduleRefresh() {
		cancelRefresh();
		refreshTimer = context.getWorker().schedule(new Runnable() {

			@Override
			public void run() {
				refreshTimer = null;
				if (getState() == REGISTERED) {
					refresh();
				}
			}

		}, getRefreshDelayMs());
	}

	private void cancelRefresh() {
		if (refreshTimer != null) {
			refreshTimer.cancel();
			refreshTimer = null;
		}
	}

	/**
	 * Refresh happens at 90% of the expiry granted by the registrar.
	 */
	public long getRefreshDelayMs() {
		return grantedExpires * 900L;
	}

	@Override
	protected void stateHasChanged(RegistrationState oldState, RegistrationState newState,
			String reason, int statusCode) {
		if (newState == FAILED || newState == UNREGISTERED) {
			cancelRefresh();
		}
		observer.onRegistrationStateChanged(this, oldState, newState, reason, statusCode);
	}

	public void dispose() {
		cancelRefresh();
		if (currentTransaction != null) {
			context.getTransactions().cancel(currentTransaction);
			currentTransaction = null;
		}
	}

	public AccountCredentials getCredentials() {
		return credentials;
	}

	public String getKey() {
		return credentials.getKey();
	}

	public NonceCounter getNonceCounter() {
		return nonceCounter;
	}

	public String getCallId() {
		return callId;
	}

	public long getSequenceNumber() {
		return sequenceNumber;
	}

	public int getGrantedExpires() {
		return grantedExpires;
	}

	public boolean wantsRegistration() {
		return wantsRegistration;
	}

	public ContactHeader getContact() {
		return contact;
	}

}
