package org.github.sipline.state;

import static org.github.sipline.state.CallState.CALLING;
import static org.github.sipline.state.CallState.CONNECTED;
import static org.github.sipline.state.CallState.ENDED;
import static org.github.sipline.state.CallState.FAILED;
import static org.github.sipline.state.CallState.IDLE;
import static org.github.sipline.state.CallState.ON_HOLD;
import static org.github.sipline.state.CallState.RINGING;
import static org.github.sipline.state.CallState.TERMINATING;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import javax.sip.address.Address;
import javax.sip.address.URI;
import javax.sip.header.ContactHeader;
import javax.sip.header.FromHeader;
import javax.sip.header.Header;
import javax.sip.header.RecordRouteHeader;
import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.AccountCredentials;
import org.github.sipline.Constants;
import org.github.sipline.Constants.RequestMethod;
import org.github.sipline.auth.NonceCounter;
import org.github.sipline.exceptions.IllegalTransitionException;
import org.github.sipline.exceptions.SiplineException;
import org.github.sipline.exceptions.TransactionTimeoutException;
import org.github.sipline.exceptions.UnsupportedChallengeException;
import org.github.sipline.messages.SessionDescriptions;
import org.github.sipline.messages.SipMessageFactory;
import org.github.sipline.messages.SipMessages;
import org.github.sipline.transaction.ClientTransaction;
import org.github.sipline.transaction.ResponseListener;
import org.github.sipline.transaction.ServerTransaction;
import org.github.sipline.worker.SignalingWorker.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * One dialog, from the initial INVITE (sent or received) until it ends. Owns the
 * dialog identifiers, sequence numbers, route set and session descriptions.
 */
public class CallStateMachine extends AbstractStateMachine<CallState, CallTrigger> {

	public enum Direction {
		OUTGOING, INCOMING
	}

	public interface Observer {

		/**
		 * Also called with {@code oldState == newState} when an in-dialog operation
		 * (hold, resume) failed without changing the call state.
		 */
		void onCallStateChanged(CallStateMachine call, CallState oldState, CallState newState,
				String reason, int statusCode);

		void onDtmfResult(CallStateMachine call, char digit, boolean success);

	}

	private static final StateMachineBehavior<CallState, CallTrigger> BEHAVIOR =
			new StateMachineBehavior<>(CallState.class, CallTrigger.class);
	static {
		BEHAVIOR.during(IDLE).on(CallTrigger.MAKE_CALL).goTo(CALLING);
		BEHAVIOR.during(IDLE).on(CallTrigger.INVITE_RECEIVED).goTo(RINGING);

		BEHAVIOR.during(CALLING).on(CallTrigger.PROVISIONAL).goTo(RINGING);
		BEHAVIOR.during(CALLING).on(CallTrigger.ANSWERED).goTo(CONNECTED);
		BEHAVIOR.during(CALLING).on(CallTrigger.CHALLENGED).stay();
		BEHAVIOR.during(CALLING).on(CallTrigger.REJECTED).goTo(FAILED);
		BEHAVIOR.during(CALLING).on(CallTrigger.CANCEL).goTo(TERMINATING);
		BEHAVIOR.during(CALLING).on(CallTrigger.BYE_RECEIVED).goTo(TERMINATING);
		BEHAVIOR.during(CALLING).on(CallTrigger.FAIL).goTo(FAILED);

		BEHAVIOR.during(RINGING).on(CallTrigger.PROVISIONAL).stay();
		BEHAVIOR.during(RINGING).on(CallTrigger.ANSWERED).goTo(CONNECTED);
		BEHAVIOR.during(RINGING).on(CallTrigger.CHALLENGED).stay();
		BEHAVIOR.during(RINGING).on(CallTrigger.REJECTED).goTo(FAILED);
		BEHAVIOR.during(RINGING).on(CallTrigger.CANCEL).goTo(TERMINATING);
		BEHAVIOR.during(RINGING).on(CallTrigger.CANCEL_RECEIVED).goTo(ENDED);
		BEHAVIOR.during(RINGING).on(CallTrigger.ACCEPT).goTo(CONNECTED);
		BEHAVIOR.during(RINGING).on(CallTrigger.DECLINE).goTo(ENDED);
		BEHAVIOR.during(RINGING).on(CallTrigger.BYE_RECEIVED).goTo(TERMINATING);
		BEHAVIOR.during(RINGING).on(CallTrigger.FAIL).goTo(FAILED);

		BEHAVIOR.during(CONNECTED).on(CallTrigger.HOLD_CONFIRMED).goTo(ON_HOLD);
		BEHAVIOR.during(CONNECTED).on(CallTrigger.SEND_DTMF).stay();
		BEHAVIOR.during(CONNECTED).on(CallTrigger.HANGUP).goTo(TERMINATING);
		BEHAVIOR.during(CONNECTED).on(CallTrigger.BYE_RECEIVED).goTo(TERMINATING);
		BEHAVIOR.during(CONNECTED).on(CallTrigger.FAIL).goTo(FAILED);

		BEHAVIOR.during(ON_HOLD).on(CallTrigger.RESUME_CONFIRMED).goTo(CONNECTED);
		BEHAVIOR.during(ON_HOLD).on(CallTrigger.SEND_DTMF).stay();
		BEHAVIOR.during(ON_HOLD).on(CallTrigger.HANGUP).goTo(TERMINATING);
		BEHAVIOR.during(ON_HOLD).on(CallTrigger.BYE_RECEIVED).goTo(TERMINATING);
		BEHAVIOR.during(ON_HOLD).on(CallTrigger.FAIL).goTo(FAILED);

		BEHAVIOR.during(TERMINATING).on(CallTrigger.BYE_RECEIVED).stay();
		BEHAVIOR.during(TERMINATING).on(CallTrigger.TERMINATED).goTo(ENDED);
		BEHAVIOR.during(TERMINATING).on(CallTrigger.FAIL).goTo(FAILED);
	}

	private final Logger logger = LoggerFactory.getLogger(CallStateMachine.class);

	private final SignalingContext context;
	private final AccountCredentials credentials;
	private final NonceCounter nonceCounter;
	private final Observer observer;
	private final String callId;
	private final ContactHeader contact;

	private Direction direction;
	private String localTag;
	private String remoteTag;
	private Address localAddress;
	private Address remoteAddress;
	private URI remoteTarget;
	private List<Address> routeSet = new ArrayList<>();
	private long localSequenceNumber = 0;
	private long remoteSequenceNumber = -1;
	private String localSdp;
	private String remoteSdp;

	private Exchange inviteExchange;
	private Exchange reInviteExchange;
	private Exchange dtmfExchange;
	private ServerTransaction inviteServerTransaction;
	private boolean cancelSent;
	private Request lastAck;
	private boolean ackReceived;
	private Cancellable ackTimer;
	private Cancellable noAnswerTimer;
	private final Deque<DtmfTone> dtmfQueue = new ArrayDeque<>();

	public CallStateMachine(SignalingContext context, AccountCredentials credentials,
			NonceCounter nonceCounter, String callId, Observer observer) {
		super(IDLE);
		this.context = context;
		this.credentials = credentials;
		this.nonceCounter = nonceCounter;
		this.callId = callId;
		this.observer = observer;
		this.contact = context.getMessageFactory().createContact(credentials.getUsername());
	}

	@Override
	protected StateMachineBehavior<CallState, CallTrigger> getBehavior() {
		return BEHAVIOR;
	}

	/**
	 * Sends the initial INVITE to {@code targetUri} offering {@code sdp}.
	 */
	public void makeCall(String targetUri, String sdp) {
		checkAllowed(CallTrigger.MAKE_CALL);
		SipMessageFactory messageFactory = context.getMessageFactory();
		remoteAddress = messageFactory.createAddress(null, targetUri);
		direction = Direction.OUTGOING;
		localTag = messageFactory.newTag();
		localAddress = messageFactory.createAddress(credentials.getDisplayName(),
				credentials.getAddressOfRecord());
		remoteTarget = remoteAddress.getURI();
		localSdp = sdp;
		Request invite = createInDialogRequest(RequestMethod.INVITE.name());
		addContactAndAllow(invite);
		if (sdp != null) {
			messageFactory.setBody(invite, sdp, Constants.SDP_CONTENT_TYPE);
		}
		fire(CallTrigger.MAKE_CALL, "Calling " + targetUri, 0);
		inviteExchange = new InviteExchange();
		inviteExchange.start(invite, false);
		logger.info("Calling {} from {} ({}).", targetUri, credentials.getKey(), callId);
	}

	/**
	 * Initial INVITE received: builds the dialog from it and rings.
	 */
	public void onInviteReceived(ServerTransaction transaction) {
		checkAllowed(CallTrigger.INVITE_RECEIVED);
		Request invite = transaction.getRequest();
		direction = Direction.INCOMING;
		inviteServerTransaction = transaction;
		FromHeader from = SipMessages.fromOf(invite);
		remoteAddress = from.getAddress();
		remoteTag = from.getTag();
		localTag = context.getMessageFactory().newTag();
		localAddress = SipMessages.toOf(invite).getAddress();
		ContactHeader remoteContact = SipMessages.contactOf(invite);
		remoteTarget = remoteContact != null && remoteContact.getAddress() != null
				? remoteContact.getAddress().getURI() : remoteAddress.getURI();
		routeSet = recordRouteOf(invite);
		remoteSequenceNumber = SipMessages.sequenceNumberOf(invite);
		if (SipMessages.hasBody(invite)) {
			remoteSdp = SipMessages.bodyOf(invite);
		}
		fire(CallTrigger.INVITE_RECEIVED, "Incoming call from " + remoteAddress.getURI(), 0);
		respond(transaction, Response.RINGING, true);
	}

	public void accept(String sdp) {
		if (direction != Direction.INCOMING) {
			throw new IllegalTransitionException(getState(), CallTrigger.ACCEPT);
		}
		checkAllowed(CallTrigger.ACCEPT);
		localSdp = sdp;
		Response ok = createResponse(inviteServerTransaction.getRequest(), Response.OK, true);
		if (sdp != null) {
			context.getMessageFactory().setBody(ok, sdp, Constants.SDP_CONTENT_TYPE);
		}
		context.getTransactions().respond(inviteServerTransaction, ok);
		fire(CallTrigger.ACCEPT, "Answered", Response.OK);
		ackTimer = context.getWorker().schedule(new Runnable() {

			@Override
			public void run() {
				ackTimer = null;
				if (!ackReceived && canFire(CallTrigger.HANGUP)) {
					logger.warn("No ACK for call {}, hanging up.", callId);
					fire(CallTrigger.HANGUP, "No ACK received", Response.REQUEST_TIMEOUT);
					sendBye();
				}
			}

		}, context.getTransactions().getTimeoutMs());
	}

	public void decline(boolean busy) {
		if (direction != Direction.INCOMING) {
			throw new IllegalTransitionException(getState(), CallTrigger.DECLINE);
		}
		checkAllowed(CallTrigger.DECLINE);
		int statusCode = busy ? Response.BUSY_HERE : Response.DECLINE;
		respond(inviteServerTransaction, statusCode, false);
		fire(CallTrigger.DECLINE, busy ? "Busy" : "Declined", statusCode);
	}

	/**
	 * Ends the call: CANCEL while our INVITE is pending, a decline while an incoming
	 * call rings, BYE once the dialog is established.
	 */
	public void hangup() {
		CallState state = getState();
		if ((state == CALLING || state == RINGING) && direction == Direction.INCOMING) {
			decline(false);
			return;
		}
		if (state == CALLING || state == RINGING) {
			checkAllowed(CallTrigger.CANCEL);
			sendCancel();
			fire(CallTrigger.CANCEL, "Cancelled", 0);
			return;
		}
		checkAllowed(CallTrigger.HANGUP);
		fire(CallTrigger.HANGUP, "Hung up", 0);
		sendBye();
	}

	private void sendCancel() {
		if (cancelSent) {
			return;
		}
		cancelSent = true;
		ClientTransaction invite = inviteExchange.transaction;
		context.getTransactions().cancel(invite);
		Request cancel = context.getMessageFactory().createCancel(invite.getRequest());
		context.getTransactions().sendRequest(cancel, new ResponseListener() {

			@Override
			public void onResponse(ClientTransaction transaction, Response response) {
				logger.debug("CANCEL for {} answered with {}.", callId, response.getStatusCode());
			}

			@Override
			public void onFailure(ClientTransaction transaction, SiplineException failure) {
				logger.warn("CANCEL for {} failed: {}", callId, failure.getMessage());
			}

		});
		logger.info("Cancelling call {}.", callId);
	}

	private void sendBye() {
		Request bye = createInDialogRequest(RequestMethod.BYE.name());
		new Exchange() {

			@Override
			void handle(Response response) {
				if (SipMessages.isFinal(response)) {
					terminated("Call ended", response.getStatusCode());
				}
			}

			@Override
			void failed(SiplineException failure) {
				logger.warn("BYE for {} failed: {}", callId, failure.getMessage());
				terminated("Call ended", 0);
			}

			private void terminated(String reason, int statusCode) {
				if (canFire(CallTrigger.TERMINATED)) {
					fire(CallTrigger.TERMINATED, reason, statusCode);
				}
			}

		}.start(bye, false);
	}

	public boolean hold() {
		return sendReInvite(true);
	}

	public boolean resume() {
		return sendReInvite(false);
	}

	private boolean sendReInvite(final boolean hold) {
		final CallTrigger trigger = hold ? CallTrigger.HOLD_CONFIRMED : CallTrigger.RESUME_CONFIRMED;
		checkAllowed(trigger);
		if (reInviteExchange != null) {
			logger.warn("A re-INVITE is already pending for call {}.", callId);
			return false;
		}
		if (localSdp == null) {
			logger.warn("{} not possible for call {}: no local session description.",
					hold ? "Hold" : "Resume", callId);
			observer.onCallStateChanged(this, getState(), getState(), (hold ? "Hold" : "Resume")
					+ " rejected: no local session description", 0);
			return false;
		}
		final String sdp = SessionDescriptions.withDirection(localSdp,
				hold ? SessionDescriptions.SENDONLY : SessionDescriptions.SENDRECV);
		Request reInvite = createInDialogRequest(RequestMethod.INVITE.name());
		addContactAndAllow(reInvite);
		context.getMessageFactory().setBody(reInvite, sdp, Constants.SDP_CONTENT_TYPE);
		reInviteExchange = new Exchange() {

			@Override
			void handle(Response response) {
				if (!SipMessages.isFinal(response)) {
					return;
				}
				reInviteExchange = null;
				int statusCode = response.getStatusCode();
				if (SipMessages.isSuccess(response)) {
					sendAck(transaction.getRequest(), response);
					localSdp = sdp;
					if (SipMessages.hasBody(response)) {
						remoteSdp = SipMessages.bodyOf(response);
					}
					if (canFire(trigger)) {
						fire(trigger, hold ? "On hold" : "Resumed", statusCode);
					}
				}
				else if (statusCode == Response.CALL_OR_TRANSACTION_DOES_NOT_EXIST
						|| statusCode == Response.REQUEST_TIMEOUT) {
					failCall(statusCode + " " + response.getReasonPhrase(), statusCode);
				}
				else {
					logger.warn("{} rejected for call {} with {}.", hold ? "Hold" : "Resume", callId,
							statusCode);
					observer.onCallStateChanged(CallStateMachine.this, getState(), getState(),
							(hold ? "Hold" : "Resume") + " rejected: " + statusCode + " "
									+ response.getReasonPhrase(), statusCode);
				}
			}

			@Override
			void failed(SiplineException failure) {
				reInviteExchange = null;
				if (failure instanceof TransactionTimeoutException) {
					failCall(failure.getMessage(), Response.REQUEST_TIMEOUT);
				}
				else {
					logger.warn("re-INVITE for call {} not sent: {}", callId, failure.getMessage());
				}
			}

		};
		reInviteExchange.start(reInvite, false);
		logger.info("{} call {}.", hold ? "Holding" : "Resuming", callId);
		return true;
	}

	public void sendDtmf(char digit, int durationMs) {
		sendDtmfSequence(String.valueOf(digit), durationMs);
	}

	/**
	 * Queues {@code digits}; each INFO is sent once the previous one completed.
	 */
	public void sendDtmfSequence(String digits, int durationMs) {
		checkAllowed(CallTrigger.SEND_DTMF);
		Preconditions.checkArgument(durationMs > 0, "DTMF duration must be positive");
		for (char digit : digits.toCharArray()) {
			Preconditions.checkArgument(isDtmfDigit(digit), "Invalid DTMF digit '%s'", digit);
		}
		for (char digit : digits.toCharArray()) {
			dtmfQueue.add(new DtmfTone(Character.toUpperCase(digit), durationMs));
		}
		sendNextDtmf();
	}

	public static boolean isDtmfDigit(char digit) {
		return (digit >= '0' && digit <= '9') || digit == '*' || digit == '#'
				|| (Character.toUpperCase(digit) >= 'A' && Character.toUpperCase(digit) <= 'D');
	}

	private void sendNextDtmf() {
		if (dtmfExchange != null || dtmfQueue.isEmpty()) {
			return;
		}
		if (!canFire(CallTrigger.SEND_DTMF)) {
			drainDtmf();
			return;
		}
		final DtmfTone tone = dtmfQueue.poll();
		Request info = createInDialogRequest(RequestMethod.INFO.name());
		context.getMessageFactory().setBody(info, "Signal=" + tone.digit + "\r\nDuration="
				+ tone.durationMs + "\r\n", Constants.DTMF_CONTENT_TYPE);
		dtmfExchange = new Exchange() {

			@Override
			void handle(Response response) {
				if (!SipMessages.isFinal(response)) {
					return;
				}
				dtmfExchange = null;
				observer.onDtmfResult(CallStateMachine.this, tone.digit,
						SipMessages.isSuccess(response));
				sendNextDtmf();
			}

			@Override
			void failed(SiplineException failure) {
				dtmfExchange = null;
				observer.onDtmfResult(CallStateMachine.this, tone.digit, false);
				sendNextDtmf();
			}

		};
		dtmfExchange.start(info, false);
	}

	private void drainDtmf() {
		while (!dtmfQueue.isEmpty()) {
			observer.onDtmfResult(this, dtmfQueue.poll().digit, false);
		}
	}

	public void onAckReceived(Request ack) {
		ackReceived = true;
		if (ackTimer != null) {
			ackTimer.cancel();
			ackTimer = null;
		}
		if (SipMessages.hasBody(ack)) {
			remoteSdp = SipMessages.bodyOf(ack);
		}
		logger.debug("ACK received for call {}.", callId);
	}

	public void onCancelReceived(ServerTransaction cancelTransaction) {
		respond(cancelTransaction, Response.OK, false);
		if (direction == Direction.INCOMING && canFire(CallTrigger.CANCEL_RECEIVED)
				&& !inviteServerTransaction.isAnswered()) {
			respond(inviteServerTransaction, Response.REQUEST_TERMINATED, false);
			fire(CallTrigger.CANCEL_RECEIVED, "Cancelled by caller", Response.REQUEST_TERMINATED);
		}
	}

	/**
	 * Request received inside the established dialog.
	 */
	public void onRequestReceived(ServerTransaction transaction) {
		Request request = transaction.getRequest();
		long sequenceNumber = SipMessages.sequenceNumberOf(request);
		if (remoteSequenceNumber >= 0 && sequenceNumber < remoteSequenceNumber) {
			logger.warn("Out of order {} for call {} (CSeq {} < {}).", request.getMethod(), callId,
					sequenceNumber, remoteSequenceNumber);
			respond(transaction, Response.SERVER_INTERNAL_ERROR, false);
			return;
		}
		remoteSequenceNumber = sequenceNumber;
		switch (Constants.getRequestMethod(request.getMethod())) {
			case BYE:
				respond(transaction, Response.OK, false);
				if (canFire(CallTrigger.BYE_RECEIVED)) {
					fire(CallTrigger.BYE_RECEIVED, "Remote hung up", 0);
					fire(CallTrigger.TERMINATED, "Remote hung up", 0);
				}
				break;
			case INVITE:
				if (reInviteExchange != null) {
					respond(transaction, Response.REQUEST_PENDING, false);
					break;
				}
				if (SipMessages.hasBody(request)) {
					remoteSdp = SipMessages.bodyOf(request);
				}
				Response ok = createResponse(request, Response.OK, true);
				if (localSdp != null) {
					context.getMessageFactory().setBody(ok, localSdp, Constants.SDP_CONTENT_TYPE);
				}
				context.getTransactions().respond(transaction, ok);
				break;
			case INFO:
				respond(transaction, Response.OK, false);
				break;
			case OPTIONS:
				Response options = createResponse(request, Response.OK, false);
				context.getMessageFactory().addAllow(options);
				context.getTransactions().respond(transaction, options);
				break;
			default:
				Response notAllowed = createResponse(request, Response.METHOD_NOT_ALLOWED, false);
				context.getMessageFactory().addAllow(notAllowed);
				context.getTransactions().respond(transaction, notAllowed);
				break;
		}
	}

	/**
	 * A 2xx to our INVITE arrived again after its transaction completed: repeat the ACK.
	 */
	public void onRetransmittedSuccess(Response response) {
		if (lastAck != null && SipMessages.sequenceNumberOf(lastAck)
				== SipMessages.sequenceNumberOf(response)) {
			logger.debug("Repeating ACK for call {}.", callId);
			context.getTransactions().sendStateless(lastAck);
		}
	}

	/**
	 * Ends the call with a failure that did not come from the peer (transport loss).
	 */
	public void failCall(String reason, int statusCode) {
		if (canFire(CallTrigger.FAIL)) {
			fire(CallTrigger.FAIL, reason, statusCode);
		}
	}

	private Request createInDialogRequest(String method) {
		localSequenceNumber++;
		return context.getMessageFactory().createRequest(method, remoteTarget, localAddress,
				localTag, remoteAddress, remoteTag, callId, localSequenceNumber, routeSet);
	}

	private Response createResponse(Request request, int statusCode, boolean withContact) {
		Response response = context.getMessageFactory().createResponse(request, statusCode, localTag);
		if (withContact) {
			addContactAndAllow(response);
		}
		return response;
	}

	private void addContactAndAllow(Message message) {
		message.addHeader((Header) contact.clone());
		context.getMessageFactory().addAllow(message);
	}

	private static List<Address> recordRouteOf(Message message) {
		List<Address> recordRoute = new ArrayList<>();
		for (Header header : SipMessages.headersOf(message, RecordRouteHeader.NAME)) {
			recordRoute.add(((RecordRouteHeader) header).getAddress());
		}
		return recordRoute;
	}

	private void respond(ServerTransaction transaction, int statusCode, boolean withContact) {
		context.getTransactions().respond(transaction,
				createResponse(transaction.getRequest(), statusCode, withContact));
	}

	private void sendAck(Request invite, Response response) {
		Request ack = context.getMessageFactory().createRequest(RequestMethod.ACK.name(),
				remoteTarget, localAddress, localTag, remoteAddress, SipMessages.toTagOf(response),
				callId, SipMessages.sequenceNumberOf(invite), routeSet);
		lastAck = ack;
		context.getTransactions().sendStateless(ack);
	}

	private void establish(Response response) {
		remoteTag = SipMessages.toTagOf(response);
		ContactHeader remoteContact = SipMessages.contactOf(response);
		if (remoteContact != null && remoteContact.getAddress() != null) {
			remoteTarget = remoteContact.getAddress().getURI();
		}
		List<Address> recordRoute = recordRouteOf(response);
		Collections.reverse(recordRoute);
		routeSet = recordRoute;
		if (SipMessages.hasBody(response)) {
			remoteSdp = SipMessages.bodyOf(response);
		}
	}

	private void startNoAnswerTimer() {
		long noAnswerMs = context.getConfig().getNoAnswerTimeoutMs();
		if (noAnswerMs <= 0 || noAnswerTimer != null) {
			return;
		}
		noAnswerTimer = context.getWorker().schedule(new Runnable() {

			@Override
			public void run() {
				noAnswerTimer = null;
				if (getState() == CALLING || getState() == RINGING) {
					logger.info("Call {} not answered within {}ms, cancelling.", callId,
							context.getConfig().getNoAnswerTimeoutMs());
					hangup();
				}
			}

		}, noAnswerMs);
	}

	private void cancelNoAnswerTimer() {
		if (noAnswerTimer != null) {
			noAnswerTimer.cancel();
			noAnswerTimer = null;
		}
	}

	@Override
	protected void stateHasChanged(CallState oldState, CallState newState, String reason, int statusCode) {
		logger.debug("Call {}: {} -> {} ({}).", callId, oldState, newState, reason);
		if (newState != CALLING && newState != RINGING) {
			cancelNoAnswerTimer();
		}
		if (newState.isTerminal()) {
			if (ackTimer != null) {
				ackTimer.cancel();
				ackTimer = null;
			}
			for (Exchange pending : new Exchange[] { inviteExchange, reInviteExchange, dtmfExchange }) {
				if (pending != null && pending.transaction != null && !pending.transaction.isTerminated()) {
					context.getTransactions().cancel(pending.transaction);
				}
			}
			drainDtmf();
		}
		observer.onCallStateChanged(this, oldState, newState, reason, statusCode);
	}

	private static String reasonFor(Response response) {
		switch (response.getStatusCode()) {
			case Response.BUSY_HERE:
				return "Busy";
			case Response.DECLINE:
				return "Declined";
			case Response.NOT_FOUND:
				return "Not found";
			case Response.REQUEST_TERMINATED:
				return "Cancelled";
			default:
				return response.getStatusCode() + " " + response.getReasonPhrase();
		}
	}

	/**
	 * A request sent inside this dialog, answered at most once with credentials
	 * when challenged.
	 */
	private abstract class Exchange implements ResponseListener {

		ClientTransaction transaction;

		void start(Request request, boolean authenticatedRetry) {
			transaction = context.getTransactions().sendRequest(request, this, authenticatedRetry);
		}

		@Override
		public void onResponse(ClientTransaction responded, Response response) {
			if (responded != transaction) {
				logger.warn("Ignoring {} for a stale {} of call {}.", response.getStatusCode(),
						responded.getMethod(), callId);
				return;
			}
			if (SipMessages.isFinal(response) && Constants.isChallenge(response.getStatusCode())
					&& !responded.isAuthenticatedRetry() && !responded.isCancelled()) {
				try {
					Request retry = context.getAuthenticationHandler().authorize(
							responded.getRequest(), response, credentials, nonceCounter);
					localSequenceNumber = Math.max(localSequenceNumber,
							SipMessages.sequenceNumberOf(retry));
					challenged();
					start(retry, true);
					return;
				} catch (UnsupportedChallengeException unsupported) {
					logger.error("Cannot answer challenge for {} of call {}: {}",
							responded.getMethod(), callId, unsupported.getMessage());
				}
			}
			handle(response);
		}

		@Override
		public void onFailure(ClientTransaction failed, SiplineException failure) {
			if (failed != transaction) {
				return;
			}
			failed(failure);
		}

		void challenged() {}

		abstract void handle(Response response);

		abstract void failed(SiplineException failure);

	}

	private class InviteExchange extends Exchange {

		@Override
		void challenged() {
			if (canFire(CallTrigger.CHALLENGED)) {
				fire(CallTrigger.CHALLENGED);
			}
		}

		@Override
		void handle(Response response) {
			int statusCode = response.getStatusCode();
			if (!SipMessages.isFinal(response)) {
				if (statusCode == Response.TRYING) {
					return;
				}
				if (SipMessages.toTagOf(response) != null) {
					remoteTag = SipMessages.toTagOf(response);
				}
				if (SipMessages.hasBody(response)) {
					remoteSdp = SipMessages.bodyOf(response);
				}
				if (canFire(CallTrigger.PROVISIONAL)) {
					fire(CallTrigger.PROVISIONAL, "Ringing", statusCode);
					startNoAnswerTimer();
				}
				return;
			}
			if (SipMessages.isSuccess(response)) {
				establish(response);
				sendAck(transaction.getRequest(), response);
				if (getState() == TERMINATING) {
					logger.info("Call {} answered after CANCEL, sending BYE.", callId);
					sendBye();
					return;
				}
				if (canFire(CallTrigger.ANSWERED)) {
					fire(CallTrigger.ANSWERED, "Answered", statusCode);
				}
				return;
			}
			if (getState() == TERMINATING) {
				fire(CallTrigger.TERMINATED, reasonFor(response), statusCode);
				return;
			}
			if (canFire(CallTrigger.REJECTED)) {
				logger.info("Call {} rejected with {} {}.", callId, statusCode, response.getReasonPhrase());
				fire(CallTrigger.REJECTED, reasonFor(response), statusCode);
			}
		}

		@Override
		void failed(SiplineException failure) {
			if (getState() == TERMINATING) {
				fire(CallTrigger.TERMINATED, "Cancelled", 0);
				return;
			}
			if (canFire(CallTrigger.REJECTED)) {
				logger.error("INVITE for call {} failed: {}", callId, failure.getMessage());
				boolean timeout = failure instanceof TransactionTimeoutException;
				if (timeout) {
					sendCancel();
				}
				fire(CallTrigger.REJECTED, failure.getMessage(), timeout ? Response.REQUEST_TIMEOUT : 0);
			}
		}

	}

	private static class DtmfTone {

		private final char digit;
		private final int durationMs;

		DtmfTone(char digit, int durationMs) {
			this.digit = digit;
			this.durationMs = durationMs;
		}

	}

	public String getCallId() {
		return callId;
	}

	public Direction getDirection() {
		return direction;
	}

	public String getLocalTag() {
		return localTag;
	}

	public String getRemoteTag() {
		return remoteTag;
	}

	public Address getRemoteAddress() {
		return remoteAddress;
	}

	public String getRemoteNumber() {
		return SipMessages.userOf(remoteAddress);
	}

	public URI getRemoteTarget() {
		return remoteTarget;
	}

	public List<Address> getRouteSet() {
		return Collections.unmodifiableList(routeSet);
	}

	public long getLocalSequenceNumber() {
		return localSequenceNumber;
	}

	public long getRemoteSequenceNumber() {
		return remoteSequenceNumber;
	}

	public String getLocalSdp() {
		return localSdp;
	}

	public String getRemoteSdp() {
		return remoteSdp;
	}

	public boolean isOnHold() {
		return getState() == ON_HOLD;
	}

	public boolean isReInvitePending() {
		return reInviteExchange != null;
	}

	public boolean isCancelSent() {
		return cancelSent;
	}

	public boolean isAckReceived() {
		return ackReceived;
	}

	public AccountCredentials getCredentials() {
		return credentials;
	}

	public int getQueuedDtmfCount() {
		return dtmfQueue.size() + (dtmfExchange != null ? 1 : 0);
	}

}
