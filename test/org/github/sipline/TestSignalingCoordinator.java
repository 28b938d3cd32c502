package org.github.sipline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import javax.sip.address.Address;
import javax.sip.header.AllowHeader;
import javax.sip.header.AuthorizationHeader;
import javax.sip.header.ContactHeader;
import javax.sip.header.ExpiresHeader;
import javax.sip.header.Header;
import javax.sip.header.WWWAuthenticateHeader;
import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.auth.AuthenticationHandler;
import org.github.sipline.events.CallStateChanged;
import org.github.sipline.events.DtmfResult;
import org.github.sipline.events.IncomingCall;
import org.github.sipline.events.RecordingSink;
import org.github.sipline.events.RegistrationStateChanged;
import org.github.sipline.events.TransportStateChanged;
import org.github.sipline.messages.MessageCodec;
import org.github.sipline.messages.SipMessageFactory;
import org.github.sipline.messages.SipMessages;
import org.github.sipline.state.CallState;
import org.github.sipline.state.RegistrationState;
import org.github.sipline.transport.FakeWebSocketConnector;
import org.github.sipline.transport.FakeWebSocketConnector.FakeConnection;
import org.github.sipline.transport.TransportSession;
import org.github.sipline.transport.TransportState;
import org.github.sipline.worker.ManualSignalingWorker;
import org.junit.Before;
import org.junit.Test;

import com.google.common.base.Suppliers;

public class TestSignalingCoordinator {

	private static final String ALICE = "alice@example.org";
	private static final String SDP = "v=0\r\n"
			+ "o=- 20518 0 IN IP4 203.0.113.1\r\n"
			+ "s=-\r\n"
			+ "c=IN IP4 203.0.113.1\r\n"
			+ "t=0 0\r\n"
			+ "m=audio 54400 RTP/AVP 0\r\n"
			+ "a=sendrecv\r\n";
	private static final String BOB_CONTACT = "<sip:bob@198.51.100.7;transport=ws>";

	private final MessageCodec codec = new MessageCodec();
	private final SipMessageFactory remote = new SipMessageFactory("WSS", "RemotePhone", null);
	private ManualSignalingWorker worker;
	private FakeWebSocketConnector connector;
	private SignalingConfig config;
	private SignalingCoordinator coordinator;
	private RecordingSink sink;

	@Before
	public void setUp() {
		worker = new ManualSignalingWorker();
		connector = new FakeWebSocketConnector();
		config = new SignalingConfig();
		config.setDomain("example.org");
		config.setTransportUrl("wss://edge.example.org/ws");
		config.addAccount(new AccountCredentials("alice", "wonderland", "example.org", "Alice"));
		coordinator = newCoordinator();
		sink = new RecordingSink();
		coordinator.setListener(sink);
	}

	private SignalingCoordinator newCoordinator() {
		return new SignalingCoordinator(config, worker, connector,
				new AuthenticationHandler(Suppliers.ofInstance("c0ffee")));
	}

	@Test
	public void registrationWaitsForTheTransport() throws Exception {
		coordinator.start();
		worker.runPending();
		assertEquals(1, connector.getConnections().size());
		assertEquals(RegistrationState.NONE, coordinator.getRegistrationState(ALICE));
		assertTrue(sentMessages().isEmpty());

		connection().open();
		worker.runPending();
		assertEquals(TransportState.CONNECTED, sink.last(TransportStateChanged.class).getState());
		assertEquals("Connected", sink.last(TransportStateChanged.class).getReason());
		Request register = lastSentRequest("REGISTER");
		assertNotNull(register);
		assertEquals("WSS", SipMessages.topViaOf(register).getTransport());

		Response challenge = remote.createResponse(register, 401, "registrar");
		challenge.addHeader(remote.createHeader(WWWAuthenticateHeader.NAME,
				"Digest realm=\"example.org\", nonce=\"n1\", qop=\"auth\""));
		deliver(challenge);
		Request authorized = lastSentRequest("REGISTER");
		assertEquals("alice", ((AuthorizationHeader) authorized.getHeader(AuthorizationHeader.NAME))
				.getUsername());

		deliver(remote.createResponse(authorized, 200, "registrar"));
		assertEquals(RegistrationState.REGISTERED, coordinator.getRegistrationState(ALICE));
		RegistrationStateChanged registered = sink.last(RegistrationStateChanged.class);
		assertEquals(ALICE, registered.getAccountKey());
		assertEquals(RegistrationState.REGISTERING, registered.getOldState());
		assertEquals(RegistrationState.REGISTERED, registered.getNewState());
		assertEquals(200, registered.getStatusCode());
	}

	@Test
	public void incomingCallIsAnnouncedAcceptedAndEndedByThePeer() throws Exception {
		registerAlice();
		Request invite = incomingInvite("sip:alice@example.org");
		deliver(invite);

		assertEquals(180, lastSentResponse().getStatusCode());
		IncomingCall incoming = sink.last(IncomingCall.class);
		assertEquals(ALICE, incoming.getAccountKey());
		String callId = SipMessages.callIdOf(invite);
		assertEquals(callId, incoming.getCallId());
		assertEquals("bob", incoming.getCallerNumber());
		assertEquals(SDP, incoming.getRemoteSdp());
		assertEquals(CallState.RINGING, coordinator.getCallState(callId));

		// a retransmitted INVITE is answered again and not announced twice
		deliver(invite);
		assertEquals(1, sink.getEvents(IncomingCall.class).size());

		coordinator.acceptCall(callId, SDP);
		worker.runPending();
		Response ok = lastSentResponse();
		assertEquals(200, ok.getStatusCode());
		assertEquals(SDP, SipMessages.bodyOf(ok));
		assertEquals(CallState.CONNECTED, coordinator.getCallState(callId));
		String localTag = SipMessages.toTagOf(ok);

		deliver(inDialogRequest(invite, "ACK", localTag, 1));
		deliver(inDialogRequest(invite, "BYE", localTag, 2));
		assertEquals(200, lastSentResponse().getStatusCode());
		assertEquals("BYE", SipMessages.cseqMethodOf(lastSentResponse()));
		CallStateChanged ended = sink.last(CallStateChanged.class);
		assertEquals(CallState.ENDED, ended.getNewState());
		assertTrue(coordinator.getActiveCallIds().isEmpty());
	}

	@Test
	public void secondInitialInviteForAKnownCallIsRejected() throws Exception {
		registerAlice();
		Request invite = incomingInvite("sip:alice@example.org");
		deliver(invite);
		Request again = remote.createRequest(Request.INVITE, invite.getRequestURI(),
				SipMessages.fromOf(invite).getAddress(), SipMessages.fromTagOf(invite),
				SipMessages.toOf(invite).getAddress(), null, SipMessages.callIdOf(invite), 2);
		again.addHeader(bobContact());
		deliver(again);
		assertEquals(500, lastSentResponse().getStatusCode());
		assertEquals(1, sink.getEvents(IncomingCall.class).size());
	}

	@Test
	public void outgoingCallThroughTheApi() throws Exception {
		registerAlice();
		String callId = coordinator.makeCall(ALICE, "bob", SDP);
		assertNotNull(callId);
		worker.runPending();
		Request invite = lastSentRequest("INVITE");
		assertEquals("sip:bob@example.org", invite.getRequestURI().toString());
		assertEquals(callId, SipMessages.callIdOf(invite));
		assertEquals("Alice", SipMessages.fromOf(invite).getAddress().getDisplayName());

		deliver(remote.createResponse(invite, 180, "bob-tag"));
		Response ok = remote.createResponse(invite, 200, "bob-tag");
		ok.addHeader(bobContact());
		remote.setBody(ok, SDP, Constants.SDP_CONTENT_TYPE);
		deliver(ok);
		assertEquals(CallState.CONNECTED, coordinator.getCallState(callId));
		assertEquals("sip:bob@198.51.100.7;transport=ws",
				lastSentRequest("ACK").getRequestURI().toString());

		// the 2xx arrives again after the transaction completed
		deliver(ok);
		assertEquals(2, sentRequests("ACK").size());

		coordinator.sendDtmf(callId, '5', 160);
		worker.runPending();
		Request info = lastSentRequest("INFO");
		assertEquals("Signal=5\r\nDuration=160\r\n", SipMessages.bodyOf(info));
		deliver(remote.createResponse(info, 200, null));
		DtmfResult dtmf = sink.last(DtmfResult.class);
		assertEquals('5', dtmf.getDigit());
		assertTrue(dtmf.isSuccess());

		coordinator.hangup(callId);
		worker.runPending();
		Request bye = lastSentRequest("BYE");
		deliver(remote.createResponse(bye, 200, null));

		List<CallState> states = new ArrayList<>();
		for (CallStateChanged changed : sink.getEvents(CallStateChanged.class)) {
			states.add(changed.getNewState());
		}
		assertEquals(Arrays.asList(CallState.CALLING, CallState.RINGING, CallState.CONNECTED,
				CallState.TERMINATING, CallState.ENDED), states);
		assertNull(coordinator.getCallState(callId));
	}

	@Test
	public void callFromUnknownAccountFailsRightAway() {
		String callId = coordinator.makeCall("nobody@example.org", "bob", SDP);
		worker.runPending();
		CallStateChanged failed = sink.last(CallStateChanged.class);
		assertEquals(callId, failed.getCallId());
		assertEquals(CallState.IDLE, failed.getOldState());
		assertEquals(CallState.FAILED, failed.getNewState());
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalidDtmfDigitIsRejectedImmediately() {
		coordinator.sendDtmf("call-1", 'X', 160);
	}

	@Test
	public void requestsOutsideAnyDialog() throws Exception {
		registerAlice();
		deliver(outOfDialog(Request.OPTIONS, null, "c-options"));
		assertEquals(200, lastSentResponse().getStatusCode());
		assertTrue(allowedMethods(lastSentResponse()).contains("INVITE"));

		deliver(outOfDialog(Request.BYE, null, "c-bye"));
		assertEquals(481, lastSentResponse().getStatusCode());

		deliver(outOfDialog(Request.INFO, "gone", "c-info"));
		assertEquals(481, lastSentResponse().getStatusCode());

		deliver(outOfDialog(Request.SUBSCRIBE, null, "c-sub"));
		assertEquals(405, lastSentResponse().getStatusCode());
		assertTrue(allowedMethods(lastSentResponse()).contains("BYE"));

		Request invite = incomingInvite("sip:alice@example.org");
		deliver(remote.createCancel(invite));
		assertEquals(481, lastSentResponse().getStatusCode());
	}

	@Test
	public void malformedFramesAreDropped() throws Exception {
		registerAlice();
		int sentBefore = sentMessages().size();
		connection().receive("HELLO WORLD\r\n\r\n");
		connection().receive("SIP/2.0 200 OK\r\nContent-Length: 4\r\n\r\n");
		worker.runPending();
		assertEquals(sentBefore, sentMessages().size());
		assertEquals(RegistrationState.REGISTERED, coordinator.getRegistrationState(ALICE));
	}

	@Test
	public void incomingCallWithoutAnyAccountIsNotFound() throws Exception {
		config = new SignalingConfig();
		config.setTransportUrl("wss://edge.example.org/ws");
		coordinator = newCoordinator();
		coordinator.setListener(sink);
		coordinator.start();
		worker.runPending();
		connection().open();
		worker.runPending();

		deliver(incomingInvite("sip:carol@example.org"));
		assertEquals(404, lastSentResponse().getStatusCode());
		assertTrue(sink.getEvents(IncomingCall.class).isEmpty());
	}

	@Test
	public void transportLossFailsRegistrationsAndReRegistersOnReconnect() throws Exception {
		registerAlice();
		String callId = connectedOutgoingCall();
		FakeConnection lost = connection();

		lost.fail("Connection reset");
		worker.runPending();
		TransportStateChanged down = sink.last(TransportStateChanged.class);
		assertEquals(TransportState.DISCONNECTED, down.getState());
		assertEquals("Connection reset", down.getReason());
		assertEquals(RegistrationState.FAILED, coordinator.getRegistrationState(ALICE));
		assertEquals(CallState.CONNECTED, coordinator.getCallState(callId));

		worker.advance(config.getReconnectInitialMs());
		assertEquals(2, connector.getConnections().size());
		connection().open();
		worker.runPending();
		assertEquals("Reconnected", sink.last(TransportStateChanged.class).getReason());
		Request register = lastSentRequest("REGISTER");
		assertNotNull(register);
		assertEquals(RegistrationState.REGISTERING, coordinator.getRegistrationState(ALICE));

		deliver(remote.createResponse(register, 200, "registrar"));
		assertEquals(RegistrationState.REGISTERED, coordinator.getRegistrationState(ALICE));
		worker.advance(config.getCallGraceMs());
		assertEquals(CallState.CONNECTED, coordinator.getCallState(callId));
	}

	@Test
	public void callsFailWhenTheTransportStaysDown() throws Exception {
		registerAlice();
		String callId = connectedOutgoingCall();

		connection().fail("Connection reset");
		worker.runPending();
		worker.advance(config.getCallGraceMs() - 1);
		assertEquals(CallState.CONNECTED, coordinator.getCallState(callId));
		worker.advance(1);

		CallStateChanged failed = sink.last(CallStateChanged.class);
		assertEquals(CallState.CONNECTED, failed.getOldState());
		assertEquals(CallState.FAILED, failed.getNewState());
		assertEquals("Transport lost: Connection reset", failed.getReason());
		assertTrue(coordinator.getActiveCallIds().isEmpty());
	}

	@Test
	public void replacedListenerStopsReceivingEvents() throws Exception {
		RecordingSink replacement = new RecordingSink();
		coordinator.setListener(replacement);
		coordinator.start();
		worker.runPending();
		connection().open();
		worker.runPending();

		assertTrue(sink.getEvents().isEmpty());
		assertEquals(1, replacement.getEvents(TransportStateChanged.class).size());

		coordinator.setListener(null);
		deliver(remote.createResponse(lastSentRequest("REGISTER"), 200, "registrar"));
		assertEquals(RegistrationState.REGISTERED, coordinator.getRegistrationState(ALICE));
		assertEquals(1, replacement.getEvents(RegistrationStateChanged.class).size());
	}

	@Test
	public void unregisterSendsExpiresZeroAndForgetsTheAccount() throws Exception {
		registerAlice();
		coordinator.unregister(ALICE);
		worker.runPending();
		Request unregister = lastSentRequest("REGISTER");
		assertEquals(0, expiresOf(unregister));

		deliver(remote.createResponse(unregister, 200, "registrar"));
		assertEquals(RegistrationState.UNREGISTERED, sink.last(RegistrationStateChanged.class).getNewState());
		assertNull(coordinator.getRegistrationState(ALICE));
	}

	@Test
	public void shutdownHangsUpUnregistersAndCloses() throws Exception {
		registerAlice();
		String callId = connectedOutgoingCall();
		FakeConnection connection = connection();

		coordinator.shutdown();
		worker.runPending();

		assertNotNull(lastSentRequest("BYE"));
		assertEquals(0, expiresOf(lastSentRequest("REGISTER")));
		assertTrue(connection.isClosed());
		assertEquals(TransportSession.NORMAL_CLOSURE, connection.getCloseCode());
		assertEquals(TransportState.CLOSED, sink.last(TransportStateChanged.class).getState());
		assertTrue(worker.isShutdown());
		assertNull(coordinator.getCallState(callId));
		assertNull(coordinator.getRegistrationState(ALICE));
	}

	@Test
	public void holdWithoutSessionDescriptionIsReportedAsRejected() throws Exception {
		registerAlice();
		Request invite = incomingInvite("sip:alice@example.org");
		deliver(invite);
		String callId = SipMessages.callIdOf(invite);
		coordinator.acceptCall(callId, null);
		worker.runPending();
		deliver(inDialogRequest(invite, Request.ACK, SipMessages.toTagOf(lastSentResponse()), 1));
		int sentBefore = sentMessages().size();

		coordinator.hold(callId);
		worker.runPending();
		CallStateChanged rejected = sink.last(CallStateChanged.class);
		assertEquals(CallState.CONNECTED, rejected.getOldState());
		assertEquals(CallState.CONNECTED, rejected.getNewState());
		assertTrue(rejected.getReason().startsWith("Hold rejected"));
		assertEquals(sentBefore, sentMessages().size());
		assertEquals(CallState.CONNECTED, coordinator.getCallState(callId));
	}

	@Test
	public void stateCanBeReadFromAnotherThreadWhileCallsComeAndGo() throws Exception {
		registerAlice();
		final AtomicBoolean running = new AtomicBoolean(true);
		final AtomicReference<Throwable> failure = new AtomicReference<>();
		Thread reader = new Thread(new Runnable() {

			@Override
			public void run() {
				try {
					while (running.get()) {
						for (String callId : coordinator.getActiveCallIds()) {
							coordinator.getCallState(callId);
						}
						coordinator.getRegistrationState(ALICE);
						coordinator.getTransportState();
					}
				} catch (Throwable unexpected) {
					failure.set(unexpected);
				}
			}

		});
		reader.start();
		try {
			for (int i = 0; i < 50; i++) {
				String callId = coordinator.makeCall(ALICE, "bob", SDP);
				worker.runPending();
				Request invite = (Request) codec.parse(connection().lastSent());
				coordinator.hangup(callId);
				worker.runPending();
				deliver(remote.createResponse(invite, 487, "bob-tag"));
				assertNull(coordinator.getCallState(callId));
			}
		} finally {
			running.set(false);
			reader.join();
		}
		assertNull(failure.get());
		assertTrue(coordinator.getActiveCallIds().isEmpty());
		assertEquals(TransportState.CONNECTED, coordinator.getTransportState());
	}

	@Test
	public void targetsAreNormalized() {
		assertEquals("sip:bob@example.org", SignalingCoordinator.normalizeTarget("bob", "example.org"));
		assertEquals("sip:bob@other.org", SignalingCoordinator.normalizeTarget(" bob@other.org ", "example.org"));
		assertEquals("sips:bob@other.org", SignalingCoordinator.normalizeTarget("sips:bob@other.org", "example.org"));
		assertEquals("SIP:bob@other.org", SignalingCoordinator.normalizeTarget("SIP:bob@other.org", "example.org"));
	}

	private void registerAlice() throws Exception {
		coordinator.start();
		worker.runPending();
		connection().open();
		worker.runPending();
		deliver(remote.createResponse(lastSentRequest("REGISTER"), 200, "registrar"));
		assertEquals(RegistrationState.REGISTERED, coordinator.getRegistrationState(ALICE));
	}

	private String connectedOutgoingCall() throws Exception {
		String callId = coordinator.makeCall(ALICE, "sip:bob@example.org", SDP);
		worker.runPending();
		Response ok = remote.createResponse(lastSentRequest("INVITE"), 200, "bob-tag");
		ok.addHeader(bobContact());
		deliver(ok);
		assertEquals(CallState.CONNECTED, coordinator.getCallState(callId));
		return callId;
	}

	private Request incomingInvite(String toUri) {
		Request invite = remote.createRequest(Request.INVITE,
				remote.createUri("sip:alice@host.invalid;transport=ws"),
				remote.createAddress(null, "sip:bob@example.org"), remote.newTag(),
				remote.createAddress(null, toUri), null, remote.newCallId(), 1);
		invite.addHeader(bobContact());
		remote.setBody(invite, SDP, Constants.SDP_CONTENT_TYPE);
		return invite;
	}

	private Request inDialogRequest(Request invite, String method, String localTag, long sequenceNumber) {
		return remote.createRequest(method, remote.createUri("sip:alice@host.invalid;transport=ws"),
				SipMessages.fromOf(invite).getAddress(), SipMessages.fromTagOf(invite),
				SipMessages.toOf(invite).getAddress(), localTag, SipMessages.callIdOf(invite),
				sequenceNumber);
	}

	private Request outOfDialog(String method, String toTag, String callId) {
		Address alice = remote.createAddress(null, "sip:alice@example.org");
		return remote.createRequest(method, remote.createUri("sip:alice@example.org"),
				remote.createAddress(null, "sip:bob@example.org"), "b1", alice, toTag, callId, 1);
	}

	private ContactHeader bobContact() {
		return (ContactHeader) remote.createHeader(ContactHeader.NAME, BOB_CONTACT);
	}

	private static List<String> allowedMethods(Response response) {
		List<String> methods = new ArrayList<>();
		for (Header allow : SipMessages.headersOf(response, AllowHeader.NAME)) {
			methods.add(((AllowHeader) allow).getMethod());
		}
		return methods;
	}

	private static int expiresOf(Request request) {
		return ((ExpiresHeader) request.getHeader(ExpiresHeader.NAME)).getExpires();
	}

	private FakeConnection connection() {
		return connector.last();
	}

	private void deliver(Message message) {
		connection().receive(codec.buildText(message));
		worker.runPending();
	}

	private List<Message> sentMessages() throws Exception {
		List<Message> messages = new ArrayList<>();
		for (FakeConnection connection : connector.getConnections()) {
			for (String frame : connection.getSent()) {
				if (!frame.trim().isEmpty()) {
					messages.add(codec.parse(frame));
				}
			}
		}
		return messages;
	}

	private List<Request> sentRequests(String method) throws Exception {
		List<Request> requests = new ArrayList<>();
		for (Message message : sentMessages()) {
			if (message instanceof Request && ((Request) message).getMethod().equals(method)) {
				requests.add((Request) message);
			}
		}
		return requests;
	}

	private Request lastSentRequest(String method) throws Exception {
		List<Request> requests = sentRequests(method);
		return requests.isEmpty() ? null : requests.get(requests.size() - 1);
	}

	private Response lastSentResponse() throws Exception {
		Response last = null;
		for (Message message : sentMessages()) {
			if (message instanceof Response) {
				last = (Response) message;
			}
		}
		assertFalse("no response was sent", last == null);
		return last;
	}

}
