package org.github.sipline.messages;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.sip.address.Address;
import javax.sip.header.Header;
import javax.sip.header.RecordRouteHeader;
import javax.sip.header.SubjectHeader;
import javax.sip.header.ViaHeader;
import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.exceptions.MalformedMessageException;
import org.junit.Test;

import com.google.common.base.CharMatcher;

public class TestMessageCodec {

	private static final String INVITE = "INVITE sip:bob@example.org SIP/2.0\r\n"
			+ "v: SIP/2.0/WSS df7jal23ls0d.invalid;branch=z9hG4bKnashds7\r\n"
			+ "Max-Forwards: 70\r\n"
			+ "f: \"Alice\" <sip:alice@example.org>;tag=1928301774\r\n"
			+ "t: <sip:bob@example.org>\r\n"
			+ "i: a84b4c76e66710@pc33.example.org\r\n"
			+ "CSeq: 314159 INVITE\r\n"
			+ "m: <sip:alice@df7jal23ls0d.invalid;transport=ws>\r\n"
			+ "c: application/sdp\r\n"
			+ "l: 4\r\n"
			+ "\r\n"
			+ "v=0\n";

	private final MessageCodec codec = new MessageCodec();
	private final SipMessageFactory messageFactory = new SipMessageFactory("WSS", null, null);

	@Test
	public void parsesRequestWithCompactHeaders() throws MalformedMessageException {
		Message message = codec.parse(INVITE);
		assertTrue(message instanceof Request);
		Request request = (Request) message;
		assertEquals(Request.INVITE, request.getMethod());
		assertEquals("sip:bob@example.org", request.getRequestURI().toString());
		assertEquals("a84b4c76e66710@pc33.example.org", SipMessages.callIdOf(request));
		assertEquals(314159L, SipMessages.sequenceNumberOf(request));
		assertEquals("1928301774", SipMessages.fromTagOf(request));
		assertEquals("Alice", SipMessages.fromOf(request).getAddress().getDisplayName());
		assertEquals("alice", SipMessages.userOf(SipMessages.fromOf(request).getAddress()));
		assertNull(SipMessages.toTagOf(request));
		assertEquals("z9hG4bKnashds7", SipMessages.branchOf(request));
		assertEquals("application/sdp", SipMessages.contentTypeOf(request));
		assertEquals("v=0\n", SipMessages.bodyOf(request));
	}

	@Test
	public void acceptsBareLineFeedsAndFoldedHeaders() throws MalformedMessageException {
		String text = "SIP/2.0 180 Ringing\n"
				+ "Via: SIP/2.0/WSS host.invalid;branch=z9hG4bK776asdhds\n"
				+ "From: <sip:alice@example.org>;tag=88sja8x\n"
				+ "To: <sip:bob@example.org>;tag=a6c85cf\n"
				+ "Call-ID: a84b4c76e66710\n"
				+ "CSeq: 1 INVITE\n"
				+ "Subject: lunch\n"
				+ "  tomorrow\n"
				+ "\n";
		Response response = (Response) codec.parse(text);
		assertEquals(180, response.getStatusCode());
		assertEquals("Ringing", response.getReasonPhrase());
		assertEquals("a6c85cf", SipMessages.toTagOf(response));
		SubjectHeader subject = (SubjectHeader) response.getHeader(SubjectHeader.NAME);
		assertEquals("lunch tomorrow",
				CharMatcher.whitespace().trimAndCollapseFrom(subject.getSubject(), ' '));
		assertFalse(SipMessages.hasBody(response));
	}

	@Test
	public void keepsListHeadersInOrder() throws MalformedMessageException {
		String text = "BYE sip:alice@host.invalid SIP/2.0\r\n"
				+ "Via: SIP/2.0/WSS proxy.example.org;branch=z9hG4bKa, SIP/2.0/WSS edge.example.org;branch=z9hG4bKb\r\n"
				+ "Via: SIP/2.0/WSS client.invalid;branch=z9hG4bKc\r\n"
				+ "Record-Route: <sip:p1.example.org;lr>, <sip:p2.example.org;lr>\r\n"
				+ "From: <sip:bob@example.org>;tag=x\r\n"
				+ "To: <sip:alice@example.org>;tag=y\r\n"
				+ "Call-ID: c1\r\n"
				+ "CSeq: 2 BYE\r\n"
				+ "Content-Length: 0\r\n"
				+ "\r\n";
		Message message = codec.parse(text);
		List<String> branches = new ArrayList<>();
		for (Header via : SipMessages.headersOf(message, ViaHeader.NAME)) {
			branches.add(((ViaHeader) via).getBranch());
		}
		assertEquals(Arrays.asList("z9hG4bKa", "z9hG4bKb", "z9hG4bKc"), branches);
		List<String> recordRoutes = new ArrayList<>();
		for (Header recordRoute : SipMessages.headersOf(message, RecordRouteHeader.NAME)) {
			recordRoutes.add(((RecordRouteHeader) recordRoute).getAddress().getURI().toString());
		}
		assertEquals(Arrays.asList("sip:p1.example.org;lr", "sip:p2.example.org;lr"), recordRoutes);
		assertEquals("z9hG4bKa", SipMessages.branchOf(message));
	}

	@Test
	public void bodyRunsToTheEndOfTheFrameWithoutContentLength() throws MalformedMessageException {
		Message message = codec.parse(INVITE.replace("l: 4\r\n", ""));
		assertEquals("v=0\n", SipMessages.bodyOf(message));
	}

	@Test
	public void rejectsContentLengthMismatch() {
		assertMalformed(INVITE.replace("l: 4", "l: 40"));
		assertMalformed(INVITE.replace("l: 4", "Content-Length: 2"));
	}

	@Test
	public void rejectsBodyWithoutContentType() {
		assertMalformed(INVITE.replace("c: application/sdp\r\n", ""));
	}

	@Test
	public void rejectsMissingMandatoryHeaders() {
		assertMalformed(INVITE.replace("i: a84b4c76e66710@pc33.example.org\r\n", ""));
		assertMalformed(INVITE.replace("CSeq: 314159 INVITE\r\n", ""));
		assertMalformed(INVITE.replace("v: SIP/2.0/WSS df7jal23ls0d.invalid;branch=z9hG4bKnashds7\r\n", ""));
	}

	@Test
	public void rejectsHeaderLineWithoutColon() {
		assertMalformed(INVITE.replace("Max-Forwards: 70", "Max-Forwards 70"));
	}

	@Test
	public void rejectsUnparsableStartLineAndCSeq() {
		assertMalformed(INVITE.replace("INVITE sip:bob@example.org SIP/2.0", "INVITE sip:bob@example.org"));
		assertMalformed(INVITE.replace("CSeq: 314159 INVITE", "CSeq: many INVITE"));
		assertMalformed("SIP/2.0 99 Too Low\r\nCall-ID: x\r\n\r\n");
		assertMalformed("");
	}

	@Test
	public void buildsViaAndRoutesFirstAndContentLengthLast() {
		Address alice = messageFactory.createAddress(null, "sip:alice@example.org");
		Address bob = messageFactory.createAddress(null, "sip:bob@example.org");
		Request request = messageFactory.createRequest(Request.INFO,
				messageFactory.createUri("sip:bob@example.org"), alice, "a", bob, "b", "call-1", 3,
				Collections.singletonList(messageFactory.parseAddress("<sip:proxy.example.org;lr>")));
		messageFactory.setBody(request, "Signal=5\r\nDuration=160\r\n", "application/dtmf-relay");

		String text = codec.buildText(request);
		int headEnd = text.indexOf("\r\n\r\n");
		String[] lines = text.substring(0, headEnd).split("\r\n");
		assertEquals("INFO sip:bob@example.org SIP/2.0", lines[0]);
		assertTrue(lines[1].startsWith("Via: SIP/2.0/WSS " + messageFactory.getLocalHost()));
		assertEquals("Route: <sip:proxy.example.org;lr>", lines[2]);
		assertTrue(Arrays.asList(lines).contains("Content-Type: application/dtmf-relay"));
		assertEquals("Content-Length: 24", lines[lines.length - 1]);
		assertEquals("Signal=5\r\nDuration=160\r\n", text.substring(headEnd + 4));
	}

	@Test
	public void rebuildingAParsedMessageIsStable() throws MalformedMessageException {
		byte[] wire = codec.build(codec.parse(INVITE));
		Message reparsed = codec.parse(wire);
		assertEquals("a84b4c76e66710@pc33.example.org", SipMessages.callIdOf(reparsed));
		assertEquals("v=0\n", SipMessages.bodyOf(reparsed));
		assertArrayEquals(wire, codec.build(reparsed));
	}

	@Test
	public void countsBodyLengthInBytes() throws MalformedMessageException {
		Response response = (Response) codec.parse("SIP/2.0 200 OK\r\n"
				+ "Via: SIP/2.0/WSS host.invalid;branch=z9hG4bK1\r\n"
				+ "From: <sip:alice@example.org>;tag=a\r\n"
				+ "To: <sip:bob@example.org>;tag=b\r\n"
				+ "Call-ID: call-2\r\n"
				+ "CSeq: 1 MESSAGE\r\n"
				+ "\r\n");
		messageFactory.setBody(response, "olá", "text/plain");
		String text = codec.buildText(response);
		assertTrue(text.contains("Content-Length: " + "olá".getBytes(StandardCharsets.UTF_8).length));
	}

	private void assertMalformed(String text) {
		try {
			codec.parse(text);
			fail("Expected MalformedMessageException for:\n" + text);
		} catch (MalformedMessageException expected) {
			assertTrue(expected.getMessage() != null);
		}
	}

}
