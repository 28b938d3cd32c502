package org.github.sipline.auth;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import javax.sip.address.Address;
import javax.sip.header.AuthorizationHeader;
import javax.sip.header.ProxyAuthenticateHeader;
import javax.sip.header.ProxyAuthorizationHeader;
import javax.sip.header.WWWAuthenticateHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.AccountCredentials;
import org.github.sipline.exceptions.UnsupportedChallengeException;
import org.github.sipline.messages.SipMessageFactory;
import org.github.sipline.messages.SipMessages;
import org.junit.Before;
import org.junit.Test;

import com.google.common.base.Suppliers;

public class TestAuthenticationHandler {

	private final AccountCredentials alice = new AccountCredentials("alice", "wonderland", "example.org");
	private SipMessageFactory messageFactory;
	private AuthenticationHandler handler;

	@Before
	public void setUp() {
		messageFactory = new SipMessageFactory("WSS", "SiplineTest", null);
		handler = new AuthenticationHandler(Suppliers.ofInstance("0a4f113b"));
	}

	@Test
	public void rfc2617QopAuthVector() throws UnsupportedChallengeException {
		String response = AuthorizationDigest.getDigest(AuthorizationDigest.MD5, "Mufasa",
				"testrealm@host.com", "Circle Of Life", "GET", "/dir/index.html",
				"dcd98b7102dd2f0e8b11d0f600bfb0c093", "00000001", "0a4f113b", "auth");
		assertEquals("6629fae49393a05397450978507c4ef1", response);
	}

	@Test
	public void rfc7616Vectors() throws UnsupportedChallengeException {
		String nonce = "7ypf/xlj9XXwfDPEoM4URrv/xwf94BcCAzFZH4GiTo0v";
		String cnonce = "f2/wE4q74E6zIJEtWaHKaf5wv/H5QzzpXusqGemxURZJ";
		assertEquals("8ca523f5e9506fed4657c9700eebdbec", AuthorizationDigest.getDigest(
				AuthorizationDigest.MD5, "Mufasa", "http-auth@example.org", "Circle of Life",
				"GET", "/dir/index.html", nonce, "00000001", cnonce, "auth"));
		assertEquals("753927fa0e85d155564e2e272a28d1802ca10daf4496794697cf8db5856cb6c1",
				AuthorizationDigest.getDigest(AuthorizationDigest.SHA_256, "Mufasa",
						"http-auth@example.org", "Circle of Life", "GET", "/dir/index.html", nonce,
						"00000001", cnonce, "auth"));
	}

	@Test
	public void credentialsWithQopAuth() throws UnsupportedChallengeException {
		DigestChallenge challenge = challengeOf("Digest realm=\"testrealm@host.com\", "
				+ "qop=\"auth,auth-int\", nonce=\"dcd98b7102dd2f0e8b11d0f600bfb0c093\", "
				+ "opaque=\"5ccc069c403ebaf9f0171e9517f40e41\"");
		assertEquals(Arrays.asList("auth", "auth-int"), challenge.getQopOptions());
		assertEquals(AuthorizationDigest.MD5, challenge.getAlgorithm());

		AuthorizationHeader credentials = handler.computeCredentials(challenge, "GET",
				messageFactory.createUri("sip:testrealm@host.com"), "Mufasa", "Circle Of Life", 1);
		assertEquals("Digest", credentials.getScheme());
		assertEquals("Mufasa", credentials.getUsername());
		assertEquals("testrealm@host.com", credentials.getRealm());
		assertEquals(AuthorizationDigest.getDigest(AuthorizationDigest.MD5, "Mufasa",
				"testrealm@host.com", "Circle Of Life", "GET", "sip:testrealm@host.com",
				"dcd98b7102dd2f0e8b11d0f600bfb0c093", "00000001", "0a4f113b", "auth"),
				credentials.getResponse());
		assertEquals("0a4f113b", credentials.getCNonce());
		assertEquals("auth", credentials.getQop());
		assertEquals(1, credentials.getNonceCount());
		assertEquals("5ccc069c403ebaf9f0171e9517f40e41", credentials.getOpaque());
		assertTrue(credentials.toString().contains("nc=00000001"));
	}

	@Test
	public void credentialsWithoutQopUseTheOldForm() throws UnsupportedChallengeException {
		DigestChallenge challenge = new DigestChallenge("example.org", "abc123", null,
				Collections.<String>emptyList(), null, false);
		AuthorizationHeader credentials = handler.computeCredentials(challenge, "REGISTER",
				messageFactory.createUri("sip:example.org"), "alice", "wonderland", 1);
		String expected = AuthorizationDigest.getDigest(AuthorizationDigest.MD5, "alice",
				"example.org", "wonderland", "REGISTER", "sip:example.org", "abc123");
		assertEquals(expected, credentials.getResponse());
		assertNull(credentials.getQop());
		assertNull(credentials.getCNonce());
		assertFalse(credentials.toString().contains("nc="));
	}

	@Test
	public void unsupportedChallenges() {
		assertUnsupported("Basic realm=\"example.org\"");
		assertUnsupported("Digest nonce=\"abc\"");
		assertUnsupportedCredentials("Digest realm=\"example.org\", nonce=\"abc\", algorithm=MD5-sess");
		assertUnsupportedCredentials("Digest realm=\"example.org\", nonce=\"abc\", qop=\"auth-int\"");
	}

	@Test
	public void proxyChallengeIsReadFromItsOwnHeader() throws UnsupportedChallengeException {
		DigestChallenge challenge = DigestChallenge.of((ProxyAuthenticateHeader) messageFactory
				.createHeader(ProxyAuthenticateHeader.NAME, "Digest realm=\"proxy.example.org\", "
						+ "nonce=\"n\", stale=true, algorithm=SHA-256"));
		assertEquals("proxy.example.org", challenge.getRealm());
		assertEquals(AuthorizationDigest.SHA_256, challenge.getAlgorithm());
		assertTrue(challenge.isStale());
	}

	@Test
	public void nonceCountRestartsForNewNonce() {
		NonceCounter counter = new NonceCounter();
		assertEquals("00000001", counter.next("first"));
		assertEquals("00000002", counter.next("first"));
		assertEquals("00000001", counter.next("second"));
		counter.reset();
		assertNull(counter.getNonce());
		assertEquals(0, counter.getCount());
	}

	@Test
	public void authorizeBuildsTheRetry() throws UnsupportedChallengeException {
		Request register = newRegister(1);
		Response challenge = challenge(register, Response.UNAUTHORIZED, WWWAuthenticateHeader.NAME,
				"nonce-1");
		NonceCounter counter = new NonceCounter();

		Request retry = handler.authorize(register, challenge, alice, counter);
		assertNotEquals(SipMessages.branchOf(register), SipMessages.branchOf(retry));
		assertEquals(2L, SipMessages.sequenceNumberOf(retry));
		assertEquals(1L, SipMessages.sequenceNumberOf(register));
		assertEquals(Request.REGISTER, SipMessages.cseqMethodOf(retry));
		assertEquals(SipMessages.callIdOf(register), SipMessages.callIdOf(retry));
		AuthorizationHeader authorization = (AuthorizationHeader) retry
				.getHeader(AuthorizationHeader.NAME);
		assertEquals("alice", authorization.getUsername());
		assertEquals("sip:example.org", authorization.getURI().toString());
		assertEquals(1, authorization.getNonceCount());
		assertNull(retry.getHeader(ProxyAuthorizationHeader.NAME));
		assertNull(register.getHeader(AuthorizationHeader.NAME));

		Request again = handler.authorize(retry, challenge(retry, Response.UNAUTHORIZED,
				WWWAuthenticateHeader.NAME, "nonce-1"), alice, counter);
		assertEquals(2, ((AuthorizationHeader) again.getHeader(AuthorizationHeader.NAME))
				.getNonceCount());
		assertEquals(1, SipMessages.headersOf(again, AuthorizationHeader.NAME).size());
	}

	@Test
	public void proxyChallengeGetsProxyAuthorization() throws UnsupportedChallengeException {
		Request register = newRegister(7);
		Request retry = handler.authorize(register, challenge(register,
				Response.PROXY_AUTHENTICATION_REQUIRED, ProxyAuthenticateHeader.NAME, "nonce-p"),
				alice, new NonceCounter());
		ProxyAuthorizationHeader proxyAuthorization = (ProxyAuthorizationHeader) retry
				.getHeader(ProxyAuthorizationHeader.NAME);
		assertEquals("Digest", proxyAuthorization.getScheme());
		assertEquals("nonce-p", proxyAuthorization.getNonce());
		assertNull(retry.getHeader(AuthorizationHeader.NAME));
		assertEquals(8L, SipMessages.sequenceNumberOf(retry));
	}

	@Test(expected = UnsupportedChallengeException.class)
	public void challengeWithoutHeaderIsUnsupported() throws UnsupportedChallengeException {
		Request register = newRegister(1);
		Response bare = messageFactory.createResponse(register, Response.UNAUTHORIZED, "t");
		handler.authorize(register, bare, alice, new NonceCounter());
	}

	private Request newRegister(long sequenceNumber) {
		Address aor = messageFactory.createAddress(null, alice.getAddressOfRecord());
		return messageFactory.createRequest(Request.REGISTER,
				messageFactory.createUri(alice.getRegistrarUri()), aor, messageFactory.newTag(),
				aor, null, messageFactory.newCallId(), sequenceNumber);
	}

	private Response challenge(Request request, int statusCode, String header, String nonce) {
		Response response = messageFactory.createResponse(request, statusCode, "registrar");
		response.addHeader(messageFactory.createHeader(header, "Digest realm=\"example.org\", "
				+ "nonce=\"" + nonce + "\", qop=\"auth\", algorithm=MD5"));
		return response;
	}

	private DigestChallenge challengeOf(String value) throws UnsupportedChallengeException {
		return DigestChallenge.of((WWWAuthenticateHeader) messageFactory
				.createHeader(WWWAuthenticateHeader.NAME, value));
	}

	private void assertUnsupported(String header) {
		try {
			challengeOf(header);
			fail("Expected " + header + " to be unsupported");
		} catch (UnsupportedChallengeException expected) {
			assertTrue(expected.getMessage() != null);
		}
	}

	private void assertUnsupportedCredentials(String header) {
		try {
			handler.computeCredentials(challengeOf(header), "REGISTER",
					messageFactory.createUri("sip:example.org"), "alice", "wonderland", 1);
			fail("Expected " + header + " to be unsupported");
		} catch (UnsupportedChallengeException expected) {
			assertTrue(expected.getMessage() != null);
		}
	}

}
