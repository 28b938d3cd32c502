package org.github.sipline.auth;

import java.security.SecureRandom;
import java.text.ParseException;

import javax.sip.InvalidArgumentException;
import javax.sip.PeerUnavailableException;
import javax.sip.SipFactory;
import javax.sip.address.URI;
import javax.sip.header.AuthorizationHeader;
import javax.sip.header.CSeqHeader;
import javax.sip.header.HeaderFactory;
import javax.sip.header.ProxyAuthenticateHeader;
import javax.sip.header.ProxyAuthorizationHeader;
import javax.sip.header.WWWAuthenticateHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.AccountCredentials;
import org.github.sipline.exceptions.SiplineException;
import org.github.sipline.exceptions.UnsupportedChallengeException;
import org.github.sipline.messages.SipMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.io.BaseEncoding;

import gov.nist.javax.sip.Utils;

/**
 * Answers 401/407 Digest challenges. Holds no per-account state: the nonce count
 * lives in the {@link NonceCounter} passed in by the caller.
 */
public class AuthenticationHandler {

	private final Logger logger = LoggerFactory.getLogger(AuthenticationHandler.class);
	private final Supplier<String> cnonceSupplier;
	private final HeaderFactory headerMaker;

	public AuthenticationHandler() {
		this(new Supplier<String>() {

			private final SecureRandom random = new SecureRandom();

			@Override
			public String get() {
				byte[] cnonce = new byte[8];
				random.nextBytes(cnonce);
				return BaseEncoding.base16().lowerCase().encode(cnonce);
			}

		});
	}

	public AuthenticationHandler(Supplier<String> cnonceSupplier) {
		this.cnonceSupplier = cnonceSupplier;
		try {
			this.headerMaker = SipFactory.getInstance().createHeaderFactory();
		} catch (PeerUnavailableException unexpectedException) {
			logger.error("JAIN-SIP header factory is unavailable.", unexpectedException);
			throw new SiplineException("JAIN-SIP header factory is unavailable.",
					unexpectedException);
		}
	}

	/**
	 * Builds the Authorization header answering {@code challenge}. Uses qop=auth when
	 * offered, the RFC 2069 form when no qop is offered.
	 */
	public AuthorizationHeader computeCredentials(DigestChallenge challenge, String method,
			URI uri, String username, String password, long nonceCount)
					throws UnsupportedChallengeException {
		DigestResponse digest = digest(challenge, method, uri, nonceCount, username, password);
		try {
			AuthorizationHeader authorizationHeader = headerMaker
					.createAuthorizationHeader(DigestChallenge.SCHEME);
			authorizationHeader.setUsername(username);
			authorizationHeader.setRealm(challenge.getRealm());
			authorizationHeader.setNonce(challenge.getNonce());
			authorizationHeader.setURI(uri);
			authorizationHeader.setResponse(digest.response);
			authorizationHeader.setAlgorithm(challenge.getAlgorithm());
			if (digest.cnonce != null) {
				authorizationHeader.setCNonce(digest.cnonce);
				authorizationHeader.setQop(DigestChallenge.QOP_AUTH);
				authorizationHeader.setNonceCount((int) nonceCount);
			}
			if (challenge.getOpaque() != null) {
				authorizationHeader.setOpaque(challenge.getOpaque());
			}
			return authorizationHeader;
		} catch (ParseException parseException) {
			throw new UnsupportedChallengeException("Authorization header could not be built: "
					+ parseException.getMessage(), parseException);
		}
	}

	/**
	 * Same as {@link #computeCredentials} for a 407 challenge.
	 */
	public ProxyAuthorizationHeader computeProxyCredentials(DigestChallenge challenge,
			String method, URI uri, String username, String password, long nonceCount)
					throws UnsupportedChallengeException {
		DigestResponse digest = digest(challenge, method, uri, nonceCount, username, password);
		try {
			ProxyAuthorizationHeader proxyAuthorizationHeader = headerMaker
					.createProxyAuthorizationHeader(DigestChallenge.SCHEME);
			proxyAuthorizationHeader.setUsername(username);
			proxyAuthorizationHeader.setRealm(challenge.getRealm());
			proxyAuthorizationHeader.setNonce(challenge.getNonce());
			proxyAuthorizationHeader.setURI(uri);
			proxyAuthorizationHeader.setResponse(digest.response);
			proxyAuthorizationHeader.setAlgorithm(challenge.getAlgorithm());
			if (digest.cnonce != null) {
				proxyAuthorizationHeader.setCNonce(digest.cnonce);
				proxyAuthorizationHeader.setQop(DigestChallenge.QOP_AUTH);
				proxyAuthorizationHeader.setNonceCount((int) nonceCount);
			}
			if (challenge.getOpaque() != null) {
				proxyAuthorizationHeader.setOpaque(challenge.getOpaque());
			}
			return proxyAuthorizationHeader;
		} catch (ParseException parseException) {
			throw new UnsupportedChallengeException("Proxy-Authorization header could not be "
					+ "built: " + parseException.getMessage(), parseException);
		}
	}

	private DigestResponse digest(DigestChallenge challenge, String method, URI uri,
			long nonceCount, String username, String password) throws UnsupportedChallengeException {
		String algorithm = challenge.getAlgorithm();
		if (!AuthorizationDigest.isSupported(algorithm)) {
			throw new UnsupportedChallengeException("Unsupported digest algorithm " + algorithm + ".");
		}
		boolean qopAuth = challenge.getQopOptions().contains(DigestChallenge.QOP_AUTH);
		if (!qopAuth && !challenge.getQopOptions().isEmpty()) {
			throw new UnsupportedChallengeException("Unsupported qop options "
					+ challenge.getQopOptions() + ".");
		}
		if (qopAuth) {
			String cnonce = cnonceSupplier.get();
			return new DigestResponse(AuthorizationDigest.getDigest(algorithm, username,
					challenge.getRealm(), password, method, uri.toString(), challenge.getNonce(),
					NonceCounter.format(nonceCount), cnonce, DigestChallenge.QOP_AUTH), cnonce);
		}
		return new DigestResponse(AuthorizationDigest.getDigest(algorithm, username,
				challenge.getRealm(), password, method, uri.toString(), challenge.getNonce()), null);
	}

	/**
	 * Copy of {@code request} answering the challenge in {@code challengeResponse}:
	 * fresh branch, CSeq incremented and the matching authorization header set.
	 */
	public Request authorize(Request request, Response challengeResponse,
			AccountCredentials credentials, NonceCounter counter) throws UnsupportedChallengeException {
		int statusCode = challengeResponse.getStatusCode();
		Preconditions.checkArgument(statusCode == Response.UNAUTHORIZED
				|| statusCode == Response.PROXY_AUTHENTICATION_REQUIRED,
				"Not a challenge: %s", statusCode);
		boolean proxy = statusCode == Response.PROXY_AUTHENTICATION_REQUIRED;
		DigestChallenge challenge;
		if (proxy) {
			ProxyAuthenticateHeader header = (ProxyAuthenticateHeader) challengeResponse
					.getHeader(ProxyAuthenticateHeader.NAME);
			if (header == null) {
				throw new UnsupportedChallengeException(statusCode + " without a challenge header.");
			}
			challenge = DigestChallenge.of(header);
		}
		else {
			WWWAuthenticateHeader header = (WWWAuthenticateHeader) challengeResponse
					.getHeader(WWWAuthenticateHeader.NAME);
			if (header == null) {
				throw new UnsupportedChallengeException(statusCode + " without a challenge header.");
			}
			challenge = DigestChallenge.of(header);
		}
		counter.next(challenge.getNonce());

		Request retry = (Request) request.clone();
		try {
			SipMessages.topViaOf(retry).setBranch(Utils.getInstance().generateBranchId());
			CSeqHeader cseq = (CSeqHeader) retry.getHeader(CSeqHeader.NAME);
			cseq.setSeqNumber(cseq.getSeqNumber() + 1);
		} catch (ParseException | InvalidArgumentException unexpectedException) {
			throw new UnsupportedChallengeException("Could not prepare the authenticated retry.",
					unexpectedException);
		}
		retry.removeHeader(AuthorizationHeader.NAME);
		retry.removeHeader(ProxyAuthorizationHeader.NAME);
		if (proxy) {
			retry.addHeader(computeProxyCredentials(challenge, request.getMethod(),
					request.getRequestURI(), credentials.getUsername(), credentials.getPassword(),
					counter.getCount()));
		}
		else {
			retry.addHeader(computeCredentials(challenge, request.getMethod(),
					request.getRequestURI(), credentials.getUsername(), credentials.getPassword(),
					counter.getCount()));
		}
		logger.debug("Answering {} challenge for {} in realm {} (nc={}).", statusCode,
				request.getMethod(), challenge.getRealm(), NonceCounter.format(counter.getCount()));
		return retry;
	}

	private static class DigestResponse {

		private final String response;
		private final String cnonce;

		DigestResponse(String response, String cnonce) {
			this.response = response;
			this.cnonce = cnonce;
		}

	}

}
