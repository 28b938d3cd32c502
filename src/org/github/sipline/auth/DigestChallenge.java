package org.github.sipline.auth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.sip.header.ProxyAuthenticateHeader;
import javax.sip.header.WWWAuthenticateHeader;

import org.github.sipline.exceptions.UnsupportedChallengeException;

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

/**
 * The Digest parameters of a {@code WWW-Authenticate} or {@code Proxy-Authenticate}
 * header parsed by JAIN-SIP.
 */
public class DigestChallenge {

	public static final String SCHEME = "Digest";
	public static final String QOP_AUTH = "auth";
	public static final String QOP_AUTH_INT = "auth-int";

	private final String realm;
	private final String nonce;
	private final String opaque;
	private final List<String> qopOptions;
	private final String algorithm;
	private final boolean stale;

	public DigestChallenge(String realm, String nonce, String opaque, List<String> qopOptions,
			String algorithm, boolean stale) {
		this.realm = realm;
		this.nonce = nonce;
		this.opaque = opaque;
		this.qopOptions = Collections.unmodifiableList(new ArrayList<>(qopOptions));
		this.algorithm = Strings.isNullOrEmpty(algorithm) ? AuthorizationDigest.MD5 : algorithm;
		this.stale = stale;
	}

	public static DigestChallenge of(WWWAuthenticateHeader header) throws UnsupportedChallengeException {
		return of(header.getScheme(), header.getRealm(), header.getNonce(), header.getOpaque(),
				header.getQop(), header.getAlgorithm(), header.isStale());
	}

	public static DigestChallenge of(ProxyAuthenticateHeader header) throws UnsupportedChallengeException {
		return of(header.getScheme(), header.getRealm(), header.getNonce(), header.getOpaque(),
				header.getQop(), header.getAlgorithm(), header.isStale());
	}

	private static DigestChallenge of(String scheme, String realm, String nonce, String opaque,
			String qop, String algorithm, boolean stale) throws UnsupportedChallengeException {
		if (!Ascii.equalsIgnoreCase(Strings.nullToEmpty(scheme), SCHEME)) {
			throw new UnsupportedChallengeException("Unsupported authentication scheme '"
					+ scheme + "'.");
		}
		if (realm == null || nonce == null) {
			throw new UnsupportedChallengeException("Digest challenge without realm or nonce.");
		}
		List<String> qopOptions = new ArrayList<>();
		for (String option : Splitter.on(',').trimResults().omitEmptyStrings()
				.split(Strings.nullToEmpty(qop))) {
			qopOptions.add(Ascii.toLowerCase(option));
		}
		return new DigestChallenge(realm, nonce, opaque, qopOptions, algorithm, stale);
	}

	public String getRealm() {
		return realm;
	}

	public String getNonce() {
		return nonce;
	}

	public String getOpaque() {
		return opaque;
	}

	public List<String> getQopOptions() {
		return qopOptions;
	}

	public String getAlgorithm() {
		return algorithm;
	}

	public boolean isStale() {
		return stale;
	}

}
