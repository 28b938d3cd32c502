package org.github.sipline.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.github.sipline.exceptions.UnsupportedChallengeException;

import com.google.common.base.Ascii;
import com.google.common.io.BaseEncoding;

/**
 * Used to calculate the message digest for user authorization, with MD5 or SHA-256
 * depending on the algorithm announced by the challenge.
 */
public class AuthorizationDigest {

	public static final String MD5 = "MD5";
	public static final String SHA_256 = "SHA-256";

	/**
	 * Calculate a digest the RFC 2069 way. Use this if the challenge offers no qop.
	 *
	 * @param algorithm
	 *            MD5 or SHA-256
	 * @param user
	 *            the local SIP user to authorize
	 * @param realm
	 *            the realm sent in the authorization challenge
	 * @param password
	 *            the local SIP user's password
	 * @param method
	 *            the SIP method of the challenged request
	 * @param uri
	 *            the request-URI of the challenged request
	 * @param nonce
	 *            the nonce sent in the authorization challenge
	 * @return the lower-case hex response value
	 */
	public static String getDigest(String algorithm, String user, String realm, String password,
			String method, String uri, String nonce) throws UnsupportedChallengeException {
		String hexDigestOne = hash(algorithm, user + ":" + realm + ":" + password);
		String hexDigestTwo = hash(algorithm, method + ":" + uri);
		return hash(algorithm, hexDigestOne + ":" + nonce + ":" + hexDigestTwo);
	}

	/**
	 * Calculate a digest for qop "auth".
	 *
	 * @param nc
	 *            the nonce count, eight hex digits
	 * @param cnonce
	 *            the client nonce chosen for this request
	 * @param qop
	 *            the selected quality of protection
	 * @return the lower-case hex response value
	 */
	public static String getDigest(String algorithm, String user, String realm, String password,
			String method, String uri, String nonce, String nc, String cnonce, String qop)
					throws UnsupportedChallengeException {
		String hexDigestOne = hash(algorithm, user + ":" + realm + ":" + password);
		String hexDigestTwo = hash(algorithm, method + ":" + uri);
		return hash(algorithm, hexDigestOne + ":" + nonce + ":" + nc + ":" + cnonce
				+ ":" + qop + ":" + hexDigestTwo);
	}

	public static boolean isSupported(String algorithm) {
		return algorithm != null && (Ascii.equalsIgnoreCase(algorithm, MD5)
				|| Ascii.equalsIgnoreCase(algorithm, SHA_256));
	}

	private static String hash(String algorithm, String text) throws UnsupportedChallengeException {
		if (!isSupported(algorithm)) {
			throw new UnsupportedChallengeException("Unsupported digest algorithm " + algorithm + ".");
		}
		try {
			MessageDigest digest = MessageDigest.getInstance(Ascii.toUpperCase(algorithm));
			digest.update(text.getBytes(StandardCharsets.UTF_8));
			return getHexString(digest.digest());
		} catch (NoSuchAlgorithmException missingAlgorithm) {
			throw new UnsupportedChallengeException("Digest algorithm " + algorithm
					+ " not available on this platform.");
		}
	}

	/**
	 * Converts a byte[] into a lower-case hex string.
	 */
	public static String getHexString(byte[] bytes) {
		return BaseEncoding.base16().lowerCase().encode(bytes);
	}

}
