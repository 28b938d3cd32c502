package org.github.sipline.auth;

/**
 * Nonce-count bookkeeping for one account. The count restarts at 1 whenever the
 * server hands out a different nonce.
 */
public class NonceCounter {

	private String nonce;
	private long count;

	public String next(String currentNonce) {
		if (nonce == null || !nonce.equals(currentNonce)) {
			nonce = currentNonce;
			count = 0;
		}
		count++;
		return format(count);
	}

	public static String format(long nonceCount) {
		return String.format("%08x", nonceCount);
	}

	public String getNonce() {
		return nonce;
	}

	public long getCount() {
		return count;
	}

	public void reset() {
		nonce = null;
		count = 0;
	}

}
