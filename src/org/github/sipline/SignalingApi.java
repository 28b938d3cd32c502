package org.github.sipline;

/**
 * Commands accepted by the signaling engine. Every command is queued on the
 * signaling worker and returns at once; outcomes are reported as events to the
 * listener given to {@link #setListener(Object)}.
 */
public interface SignalingApi {

	/**
	 * Opens the transport and registers the accounts found in the configuration.
	 */
	void start();

	/**
	 * Hangs up active calls, unregisters accounts and closes the transport.
	 */
	void shutdown();

	/**
	 * Replaces the event listener: an object with Guava {@code @Subscribe}
	 * methods for the events of {@code org.github.sipline.events}.
	 */
	void setListener(Object listener);

	void register(AccountCredentials credentials);

	void unregister(String accountKey);

	/**
	 * @param target a full SIP URI, {@code user@domain} or a bare number, which
	 *            is placed in the account's domain.
	 * @return the Call-ID of the new call.
	 */
	String makeCall(String accountKey, String target, String sdp);

	void acceptCall(String callId, String sdp);

	void declineCall(String callId, boolean busy);

	void hangup(String callId);

	void hold(String callId);

	void resume(String callId);

	void sendDtmf(String callId, char digit, int durationMs);

	void sendDtmfSequence(String callId, String digits, int durationMs);

}
