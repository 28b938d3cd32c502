package org.github.sipline;

import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.github.sipline.exceptions.SiplineException;

import com.google.common.base.Strings;
import com.google.common.io.Resources;

/**
 * Engine settings. Defaults match a WebSocket deployment; any of them can be
 * overridden from a {@code sipline.properties} resource or set directly.
 */
public class SignalingConfig {

	public static final String RESOURCE = "sipline.properties";
	private static final String PREFIX = "sipline.";

	private String domain;
	private String transportUrl;
	private String userAgent = "Sipline/1.0";
	private long keepaliveIntervalMs = 30000;
	private long keepaliveGraceMs = 10000;
	private boolean crlfKeepalive = false;
	private long reconnectInitialMs = 2000;
	private long reconnectMaxMs = 60000;
	private int reconnectMaxAttempts = 0;
	private int registrationExpires = 3600;
	private long transactionTimeoutMs = 32000;
	private boolean retransmissionEnabled = false;
	private long t1Ms = 500;
	private long t2Ms = 4000;
	private long callGraceMs = 15000;
	private long noAnswerTimeoutMs = 0;
	private String contactParams;
	private final List<AccountCredentials> accounts = new ArrayList<>();

	/**
	 * Reads {@value #RESOURCE} from the classpath.
	 */
	public static SignalingConfig load() {
		return load(RESOURCE);
	}

	public static SignalingConfig load(String resourceName) {
		URL resource = Resources.getResource(resourceName);
		Properties properties = new Properties();
		try (Reader reader = Resources.asCharSource(resource, StandardCharsets.UTF_8).openStream()) {
			properties.load(reader);
		} catch (IOException ioException) {
			throw new SiplineException("Could not read " + resourceName + ".", ioException);
		}
		return fromProperties(properties);
	}

	public static SignalingConfig fromProperties(Properties properties) {
		SignalingConfig config = new SignalingConfig();
		config.domain = properties.getProperty(PREFIX + "domain");
		config.transportUrl = properties.getProperty(PREFIX + "transport.url");
		config.userAgent = properties.getProperty(PREFIX + "user.agent", config.userAgent);
		config.keepaliveIntervalMs = longValue(properties, "keepalive.interval.ms",
				config.keepaliveIntervalMs);
		config.keepaliveGraceMs = longValue(properties, "keepalive.grace.ms", config.keepaliveGraceMs);
		config.crlfKeepalive = Boolean.parseBoolean(properties.getProperty(PREFIX
				+ "keepalive.crlf", String.valueOf(config.crlfKeepalive)));
		config.reconnectInitialMs = longValue(properties, "reconnect.initial.ms",
				config.reconnectInitialMs);
		config.reconnectMaxMs = longValue(properties, "reconnect.max.ms", config.reconnectMaxMs);
		config.reconnectMaxAttempts = (int) longValue(properties, "reconnect.max.attempts",
				config.reconnectMaxAttempts);
		config.registrationExpires = (int) longValue(properties, "registration.expires",
				config.registrationExpires);
		config.transactionTimeoutMs = longValue(properties, "transaction.timeout.ms",
				config.transactionTimeoutMs);
		config.retransmissionEnabled = Boolean.parseBoolean(properties.getProperty(PREFIX
				+ "retransmission.enabled", String.valueOf(config.retransmissionEnabled)));
		config.t1Ms = longValue(properties, "retransmission.t1.ms", config.t1Ms);
		config.t2Ms = longValue(properties, "retransmission.t2.ms", config.t2Ms);
		config.callGraceMs = longValue(properties, "call.grace.ms", config.callGraceMs);
		config.noAnswerTimeoutMs = longValue(properties, "call.noanswer.ms",
				config.noAnswerTimeoutMs);
		config.contactParams = properties.getProperty(PREFIX + "contact.params");
		for (int index = 1; ; index++) {
			String accountPrefix = PREFIX + "account." + index + ".";
			String username = properties.getProperty(accountPrefix + "username");
			if (Strings.isNullOrEmpty(username)) {
				break;
			}
			String accountDomain = properties.getProperty(accountPrefix + "domain", config.domain);
			config.accounts.add(new AccountCredentials(username,
					properties.getProperty(accountPrefix + "password"), accountDomain,
					properties.getProperty(accountPrefix + "display")));
		}
		return config;
	}

	private static long longValue(Properties properties, String key, long defaultValue) {
		String value = properties.getProperty(PREFIX + key);
		if (Strings.isNullOrEmpty(value)) {
			return defaultValue;
		}
		try {
			return Long.parseLong(value.trim());
		} catch (NumberFormatException invalidNumber) {
			throw new SiplineException("Invalid value '" + value + "' for " + PREFIX + key + ".",
					invalidNumber);
		}
	}

	public String getDomain() {
		return domain;
	}

	public void setDomain(String domain) {
		this.domain = domain;
	}

	public String getTransportUrl() {
		return transportUrl;
	}

	public void setTransportUrl(String transportUrl) {
		this.transportUrl = transportUrl;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public long getKeepaliveIntervalMs() {
		return keepaliveIntervalMs;
	}

	public void setKeepaliveIntervalMs(long keepaliveIntervalMs) {
		this.keepaliveIntervalMs = keepaliveIntervalMs;
	}

	public long getKeepaliveGraceMs() {
		return keepaliveGraceMs;
	}

	public void setKeepaliveGraceMs(long keepaliveGraceMs) {
		this.keepaliveGraceMs = keepaliveGraceMs;
	}

	/**
	 * Whether CRLF keepalives are sent on top of WebSocket pings. A server that
	 * answers them proves it is alive; one that never does is not held to them.
	 */
	public boolean isCrlfKeepalive() {
		return crlfKeepalive;
	}

	public void setCrlfKeepalive(boolean crlfKeepalive) {
		this.crlfKeepalive = crlfKeepalive;
	}

	public long getReconnectInitialMs() {
		return reconnectInitialMs;
	}

	public void setReconnectInitialMs(long reconnectInitialMs) {
		this.reconnectInitialMs = reconnectInitialMs;
	}

	public long getReconnectMaxMs() {
		return reconnectMaxMs;
	}

	public void setReconnectMaxMs(long reconnectMaxMs) {
		this.reconnectMaxMs = reconnectMaxMs;
	}

	public int getReconnectMaxAttempts() {
		return reconnectMaxAttempts;
	}

	public void setReconnectMaxAttempts(int reconnectMaxAttempts) {
		this.reconnectMaxAttempts = reconnectMaxAttempts;
	}

	public int getRegistrationExpires() {
		return registrationExpires;
	}

	public void setRegistrationExpires(int registrationExpires) {
		this.registrationExpires = registrationExpires;
	}

	public long getTransactionTimeoutMs() {
		return transactionTimeoutMs;
	}

	public void setTransactionTimeoutMs(long transactionTimeoutMs) {
		this.transactionTimeoutMs = transactionTimeoutMs;
	}

	public boolean isRetransmissionEnabled() {
		return retransmissionEnabled;
	}

	public void setRetransmissionEnabled(boolean retransmissionEnabled) {
		this.retransmissionEnabled = retransmissionEnabled;
	}

	public long getT1Ms() {
		return t1Ms;
	}

	public void setT1Ms(long t1Ms) {
		this.t1Ms = t1Ms;
	}

	public long getT2Ms() {
		return t2Ms;
	}

	public void setT2Ms(long t2Ms) {
		this.t2Ms = t2Ms;
	}

	public long getCallGraceMs() {
		return callGraceMs;
	}

	public void setCallGraceMs(long callGraceMs) {
		this.callGraceMs = callGraceMs;
	}

	/**
	 * How long a ringing outgoing call waits for an answer before it is cancelled.
	 * 0 waits until the callee or the caller ends it.
	 */
	public long getNoAnswerTimeoutMs() {
		return noAnswerTimeoutMs;
	}

	public void setNoAnswerTimeoutMs(long noAnswerTimeoutMs) {
		this.noAnswerTimeoutMs = noAnswerTimeoutMs;
	}

	public String getContactParams() {
		return contactParams;
	}

	public void setContactParams(String contactParams) {
		this.contactParams = contactParams;
	}

	public List<AccountCredentials> getAccounts() {
		return Collections.unmodifiableList(accounts);
	}

	public void addAccount(AccountCredentials account) {
		accounts.add(account);
	}

}
