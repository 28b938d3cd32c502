package org.github.sipline;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

public class AccountCredentials {

	private final String username;
	private final String password;
	private final String domain;
	private final String displayName;

	public AccountCredentials(String username, String password, String domain) {
		this(username, password, domain, null);
	}

	public AccountCredentials(String username, String password, String domain, String displayName) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(username), "username is required");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(domain), "domain is required");
		this.username = username;
		this.password = Strings.nullToEmpty(password);
		this.domain = domain;
		this.displayName = Strings.emptyToNull(displayName);
	}

	public static String keyOf(String username, String domain) {
		return username + "@" + domain;
	}

	public String getKey() {
		return keyOf(username, domain);
	}

	public String getUsername() {
		return username;
	}

	public String getPassword() {
		return password;
	}

	public String getDomain() {
		return domain;
	}

	public String getDisplayName() {
		return displayName;
	}

	public String getAddressOfRecord() {
		return "sip:" + username + "@" + domain;
	}

	public String getRegistrarUri() {
		return "sip:" + domain;
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof AccountCredentials)) {
			return false;
		}
		AccountCredentials that = (AccountCredentials) other;
		return username.equals(that.username) && domain.equals(that.domain)
				&& password.equals(that.password)
				&& Objects.equal(displayName, that.displayName);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(username, domain, password, displayName);
	}

	@Override
	public String toString() {
		return getKey();
	}

}
