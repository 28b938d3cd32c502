package org.github.sipline.state;

public enum RegistrationState {

	NONE, REGISTERING, REGISTERED, REFRESHING, UNREGISTERING, UNREGISTERED, FAILED;

	public boolean isRegistered() {
		return this == REGISTERED || this == REFRESHING;
	}

}
