package org.github.sipline.state;

public enum RegistrationTrigger {
	REGISTER, SUCCEEDED, CHALLENGED, FAILED, REFRESH_DUE, UNREGISTER
}
