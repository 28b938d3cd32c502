package org.github.sipline.exceptions;

/**
 * A state machine was asked to react to something its current state does not allow.
 * The machine that throws it is left untouched.
 */
public class IllegalTransitionException extends SiplineException {

	private static final long serialVersionUID = 8143329872450175633L;
	private final String state;
	private final String trigger;

	public IllegalTransitionException(Enum<?> state, Enum<?> trigger) {
		super(String.format("No transition from %s on %s.", state, trigger));
		this.state = state.name();
		this.trigger = trigger.name();
	}

	public String getState() {
		return state;
	}

	public String getTrigger() {
		return trigger;
	}

}
