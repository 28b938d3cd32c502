package org.github.sipline.state;

import org.github.sipline.exceptions.IllegalTransitionException;
import org.github.sipline.state.StateMachineBehavior.Step;

public abstract class AbstractStateMachine<S extends Enum<S>, T extends Enum<T>> {

	private volatile S currentState;

	protected AbstractStateMachine(S initialState) {
		currentState = initialState;
	}

	protected abstract StateMachineBehavior<S, T> getBehavior();

	public S getState() {
		return currentState;
	}

	public boolean canFire(T trigger) {
		return getBehavior().allows(currentState, trigger);
	}

	/**
	 * Computes the next step for {@code trigger}. An unknown transition leaves the
	 * machine where it was.
	 */
	protected S fire(T trigger, String reason, int statusCode) {
		Step<S> nextStep = getBehavior().computeNextStep(currentState, trigger);
		if (nextStep == null) {
			throw new IllegalTransitionException(currentState, trigger);
		}
		S oldState = currentState;
		currentState = nextStep.getNextState();
		if (oldState != currentState) {
			stateHasChanged(oldState, currentState, reason, statusCode);
		}
		return currentState;
	}

	protected S fire(T trigger) {
		return fire(trigger, null, 0);
	}

	protected void checkAllowed(T trigger) {
		if (!canFire(trigger)) {
			throw new IllegalTransitionException(currentState, trigger);
		}
	}

	protected abstract void stateHasChanged(S oldState, S newState, String reason, int statusCode);

}
