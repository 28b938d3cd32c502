package org.github.sipline.state;

import java.util.EnumMap;
import java.util.Map;

/**
 * Transition table of a state machine, declared fluently:
 * {@code during(IDLE).on(REGISTER).goTo(REGISTERING)}.
 */
public class StateMachineBehavior<S extends Enum<S>, T extends Enum<T>> {

	private final Map<S, Map<T, Step<S>>> behavior;
	private final Class<T> triggerType;

	public StateMachineBehavior(Class<S> stateType, Class<T> triggerType) {
		this.triggerType = triggerType;
		behavior = new EnumMap<>(stateType);
		for (S state : stateType.getEnumConstants()) {
			behavior.put(state, new EnumMap<T, Step<S>>(triggerType));
		}
	}

	public class During {

		private final S currentState;

		During(S current) {
			currentState = current;
		}

		public On on(T trigger) {
			return new On(currentState, trigger);
		}

	}

	public class On {

		private final S currentState;
		private final T trigger;

		On(S current, T trigger) {
			currentState = current;
			this.trigger = trigger;
		}

		public Step<S> goTo(S newState) {
			Step<S> step = new Step<>(newState);
			behavior.get(currentState).put(trigger, step);
			return step;
		}

		public Step<S> stay() {
			return goTo(currentState);
		}

	}

	public static class Step<S> {

		private final S newState;

		Step(S brandnew) {
			newState = brandnew;
		}

		public S getNextState() {
			return newState;
		}

	}

	public During during(S currentState) {
		return new During(currentState);
	}

	public Step<S> computeNextStep(S currentState, T trigger) {
		return behavior.get(currentState).get(trigger);
	}

	public boolean allows(S currentState, T trigger) {
		return computeNextStep(currentState, trigger) != null;
	}

	public Class<T> getTriggerType() {
		return triggerType;
	}

}
