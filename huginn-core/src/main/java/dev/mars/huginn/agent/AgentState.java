/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.huginn.agent;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.mars.huginn.core.exceptions.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of a Huginn agent instance.
 *
 * <p>
 * The normal path is {@code UNINITIALIZED → ENROLLING → READY → RUNNING → STOPPED}.
 * {@code ERROR} is reachable from every state and is entered when the backend
 * irrecoverably rejects both tokens. No state is terminal: a stopped or failed
 * agent can always be initialized again.
 * </p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public enum AgentState {

    /**
     * No confirmed credentials. Initial state, and the state an agent falls
     * back to after a failed enrollment.
     */
    UNINITIALIZED("uninitialized", "Agent has no confirmed credentials"),

    /**
     * Enrollment exchange with the backend is in progress.
     */
    ENROLLING("enrolling", "Agent is enrolling with the backend"),

    /**
     * Credentials are present and confirmed; loops are not armed yet.
     */
    READY("ready", "Agent is enrolled and ready to start"),

    /**
     * Task poll and telemetry loops are armed.
     */
    RUNNING("running", "Agent is polling for tasks and reporting telemetry"),

    /**
     * Loops and refresh timer have been cancelled by the host.
     */
    STOPPED("stopped", "Agent has been stopped"),

    /**
     * Authentication failed irrecoverably and credentials were cleared.
     */
    ERROR("error", "Agent authentication failed; re-enrollment required");

    // ── Transition table (single source of truth) ──────────────────────

    private static final Map<AgentState, Set<AgentState>> TRANSITIONS;

    static {
        var map = new EnumMap<AgentState, Set<AgentState>>(AgentState.class);
        map.put(UNINITIALIZED, EnumSet.of(ENROLLING, READY, ERROR));
        map.put(ENROLLING, EnumSet.of(READY, UNINITIALIZED, ERROR));
        map.put(READY, EnumSet.of(ENROLLING, RUNNING, STOPPED, ERROR));
        map.put(RUNNING, EnumSet.of(STOPPED, ERROR));
        map.put(STOPPED, EnumSet.of(ENROLLING, READY, RUNNING, ERROR));
        map.put(ERROR, EnumSet.of(ENROLLING, READY, UNINITIALIZED, STOPPED));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final String description;

    AgentState(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether an agent in this state holds credentials it may use for
     * authenticated requests.
     */
    public boolean isEnrolled() {
        return this == READY || this == RUNNING || this == STOPPED;
    }

    /**
     * Checks whether a transition from this state to the given target is valid.
     *
     * <pre>
     *   UNINITIALIZED → ENROLLING, READY, ERROR
     *   ENROLLING     → READY, UNINITIALIZED, ERROR
     *   READY         → ENROLLING, RUNNING, STOPPED, ERROR
     *   RUNNING       → STOPPED, ERROR
     *   STOPPED       → ENROLLING, READY, RUNNING, ERROR
     *   ERROR         → ENROLLING, READY, UNINITIALIZED, STOPPED
     * </pre>
     *
     * @param target the target state
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(AgentState target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(AgentState.class)).contains(target);
    }

    /**
     * Returns the target state if the transition is valid.
     *
     * @param target the requested state
     * @return {@code target}
     * @throws InvalidTransitionException if the move is not in the transition table
     */
    public AgentState transitionTo(AgentState target) throws InvalidTransitionException {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(this, target,
                    getValidTransitions().toArray(new AgentState[0]));
        }
        return target;
    }

    public Set<AgentState> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    public static AgentState fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Agent state value must not be null");
        }
        for (AgentState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown agent state: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
