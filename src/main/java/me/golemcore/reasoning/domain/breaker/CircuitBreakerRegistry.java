package me.golemcore.reasoning.domain.breaker;

import me.golemcore.reasoning.domain.model.CircuitBreakerState;
import me.golemcore.reasoning.domain.model.LoopState;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-tool circuit breakers. Each tool has an independent breaker created on
 * first use; there is no lock shared across tools.
 */
public class CircuitBreakerRegistry implements LoopState.BreakerStateView {

    private final CircuitBreakerConfig defaultConfig;
    private final Map<String, CircuitBreakerConfig> toolConfigs;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock) {
        this(defaultConfig, Map.of(), clock);
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Map<String, CircuitBreakerConfig> toolConfigs,
            Clock clock) {
        this.defaultConfig = defaultConfig;
        this.toolConfigs = toolConfigs == null ? Map.of() : Map.copyOf(toolConfigs);
        this.clock = clock;
    }

    public BreakerAdmission tryAcquire(String toolName) {
        return breakerFor(toolName).tryAcquire();
    }

    public void recordSuccess(String toolName) {
        breakerFor(toolName).recordSuccess();
    }

    public void recordFailure(String toolName) {
        breakerFor(toolName).recordFailure();
    }

    public void releaseTrialCall(String toolName) {
        breakerFor(toolName).releaseTrialCall();
    }

    @Override
    public CircuitBreakerState stateOf(String toolName) {
        CircuitBreaker breaker = breakers.get(toolName);
        return breaker != null ? breaker.state() : CircuitBreakerState.initial();
    }

    /**
     * Current state of every breaker created so far, sorted by tool name.
     */
    public Map<String, CircuitBreakerState> snapshot() {
        Map<String, CircuitBreakerState> sorted = new TreeMap<>();
        breakers.forEach((name, breaker) -> sorted.put(name, breaker.state()));
        return Collections.unmodifiableMap(new LinkedHashMap<>(sorted));
    }

    public void reset(String toolName) {
        breakers.remove(toolName);
    }

    CircuitBreaker breakerFor(String toolName) {
        return breakers.computeIfAbsent(toolName,
                name -> new CircuitBreaker(name, toolConfigs.getOrDefault(name, defaultConfig), clock));
    }
}
