package com.freightplatform.loadservice.core.statemachine;

import com.freightplatform.loadservice.model.LoadStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.freightplatform.loadservice.model.LoadStatus.*;

/**
 * Allowed one-hop moves between load statuses.
 *
 * <p>The table is built once and shared. It never contains self-edges: a request to
 * stay in the current status is an idempotent re-confirmation handled by the
 * lifecycle service, not a transition.</p>
 *
 * <p>COMPLETED and CANCELLED have no outgoing edges.</p>
 */
public final class TransitionRuleTable {

    private static final Map<LoadStatus, Set<LoadStatus>> RULES;

    static {
        Map<LoadStatus, Set<LoadStatus>> rules = new EnumMap<>(LoadStatus.class);
        rules.put(CREATED, EnumSet.of(PENDING, CANCELLED));
        rules.put(PENDING, EnumSet.of(OPTIMIZING, AVAILABLE, CANCELLED));
        rules.put(OPTIMIZING, EnumSet.of(AVAILABLE, CANCELLED));
        rules.put(AVAILABLE, EnumSet.of(RESERVED, CANCELLED, EXPIRED));
        rules.put(RESERVED, EnumSet.of(ASSIGNED, AVAILABLE, CANCELLED));
        rules.put(ASSIGNED, EnumSet.of(IN_TRANSIT, CANCELLED));
        rules.put(IN_TRANSIT, EnumSet.of(AT_PICKUP, DELAYED, CANCELLED));
        rules.put(AT_PICKUP, EnumSet.of(LOADED, EXCEPTION, CANCELLED));
        rules.put(LOADED, EnumSet.of(IN_TRANSIT, CANCELLED));
        rules.put(DELAYED, EnumSet.of(IN_TRANSIT, CANCELLED));
        rules.put(EXCEPTION, EnumSet.of(RESOLVED, CANCELLED));
        rules.put(RESOLVED, EnumSet.of(AT_PICKUP, AT_DROPOFF, CANCELLED));
        rules.put(AT_DROPOFF, EnumSet.of(DELIVERED, EXCEPTION, CANCELLED));
        rules.put(DELIVERED, EnumSet.of(COMPLETED, EXCEPTION));
        rules.put(EXPIRED, EnumSet.of(AVAILABLE));
        rules.put(COMPLETED, EnumSet.noneOf(LoadStatus.class));
        rules.put(CANCELLED, EnumSet.noneOf(LoadStatus.class));

        Map<LoadStatus, Set<LoadStatus>> frozen = new EnumMap<>(LoadStatus.class);
        rules.forEach((from, targets) -> frozen.put(from, Collections.unmodifiableSet(targets)));
        RULES = Collections.unmodifiableMap(frozen);
    }

    private TransitionRuleTable() {
    }

    public static boolean allowed(LoadStatus from, LoadStatus to) {
        requireStatus(from, "from");
        requireStatus(to, "to");
        return RULES.get(from).contains(to);
    }

    public static Set<LoadStatus> allowedTargets(LoadStatus from) {
        requireStatus(from, "from");
        return RULES.get(from);
    }

    public static boolean isTerminal(LoadStatus status) {
        return allowedTargets(status).isEmpty();
    }

    /**
     * Read-only view of the whole table, shared by reference.
     */
    public static Map<LoadStatus, Set<LoadStatus>> asMap() {
        return RULES;
    }

    private static void requireStatus(LoadStatus status, String name) {
        if (status == null) {
            throw new IllegalArgumentException("Status '" + name + "' must not be null");
        }
    }
}
