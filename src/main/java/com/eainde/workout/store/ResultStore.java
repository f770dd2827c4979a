package com.eainde.workout.store;

import com.eainde.workout.tool.output.ToolFailure;
import com.eainde.workout.tool.output.ToolOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Role-keyed, array-valued store of tool results for one extraction run.
 *
 * <p>Writes with an index are positional: the list grows with holes so that
 * {@code read(role, i)} is stable no matter in which order workouts are processed.
 * Writes without an index append. A read without an index returns the last slot.</p>
 *
 * <p>Indexes are capped at {@link #MAX_WORKOUT_INDEX}; a positional write pads the list up to the index.</p>
 *
 * <p>Not thread-safe. A run executes its tools strictly one after another.</p>
 */
public class ResultStore {

    public static final int MAX_WORKOUT_INDEX = 99;

    private final Map<ResultRole, List<ToolOutput>> entries = new EnumMap<>(ResultRole.class);

    public void write(ResultRole role, ToolOutput value, Integer index) {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(value, "value");
        List<ToolOutput> slots = entries.computeIfAbsent(role, r -> new ArrayList<>());

        if (index == null) {
            slots.add(value);
            return;
        }
        if (index < 0 || index > MAX_WORKOUT_INDEX) {
            throw new IllegalArgumentException(
                    "workoutIndex must be between 0 and " + MAX_WORKOUT_INDEX + " but was " + index);
        }
        while (slots.size() <= index) {
            slots.add(null);
        }
        slots.set(index, value);
    }

    public void write(ResultRole role, ToolOutput value) {
        write(role, value, null);
    }

    /**
     * @return the slot at {@code index}, or the last slot when {@code index} is null.
     *         Empty for holes, out-of-range indexes and roles never written.
     */
    public Optional<ToolOutput> read(ResultRole role, Integer index) {
        List<ToolOutput> slots = entries.get(role);
        if (slots == null || slots.isEmpty()) {
            return Optional.empty();
        }
        if (index == null) {
            return Optional.ofNullable(slots.get(slots.size() - 1));
        }
        if (index < 0 || index >= slots.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(slots.get(index));
    }

    /**
     * Typed read. A slot holding a {@link ToolFailure} (or any other variant) reads as empty.
     */
    public <T extends ToolOutput> Optional<T> read(ResultRole role, Integer index, Class<T> type) {
        return read(role, index)
                .filter(type::isInstance)
                .map(type::cast);
    }

    /**
     * All written values for the role in slot order, holes skipped.
     */
    public List<ToolOutput> readAll(ResultRole role) {
        List<ToolOutput> slots = entries.get(role);
        if (slots == null) {
            return Collections.emptyList();
        }
        return slots.stream().filter(Objects::nonNull).toList();
    }

    public <T extends ToolOutput> List<T> readAll(ResultRole role, Class<T> type) {
        return readAll(role).stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    /**
     * Number of slots for the role, holes included.
     */
    public int count(ResultRole role) {
        List<ToolOutput> slots = entries.get(role);
        return slots == null ? 0 : slots.size();
    }

    public boolean hasAny(ResultRole role) {
        return !readAll(role).isEmpty();
    }

    public boolean isEmpty() {
        return entries.values().stream().allMatch(List::isEmpty);
    }

    /**
     * Count of stored results that are not tool failures, across all roles.
     */
    public long successfulCount() {
        return entries.values().stream()
                .flatMap(List::stream)
                .filter(Objects::nonNull)
                .filter(value -> !(value instanceof ToolFailure))
                .count();
    }
}
