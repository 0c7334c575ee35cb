package io.github.drompincen.taskcore.runtime.event;

import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import io.github.drompincen.taskcore.protocol.event.EventCategory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Content predicate of a subscription. An empty key set means every event of the category.
 */
public final class SubscriptionFilter implements Predicate<DomainEvent> {

    private static final SubscriptionFilter ALL = new SubscriptionFilter(null, Set.of(), Set.of());

    private final EventCategory category;
    private final Set<String> listKeys;
    private final Set<String> taskIds;

    private SubscriptionFilter(EventCategory category, Set<String> listKeys, Set<String> taskIds) {
        this.category = category;
        this.listKeys = listKeys;
        this.taskIds = taskIds;
    }

    public static SubscriptionFilter all() {
        return ALL;
    }

    public static SubscriptionFilter category(EventCategory category) {
        return new SubscriptionFilter(category, Set.of(), Set.of());
    }

    public static SubscriptionFilter boardLists(Collection<String> listKeys) {
        return new SubscriptionFilter(EventCategory.BOARD, clean(listKeys), Set.of());
    }

    public static SubscriptionFilter timelineTasks(Collection<String> taskIds) {
        return new SubscriptionFilter(EventCategory.TIMELINE, Set.of(), clean(taskIds));
    }

    /**
     * Builds a filter from its loose textual form, as received from query parameters or a
     * websocket subscribe message. A missing or unknown category yields {@link #all()}.
     */
    public static SubscriptionFilter parse(String category, Collection<String> listKeys, Collection<String> taskIds) {
        if (category == null || category.isBlank()) {
            return all();
        }
        EventCategory parsed;
        try {
            parsed = EventCategory.valueOf(category.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return all();
        }
        switch (parsed) {
            case BOARD:
                return boardLists(listKeys == null ? Set.of() : listKeys);
            case TIMELINE:
                return timelineTasks(taskIds == null ? Set.of() : taskIds);
            default:
                return category(parsed);
        }
    }

    /** Splits a comma separated parameter, ignoring blanks. Null yields an empty set. */
    public static Set<String> splitCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return clean(Arrays.asList(csv.split(",")));
    }

    private static Set<String> clean(Collection<String> values) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean test(DomainEvent event) {
        if (category == null) {
            return true;
        }
        if (event.category() != category) {
            return false;
        }
        if (!listKeys.isEmpty() && !containsKey(listKeys, event.listKey())) {
            return false;
        }
        return taskIds.isEmpty() || containsKey(taskIds, event.taskId());
    }

    // immutable sets reject contains(null)
    private static boolean containsKey(Set<String> keys, String key) {
        return key != null && keys.contains(key);
    }

    public EventCategory getCategory() { return category; }
    public Set<String> getListKeys() { return listKeys; }
    public Set<String> getTaskIds() { return taskIds; }

    @Override
    public String toString() {
        return "SubscriptionFilter{category=" + (category == null ? "ALL" : category)
                + ", listKeys=" + listKeys + ", taskIds=" + taskIds + '}';
    }
}
