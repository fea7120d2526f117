package hintvote.coordinator.registry;

import java.util.List;

/**
 * Resources that gained their first owner or lost their last owner in a membership replace.
 * Resources that stayed owned by someone are not reported.
 */
public record MembershipDelta(List<Integer> added, List<Integer> removed) {

    public MembershipDelta {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
