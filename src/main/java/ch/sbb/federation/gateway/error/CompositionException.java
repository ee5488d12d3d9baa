package ch.sbb.federation.gateway.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the registered subgraphs cannot be merged into one schema.
 *
 * <p>Lists every conflict found, not only the first one. The last successfully
 * composed schema stays live.</p>
 */
public class CompositionException extends FederationException {

    private final List<Conflict> conflicts;

    public CompositionException(List<Conflict> conflicts) {
        super(describe(conflicts), null, null, null);
        this.conflicts = List.copyOf(conflicts);
    }

    public List<Conflict> getConflicts() {
        return conflicts;
    }

    @Override
    public String getCode() {
        return "COMPOSITION_FAILED";
    }

    private static String describe(List<Conflict> conflicts) {
        return "Schema composition failed with " + conflicts.size() + " conflict(s): "
            + conflicts.stream().map(Conflict::toString).collect(Collectors.joining("; "));
    }

    /**
     * A single composition conflict.
     *
     * @param coordinate the type or {@code Type.field} coordinate in conflict
     * @param subgraphs the subgraphs involved
     * @param reason human readable reason
     */
    public record Conflict(String coordinate, List<String> subgraphs, String reason) {

        public Conflict {
            subgraphs = subgraphs != null ? List.copyOf(subgraphs) : List.of();
        }

        @Override
        public String toString() {
            return coordinate + " " + subgraphs + ": " + reason;
        }
    }
}
