package cloud.adauth;

/**
 * Group id paired with its directory display name.
 */
public record NamedGroup(String id, String name) {
}
