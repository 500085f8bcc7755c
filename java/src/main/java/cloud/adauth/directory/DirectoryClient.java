package cloud.adauth.directory;

import cloud.adauth.AuthException;

import java.util.Map;
import java.util.Set;

/**
 * Contract for the directory queries used by authorization decisions.
 */
public interface DirectoryClient {

    /**
     * Resolves the ids of every group the bearer of {@code accessToken} belongs to.
     */
    Set<String> userGroups(String accessToken) throws AuthException;

    /**
     * Lists the organisation's groups as id to display name. Only meant for rendering; never use it to authorize.
     */
    Map<String, String> allGroups(String accessToken) throws AuthException;
}
