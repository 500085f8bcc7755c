package cloud.adauth.auth;

import cloud.adauth.Config;
import cloud.adauth.internal.HttpUtil;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the authorize-endpoint URL that starts the authorization-code flow.
 */
public final class SignInUrl {

    private SignInUrl() {
    }

    public static String build(Config config) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("redirect_uri", config.getRedirectUri());
        params.put("client_id", config.getAppId());

        String base = config.getAuthUrl();
        String fragment = "";
        int hash = base.indexOf('#');
        if (hash >= 0) {
            fragment = base.substring(hash);
            base = base.substring(0, hash);
        }
        String separator = base.contains("?") ? "&" : "?";
        return base + separator + HttpUtil.formEncode(params) + fragment;
    }
}
