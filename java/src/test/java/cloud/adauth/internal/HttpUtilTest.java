package cloud.adauth.internal;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HttpUtilTest {

    @Test
    void formEncodeEscapesValuesAndSkipsNulls() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("redirect_uri", "https://app.example.com/connect/get_token");
        form.put("client_secret", "a+b=c&d");
        form.put("scope", null);

        assertEquals(
            "grant_type=authorization_code"
                + "&redirect_uri=https%3A%2F%2Fapp.example.com%2Fconnect%2Fget_token"
                + "&client_secret=a%2Bb%3Dc%26d",
            HttpUtil.formEncode(form));
    }
}
