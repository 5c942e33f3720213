package org.scoringapi.gateway.domain.request;

import org.scoringapi.gateway.domain.field.ArgumentsField;
import org.scoringapi.gateway.domain.field.CharField;

import java.util.Collections;
import java.util.Map;

/**
 * Outer request envelope: credentials, the method name and its arguments.
 */
public final class MethodRequest extends Request {

    public static final String ADMIN_LOGIN = "admin";

    public static final String ACCOUNT = "account";
    public static final String LOGIN = "login";
    public static final String TOKEN = "token";
    public static final String ARGUMENTS = "arguments";
    public static final String METHOD = "method";

    public static final Schema SCHEMA = Schema.builder("MethodRequest")
            .field(ACCOUNT, new CharField(false, true))
            .field(LOGIN, new CharField(true, true))
            .field(TOKEN, new CharField(true, true))
            .field(ARGUMENTS, new ArgumentsField(true, true))
            .field(METHOD, new CharField(true, false))
            .build();

    public MethodRequest(Map<String, ?> raw) {
        super(SCHEMA, raw);
    }

    public String getAccount() {
        return getText(ACCOUNT);
    }

    public String getLogin() {
        return getText(LOGIN);
    }

    public String getToken() {
        return getText(TOKEN);
    }

    public String getMethod() {
        return getText(METHOD);
    }

    /**
     * Method arguments; an empty map when absent or null.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getArguments() {
        Object value = getValue(ARGUMENTS);
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }

    public boolean isAdmin() {
        return ADMIN_LOGIN.equals(getLogin());
    }
}
