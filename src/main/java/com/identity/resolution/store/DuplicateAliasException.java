package com.identity.resolution.store;

import com.identity.resolution.core.model.AliasScope;

/**
 * The alias text is already mapped, within its scope, to a different canonical entity.
 * Never retried; the existing mapping is left untouched.
 */
public class DuplicateAliasException extends StoreException {

    private final String aliasText;
    private final AliasScope scope;
    private final String existingCanonicalId;
    private final String requestedCanonicalId;

    public DuplicateAliasException(String aliasText, AliasScope scope,
                                   String existingCanonicalId, String requestedCanonicalId) {
        super("Alias '" + aliasText + "' (" + scope.getCode() + ") already maps to "
                + existingCanonicalId + ", cannot map it to " + requestedCanonicalId);
        this.aliasText = aliasText;
        this.scope = scope;
        this.existingCanonicalId = existingCanonicalId;
        this.requestedCanonicalId = requestedCanonicalId;
    }

    public String getAliasText() {
        return aliasText;
    }

    public AliasScope getScope() {
        return scope;
    }

    public String getExistingCanonicalId() {
        return existingCanonicalId;
    }

    public String getRequestedCanonicalId() {
        return requestedCanonicalId;
    }
}
