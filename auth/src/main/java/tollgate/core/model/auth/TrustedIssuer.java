package tollgate.core.model.auth;

/**
 * An identity provider whose tokens are accepted, with the audience they must carry.
 */
public record TrustedIssuer(String issuer, String audience) {

    public TrustedIssuer {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("Audience cannot be null or blank for issuer " + issuer);
        }
    }
}
