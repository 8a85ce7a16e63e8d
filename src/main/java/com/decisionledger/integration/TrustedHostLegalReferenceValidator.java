package com.decisionledger.integration;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Accepts https IRIs served by a trusted legislation host, such as
 * {@code https://finlex.fi/fi/laki/alkup/1997/19970313#L1}. The last path segment
 * becomes the title and the fragment the section.
 */
public class TrustedHostLegalReferenceValidator implements LegalReferenceValidator {

    private final Set<String> trustedHosts;

    public TrustedHostLegalReferenceValidator(Set<String> trustedHosts) {
        this.trustedHosts = trustedHosts.stream()
            .map(h -> h.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public LegalReferenceCheck validate(String iri) {
        if (iri == null || iri.isBlank()) {
            return LegalReferenceCheck.invalid();
        }
        URI uri;
        try {
            uri = new URI(iri);
        } catch (URISyntaxException ex) {
            return LegalReferenceCheck.invalid();
        }
        if (!"https".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null || !isTrusted(uri.getHost())) {
            return LegalReferenceCheck.invalid();
        }
        String path = uri.getPath() == null ? "" : uri.getPath();
        String[] segments = path.split("/");
        String title = segments.length == 0 ? uri.getHost() : segments[segments.length - 1];
        return new LegalReferenceCheck(true, title.isBlank() ? uri.getHost() : title, uri.getFragment());
    }

    private boolean isTrusted(String host) {
        String normalized = host.toLowerCase(Locale.ROOT);
        return trustedHosts.stream().anyMatch(t -> normalized.equals(t) || normalized.endsWith("." + t));
    }
}
