package com.greenwashradar.pipeline.service.validation;

import com.greenwashradar.pipeline.dto.ValidationContext;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a URL belongs to the company under analysis.
 * A configured company domain is matched exactly or as a parent domain; without one, the
 * host is checked for the normalized company name.
 */
@Component
public class OwnDomainPolicy {

    private static final Pattern CORPORATE_SUFFIX = Pattern.compile(
            "(股份有限公司|有限公司|公司|\\b(inc|corp|corporation|co|ltd|limited|plc|group|holdings?)\\b\\.?)",
            Pattern.CASE_INSENSITIVE);

    public Set<String> excludedDomains(ValidationContext context) {
        if (context.companyDomain() == null || context.companyDomain().isBlank()) {
            return Set.of();
        }
        return Set.of(context.companyDomain().trim().toLowerCase(Locale.ROOT));
    }

    public boolean isOwnDomain(String url, ValidationContext context) {
        String host = host(url);
        if (host == null) {
            return false;
        }
        for (String domain : excludedDomains(context)) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        String name = normalizeName(context.companyName());
        return name.length() >= 3 && host.replace("-", "").contains(name);
    }

    static String normalizeName(String companyName) {
        if (companyName == null) {
            return "";
        }
        return CORPORATE_SUFFIX.matcher(companyName.toLowerCase(Locale.ROOT))
                .replaceAll("")
                .replaceAll("[\\s.,&'-]", "");
    }

    private static String host(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
